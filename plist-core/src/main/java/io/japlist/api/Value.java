package io.japlist.api;

import io.japlist.impl.ValueEvents;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * An in-memory property list value.
 *
 * <p>Values are immutable. Dictionaries keep the insertion order of their keys, which is also the
 * order of the key/value pairs in the event stream produced by {@link #events()}.
 *
 * <pre>{@code
 * Value person = Value.dictionary(Map.of("Age", Value.integer(28)));
 * ValueEvents events = person.events();
 * while (events.hasNext()) {
 *   writer.write(events.next());
 * }
 * }</pre>
 */
public sealed interface Value
    permits Value.PlistArray,
        Value.PlistDictionary,
        Value.PlistBoolean,
        Value.PlistData,
        Value.PlistDate,
        Value.PlistReal,
        Value.PlistInteger,
        Value.PlistString {

  /** Flattens this value into its event sequence. */
  default ValueEvents events() {
    return ValueEvents.of(this);
  }

  record PlistArray(List<Value> elements) implements Value {
    public PlistArray {
      elements = Collections.unmodifiableList(new ArrayList<>(elements));
    }

    public int size() {
      return elements.size();
    }

    public Value get(int index) {
      return elements.get(index);
    }
  }

  record PlistDictionary(Map<String, Value> entries) implements Value {
    public PlistDictionary {
      entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    public int size() {
      return entries.size();
    }

    /** Returns the value stored under {@code key}, or {@code null}. */
    public Value get(String key) {
      return entries.get(key);
    }
  }

  record PlistBoolean(boolean value) implements Value {}

  record PlistData(byte[] value) implements Value {
    public PlistData {
      value = value.clone();
    }

    @Override
    public byte[] value() {
      return value.clone();
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof PlistData other && Arrays.equals(value, other.value);
    }

    @Override
    public int hashCode() {
      return Arrays.hashCode(value);
    }

    @Override
    public String toString() {
      return "PlistData[" + value.length + " bytes]";
    }
  }

  record PlistDate(Instant value) implements Value {
    public PlistDate {
      Objects.requireNonNull(value, "value must not be null");
    }
  }

  /**
   * A floating point value. Equality follows {@link Double#equals(Object)}, so {@code NaN} equals
   * itself and {@code 0.0} differs from {@code -0.0}.
   */
  record PlistReal(double value) implements Value {}

  record PlistInteger(long value) implements Value {}

  record PlistString(String value) implements Value {
    public PlistString {
      Objects.requireNonNull(value, "value must not be null");
    }
  }

  static PlistArray array(List<Value> elements) {
    return new PlistArray(elements);
  }

  static PlistArray array(Value... elements) {
    return new PlistArray(Arrays.asList(elements));
  }

  /** Creates a dictionary; iteration order of {@code entries} becomes the key order. */
  static PlistDictionary dictionary(Map<String, Value> entries) {
    return new PlistDictionary(entries);
  }

  static PlistBoolean bool(boolean value) {
    return new PlistBoolean(value);
  }

  static PlistData data(byte[] value) {
    return new PlistData(value);
  }

  static PlistDate date(Instant value) {
    return new PlistDate(value);
  }

  static PlistReal real(double value) {
    return new PlistReal(value);
  }

  static PlistInteger integer(long value) {
    return new PlistInteger(value);
  }

  static PlistString string(String value) {
    return new PlistString(value);
  }
}
