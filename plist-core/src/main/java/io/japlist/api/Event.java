package io.japlist.api;

import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * One element of a property list encoded as a flat stream.
 *
 * <p>Every {@link StartArray} and {@link StartDictionary} is closed by exactly one matching {@link
 * EndArray} or {@link EndDictionary}. Dictionary entries appear as a {@link StringValue} key
 * immediately followed by the events of its value:
 *
 * <pre>
 * StartDictionary(2)
 * StringValue("Height")   // key
 * RealValue(181.2)        // value
 * StringValue("Age")      // key
 * IntegerValue(28)        // value
 * EndDictionary
 * </pre>
 *
 * <p>The length carried by a start event is a preallocation hint only. Consumers must stop at the
 * end marker and never loop on the hint.
 */
public sealed interface Event
    permits Event.StartArray,
        Event.EndArray,
        Event.StartDictionary,
        Event.EndDictionary,
        Event.BooleanValue,
        Event.DataValue,
        Event.DateValue,
        Event.IntegerValue,
        Event.RealValue,
        Event.StringValue {

  /** Opens an array. The length, when present, is the number of elements. */
  record StartArray(OptionalLong length) implements Event {
    public StartArray {
      Objects.requireNonNull(length, "length must not be null");
    }

    public static StartArray of(long length) {
      return new StartArray(OptionalLong.of(length));
    }

    public static StartArray unknownLength() {
      return new StartArray(OptionalLong.empty());
    }
  }

  /** Closes the innermost open array. */
  record EndArray() implements Event {}

  /** Opens a dictionary. The length, when present, is the number of key/value pairs. */
  record StartDictionary(OptionalLong length) implements Event {
    public StartDictionary {
      Objects.requireNonNull(length, "length must not be null");
    }

    public static StartDictionary of(long length) {
      return new StartDictionary(OptionalLong.of(length));
    }

    public static StartDictionary unknownLength() {
      return new StartDictionary(OptionalLong.empty());
    }
  }

  /** Closes the innermost open dictionary. */
  record EndDictionary() implements Event {}

  record BooleanValue(boolean value) implements Event {}

  /** Raw bytes. The array is owned by the event and compared by content. */
  record DataValue(byte[] value) implements Event {
    public DataValue {
      Objects.requireNonNull(value, "value must not be null");
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof DataValue other && Arrays.equals(value, other.value);
    }

    @Override
    public int hashCode() {
      return Arrays.hashCode(value);
    }

    @Override
    public String toString() {
      return "DataValue[" + value.length + " bytes]";
    }
  }

  record DateValue(Instant value) implements Event {
    public DateValue {
      Objects.requireNonNull(value, "value must not be null");
    }
  }

  record IntegerValue(long value) implements Event {}

  record RealValue(double value) implements Event {}

  /** A string value, or a dictionary key when it directly follows a dictionary entry. */
  record StringValue(String value) implements Event {
    public StringValue {
      Objects.requireNonNull(value, "value must not be null");
    }
  }

  /** Returns true for {@link StartArray} and {@link StartDictionary}. */
  default boolean isContainerStart() {
    return this instanceof StartArray || this instanceof StartDictionary;
  }

  /** Returns true for {@link EndArray} and {@link EndDictionary}. */
  default boolean isContainerEnd() {
    return this instanceof EndArray || this instanceof EndDictionary;
  }
}
