package io.japlist.impl;

import io.japlist.api.Event;
import io.japlist.api.EventReader;
import io.japlist.api.EventWriter;
import io.japlist.api.PlistException;
import io.japlist.api.PlistFormatException;
import io.japlist.api.Value;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rebuilds a {@link Value} from an event stream.
 *
 * <p>The builder accepts exactly one root value. Length hints on start events only size the
 * backing collections; the end markers decide when a container is complete.
 */
public final class ValueBuilder implements EventWriter {

  // Hints above this are ignored for preallocation
  private static final long MAX_PREALLOCATION = 1024;

  private final Deque<Container> stack = new ArrayDeque<>();
  private Value result;

  /**
   * Reads events from {@code reader} until one complete value has been built.
   *
   * @param reader the event source, positioned at the start of a value
   * @return the value
   * @throws PlistException if the source fails, ends early, or is not well formed
   */
  public static Value build(EventReader reader) throws PlistException {
    ValueBuilder builder = new ValueBuilder();
    while (!builder.isComplete()) {
      Event event = reader.nextEvent();
      if (event == null) {
        throw new PlistFormatException("Event stream ended before a complete value");
      }
      builder.write(event);
    }
    return builder.result();
  }

  @Override
  public void write(Event event) throws PlistException {
    if (result != null) {
      throw PlistFormatException.unexpectedEvent(event, "no further events after the root value");
    }
    Container top = stack.peek();
    if (top instanceof DictionaryContainer dict && dict.pendingKey == null) {
      if (event instanceof Event.StringValue key) {
        dict.pendingKey = key.value();
      } else if (event instanceof Event.EndDictionary) {
        stack.pop();
        complete(Value.dictionary(dict.entries));
      } else {
        throw PlistFormatException.unexpectedEvent(event, "a dictionary key or EndDictionary");
      }
      return;
    }

    if (event instanceof Event.StartArray start) {
      stack.push(new ArrayContainer(capacity(start.length().orElse(0))));
    } else if (event instanceof Event.StartDictionary start) {
      stack.push(new DictionaryContainer(capacity(start.length().orElse(0))));
    } else if (event instanceof Event.EndArray) {
      if (!(top instanceof ArrayContainer array)) {
        throw PlistFormatException.unexpectedEvent(event, "a value");
      }
      stack.pop();
      complete(Value.array(array.elements));
    } else if (event instanceof Event.EndDictionary) {
      throw PlistFormatException.unexpectedEvent(event, "a value");
    } else {
      complete(scalar(event));
    }
  }

  /** Returns true once the root value is complete. */
  public boolean isComplete() {
    return result != null;
  }

  /**
   * Returns the built value.
   *
   * @throws IllegalStateException if the root value is not complete yet
   */
  public Value result() {
    if (result == null) {
      throw new IllegalStateException("Value is not complete, open containers: " + stack.size());
    }
    return result;
  }

  private void complete(Value value) {
    Container top = stack.peek();
    if (top == null) {
      result = value;
    } else {
      top.add(value);
    }
  }

  private static Value scalar(Event event) {
    if (event instanceof Event.BooleanValue b) {
      return Value.bool(b.value());
    } else if (event instanceof Event.DataValue data) {
      return Value.data(data.value());
    } else if (event instanceof Event.DateValue date) {
      return Value.date(date.value());
    } else if (event instanceof Event.IntegerValue integer) {
      return Value.integer(integer.value());
    } else if (event instanceof Event.RealValue real) {
      return Value.real(real.value());
    } else if (event instanceof Event.StringValue string) {
      return Value.string(string.value());
    }
    throw new AssertionError("Not a scalar event: " + event);
  }

  private static int capacity(long hint) {
    return (int) Math.min(Math.max(hint, 0), MAX_PREALLOCATION);
  }

  private interface Container {
    void add(Value value);
  }

  private static final class ArrayContainer implements Container {
    final List<Value> elements;

    ArrayContainer(int capacity) {
      this.elements = new ArrayList<>(capacity);
    }

    @Override
    public void add(Value value) {
      elements.add(value);
    }
  }

  private static final class DictionaryContainer implements Container {
    final Map<String, Value> entries;
    String pendingKey;

    DictionaryContainer(int capacity) {
      this.entries = new LinkedHashMap<>(Math.max(16, capacity * 2));
    }

    @Override
    public void add(Value value) {
      entries.put(pendingKey, value);
      pendingKey = null;
    }
  }
}
