package io.japlist.impl;

import io.japlist.api.Event;
import io.japlist.api.EventReader;
import io.japlist.api.Value;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * The event sequence of a {@link Value}, produced by a pre-order depth-first walk.
 *
 * <p>Arrays become {@code StartArray(n)}, the events of each element, {@code EndArray}.
 * Dictionaries become {@code StartDictionary(n)}, then for each entry in iteration order a {@code
 * StringValue} key followed by the events of the value, then {@code EndDictionary}. Scalars become a
 * single event. Empty containers produce only their start and end events.
 *
 * <p>The whole sequence is computed up front; iteration is single-pass and cannot be restarted.
 * Flatten the value again for a fresh sequence.
 */
public final class ValueEvents implements Iterator<Event>, EventReader {

  private final List<Event> events;
  private int next;

  private ValueEvents(List<Event> events) {
    this.events = events;
  }

  /** Flattens {@code value}. Never fails for a well formed value. */
  public static ValueEvents of(Value value) {
    Objects.requireNonNull(value, "value must not be null");
    List<Event> events = new ArrayList<>();
    flatten(value, events);
    return new ValueEvents(events);
  }

  /** Flattens {@code value} into an unmodifiable list. */
  public static List<Event> flatten(Value value) {
    Objects.requireNonNull(value, "value must not be null");
    List<Event> events = new ArrayList<>();
    flatten(value, events);
    return Collections.unmodifiableList(events);
  }

  /** Iterative pre-order walk; nesting depth is limited by heap only. */
  private static void flatten(Value root, List<Event> events) {
    Deque<Frame> stack = new ArrayDeque<>();
    Value value = root;
    while (true) {
      if (value != null) {
        Frame frame = open(value, events);
        if (frame != null) {
          stack.push(frame);
        }
      }
      Frame top = stack.peek();
      if (top == null) {
        return;
      }
      if (top.children.hasNext()) {
        value = top.next(events);
      } else {
        stack.pop();
        events.add(top.end);
        value = null;
      }
    }
  }

  /** Emits the first event of {@code value}; returns the frame to walk for containers. */
  private static Frame open(Value value, List<Event> events) {
    if (value instanceof Value.PlistArray array) {
      events.add(Event.StartArray.of(array.size()));
      return new Frame(array.elements().iterator(), new Event.EndArray());
    } else if (value instanceof Value.PlistDictionary dict) {
      events.add(Event.StartDictionary.of(dict.size()));
      return new Frame(dict.entries().entrySet().iterator(), new Event.EndDictionary());
    } else if (value instanceof Value.PlistBoolean b) {
      events.add(new Event.BooleanValue(b.value()));
    } else if (value instanceof Value.PlistData data) {
      events.add(new Event.DataValue(data.value()));
    } else if (value instanceof Value.PlistDate date) {
      events.add(new Event.DateValue(date.value()));
    } else if (value instanceof Value.PlistReal real) {
      events.add(new Event.RealValue(real.value()));
    } else if (value instanceof Value.PlistInteger integer) {
      events.add(new Event.IntegerValue(integer.value()));
    } else if (value instanceof Value.PlistString string) {
      events.add(new Event.StringValue(string.value()));
    } else {
      throw new AssertionError("Unknown value type: " + value);
    }
    return null;
  }

  /** An open container: its remaining children and its closing event. */
  private static final class Frame {
    final Iterator<?> children;
    final Event end;

    Frame(Iterator<?> children, Event end) {
      this.children = children;
      this.end = end;
    }

    /** Returns the next child value; dictionary entries emit their key first. */
    Value next(List<Event> events) {
      Object child = children.next();
      if (child instanceof Map.Entry<?, ?> entry) {
        events.add(new Event.StringValue((String) entry.getKey()));
        return (Value) entry.getValue();
      }
      return (Value) child;
    }
  }

  /** Number of events not consumed yet. */
  public int remaining() {
    return events.size() - next;
  }

  @Override
  public boolean hasNext() {
    return next < events.size();
  }

  @Override
  public Event next() {
    if (!hasNext()) {
      throw new NoSuchElementException();
    }
    return events.get(next++);
  }

  /** Returns the next event, or {@code null} once every event was consumed. */
  @Override
  public Event nextEvent() {
    return hasNext() ? events.get(next++) : null;
  }
}
