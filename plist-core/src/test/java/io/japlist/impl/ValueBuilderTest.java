package io.japlist.impl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.japlist.api.Event;
import io.japlist.api.EventReader;
import io.japlist.api.PlistFormatException;
import io.japlist.api.Value;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ValueBuilderTest {

  private static EventReader readerOf(Event... events) {
    Iterator<Event> it = List.of(events).iterator();
    return () -> it.hasNext() ? it.next() : null;
  }

  @Test
  void buildsDictionaryFromEvents() throws Exception {
    Value value =
        ValueBuilder.build(
            readerOf(
                Event.StartDictionary.of(1),
                new Event.StringValue("Age"),
                new Event.IntegerValue(28),
                new Event.EndDictionary()));

    assertThat(value).isEqualTo(Value.dictionary(Map.of("Age", Value.integer(28))));
  }

  @Test
  void lengthHintIsNotTrusted() throws Exception {
    Value value =
        ValueBuilder.build(
            readerOf(
                Event.StartArray.of(5),
                new Event.BooleanValue(true),
                new Event.EndArray()));

    assertThat(value).isEqualTo(Value.array(Value.bool(true)));
  }

  @Test
  void unknownLengthContainers() throws Exception {
    Value value =
        ValueBuilder.build(
            readerOf(
                Event.StartArray.unknownLength(),
                Event.StartDictionary.unknownLength(),
                new Event.EndDictionary(),
                new Event.EndArray()));

    assertThat(value).isEqualTo(Value.array(Value.dictionary(Map.of())));
  }

  @Test
  void stopsAfterRootValue() throws Exception {
    EventReader reader = readerOf(new Event.StringValue("one"), new Event.StringValue("two"));

    assertThat(ValueBuilder.build(reader)).isEqualTo(Value.string("one"));
    assertThat(reader.nextEvent()).isEqualTo(new Event.StringValue("two"));
  }

  @Test
  void rejectsEventsAfterRootValue() throws Exception {
    ValueBuilder builder = new ValueBuilder();
    builder.write(new Event.IntegerValue(1));

    assertThat(builder.isComplete()).isTrue();
    assertThatThrownBy(() -> builder.write(new Event.IntegerValue(2)))
        .isInstanceOf(PlistFormatException.class);
  }

  @Test
  void rejectsNonStringKey() {
    ValueBuilder builder = new ValueBuilder();

    assertThatThrownBy(
            () -> {
              builder.write(Event.StartDictionary.of(1));
              builder.write(new Event.IntegerValue(1));
            })
        .isInstanceOf(PlistFormatException.class)
        .hasMessageContaining("dictionary key");
  }

  @Test
  void rejectsMismatchedEnd() {
    assertThatThrownBy(
            () -> ValueBuilder.build(readerOf(Event.StartArray.of(0), new Event.EndDictionary())))
        .isInstanceOf(PlistFormatException.class);
    assertThatThrownBy(
            () -> ValueBuilder.build(readerOf(Event.StartDictionary.of(0), new Event.EndArray())))
        .isInstanceOf(PlistFormatException.class);
  }

  @Test
  void rejectsEndWhileValuePending() {
    assertThatThrownBy(
            () ->
                ValueBuilder.build(
                    readerOf(
                        Event.StartDictionary.of(1),
                        new Event.StringValue("key"),
                        new Event.EndDictionary())))
        .isInstanceOf(PlistFormatException.class);
  }

  @Test
  void rejectsEndAtRoot() {
    assertThatThrownBy(() -> ValueBuilder.build(readerOf(new Event.EndArray())))
        .isInstanceOf(PlistFormatException.class);
  }

  @Test
  void rejectsTruncatedStream() {
    assertThatThrownBy(() -> ValueBuilder.build(readerOf(Event.StartArray.of(2))))
        .isInstanceOf(PlistFormatException.class)
        .hasMessageContaining("ended");
    assertThatThrownBy(() -> ValueBuilder.build(readerOf()))
        .isInstanceOf(PlistFormatException.class);
  }

  @Test
  void resultBeforeCompletion() throws Exception {
    ValueBuilder builder = new ValueBuilder();
    builder.write(Event.StartArray.of(1));

    assertThat(builder.isComplete()).isFalse();
    assertThatThrownBy(builder::result).isInstanceOf(IllegalStateException.class);
  }
}
