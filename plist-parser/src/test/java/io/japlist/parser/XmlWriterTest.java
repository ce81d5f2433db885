package io.japlist.parser;

import static org.junit.jupiter.api.Assertions.*;

import io.japlist.api.Event;
import io.japlist.api.PlistException;
import io.japlist.api.PlistFormatException;
import io.japlist.api.Value;
import io.japlist.impl.ValueBuilder;
import io.japlist.impl.ValueEvents;
import io.japlist.utils.PlistInput;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class XmlWriterTest {

  private static String write(XmlWriter.Options options, Event... events) throws PlistException {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    XmlWriter writer = new XmlWriter(out, options);
    for (Event event : events) {
      writer.write(event);
    }
    assertTrue(writer.isFinished());
    return out.toString(StandardCharsets.UTF_8);
  }

  @Test
  void writesAppleLayout() throws Exception {
    Map<String, Value> entries = new LinkedHashMap<>();
    entries.put("Age", Value.integer(28));
    entries.put("Tags", Value.array(Value.string("a")));

    String xml =
        write(
            XmlWriter.Options.DEFAULT,
            ValueEvents.flatten(Value.dictionary(entries)).toArray(new Event[0]));

    assertEquals(
        "<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n"
            + "<!DOCTYPE plist PUBLIC \"-//Apple//DTD PLIST 1.0//EN\""
            + " \"http://www.apple.com/DTDs/PropertyList-1.0.dtd\">\n"
            + "<plist version=\"1.0\">\n"
            + "<dict>\n"
            + "\t<key>Age</key>\n"
            + "\t<integer>28</integer>\n"
            + "\t<key>Tags</key>\n"
            + "\t<array>\n"
            + "\t\t<string>a</string>\n"
            + "\t</array>\n"
            + "</dict>\n"
            + "</plist>\n",
        xml);
  }

  @Test
  void honorsOptions() throws Exception {
    XmlWriter.Options options = XmlWriter.Options.builder().indent("  ").writeDoctype(false).build();

    String xml =
        write(options, Event.StartArray.of(1), new Event.BooleanValue(true), new Event.EndArray());

    assertEquals(
        "<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n"
            + "<plist version=\"1.0\">\n"
            + "<array>\n"
            + "  <true/>\n"
            + "</array>\n"
            + "</plist>\n",
        xml);
  }

  @Test
  void writesScalarFormats() throws Exception {
    String xml =
        write(
            XmlWriter.Options.DEFAULT,
            Event.StartArray.unknownLength(),
            new Event.RealValue(Double.NaN),
            new Event.RealValue(Double.NEGATIVE_INFINITY),
            new Event.DateValue(Instant.parse("2001-01-01T00:00:00.750Z")),
            new Event.DataValue(new byte[] {1, 2, 3}),
            new Event.EndArray());

    assertTrue(xml.contains("<real>nan</real>"), xml);
    assertTrue(xml.contains("<real>-infinity</real>"), xml);
    assertTrue(xml.contains("<date>2001-01-01T00:00:00Z</date>"), xml);
    assertTrue(xml.contains("<data>AQID</data>"), xml);
  }

  @Test
  void outputReadsBackAsSameValue() throws Exception {
    Map<String, Value> entries = new LinkedHashMap<>();
    entries.put("text", Value.string("a < b & c > \"d\""));
    entries.put("empty", Value.array());
    entries.put("nested", Value.dictionary(Map.of("k", Value.real(-0.5))));
    entries.put("when", Value.date(Instant.parse("1999-12-31T23:59:59Z")));
    entries.put("bytes", Value.data(new byte[] {(byte) 0xCA, (byte) 0xFE}));
    entries.put("yes", Value.bool(true));
    Value value = Value.dictionary(entries);

    ByteArrayOutputStream out = new ByteArrayOutputStream();
    Plist.writeXml(value, out);
    Value read = ValueBuilder.build(new XmlReader(PlistInput.of(out.toByteArray())));

    assertEquals(value, read);
    assertEquals(ValueEvents.flatten(value), ValueEvents.flatten(read));
  }

  @Test
  void rejectsNonStringKey() throws Exception {
    XmlWriter writer = new XmlWriter(new ByteArrayOutputStream());
    writer.write(Event.StartDictionary.of(1));

    assertThrows(PlistFormatException.class, () -> writer.write(new Event.IntegerValue(1)));
  }

  @Test
  void rejectsMismatchedEnd() throws Exception {
    XmlWriter writer = new XmlWriter(new ByteArrayOutputStream());
    writer.write(Event.StartArray.of(0));

    assertThrows(PlistFormatException.class, () -> writer.write(new Event.EndDictionary()));
  }

  @Test
  void rejectsEndWhileDictionaryValuePending() throws Exception {
    XmlWriter writer = new XmlWriter(new ByteArrayOutputStream());
    writer.write(Event.StartDictionary.of(1));
    writer.write(new Event.StringValue("key"));

    assertThrows(PlistFormatException.class, () -> writer.write(new Event.EndDictionary()));
    assertThrows(PlistFormatException.class, () -> writer.write(new Event.EndArray()));
  }

  @Test
  void rejectsEventsAfterRootValue() throws Exception {
    XmlWriter writer = new XmlWriter(new ByteArrayOutputStream());
    writer.write(new Event.StringValue("root"));

    assertTrue(writer.isFinished());
    assertThrows(PlistFormatException.class, () -> writer.write(new Event.StringValue("more")));
  }

  @Test
  void rejectsNonWhitespaceIndent() {
    assertThrows(IllegalArgumentException.class, () -> new XmlWriter.Options("--", true));
  }
}
