package io.japlist.parser;

import io.japlist.api.Event;
import io.japlist.api.EventWriter;
import io.japlist.api.PlistException;
import io.japlist.api.PlistFormatException;
import io.japlist.api.PlistIOException;
import java.io.OutputStream;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayDeque;
import java.util.Base64;
import java.util.Deque;
import java.util.Objects;
import javax.xml.stream.XMLOutputFactory;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes an event stream as an XML property list.
 *
 * <p>The document header is written with the first event. Once the root value is complete the
 * closing {@code </plist>} tag is written and the output is flushed; the output stream itself is
 * left open. Strings in dictionary key position become {@code <key>} elements.
 *
 * <pre>{@code
 * XmlWriter writer = new XmlWriter(out);
 * for (Event event : ValueEvents.flatten(value)) {
 *   writer.write(event);
 * }
 * assert writer.isFinished();
 * }</pre>
 */
public final class XmlWriter implements EventWriter {
  private static final Logger LOG = LoggerFactory.getLogger(XmlWriter.class);

  private static final String DOCTYPE =
      "<!DOCTYPE plist PUBLIC \"-//Apple//DTD PLIST 1.0//EN\""
          + " \"http://www.apple.com/DTDs/PropertyList-1.0.dtd\">";

  private static final XMLOutputFactory FACTORY = XMLOutputFactory.newFactory();

  private final XMLStreamWriter xml;
  private final Options options;
  private final Deque<Container> stack = new ArrayDeque<>();
  private boolean started;
  private boolean finished;

  /**
   * Creates a writer with {@link Options#DEFAULT}.
   *
   * @param out destination of the UTF-8 encoded document
   * @throws PlistIOException if the XML writer cannot be created
   */
  public XmlWriter(OutputStream out) throws PlistIOException {
    this(out, Options.DEFAULT);
  }

  /**
   * Creates a writer.
   *
   * @param out destination of the UTF-8 encoded document
   * @param options formatting options
   * @throws PlistIOException if the XML writer cannot be created
   */
  public XmlWriter(OutputStream out, Options options) throws PlistIOException {
    Objects.requireNonNull(out, "out must not be null");
    this.options = Objects.requireNonNull(options, "options must not be null");
    try {
      this.xml = FACTORY.createXMLStreamWriter(out, "UTF-8");
    } catch (XMLStreamException e) {
      throw PlistIOException.writeFailed(e);
    }
  }

  @Override
  public void write(Event event) throws PlistException {
    Objects.requireNonNull(event, "event must not be null");
    if (finished) {
      throw PlistFormatException.unexpectedEvent(event, "no further events after the root value");
    }
    try {
      if (!started) {
        startDocument();
      }
      Container top = stack.peek();
      if (top != null && top.dictionary && top.expectKey) {
        writeKeyPosition(top, event);
        return;
      }

      if (event instanceof Event.StartArray) {
        startContainer("array", new Container(false));
      } else if (event instanceof Event.StartDictionary) {
        startContainer("dict", new Container(true));
      } else if (event instanceof Event.EndArray) {
        if (top == null || top.dictionary) {
          throw PlistFormatException.unexpectedEvent(event, "a value");
        }
        endContainer();
      } else if (event instanceof Event.EndDictionary) {
        throw PlistFormatException.unexpectedEvent(event, "a dictionary value");
      } else {
        writeScalar(event);
        valueCompleted();
      }
    } catch (XMLStreamException e) {
      throw PlistIOException.writeFailed(e);
    }
  }

  /** Returns true once the root value and the closing tag were written. */
  public boolean isFinished() {
    return finished;
  }

  private void writeKeyPosition(Container top, Event event)
      throws XMLStreamException, PlistException {
    if (event instanceof Event.StringValue key) {
      indent(stack.size());
      writeTextElement("key", key.value());
      top.expectKey = false;
    } else if (event instanceof Event.EndDictionary) {
      endContainer();
    } else {
      throw PlistFormatException.unexpectedEvent(event, "a dictionary key or EndDictionary");
    }
  }

  private void startDocument() throws XMLStreamException {
    xml.writeStartDocument("UTF-8", "1.0");
    if (options.writeDoctype()) {
      xml.writeCharacters("\n");
      xml.writeDTD(DOCTYPE);
    }
    xml.writeCharacters("\n");
    xml.writeStartElement("plist");
    xml.writeAttribute("version", "1.0");
    started = true;
  }

  private void startContainer(String name, Container container) throws XMLStreamException {
    indent(stack.size());
    xml.writeStartElement(name);
    stack.push(container);
  }

  private void endContainer() throws XMLStreamException {
    stack.pop();
    indent(stack.size());
    xml.writeEndElement();
    valueCompleted();
  }

  private void writeScalar(Event event) throws XMLStreamException {
    indent(stack.size());
    if (event instanceof Event.BooleanValue b) {
      xml.writeEmptyElement(b.value() ? "true" : "false");
    } else if (event instanceof Event.DataValue data) {
      writeTextElement("data", Base64.getEncoder().encodeToString(data.value()));
    } else if (event instanceof Event.DateValue date) {
      writeTextElement("date", formatDate(date.value()));
    } else if (event instanceof Event.IntegerValue integer) {
      writeTextElement("integer", Long.toString(integer.value()));
    } else if (event instanceof Event.RealValue real) {
      writeTextElement("real", formatReal(real.value()));
    } else if (event instanceof Event.StringValue string) {
      writeTextElement("string", string.value());
    } else {
      throw new AssertionError("Not a scalar event: " + event);
    }
  }

  private void valueCompleted() throws XMLStreamException {
    Container top = stack.peek();
    if (top != null) {
      if (top.dictionary) {
        top.expectKey = true;
      }
      return;
    }
    xml.writeCharacters("\n");
    xml.writeEndElement(); // plist
    xml.writeCharacters("\n");
    xml.writeEndDocument();
    xml.flush();
    xml.close();
    finished = true;
    LOG.debug("XML property list written");
  }

  private void writeTextElement(String name, String text) throws XMLStreamException {
    xml.writeStartElement(name);
    xml.writeCharacters(text);
    xml.writeEndElement();
  }

  private void indent(int depth) throws XMLStreamException {
    xml.writeCharacters("\n" + options.indent().repeat(depth));
  }

  /** Dates are written as UTC instants with second precision. */
  static String formatDate(Instant instant) {
    return DateTimeFormatter.ISO_INSTANT.format(instant.truncatedTo(ChronoUnit.SECONDS));
  }

  static String formatReal(double value) {
    if (Double.isNaN(value)) {
      return "nan";
    }
    if (Double.isInfinite(value)) {
      return value > 0 ? "+infinity" : "-infinity";
    }
    return Double.toString(value);
  }

  private static final class Container {
    final boolean dictionary;
    boolean expectKey;

    Container(boolean dictionary) {
      this.dictionary = dictionary;
      this.expectKey = dictionary;
    }
  }

  /** Formatting options. */
  public record Options(String indent, boolean writeDoctype) {

    /** Tab indentation with the Apple document type declaration. */
    public static final Options DEFAULT = new Options("\t", true);

    public Options {
      Objects.requireNonNull(indent, "indent must not be null");
      if (!indent.isBlank()) {
        throw new IllegalArgumentException("indent must only contain whitespace: '" + indent + "'");
      }
    }

    public static Builder builder() {
      return new Builder();
    }

    public static class Builder {
      private String indent = "\t";
      private boolean writeDoctype = true;

      public Builder indent(String value) {
        this.indent = Objects.requireNonNull(value, "indent must not be null");
        return this;
      }

      public Builder writeDoctype(boolean value) {
        this.writeDoctype = value;
        return this;
      }

      public Options build() {
        return new Options(indent, writeDoctype);
      }
    }
  }
}
