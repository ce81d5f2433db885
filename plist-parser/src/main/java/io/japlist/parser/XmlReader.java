package io.japlist.parser;

import io.japlist.api.Event;
import io.japlist.api.EventReader;
import io.japlist.api.PlistException;
import io.japlist.api.PlistFormatException;
import io.japlist.utils.PlistInput;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Base64;
import java.util.Locale;
import java.util.Objects;
import javax.xml.stream.Location;
import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;

/**
 * Event reader for the XML encoding.
 *
 * <p>The root {@code <plist>} element is transparent. Containers carry no length hint since the
 * element count is only known once the closing tag was read. Document type declarations are
 * skipped without being resolved.
 */
public final class XmlReader implements EventReader {

  private static final XMLInputFactory FACTORY = createFactory();

  private final PlistInput input;
  private XMLStreamReader xml; // created on the first pull
  private boolean finished;

  public XmlReader(PlistInput input) {
    this.input = Objects.requireNonNull(input, "input must not be null");
  }

  private static XMLInputFactory createFactory() {
    XMLInputFactory factory = XMLInputFactory.newFactory();
    factory.setProperty(XMLInputFactory.SUPPORT_DTD, false);
    factory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, false);
    factory.setProperty(XMLInputFactory.IS_COALESCING, true);
    return factory;
  }

  @Override
  public Event nextEvent() throws PlistException {
    if (finished) {
      return null;
    }
    try {
      if (xml == null) {
        xml = FACTORY.createXMLStreamReader(input.asInputStream());
      }
      while (xml.hasNext()) {
        int type = xml.next();
        if (type == XMLStreamConstants.START_ELEMENT) {
          Event event = startElement(xml.getLocalName());
          if (event != null) {
            return event;
          }
        } else if (type == XMLStreamConstants.END_ELEMENT) {
          switch (xml.getLocalName()) {
            case "array" -> {
              return new Event.EndArray();
            }
            case "dict" -> {
              return new Event.EndDictionary();
            }
            case "plist" -> {
              finish();
              return null;
            }
            default -> {
              // scalar end tags are consumed together with their text
            }
          }
        } else if (type == XMLStreamConstants.CHARACTERS && !xml.isWhiteSpace()) {
          throw new PlistFormatException("Unexpected text content", location(xml.getLocation()));
        }
      }
      finish();
      return null;
    } catch (XMLStreamException e) {
      throw new PlistFormatException(
          "Malformed XML property list", e, location(e.getLocation()));
    }
  }

  private Event startElement(String name) throws XMLStreamException, PlistFormatException {
    return switch (name) {
      case "plist" -> null;
      case "array" -> Event.StartArray.unknownLength();
      case "dict" -> Event.StartDictionary.unknownLength();
      case "key", "string" -> new Event.StringValue(xml.getElementText());
      case "integer" -> new Event.IntegerValue(parseInteger(text()));
      case "real" -> new Event.RealValue(parseReal(text()));
      case "true" -> {
        xml.getElementText();
        yield new Event.BooleanValue(true);
      }
      case "false" -> {
        xml.getElementText();
        yield new Event.BooleanValue(false);
      }
      case "date" -> new Event.DateValue(parseDate(text()));
      case "data" -> new Event.DataValue(parseData(xml.getElementText()));
      default -> throw new PlistFormatException(
          "Unknown element <" + name + ">", location(xml.getLocation()));
    };
  }

  private String text() throws XMLStreamException {
    return xml.getElementText().trim();
  }

  private long parseInteger(String text) throws PlistFormatException {
    try {
      return Long.parseLong(text);
    } catch (NumberFormatException e) {
      throw new PlistFormatException("Invalid integer: " + text, e, location(xml.getLocation()));
    }
  }

  private double parseReal(String text) throws PlistFormatException {
    switch (text.toLowerCase(Locale.ROOT)) {
      case "nan":
        return Double.NaN;
      case "inf":
      case "+inf":
      case "infinity":
      case "+infinity":
        return Double.POSITIVE_INFINITY;
      case "-inf":
      case "-infinity":
        return Double.NEGATIVE_INFINITY;
      default:
        try {
          return Double.parseDouble(text);
        } catch (NumberFormatException e) {
          throw new PlistFormatException("Invalid real: " + text, e, location(xml.getLocation()));
        }
    }
  }

  private Instant parseDate(String text) throws PlistFormatException {
    try {
      return Instant.parse(text);
    } catch (DateTimeParseException e) {
      throw new PlistFormatException("Invalid date: " + text, e, location(xml.getLocation()));
    }
  }

  private byte[] parseData(String text) throws PlistFormatException {
    try {
      return Base64.getMimeDecoder().decode(text);
    } catch (IllegalArgumentException e) {
      throw new PlistFormatException("Invalid base64 data", e, location(xml.getLocation()));
    }
  }

  private void finish() throws XMLStreamException {
    finished = true;
    xml.close();
  }

  private static String location(Location location) {
    if (location == null) {
      return null;
    }
    return "line " + location.getLineNumber() + ", column " + location.getColumnNumber();
  }
}
