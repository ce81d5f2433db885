package io.japlist.parser;

import io.japlist.api.Event;
import io.japlist.api.PlistException;
import io.japlist.api.PlistIOException;
import io.japlist.api.Value;
import io.japlist.impl.ValueBuilder;
import io.japlist.impl.ValueEvents;
import io.japlist.utils.PlistInput;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Main entry point for reading and writing property lists.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * Value settings = Plist.readValue(Path.of("Info.plist"));
 * if (settings instanceof Value.PlistDictionary dict) {
 *   System.out.println(dict.get("CFBundleIdentifier"));
 * }
 *
 * try (OutputStream out = Files.newOutputStream(target)) {
 *   Plist.writeXml(settings, out);
 * }
 * }</pre>
 *
 * <p>Reading accepts both the binary and the XML encoding; writing produces XML.
 */
public final class Plist {

  private Plist() {}

  /** Creates an encoding-detecting event reader over {@code input}. */
  public static PlistReader newReader(PlistInput input) {
    return new PlistReader(input);
  }

  /** Creates an encoding-detecting event reader over an in-memory document. */
  public static PlistReader newReader(byte[] data) {
    return new PlistReader(PlistInput.of(data));
  }

  /**
   * Reads one value from a property list file.
   *
   * @param path the file to read
   * @return the root value
   * @throws PlistException if the file cannot be read or is malformed
   * @throws NullPointerException if path is null
   */
  public static Value readValue(Path path) throws PlistException {
    Objects.requireNonNull(path, "path must not be null");
    try (PlistInput input = PlistInput.open(path)) {
      return readValue(input);
    } catch (IOException e) {
      throw new PlistIOException("Failed to read property list", e, path.toString());
    }
  }

  /**
   * Reads one value from an in-memory property list.
   *
   * @param data the encoded document
   * @return the root value
   * @throws PlistException if the document is malformed
   */
  public static Value readValue(byte[] data) throws PlistException {
    return readValue(PlistInput.of(data));
  }

  /**
   * Reads one value from {@code input}. The input is not closed.
   *
   * @param input the encoded document
   * @return the root value
   * @throws PlistException if the input fails or is malformed
   */
  public static Value readValue(PlistInput input) throws PlistException {
    return ValueBuilder.build(new PlistReader(input));
  }

  /**
   * Writes {@code value} as an XML property list with default options. The stream is flushed but
   * not closed.
   *
   * @param value the value to write
   * @param out the destination
   * @throws PlistException if writing fails
   */
  public static void writeXml(Value value, OutputStream out) throws PlistException {
    writeXml(value, out, XmlWriter.Options.DEFAULT);
  }

  /**
   * Writes {@code value} as an XML property list. The stream is flushed but not closed.
   *
   * @param value the value to write
   * @param out the destination
   * @param options formatting options
   * @throws PlistException if writing fails
   */
  public static void writeXml(Value value, OutputStream out, XmlWriter.Options options)
      throws PlistException {
    Objects.requireNonNull(value, "value must not be null");
    XmlWriter writer = new XmlWriter(out, options);
    ValueEvents events = value.events();
    Event event;
    while ((event = events.nextEvent()) != null) {
      writer.write(event);
    }
  }

  /** Encodes {@code value} as an XML property list. */
  public static byte[] toXml(Value value) throws PlistException {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    writeXml(value, out);
    return out.toByteArray();
  }
}
