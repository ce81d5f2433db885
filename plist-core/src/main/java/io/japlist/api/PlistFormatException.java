package io.japlist.api;

/**
 * Exception thrown for malformed property list content or an event sequence that does not
 * describe a well formed value.
 */
public class PlistFormatException extends PlistException {

  public PlistFormatException(String message) {
    super(message, null, FORMAT);
  }

  public PlistFormatException(String message, String context) {
    super(message, context, FORMAT);
  }

  public PlistFormatException(String message, Throwable cause, String context) {
    super(message, cause, context, FORMAT);
  }

  public PlistFormatException(String message, long offset) {
    super(message, null, offset, FORMAT);
  }

  /**
   * Creates a PlistFormatException for an event that is not allowed at the current position.
   *
   * @param event the offending event
   * @param expected what the consumer expected instead
   * @return a new PlistFormatException instance
   */
  public static PlistFormatException unexpectedEvent(Event event, String expected) {
    return new PlistFormatException("Unexpected " + event + ", expected " + expected);
  }
}
