package io.japlist.api;

import java.util.OptionalLong;

/**
 * Base exception for property list reading and writing errors.
 *
 * <p>The context names where in the document the problem was found: a byte offset for binary
 * input ({@code "offset 1234"}), a line and column for XML, or an object reference. When the
 * position is a byte offset it is also available as a number from {@link #getOffset()}, so
 * callers can report or seek to it without parsing the message. The error code is {@link #IO}
 * for failures of the underlying input or output and {@link #FORMAT} for malformed content.
 */
public class PlistException extends Exception {
  public static final String IO = "IO";
  public static final String FORMAT = "FORMAT";

  private static final long NO_OFFSET = -1;

  private final String context;
  private final String errorCode;
  private final long offset;

  public PlistException(String message) {
    this(message, null, null, null, NO_OFFSET);
  }

  public PlistException(String message, String context, String errorCode) {
    this(message, null, context, errorCode, NO_OFFSET);
  }

  public PlistException(String message, Throwable cause, String context, String errorCode) {
    this(message, cause, context, errorCode, NO_OFFSET);
  }

  /** An error located at byte {@code offset} of the input. */
  public PlistException(String message, Throwable cause, long offset, String errorCode) {
    this(message, cause, "offset " + offset, errorCode, offset);
  }

  private PlistException(
      String message, Throwable cause, String context, String errorCode, long offset) {
    super(describe(message, context, errorCode), cause);
    this.context = context;
    this.errorCode = errorCode;
    this.offset = offset;
  }

  private static String describe(String message, String context, String errorCode) {
    String text = message;
    if (context != null) {
      text += " [Context: " + context + "]";
    }
    if (errorCode != null) {
      text += " [Error Code: " + errorCode + "]";
    }
    return text;
  }

  public String getContext() {
    return context;
  }

  public String getErrorCode() {
    return errorCode;
  }

  /** Byte offset of the problem, if it was located in binary input. */
  public OptionalLong getOffset() {
    return offset < 0 ? OptionalLong.empty() : OptionalLong.of(offset);
  }
}
