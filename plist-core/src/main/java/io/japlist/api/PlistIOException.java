package io.japlist.api;

import java.io.IOException;

/**
 * Exception thrown when the underlying input or output fails.
 */
public class PlistIOException extends PlistException {

  public PlistIOException(String message, Throwable cause) {
    super(message, cause, null, IO);
  }

  public PlistIOException(String message, Throwable cause, String context) {
    super(message, cause, context, IO);
  }

  private PlistIOException(String message, Throwable cause, long offset) {
    super(message, cause, offset, IO);
  }

  /** The 8 byte format signature could not be read. */
  public static PlistIOException probeFailed(IOException cause) {
    return new PlistIOException("Failed to read the format signature", cause, 0);
  }

  /**
   * Creates a PlistIOException for a read at the given offset.
   *
   * @param offset the absolute offset of the failed read
   * @param cause the underlying IOException
   * @return a new PlistIOException instance
   */
  public static PlistIOException readFailed(long offset, IOException cause) {
    return new PlistIOException("Failed to read property list", cause, offset);
  }

  public static PlistIOException writeFailed(Throwable cause) {
    return new PlistIOException("Failed to write property list", cause);
  }
}
