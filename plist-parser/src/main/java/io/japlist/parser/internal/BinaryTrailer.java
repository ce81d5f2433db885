package io.japlist.parser.internal;

import io.japlist.api.PlistFormatException;
import java.nio.ByteBuffer;

/**
 * The fixed 32 byte trailer at the end of a {@code bplist00} file.
 *
 * <pre>
 *   [u1]*6 - unused
 *   u1     - size of an offset table entry (1..8)
 *   u1     - size of an object reference (1..8)
 *   u8     - number of objects
 *   u8     - index of the top object
 *   u8     - absolute offset of the offset table
 * </pre>
 */
public record BinaryTrailer(
    int offsetSize, int refSize, long objectCount, long topObject, long offsetTableOffset) {

  public static final int SIZE = 32;

  /** Decodes a trailer from its raw {@link #SIZE} bytes. */
  public static BinaryTrailer decode(byte[] raw) {
    if (raw.length != SIZE) {
      throw new IllegalArgumentException("Trailer must be " + SIZE + " bytes, got " + raw.length);
    }
    ByteBuffer buffer = ByteBuffer.wrap(raw); // big-endian
    buffer.position(6);
    int offsetSize = buffer.get() & 0xFF;
    int refSize = buffer.get() & 0xFF;
    long objectCount = buffer.getLong();
    long topObject = buffer.getLong();
    long offsetTableOffset = buffer.getLong();
    return new BinaryTrailer(offsetSize, refSize, objectCount, topObject, offsetTableOffset);
  }

  /**
   * Checks the trailer against the size of the file it was read from.
   *
   * @param fileLength total length of the input
   * @param headerSize length of the signature preceding the first object
   * @throws PlistFormatException if any field is out of range
   */
  public void validate(long fileLength, int headerSize) throws PlistFormatException {
    if (offsetSize < 1 || offsetSize > 8) {
      throw new PlistFormatException("Invalid offset table entry size: " + offsetSize, "trailer");
    }
    if (refSize < 1 || refSize > 8) {
      throw new PlistFormatException("Invalid object reference size: " + refSize, "trailer");
    }
    if (objectCount < 1 || objectCount > Integer.MAX_VALUE) {
      throw new PlistFormatException("Invalid object count: " + objectCount, "trailer");
    }
    if (topObject < 0 || topObject >= objectCount) {
      throw new PlistFormatException(
          "Top object " + topObject + " outside of " + objectCount + " objects", "trailer");
    }
    long tableLength = objectCount * offsetSize;
    if (tableLength > Integer.MAX_VALUE) {
      throw new PlistFormatException("Offset table too large: " + tableLength + " bytes", "trailer");
    }
    if (offsetTableOffset < headerSize
        || offsetTableOffset > fileLength - SIZE
        || tableLength > fileLength - SIZE - offsetTableOffset) {
      throw new PlistFormatException(
          "Offset table at " + offsetTableOffset + " does not fit in " + fileLength + " bytes",
          "trailer");
    }
  }
}
