package io.japlist.parser;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/** Physical encodings a {@link PlistReader} can detect. */
public enum PlistFormat {
  /** Compact binary encoding, starting with {@code bplist00}. */
  BINARY,
  /** XML markup encoding. Anything without the binary signature is assumed to be XML. */
  XML;

  /** Number of leading bytes inspected when detecting the encoding. */
  public static final int SIGNATURE_LENGTH = 8;

  private static final byte[] BINARY_SIGNATURE = "bplist00".getBytes(StandardCharsets.US_ASCII);

  /**
   * Classifies the leading bytes of a property list.
   *
   * @param probe exactly {@link #SIGNATURE_LENGTH} bytes read from offset 0
   * @return {@link #BINARY} if the bytes are the binary signature, {@link #XML} otherwise
   */
  public static PlistFormat detect(byte[] probe) {
    if (probe.length != SIGNATURE_LENGTH) {
      throw new IllegalArgumentException(
          "Probe must be " + SIGNATURE_LENGTH + " bytes, got " + probe.length);
    }
    return Arrays.equals(probe, BINARY_SIGNATURE) ? BINARY : XML;
  }

  /** Returns a copy of the binary signature. */
  public static byte[] binarySignature() {
    return BINARY_SIGNATURE.clone();
  }
}
