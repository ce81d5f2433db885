package io.japlist.parser.internal;

/**
 * Object markers of the {@code bplist00} encoding. The high nibble of a marker byte selects the
 * object type, the low nibble carries a size or a length.
 */
public final class BinaryMarker {
  private BinaryMarker() {}

  // High nibble
  public static final int SINGLETON = 0x0;
  public static final int INTEGER = 0x1;
  public static final int REAL = 0x2;
  public static final int DATE = 0x3;
  public static final int DATA = 0x4;
  public static final int ASCII_STRING = 0x5;
  public static final int UTF16_STRING = 0x6;
  public static final int UID = 0x8;
  public static final int ARRAY = 0xA;
  public static final int SET = 0xC;
  public static final int DICTIONARY = 0xD;

  // Complete marker bytes
  public static final int NULL = 0x00;
  public static final int FALSE = 0x08;
  public static final int TRUE = 0x09;
  public static final int FILL = 0x0F;
  public static final int DATE_MARKER = 0x33;

  /** Low nibble value meaning an integer object holding the real length follows. */
  public static final int LENGTH_FOLLOWS = 0xF;

  /** Returns the object type of a marker byte. */
  public static int typeOf(int marker) {
    return (marker >>> 4) & 0xF;
  }

  /** Returns the size or length nibble of a marker byte. */
  public static int infoOf(int marker) {
    return marker & 0xF;
  }

  /** Returns a human-readable name for the given object type. */
  public static String nameOf(int type) {
    return switch (type) {
      case SINGLETON -> "SINGLETON";
      case INTEGER -> "INTEGER";
      case REAL -> "REAL";
      case DATE -> "DATE";
      case DATA -> "DATA";
      case ASCII_STRING -> "ASCII_STRING";
      case UTF16_STRING -> "UTF16_STRING";
      case UID -> "UID";
      case ARRAY -> "ARRAY";
      case SET -> "SET";
      case DICTIONARY -> "DICTIONARY";
      default -> "UNKNOWN(0x" + Integer.toHexString(type) + ")";
    };
  }
}
