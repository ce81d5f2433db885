package io.japlist.parser;

import io.japlist.api.Event;
import io.japlist.api.EventReader;
import io.japlist.api.PlistException;
import io.japlist.api.PlistFormatException;
import io.japlist.api.PlistIOException;
import io.japlist.parser.internal.BinaryMarker;
import io.japlist.parser.internal.BinaryTrailer;
import io.japlist.utils.PlistInput;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.longs.LongArrayList;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Event reader for the binary {@code bplist00} encoding.
 *
 * <p>File layout:
 *
 * <pre>
 * Header:
 *   [u1]*8 - "bplist00"
 *
 * Objects (repeated):
 *   u1     - marker, high nibble = type, low nibble = size or length
 *   [u1]*  - payload; containers hold object references of refSize bytes
 *
 * Offset table:
 *   [u(offsetSize)]* - absolute offset of every object, indexed by object reference
 *
 * Trailer:
 *   [u1]*32 - see {@link BinaryTrailer}
 * </pre>
 *
 * <p>Objects are decoded on demand by following references from the top object. Containers emit
 * their exact child count as length hint. An object that references one of its own ancestors is
 * rejected.
 *
 * <p>Objects may be referenced from several containers and are decoded once per reference. The
 * number of decoded objects is limited to {@value #MAX_EXPANSION} per byte of input, so a small
 * file whose shared references fan out exponentially fails instead of producing billions of
 * events.
 */
public final class BinaryReader implements EventReader {
  private static final Logger LOG = LoggerFactory.getLogger(BinaryReader.class);

  /** Reference date of binary dates: 2001-01-01T00:00:00Z. */
  static final Instant REFERENCE_DATE = Instant.ofEpochSecond(978_307_200L);

  /** Decoded objects allowed per byte of input. */
  static final int MAX_EXPANSION = 256;

  private final PlistInput input;
  private final Deque<Container> stack = new ArrayDeque<>();
  private final IntOpenHashSet openObjects = new IntOpenHashSet();

  private LongArrayList offsets; // null until the trailer was read
  private BinaryTrailer trailer;
  private long fileLength;
  private long objectBudget;
  private boolean finished;

  public BinaryReader(PlistInput input) {
    this.input = Objects.requireNonNull(input, "input must not be null");
  }

  @Override
  public Event nextEvent() throws PlistException {
    if (finished) {
      return null;
    }
    if (offsets == null) {
      readTrailer();
      return readObject((int) trailer.topObject());
    }
    Container top = stack.peek();
    if (top == null) {
      finished = true;
      return null;
    }
    if (top.next < top.refs.size()) {
      return readObject(top.refs.getInt(top.next++));
    }
    stack.pop();
    openObjects.remove(top.object);
    return top.dictionary ? new Event.EndDictionary() : new Event.EndArray();
  }

  private void readTrailer() throws PlistException {
    try {
      fileLength = input.length();
    } catch (IOException e) {
      throw PlistIOException.readFailed(0, e);
    }
    if (fileLength < PlistFormat.SIGNATURE_LENGTH + BinaryTrailer.SIZE) {
      throw new PlistFormatException("Binary property list too short: " + fileLength + " bytes");
    }
    byte[] signature = read(0, PlistFormat.SIGNATURE_LENGTH);
    if (PlistFormat.detect(signature) != PlistFormat.BINARY) {
      throw new PlistFormatException("Missing bplist00 signature", 0);
    }

    BinaryTrailer decoded =
        BinaryTrailer.decode(read(fileLength - BinaryTrailer.SIZE, BinaryTrailer.SIZE));
    decoded.validate(fileLength, PlistFormat.SIGNATURE_LENGTH);

    int count = (int) decoded.objectCount();
    ByteBuffer raw =
        ByteBuffer.wrap(read(decoded.offsetTableOffset(), count * decoded.offsetSize()));
    LongArrayList table = new LongArrayList(count);
    for (int i = 0; i < count; i++) {
      long offset = readSized(raw, decoded.offsetSize());
      if (offset < PlistFormat.SIGNATURE_LENGTH || offset >= decoded.offsetTableOffset()) {
        throw new PlistFormatException(
            "Object " + i + " has offset " + offset + " outside of the object area", "offset table");
      }
      table.add(offset);
    }
    LOG.debug(
        "Binary plist: {} objects, offset size {}, ref size {}, top object {}",
        count,
        decoded.offsetSize(),
        decoded.refSize(),
        decoded.topObject());
    trailer = decoded;
    offsets = table;
    objectBudget = fileLength * MAX_EXPANSION;
  }

  private Event readObject(int ref) throws PlistException {
    if (ref < 0 || ref >= offsets.size()) {
      throw new PlistFormatException(
          "Object reference " + ref + " outside of " + offsets.size() + " objects");
    }
    if (openObjects.contains(ref)) {
      throw new PlistFormatException("Object " + ref + " contains itself", "object " + ref);
    }
    if (--objectBudget < 0) {
      throw new PlistFormatException(
          "Shared references expand to more than "
              + fileLength * MAX_EXPANSION
              + " objects in a "
              + fileLength
              + " byte file",
          "object " + ref);
    }
    long offset = offsets.getLong(ref);
    int marker = read(offset, 1)[0] & 0xFF;
    long payload = offset + 1;
    int info = BinaryMarker.infoOf(marker);

    switch (BinaryMarker.typeOf(marker)) {
      case BinaryMarker.SINGLETON -> {
        if (marker == BinaryMarker.TRUE || marker == BinaryMarker.FALSE) {
          return new Event.BooleanValue(marker == BinaryMarker.TRUE);
        }
        throw unsupported(marker, ref);
      }
      case BinaryMarker.INTEGER -> {
        return new Event.IntegerValue(readInteger(payload, info));
      }
      case BinaryMarker.REAL -> {
        return switch (info) {
          case 2 -> new Event.RealValue(ByteBuffer.wrap(read(payload, 4)).getFloat());
          case 3 -> new Event.RealValue(ByteBuffer.wrap(read(payload, 8)).getDouble());
          default -> throw unsupported(marker, ref);
        };
      }
      case BinaryMarker.DATE -> {
        if (marker != BinaryMarker.DATE_MARKER) {
          throw unsupported(marker, ref);
        }
        double seconds = ByteBuffer.wrap(read(payload, 8)).getDouble();
        return new Event.DateValue(toInstant(seconds, ref));
      }
      case BinaryMarker.DATA -> {
        Sized sized = readLength(payload, info);
        return new Event.DataValue(read(sized.start(), checkedLength(sized.length(), 1, ref)));
      }
      case BinaryMarker.ASCII_STRING -> {
        Sized sized = readLength(payload, info);
        byte[] bytes = read(sized.start(), checkedLength(sized.length(), 1, ref));
        return new Event.StringValue(new String(bytes, StandardCharsets.US_ASCII));
      }
      case BinaryMarker.UTF16_STRING -> {
        Sized sized = readLength(payload, info);
        // length counts UTF-16 code units
        int units = checkedLength(sized.length(), 2, ref);
        byte[] bytes = read(sized.start(), units * 2);
        return new Event.StringValue(new String(bytes, StandardCharsets.UTF_16BE));
      }
      case BinaryMarker.ARRAY -> {
        Sized sized = readLength(payload, info);
        int length = checkedLength(sized.length(), trailer.refSize(), ref);
        IntArrayList refs = readRefs(sized.start(), length);
        push(new Container(ref, false, refs));
        return Event.StartArray.of(length);
      }
      case BinaryMarker.DICTIONARY -> {
        Sized sized = readLength(payload, info);
        int length = checkedLength(sized.length(), 2L * trailer.refSize(), ref);
        IntArrayList keys = readRefs(sized.start(), length);
        IntArrayList values = readRefs(sized.start() + (long) length * trailer.refSize(), length);
        IntArrayList refs = new IntArrayList(length * 2);
        for (int i = 0; i < length; i++) {
          refs.add(keys.getInt(i));
          refs.add(values.getInt(i));
        }
        push(new Container(ref, true, refs));
        return Event.StartDictionary.of(length);
      }
      default -> throw unsupported(marker, ref);
    }
  }

  private void push(Container container) {
    stack.push(container);
    openObjects.add(container.object);
  }

  /** 1, 2 and 4 byte integers are unsigned, 8 and 16 byte integers are signed. */
  private long readInteger(long position, int info) throws PlistException {
    if (info > 4) {
      throw new PlistFormatException(
          "Unsupported integer size: " + (1 << info) + " bytes", position);
    }
    ByteBuffer buffer = ByteBuffer.wrap(read(position, 1 << info));
    return switch (info) {
      case 0 -> buffer.get() & 0xFFL;
      case 1 -> buffer.getShort() & 0xFFFFL;
      case 2 -> buffer.getInt() & 0xFFFFFFFFL;
      case 3 -> buffer.getLong();
      default -> {
        long high = buffer.getLong();
        long low = buffer.getLong();
        if (high != (low >> 63)) {
          throw new PlistFormatException(
              "128-bit integer does not fit in 64 bits", position);
        }
        yield low;
      }
    };
  }

  private Sized readLength(long position, int info) throws PlistException {
    if (info != BinaryMarker.LENGTH_FOLLOWS) {
      return new Sized(info, position);
    }
    int marker = read(position, 1)[0] & 0xFF;
    if (BinaryMarker.typeOf(marker) != BinaryMarker.INTEGER) {
      throw new PlistFormatException(
          "Expected an integer length, found " + BinaryMarker.nameOf(BinaryMarker.typeOf(marker)),
          position);
    }
    int sizeInfo = BinaryMarker.infoOf(marker);
    long length = readInteger(position + 1, sizeInfo);
    return new Sized(length, position + 1 + (1L << sizeInfo));
  }

  /** Rejects lengths that are negative or cannot fit in the input. */
  private int checkedLength(long length, long unitSize, int ref) throws PlistFormatException {
    if (length < 0
        || length > Integer.MAX_VALUE / 2
        || length * unitSize > fileLength
        || length * unitSize > Integer.MAX_VALUE) {
      throw new PlistFormatException("Invalid length " + length, "object " + ref);
    }
    return (int) length;
  }

  private IntArrayList readRefs(long position, int count) throws PlistException {
    int refSize = trailer.refSize();
    ByteBuffer buffer = ByteBuffer.wrap(read(position, count * refSize));
    IntArrayList refs = new IntArrayList(count);
    for (int i = 0; i < count; i++) {
      long ref = readSized(buffer, refSize);
      if (ref >= offsets.size()) {
        throw new PlistFormatException(
            "Object reference " + ref + " outside of " + offsets.size() + " objects",
            position + (long) i * refSize);
      }
      refs.add((int) ref);
    }
    return refs;
  }

  private static Instant toInstant(double seconds, int ref) throws PlistFormatException {
    if (Double.isNaN(seconds) || Double.isInfinite(seconds)) {
      throw new PlistFormatException("Invalid date: " + seconds, "object " + ref);
    }
    long whole = (long) Math.floor(seconds);
    long nanos = Math.round((seconds - whole) * 1_000_000_000d);
    try {
      return REFERENCE_DATE.plus(Duration.ofSeconds(whole, nanos));
    } catch (ArithmeticException | DateTimeException e) {
      throw new PlistFormatException("Date out of range: " + seconds, e, "object " + ref);
    }
  }

  /** Reads an unsigned big-endian value of {@code size} bytes. */
  private static long readSized(ByteBuffer buffer, int size) throws PlistFormatException {
    long value = 0;
    for (int i = 0; i < size; i++) {
      value = (value << 8) | (buffer.get() & 0xFF);
    }
    if (value < 0) {
      throw new PlistFormatException("Offset or reference does not fit in 63 bits");
    }
    return value;
  }

  private byte[] read(long position, int length) throws PlistException {
    byte[] bytes = new byte[length];
    try {
      input.seek(position);
      input.readFully(bytes);
    } catch (IOException e) {
      throw PlistIOException.readFailed(position, e);
    }
    return bytes;
  }

  private static PlistFormatException unsupported(int marker, int ref) {
    return new PlistFormatException(
        "Unsupported object marker 0x"
            + Integer.toHexString(marker)
            + " ("
            + BinaryMarker.nameOf(BinaryMarker.typeOf(marker))
            + ")",
        "object " + ref);
  }

  /** A length together with the offset of the data it describes. */
  private record Sized(long length, long start) {}

  /** An open array or dictionary. Dictionary refs alternate key and value. */
  private static final class Container {
    final int object;
    final boolean dictionary;
    final IntArrayList refs;
    int next;

    Container(int object, boolean dictionary, IntArrayList refs) {
      this.object = object;
      this.dictionary = dictionary;
      this.refs = refs;
    }
  }
}
