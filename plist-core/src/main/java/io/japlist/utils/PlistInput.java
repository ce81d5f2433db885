package io.japlist.utils;

import java.io.Closeable;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.channels.SeekableByteChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;

/**
 * Random access byte input for property list readers.
 *
 * <p>Readers only need two primitives: moving to an absolute offset and reading an exact number of
 * bytes. Streaming parsers can view the input from the current position as an {@link InputStream}.
 */
public abstract class PlistInput implements Closeable {

  protected PlistInput() {}

  /** Wraps an in-memory byte array. The array is not copied. */
  public static PlistInput of(byte[] data) {
    return new ByteArrayPlistInput(Objects.requireNonNull(data, "data must not be null"));
  }

  /** Wraps a seekable channel. Closing the input closes the channel. */
  public static PlistInput of(SeekableByteChannel channel) {
    return new ChannelPlistInput(Objects.requireNonNull(channel, "channel must not be null"));
  }

  /**
   * Opens a file for reading.
   *
   * @param path the file to read
   * @return a new input positioned at offset 0
   * @throws IOException if the file cannot be opened
   */
  public static PlistInput open(Path path) throws IOException {
    Objects.requireNonNull(path, "path must not be null");
    return new ChannelPlistInput(Files.newByteChannel(path, StandardOpenOption.READ));
  }

  /**
   * Moves to an absolute offset.
   *
   * @param position the new offset, between 0 and {@link #length()}
   * @throws IOException if the offset is invalid or the input cannot seek
   */
  public abstract void seek(long position) throws IOException;

  /** Returns the current absolute offset. */
  public abstract long position() throws IOException;

  /** Returns the total length in bytes. */
  public abstract long length() throws IOException;

  /**
   * Reads exactly {@code length} bytes.
   *
   * @throws EOFException if the input ends first; the position is then unspecified
   * @throws IOException if reading fails
   */
  public abstract void readFully(byte[] buffer, int offset, int length) throws IOException;

  /** Reads exactly {@code buffer.length} bytes. */
  public void readFully(byte[] buffer) throws IOException {
    readFully(buffer, 0, buffer.length);
  }

  /**
   * Returns a stream reading from the current position onwards. Reads through the stream advance
   * this input; closing the stream does not close the input.
   */
  public InputStream asInputStream() {
    return new InputStream() {
      @Override
      public int read() throws IOException {
        byte[] one = new byte[1];
        return read(one, 0, 1) < 0 ? -1 : one[0] & 0xFF;
      }

      @Override
      public int read(byte[] b, int off, int len) throws IOException {
        Objects.checkFromIndexSize(off, len, b.length);
        if (len == 0) {
          return 0;
        }
        long available = length() - position();
        if (available <= 0) {
          return -1;
        }
        int n = (int) Math.min(len, available);
        readFully(b, off, n);
        return n;
      }
    };
  }

  /** In-memory input. */
  static final class ByteArrayPlistInput extends PlistInput {
    private final byte[] data;
    private int position;

    ByteArrayPlistInput(byte[] data) {
      this.data = data;
    }

    @Override
    public void seek(long position) throws IOException {
      if (position < 0 || position > data.length) {
        throw new IOException("Seek outside of input: " + position + " (length " + data.length + ")");
      }
      this.position = (int) position;
    }

    @Override
    public long position() {
      return position;
    }

    @Override
    public long length() {
      return data.length;
    }

    @Override
    public void readFully(byte[] buffer, int offset, int length) throws IOException {
      Objects.checkFromIndexSize(offset, length, buffer.length);
      int n = Math.min(length, data.length - position);
      System.arraycopy(data, position, buffer, offset, n);
      position += n;
      if (n < length) {
        throw new EOFException("Needed " + length + " bytes, only " + n + " available");
      }
    }

    @Override
    public void close() {}
  }

  /** Input over a {@link SeekableByteChannel}, e.g. a file channel. */
  static final class ChannelPlistInput extends PlistInput {
    private final SeekableByteChannel channel;

    ChannelPlistInput(SeekableByteChannel channel) {
      this.channel = channel;
    }

    @Override
    public void seek(long position) throws IOException {
      if (position < 0) {
        throw new IOException("Negative seek offset: " + position);
      }
      channel.position(position);
    }

    @Override
    public long position() throws IOException {
      return channel.position();
    }

    @Override
    public long length() throws IOException {
      return channel.size();
    }

    @Override
    public void readFully(byte[] buffer, int offset, int length) throws IOException {
      ByteBuffer target = ByteBuffer.wrap(buffer, offset, length);
      while (target.hasRemaining()) {
        if (channel.read(target) < 0) {
          throw new EOFException(
              "Needed " + length + " bytes, only " + (length - target.remaining()) + " available");
        }
      }
    }

    @Override
    public void close() throws IOException {
      channel.close();
    }
  }
}
