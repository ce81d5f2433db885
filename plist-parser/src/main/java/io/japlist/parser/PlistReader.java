package io.japlist.parser;

import io.japlist.api.Event;
import io.japlist.api.EventReader;
import io.japlist.api.PlistException;
import io.japlist.api.PlistIOException;
import io.japlist.utils.PlistInput;
import java.io.Closeable;
import java.io.IOException;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Event reader that detects the encoding of its input and delegates to the matching reader.
 *
 * <p>Detection happens once, on the first call to {@link #nextEvent()}: the first {@value
 * PlistFormat#SIGNATURE_LENGTH} bytes are compared with the {@code bplist00} signature and the
 * input is rewound to offset 0. Inputs with the signature are read by a {@link BinaryReader},
 * everything else by an {@link XmlReader}. After that every call is forwarded to the chosen
 * reader unchanged.
 *
 * <p>If the input cannot provide the signature bytes (shorter than {@value
 * PlistFormat#SIGNATURE_LENGTH} bytes, or a read or seek fails) the call throws a {@link
 * PlistIOException} and the reader stays undecided. Before throwing it tries once more to rewind to
 * offset 0, so a later call probes again from the start whenever the input still accepts seeks.
 *
 * <pre>{@code
 * try (PlistReader reader = new PlistReader(PlistInput.open(path))) {
 *   Event event;
 *   while ((event = reader.nextEvent()) != null) {
 *     writer.write(event);
 *   }
 * }
 * }</pre>
 *
 * <p>Not thread-safe.
 */
public final class PlistReader implements EventReader, Closeable {
  private static final Logger LOG = LoggerFactory.getLogger(PlistReader.class);

  private State state;

  public PlistReader(PlistInput input) {
    this.state = new Unbound(Objects.requireNonNull(input, "input must not be null"));
  }

  @Override
  public Event nextEvent() throws PlistException {
    while (true) {
      if (state instanceof Bound bound) {
        return bound.reader().nextEvent();
      }
      state = bind((Unbound) state);
    }
  }

  /** Returns the detected encoding, or empty before the first event was requested. */
  public Optional<PlistFormat> format() {
    return state instanceof Bound bound ? Optional.of(bound.format()) : Optional.empty();
  }

  /** Closes the underlying input. */
  @Override
  public void close() throws IOException {
    state.input().close();
  }

  private static Bound bind(Unbound unbound) throws PlistIOException {
    PlistInput input = unbound.input();
    PlistFormat format;
    try {
      format = detect(input);
    } catch (IOException e) {
      throw PlistIOException.probeFailed(e);
    }
    LOG.debug("Detected {} property list encoding", format);
    EventReader reader =
        format == PlistFormat.BINARY ? new BinaryReader(input) : new XmlReader(input);
    return new Bound(format, reader, input);
  }

  private static PlistFormat detect(PlistInput input) throws IOException {
    byte[] probe = new byte[PlistFormat.SIGNATURE_LENGTH];
    try {
      input.seek(0);
      input.readFully(probe);
      input.seek(0);
    } catch (IOException e) {
      try {
        input.seek(0);
      } catch (IOException rewind) {
        e.addSuppressed(rewind);
      }
      throw e;
    }
    return PlistFormat.detect(probe);
  }

  private sealed interface State permits Unbound, Bound {
    PlistInput input();
  }

  /** Encoding not known yet; holds the input until detection succeeds. */
  private record Unbound(PlistInput input) implements State {}

  /** Encoding detected; the input now belongs to {@code reader}. */
  private record Bound(PlistFormat format, EventReader reader, PlistInput input)
      implements State {}
}
