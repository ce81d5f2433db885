package io.japlist.parser;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

import io.japlist.api.Event;
import io.japlist.api.PlistFormatException;
import io.japlist.api.PlistIOException;
import io.japlist.api.Value;
import io.japlist.parser.test.SyntheticBinaryPlistGenerator;
import io.japlist.utils.PlistInput;
import java.io.EOFException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

class PlistReaderTest {

  private static final Value AGE = Value.dictionary(Map.of("Age", Value.integer(28)));

  private static final String AGE_XML =
      "<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n"
          + "<plist version=\"1.0\"><dict><key>Age</key><integer>28</integer></dict></plist>";

  private static byte[] xml(String text) {
    return text.getBytes(StandardCharsets.UTF_8);
  }

  @Test
  void bindsBinaryReaderForSignature() throws Exception {
    PlistReader reader = Plist.newReader(SyntheticBinaryPlistGenerator.generate(AGE));

    assertEquals(Optional.empty(), reader.format());
    assertEquals(Event.StartDictionary.of(1), reader.nextEvent());
    assertEquals(Optional.of(PlistFormat.BINARY), reader.format());
    assertEquals(new Event.StringValue("Age"), reader.nextEvent());
    assertEquals(new Event.IntegerValue(28), reader.nextEvent());
    assertEquals(new Event.EndDictionary(), reader.nextEvent());
    assertNull(reader.nextEvent());
  }

  @Test
  void bindsXmlReaderOtherwise() throws Exception {
    PlistReader reader = Plist.newReader(xml(AGE_XML));

    assertEquals(Event.StartDictionary.unknownLength(), reader.nextEvent());
    assertEquals(Optional.of(PlistFormat.XML), reader.format());
    assertEquals(new Event.StringValue("Age"), reader.nextEvent());
    assertEquals(new Event.IntegerValue(28), reader.nextEvent());
    assertEquals(new Event.EndDictionary(), reader.nextEvent());
    assertNull(reader.nextEvent());
  }

  @Test
  void nearMissSignatureBindsXml() {
    PlistReader reader = Plist.newReader(xml("bplist01 is not a property list"));

    // the XML reader owns the error, the binding stays
    PlistFormatException e = assertThrows(PlistFormatException.class, reader::nextEvent);
    assertEquals("FORMAT", e.getErrorCode());
    assertEquals(Optional.of(PlistFormat.XML), reader.format());
  }

  @Test
  void exhaustionIsIdempotent() throws Exception {
    for (byte[] data :
        new byte[][] {SyntheticBinaryPlistGenerator.generate(AGE), xml(AGE_XML)}) {
      PlistReader reader = Plist.newReader(data);
      while (reader.nextEvent() != null) {
        // drain
      }
      for (int i = 0; i < 3; i++) {
        assertNull(reader.nextEvent());
      }
    }
  }

  @Test
  void shortInputIsProbeError() {
    PlistReader reader = Plist.newReader(xml("<a/>"));

    PlistIOException e = assertThrows(PlistIOException.class, reader::nextEvent);
    assertInstanceOf(EOFException.class, e.getCause());
    assertEquals("IO", e.getErrorCode());
    assertEquals(Optional.empty(), reader.format());
  }

  @Test
  void subReaderStartsAtOffsetZero() throws Exception {
    PlistInput input = PlistInput.of(SyntheticBinaryPlistGenerator.generate(AGE));
    input.seek(20);

    PlistReader reader = new PlistReader(input);

    assertEquals(Event.StartDictionary.of(1), reader.nextEvent());
  }

  @Test
  void probeRewindsBeforeDelegating() throws Exception {
    PlistInput input = spy(PlistInput.of(xml(AGE_XML)));
    input.seek(9);

    new PlistReader(input).nextEvent();

    InOrder order = inOrder(input);
    order.verify(input).seek(0);
    order.verify(input).readFully(any(byte[].class), eq(0), eq(PlistFormat.SIGNATURE_LENGTH));
    order.verify(input).seek(0);
  }

  @Test
  void failedProbeLeavesReaderUnboundAndRetryable() throws Exception {
    PlistInput input = spy(PlistInput.of(SyntheticBinaryPlistGenerator.generate(AGE)));
    doThrow(new IOException("transient"))
        .doCallRealMethod()
        .when(input)
        .readFully(any(byte[].class), anyInt(), anyInt());
    PlistReader reader = new PlistReader(input);

    PlistIOException e = assertThrows(PlistIOException.class, reader::nextEvent);
    assertEquals("transient", e.getCause().getMessage());
    assertEquals(Optional.empty(), reader.format());

    assertEquals(Event.StartDictionary.of(1), reader.nextEvent());
    assertEquals(Optional.of(PlistFormat.BINARY), reader.format());
  }

  @Test
  void failedRewindIsSuppressed() throws Exception {
    PlistInput input = mock(PlistInput.class);
    doThrow(new IOException("read")).when(input).readFully(any(byte[].class));
    doNothing().doThrow(new IOException("seek")).when(input).seek(0);

    PlistIOException e = assertThrows(PlistIOException.class, new PlistReader(input)::nextEvent);

    assertEquals("read", e.getCause().getMessage());
    assertEquals(1, e.getCause().getSuppressed().length);
    assertEquals("seek", e.getCause().getSuppressed()[0].getMessage());
  }

  @Test
  void closeClosesInput() throws Exception {
    PlistInput input = mock(PlistInput.class);

    new PlistReader(input).close();

    verify(input).close();
  }
}
