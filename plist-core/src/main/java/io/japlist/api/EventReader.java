package io.japlist.api;

/**
 * Pull source of property list events.
 *
 * <p>Readers are single-pass and single-consumer. Once the end of the stream is reached every
 * further call returns {@code null} again. The behavior of a call following a thrown exception is
 * reader specific and should not be relied upon.
 */
public interface EventReader {

  /**
   * Returns the next event.
   *
   * @return the next event, or {@code null} at the end of the stream
   * @throws PlistException if the underlying input fails or is malformed
   */
  Event nextEvent() throws PlistException;
}
