package io.japlist.api;

/**
 * Push consumer of property list events.
 *
 * <p>The event stream is flat, so writers track container nesting and dictionary key position
 * themselves. Nothing is promised about buffering; writers that produce output document how it is
 * finished and flushed.
 */
public interface EventWriter {

  /**
   * Accepts one event.
   *
   * @param event the event to consume
   * @throws PlistException if the event is not valid at this position or output fails
   */
  void write(Event event) throws PlistException;
}
