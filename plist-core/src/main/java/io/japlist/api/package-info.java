/**
 * Public API for reading and writing property lists as a flat stream of events.
 *
 * <p><b>Model</b>
 *
 * <ul>
 *   <li>{@link io.japlist.api.Value} is the in-memory tree: arrays, ordered dictionaries and the
 *       scalar types boolean, data, date, integer, real and string.
 *   <li>{@link io.japlist.api.Event} is the encoding independent stream representation of a value.
 *   <li>{@link io.japlist.api.EventReader} pulls events from an encoded source and {@link
 *       io.japlist.api.EventWriter} pushes them into an encoder.
 * </ul>
 *
 * <p><b>Example</b>
 *
 * <pre>{@code
 * Value value = Value.dictionary(Map.of("Age", Value.integer(28)));
 * List<Event> events = ValueEvents.flatten(value);
 * // [StartDictionary(1), StringValue("Age"), IntegerValue(28), EndDictionary]
 * }</pre>
 */
package io.japlist.api;
