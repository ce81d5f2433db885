/**
 * Encodings of property lists.
 *
 * <ul>
 *   <li>{@link io.japlist.parser.PlistReader} detects the encoding of an input and delegates to
 *       {@link io.japlist.parser.BinaryReader} or {@link io.japlist.parser.XmlReader}.
 *   <li>{@link io.japlist.parser.XmlWriter} encodes an event stream as XML.
 *   <li>{@link io.japlist.parser.Plist} reads and writes whole {@link io.japlist.api.Value}s.
 * </ul>
 */
package io.japlist.parser;
