/**
 * Structured Response Decoding
 * =============================================================================
 *
 * <p>This package turns the raw scratch lines of a structured query into typed
 * data. Each response line is a {@code ;}-separated record:</p>
 *
 * <pre>
 *   name ; kind ; vary ; value [; extras...]
 * </pre>
 *
 * <h2>Layering</h2>
 * <pre>
 *   ResponseLine
 *        → FieldRecord          (positional view, structural checks)
 *            → FieldDecoder     (kind-tag dispatch → DecodedValue)
 *                → ArrayReassembler (name[i] + num_names → ArrayField)
 * </pre>
 *
 * <h2>Error taxonomy</h2>
 * <ul>
 *   <li>{@link com.questrail.tao.protocol.ProtocolException}: malformed record</li>
 *   <li>{@link com.questrail.tao.protocol.decode.DecodeException}: one field's value
 *       does not match its kind</li>
 *   <li>{@link com.questrail.tao.protocol.decode.ConsistencyException}: an array
 *       contradicts its indices or advertised count</li>
 *   <li>{@link com.questrail.tao.protocol.decode.MalformedRowException}: a matrix
 *       row has the wrong width</li>
 * </ul>
 *
 * <p>Whether decode and consistency failures abort or are reported is chosen
 * with {@link com.questrail.tao.protocol.decode.DecodeStrictness}.</p>
 *
 * <p>Nothing in this package performs I/O.</p>
 */
package com.questrail.tao.protocol.decode;
