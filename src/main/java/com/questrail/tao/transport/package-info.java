/**
 * Engine Transport Port
 * =============================================================================
 *
 * These types define the boundary between the protocol layers (command
 * serialization, structured queries, field decoding) and whatever carries
 * bytes to and from the engine.
 *
 * <h2>Architectural constraints</h2>
 * Implementations of {@link com.questrail.tao.transport.EngineTransport} MUST:
 * <ul>
 *   <li>Perform transport work only (no splitting or decoding of scratch lines)</li>
 *   <li>Block until the engine has answered each call</li>
 *   <li>Not retry failed calls</li>
 *   <li>Signal crash and close through the exception types in this package</li>
 * </ul>
 *
 * <p>Spawning and supervising an engine subprocess is outside this package.</p>
 */
package com.questrail.tao.transport;
