/**
 * Transport Ports
 * =============================================================================
 *
 * Framework-agnostic boundary between a concrete networking implementation
 * (Netty UDP, a test double) and the request handling of the timestamp service.
 *
 * <p>Everything above the transport adapter sees only:</p>
 * <ul>
 *   <li>Raw datagram payloads as {@code byte[]}</li>
 *   <li>Remote endpoints as standard {@link java.net.SocketAddress}</li>
 *   <li>Transport lifecycle notifications (up/down)</li>
 * </ul>
 *
 * <h2>Architectural constraints (binding)</h2>
 * Implementations of these ports MUST:
 * <ul>
 *   <li>Perform transport I/O only</li>
 *   <li>Not decode requests or call the allocation engine</li>
 *   <li>Not retry sends</li>
 * </ul>
 */
package com.questrail.tso.transport;
