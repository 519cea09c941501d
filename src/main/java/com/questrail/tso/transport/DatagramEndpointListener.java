package com.questrail.tso.transport;

import java.net.SocketAddress;

/**
 * DatagramEndpointListener
 * -----------------------------------------------------------------------------
 * Callback sink for {@link DatagramEndpoint}.
 *
 * <p>Ordering guarantees must be documented by each concrete endpoint (Netty
 * endpoints serialize callbacks on the channel's event loop).</p>
 */
public interface DatagramEndpointListener
{
    /**
     * Called when the transport becomes usable.
     */
    void onTransportUp();

    /**
     * Called when the transport becomes unusable.
     *
     * @param cause an exception or diagnostic cause; may be {@code null} for
     *              orderly shutdown
     */
    void onTransportDown(Throwable cause);

    /**
     * Called when a datagram is received.
     *
     * <p>The payload is delivered exactly as received. Netty-backed
     * implementations copy from {@code ByteBuf} into a {@code byte[]} and release
     * reference-counted buffers internally.</p>
     *
     * @param remote remote sender endpoint
     * @param payload raw datagram payload
     */
    void onDatagram(SocketAddress remote, byte[] payload);
}
