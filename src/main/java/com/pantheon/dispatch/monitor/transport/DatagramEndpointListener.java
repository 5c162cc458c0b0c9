package com.pantheon.dispatch.monitor.transport;

import java.net.SocketAddress;

/**
 * Callback sink for {@link DatagramEndpoint}.
 *
 * <p>Callbacks are delivered serially by the implementation (Netty delivers them
 * on the channel's event loop).</p>
 */
public interface DatagramEndpointListener
{
    /**
     * The transport became usable.
     */
    void onTransportUp();

    /**
     * The transport became unusable.
     *
     * @param cause diagnostic cause; {@code null} for an orderly shutdown
     */
    void onTransportDown(Throwable cause);

    /**
     * One datagram was received. The payload is a full datagram, copied out of
     * any framework buffer.
     *
     * @param remote  sender
     * @param payload raw datagram payload
     */
    void onDatagram(SocketAddress remote, byte[] payload);
}
