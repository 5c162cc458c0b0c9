package com.pantheon.dispatch.monitor.transport;

import java.net.SocketAddress;

/**
 * DatagramEndpoint
 * -----------------------------------------------------------------------------
 * Port for a datagram transport (UDP-style) used to talk to the RFID reader.
 *
 * <p>The endpoint moves bytes only. Decoding reports into tag identifiers and
 * deciding what to send belong to the reader driver above it. Implementations
 * may be backed by Netty or by a test double.</p>
 */
public interface DatagramEndpoint
{
    /**
     * Start the endpoint and begin receiving datagrams.
     *
     * <p>On successful activation the endpoint notifies its listener via
     * {@link DatagramEndpointListener#onTransportUp()}.</p>
     */
    void start();

    /**
     * Stop the endpoint and release all transport resources.
     *
     * <p>The listener is notified via
     * {@link DatagramEndpointListener#onTransportDown(Throwable)}.</p>
     */
    void stop();

    /**
     * Send a datagram to the specified remote endpoint. Silently dropped when the
     * transport is not up.
     */
    void send(SocketAddress remote, byte[] payload);

    /**
     * Register the listener that receives inbound datagrams and lifecycle events.
     * Must be called before {@link #start()}.
     */
    void setListener(DatagramEndpointListener listener);
}
