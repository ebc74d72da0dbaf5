package com.questrail.navigation.protocol.step.transport;

import java.net.SocketAddress;

/**
 * DatagramEndpoint
 * -----------------------------------------------------------------------------
 * Minimal port for a datagram-based transport (UDP-style).
 *
 * <p>Higher layers are responsible for turning inbound payloads into
 * acknowledgements and for deciding when to send. Implementations may be
 * backed by Netty, java.nio, or a test double.</p>
 */
public interface DatagramEndpoint
{
    /**
     * Start the endpoint and begin receiving datagrams.
     *
     * <p>On successful activation, the endpoint MUST notify its listener via
     * {@link DatagramEndpointListener#onTransportUp()} exactly once per
     * transition. Activation may complete asynchronously.</p>
     */
    void start();

    /**
     * Stop the endpoint and release all transport resources.
     *
     * <p>The listener is notified via
     * {@link DatagramEndpointListener#onTransportDown(Throwable)} at most once
     * per transition.</p>
     */
    void stop();

    /**
     * Send a datagram to the specified remote endpoint.
     *
     * @return {@code true} if the datagram was handed to the transport;
     *         {@code false} if the endpoint is not up
     */
    boolean send(SocketAddress remote, byte[] payload);

    /**
     * Register the listener that receives inbound datagrams and lifecycle events.
     *
     * <p>This must be called before {@link #start()}.</p>
     */
    void setListener(DatagramEndpointListener listener);
}
