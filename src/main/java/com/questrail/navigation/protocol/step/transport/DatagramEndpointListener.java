package com.questrail.navigation.protocol.step.transport;

import java.net.SocketAddress;

/**
 * DatagramEndpointListener
 * -----------------------------------------------------------------------------
 * Callback sink for {@link DatagramEndpoint}.
 *
 * <p>Callbacks must be delivered in a serialized manner by the implementation.
 * They typically arrive on a transport thread, not the planning thread.</p>
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
     * Called when a datagram is received. The payload is one complete
     * datagram, copied out of any framework buffer.
     */
    void onDatagram(SocketAddress remote, byte[] payload);
}
