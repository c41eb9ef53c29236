package com.pmr.collab.transport;

import java.net.URI;

/**
 * Opens duplex text connections to a collaboration endpoint.
 */
public interface Transport {

    /**
     * Starts connecting. The outcome is reported through the listener: exactly one of
     * {@link TransportListener#onOpen} or {@link TransportListener#onConnectFailed}.
     */
    void connect(URI endpoint, String accessToken, TransportListener listener);
}
