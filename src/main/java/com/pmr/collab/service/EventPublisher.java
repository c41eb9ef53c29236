package com.pmr.collab.service;

import com.pmr.collab.codec.EventType;
import com.pmr.collab.dto.WirePayload;

/**
 * Outbound side of the transport session as seen by the other components.
 */
public interface EventPublisher {

    /**
     * @throws com.pmr.collab.exception.NotConnectedException if the session is not connected
     * @throws com.pmr.collab.exception.ConnectionException if the frame could not be written
     */
    void publish(EventType type, WirePayload payload);

    boolean isConnected();

    /**
     * @throws com.pmr.collab.exception.NotConnectedException if the session is not connected
     */
    void ensureConnected();
}
