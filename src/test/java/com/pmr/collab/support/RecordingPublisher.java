package com.pmr.collab.support;

import com.pmr.collab.codec.EventType;
import com.pmr.collab.dto.WirePayload;
import com.pmr.collab.exception.NotConnectedException;
import com.pmr.collab.model.ConnectionState;
import com.pmr.collab.service.EventPublisher;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Publisher that records outbound events instead of sending them.
 */
public class RecordingPublisher implements EventPublisher {
    private final List<Published> published = new ArrayList<>();
    private boolean connected = true;

    @Override
    public void publish(EventType type, WirePayload payload) {
        ensureConnected();
        published.add(new Published(type, payload));
    }

    @Override
    public boolean isConnected() {
        return connected;
    }

    @Override
    public void ensureConnected() {
        if (!connected) {
            throw new NotConnectedException(ConnectionState.RECONNECTING);
        }
    }

    public void setConnected(boolean connected) {
        this.connected = connected;
    }

    public List<Published> getPublished() {
        return published;
    }

    public List<EventType> types() {
        return published.stream().map(Published::getType).collect(Collectors.toList());
    }

    public <T extends WirePayload> T last(EventType type, Class<T> payloadType) {
        for (int i = published.size() - 1; i >= 0; i--) {
            if (published.get(i).getType() == type) {
                return payloadType.cast(published.get(i).getPayload());
            }
        }
        throw new AssertionError("Nothing published for " + type);
    }

    @Value
    public static class Published {
        EventType type;
        WirePayload payload;
    }
}
