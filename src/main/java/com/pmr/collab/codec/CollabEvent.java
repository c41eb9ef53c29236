package com.pmr.collab.codec;

import com.pmr.collab.dto.WirePayload;
import lombok.Value;

import java.time.Instant;

/**
 * A decoded inbound event whose payload has already been validated for its kind.
 */
@Value
public class CollabEvent {
    EventType type;
    String userId;
    Instant timestamp;
    WirePayload payload;

    public <T extends WirePayload> T payloadAs(Class<T> payloadType) {
        return payloadType.cast(payload);
    }
}
