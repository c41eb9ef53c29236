package com.pmr.collab.codec;

import com.pmr.collab.dto.CommentDTO;
import com.pmr.collab.dto.CommentResolvePayload;
import com.pmr.collab.dto.ConflictDTO;
import com.pmr.collab.dto.ConflictResolvedPayload;
import com.pmr.collab.dto.CursorPayload;
import com.pmr.collab.dto.HeartbeatPayload;
import com.pmr.collab.dto.SectionUpdatePayload;
import com.pmr.collab.dto.SyncPayload;
import com.pmr.collab.dto.UserPresencePayload;
import com.pmr.collab.dto.WirePayload;

import java.util.Arrays;
import java.util.Optional;

/**
 * Event kinds of the collaboration protocol with their wire tag and payload type.
 */
public enum EventType {
    USER_JOINED("user_joined", UserPresencePayload.class),
    USER_LEFT("user_left", UserPresencePayload.class),
    CURSOR_POSITION("cursor_position", CursorPayload.class),
    SECTION_UPDATE("section_update", SectionUpdatePayload.class),
    CONFLICT_DETECTED("conflict_detected", ConflictDTO.class),
    CONFLICT_RESOLVED("conflict_resolved", ConflictResolvedPayload.class),
    COMMENT_ADD("comment_add", CommentDTO.class),
    COMMENT_RESOLVE("comment_resolve", CommentResolvePayload.class),
    SYNC("sync", SyncPayload.class),
    HEARTBEAT("heartbeat", HeartbeatPayload.class);

    private final String wireName;
    private final Class<? extends WirePayload> payloadType;

    EventType(String wireName, Class<? extends WirePayload> payloadType) {
        this.wireName = wireName;
        this.payloadType = payloadType;
    }

    public String getWireName() {
        return wireName;
    }

    public Class<? extends WirePayload> getPayloadType() {
        return payloadType;
    }

    public static Optional<EventType> fromWireName(String wireName) {
        return Arrays.stream(values())
                .filter(type -> type.wireName.equals(wireName))
                .findFirst();
    }
}
