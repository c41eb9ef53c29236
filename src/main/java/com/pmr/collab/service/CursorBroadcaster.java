package com.pmr.collab.service;

import com.pmr.collab.codec.EventType;
import com.pmr.collab.dto.CursorPayload;
import com.pmr.collab.model.ActiveUser;
import com.pmr.collab.model.CursorPosition;
import com.pmr.collab.model.Position;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Throttles the local pointer onto the wire and keeps the latest pointer of every remote user.
 */
@Slf4j
public class CursorBroadcaster {
    private final String localUserId;
    private final EventPublisher publisher;
    private final SessionEventLoop loop;
    private final PresenceTracker presence;
    private final Duration throttle;
    private final Map<String, CursorPosition> remoteCursors = new LinkedHashMap<>();

    private CursorPayload pending;
    private SessionEventLoop.Cancellable flushTimer;

    public CursorBroadcaster(String localUserId, EventPublisher publisher, SessionEventLoop loop,
                             PresenceTracker presence, Duration throttle) {
        this.localUserId = localUserId;
        this.publisher = publisher;
        this.loop = loop;
        this.presence = presence;
        this.throttle = throttle;
    }

    /**
     * Queues the local pointer. At most one position is sent per throttle window;
     * positions superseded within the window are dropped.
     */
    public void updateCursor(String sectionId, double x, double y) {
        publisher.ensureConnected();
        pending = new CursorPayload(sectionId, x, y);
        if (flushTimer == null) {
            flushTimer = loop.schedule(this::flush, throttle);
        }
    }

    private void flush() {
        flushTimer = null;
        CursorPayload payload = pending;
        pending = null;
        if (payload == null) {
            return;
        }
        if (!publisher.isConnected()) {
            log.debug("Dropping cursor update for section {}, session no longer connected", payload.getSectionId());
            return;
        }
        publisher.publish(EventType.CURSOR_POSITION, payload);
    }

    /**
     * @return the stored cursor, or empty for the local user's own echo
     */
    public Optional<CursorPosition> applyRemote(String userId, CursorPayload payload) {
        if (userId == null || userId.equals(localUserId)) {
            return Optional.empty();
        }
        String userName = presence.find(userId).map(ActiveUser::getName).orElse(userId);
        CursorPosition cursor = new CursorPosition(userId, userName, payload.getSectionId(),
                new Position(payload.getX(), payload.getY()), presence.colorFor(userId));
        remoteCursors.put(userId, cursor);
        return Optional.of(cursor);
    }

    public void remove(String userId) {
        remoteCursors.remove(userId);
    }

    public void clear() {
        remoteCursors.clear();
    }

    /** Cancels the pending throttle window without sending. */
    public void cancel() {
        if (flushTimer != null) {
            flushTimer.cancel();
            flushTimer = null;
        }
        pending = null;
    }

    public List<CursorPosition> getRemoteCursors() {
        return Collections.unmodifiableList(new ArrayList<>(remoteCursors.values()));
    }
}
