package com.pmr.collab.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.pmr.collab.codec.EventType;
import com.pmr.collab.dto.SectionUpdatePayload;
import com.pmr.collab.model.Conflict;
import com.pmr.collab.model.ConflictingChange;
import com.pmr.collab.model.SectionState;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Applies local edits optimistically and merges remote edits into the local document view.
 * A remote edit racing an unacknowledged local edit is handed to the {@link ConflictDetector}
 * instead of being applied.
 */
@Slf4j
public class SectionSynchronizer {
    static final int RECENT_CHANGES_LIMIT = 50;

    private final String localUserId;
    private final EventPublisher publisher;
    private final ConflictDetector detector;
    private final ListenerRegistry listeners;
    private final Supplier<Instant> clock;
    private final Duration remoteConflictWindow;

    private final Map<String, SectionState> sections = new LinkedHashMap<>();
    // local edits the server has not echoed back yet
    private final Map<String, TrackedEdit> inFlight = new HashMap<>();
    private final Map<String, TrackedEdit> lastRemote = new HashMap<>();
    private final Deque<SectionState> recentRemoteChanges = new ArrayDeque<>();

    public SectionSynchronizer(String localUserId, EventPublisher publisher, ConflictDetector detector,
                               ListenerRegistry listeners, Supplier<Instant> clock, Duration remoteConflictWindow) {
        this.localUserId = localUserId;
        this.publisher = publisher;
        this.detector = detector;
        this.listeners = listeners;
        this.clock = clock;
        this.remoteConflictWindow = remoteConflictWindow;
    }

    /**
     * Applies the edit locally, then broadcasts it. The local change is kept even if the
     * broadcast throws; the caller decides how to surface that.
     */
    public SectionState updateSection(String sectionId, JsonNode content) {
        Instant now = clock.get();
        ConflictingChange change = new ConflictingChange(localUserId, content, now);
        SectionState state = new SectionState(sectionId, content, now, localUserId);
        track(sectionId, change);
        sections.put(sectionId, state);
        detector.findOpen(sectionId).ifPresent(conflict -> detector.accumulate(conflict, change));

        publisher.publish(EventType.SECTION_UPDATE, new SectionUpdatePayload(sectionId, content, localUserId));
        return state;
    }

    public void applyRemote(String senderId, Instant timestamp, SectionUpdatePayload payload) {
        String sectionId = payload.getSectionId();
        String editorId = payload.getEditorId() != null ? payload.getEditorId() : senderId;
        Instant at = timestamp != null ? timestamp : clock.get();

        if (localUserId.equals(editorId)) {
            acknowledge(payload);
            return;
        }

        ConflictingChange change = new ConflictingChange(editorId, payload.getContent(), at);
        Optional<Conflict> open = detector.findOpen(sectionId);
        if (open.isPresent()) {
            detector.accumulate(open.get(), change);
            return;
        }

        TrackedEdit pending = inFlight.get(sectionId);
        if (pending != null) {
            detector.detect(sectionId, pending.getBaseContent(), List.of(pending.getChange(), change));
            return;
        }

        TrackedEdit previous = lastRemote.get(sectionId);
        if (isConcurrentRemote(previous, change)) {
            detector.detect(sectionId, previous.getBaseContent(), List.of(previous.getChange(), change));
            return;
        }

        lastRemote.put(sectionId, new TrackedEdit(contentOf(sectionId), change));
        SectionState state = apply(sectionId, payload.getContent(), at, editorId);
        recentRemoteChanges.addLast(state);
        while (recentRemoteChanges.size() > RECENT_CHANGES_LIMIT) {
            recentRemoteChanges.removeFirst();
        }
    }

    /**
     * Applies and broadcasts content chosen by a local conflict resolution.
     */
    public void publishResolution(String sectionId, JsonNode content) {
        Instant now = clock.get();
        lastRemote.remove(sectionId);
        inFlight.remove(sectionId);
        track(sectionId, new ConflictingChange(localUserId, content, now));
        apply(sectionId, content, now, localUserId);
        publisher.publish(EventType.SECTION_UPDATE, new SectionUpdatePayload(sectionId, content, localUserId));
    }

    /**
     * Applies content carried by a peer's conflict resolution.
     */
    public void applyResolution(String sectionId, JsonNode content, String resolverId, Instant at) {
        clearPending(sectionId);
        apply(sectionId, content, at != null ? at : clock.get(), resolverId);
    }

    public void clearPending(String sectionId) {
        inFlight.remove(sectionId);
        lastRemote.remove(sectionId);
    }

    /** Forgets in-flight edits after a fresh snapshot. The section contents are kept. */
    public void reset() {
        inFlight.clear();
        lastRemote.clear();
    }

    public boolean hasPendingEdit(String sectionId) {
        return inFlight.containsKey(sectionId);
    }

    public Optional<SectionState> getSection(String sectionId) {
        return Optional.ofNullable(sections.get(sectionId));
    }

    public List<SectionState> getSections() {
        return Collections.unmodifiableList(new ArrayList<>(sections.values()));
    }

    public List<SectionState> getRecentRemoteChanges() {
        return Collections.unmodifiableList(new ArrayList<>(recentRemoteChanges));
    }

    private void track(String sectionId, ConflictingChange change) {
        TrackedEdit previous = inFlight.get(sectionId);
        JsonNode base = previous != null ? previous.getBaseContent() : contentOf(sectionId);
        inFlight.put(sectionId, new TrackedEdit(base, change));
    }

    private void acknowledge(SectionUpdatePayload echo) {
        TrackedEdit pending = inFlight.get(echo.getSectionId());
        if (pending != null && Objects.equals(pending.getChange().getContent(), echo.getContent())) {
            inFlight.remove(echo.getSectionId());
            log.debug("Edit of section {} acknowledged", echo.getSectionId());
        }
    }

    private boolean isConcurrentRemote(TrackedEdit previous, ConflictingChange change) {
        if (previous == null || remoteConflictWindow.isZero() || remoteConflictWindow.isNegative()) {
            return false;
        }
        if (previous.getChange().getUserId().equals(change.getUserId())) {
            return false;
        }
        Duration gap = Duration.between(previous.getChange().getTimestamp(), change.getTimestamp()).abs();
        return gap.compareTo(remoteConflictWindow) <= 0;
    }

    private SectionState apply(String sectionId, JsonNode content, Instant at, String editorId) {
        SectionState state = new SectionState(sectionId, content, at, editorId);
        sections.put(sectionId, state);
        listeners.fire(listener -> listener.onSectionUpdate(sectionId, content, editorId));
        return state;
    }

    private JsonNode contentOf(String sectionId) {
        SectionState state = sections.get(sectionId);
        return state != null ? state.getContent() : null;
    }

    @Value
    private static class TrackedEdit {
        JsonNode baseContent;
        ConflictingChange change;
    }
}
