package com.pmr.collab.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.pmr.collab.codec.EventType;
import com.pmr.collab.dto.ConflictResolvedPayload;
import com.pmr.collab.exception.AlreadyResolvedException;
import com.pmr.collab.model.Conflict;
import com.pmr.collab.model.ResolutionStrategy;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Resolves conflicts on user request and applies resolutions made by peers.
 */
@Slf4j
public class ConflictResolver {
    private final String localUserId;
    private final EventPublisher publisher;
    private final ConflictDetector detector;
    private final SectionSynchronizer synchronizer;
    private final ListenerRegistry listeners;
    private final Supplier<Instant> clock;

    public ConflictResolver(String localUserId, EventPublisher publisher, ConflictDetector detector,
                            SectionSynchronizer synchronizer, ListenerRegistry listeners, Supplier<Instant> clock) {
        this.localUserId = localUserId;
        this.publisher = publisher;
        this.detector = detector;
        this.synchronizer = synchronizer;
        this.listeners = listeners;
        this.clock = clock;
    }

    /**
     * Resolves a conflict and broadcasts the outcome so every peer converges on it.
     *
     * @param mergeFunction required for {@link ResolutionStrategy#MERGE}, ignored otherwise
     * @throws AlreadyResolvedException if the conflict was resolved before; nothing is broadcast
     * @throws IllegalArgumentException if no such conflict exists or a merge has no merge function
     */
    public Conflict resolve(String conflictId, ResolutionStrategy strategy, MergeFunction mergeFunction) {
        Conflict conflict = detector.find(conflictId)
                .orElseThrow(() -> new IllegalArgumentException("Conflict not found: " + conflictId));
        if (conflict.isResolved()) {
            throw new AlreadyResolvedException(conflictId);
        }
        publisher.ensureConnected();

        JsonNode content = resolvedContent(conflict, strategy, mergeFunction);
        conflict.markResolved(strategy, localUserId, clock.get());
        log.info("Conflict {} on section {} resolved by {} using {}",
                conflictId, conflict.getSectionId(), localUserId, strategy.getWireName());

        publisher.publish(EventType.CONFLICT_RESOLVED,
                new ConflictResolvedPayload(conflictId, conflict.getSectionId(), strategy, content));
        if (content != null) {
            synchronizer.publishResolution(conflict.getSectionId(), content);
        } else {
            synchronizer.clearPending(conflict.getSectionId());
        }
        listeners.fire(listener -> listener.onConflictResolved(conflict));
        return conflict;
    }

    /**
     * Applies a peer's {@code conflict_resolved}. Peers that synthesised the conflict
     * locally know it under another id, so the section id is the fallback key.
     */
    public void applyRemote(String resolverId, Instant timestamp, ConflictResolvedPayload payload) {
        Optional<Conflict> conflict = detector.find(payload.getConflictId());
        if (conflict.isEmpty() && payload.getSectionId() != null) {
            conflict = detector.findOpen(payload.getSectionId());
        }
        String sectionId = conflict.map(Conflict::getSectionId).orElse(payload.getSectionId());

        if (conflict.isPresent() && !conflict.get().isResolved()) {
            conflict.get().markResolved(payload.getResolution(), resolverId, timestamp != null ? timestamp : clock.get());
        } else if (conflict.isPresent()) {
            log.debug("Conflict {} already resolved, ignoring duplicate resolution", conflict.get().getId());
            return;
        } else {
            log.debug("Resolution for unknown conflict {}", payload.getConflictId());
        }

        if (sectionId != null) {
            if (payload.getContent() != null) {
                synchronizer.applyResolution(sectionId, payload.getContent(), resolverId, timestamp);
            } else {
                synchronizer.clearPending(sectionId);
            }
        }
        conflict.ifPresent(resolved -> listeners.fire(listener -> listener.onConflictResolved(resolved)));
    }

    private JsonNode resolvedContent(Conflict conflict, ResolutionStrategy strategy, MergeFunction mergeFunction) {
        switch (strategy) {
            case OVERWRITE:
                return conflict.latestChange().getContent();
            case MERGE:
                if (mergeFunction == null) {
                    throw new IllegalArgumentException("Merge resolution needs a merge function");
                }
                return mergeFunction.merge(conflict.getOriginalContent(), conflict.getConflictingChanges());
            case MANUAL:
            default:
                return null;
        }
    }
}
