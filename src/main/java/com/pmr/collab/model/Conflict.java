package com.pmr.collab.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.pmr.collab.exception.AlreadyResolvedException;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Overlapping edits to one section that neither editor had observed.
 * Only the resolution fields change after creation, and only once.
 */
@Getter
@ToString
public class Conflict {
    private final String id;
    private final String sectionId;
    private final ConflictType type;
    private final JsonNode originalContent;
    private final List<String> conflictingUsers = new ArrayList<>();
    private final List<ConflictingChange> conflictingChanges = new ArrayList<>();
    private final Instant detectedAt;
    private ResolutionStrategy resolution;
    private boolean resolved;
    private String resolvedBy;
    private Instant resolvedAt;

    public Conflict(String id, String sectionId, ConflictType type, JsonNode originalContent,
                    List<ConflictingChange> changes, Instant detectedAt) {
        if (changes == null || changes.size() < 2) {
            throw new IllegalArgumentException("A conflict needs at least two changes, got "
                    + (changes == null ? 0 : changes.size()));
        }
        this.id = id;
        this.sectionId = sectionId;
        this.type = type;
        this.originalContent = originalContent;
        this.detectedAt = detectedAt;
        changes.forEach(this::addChange);
    }

    public List<String> getConflictingUsers() {
        return Collections.unmodifiableList(conflictingUsers);
    }

    public List<ConflictingChange> getConflictingChanges() {
        return Collections.unmodifiableList(conflictingChanges);
    }

    /**
     * Accumulates a further change into this still-open conflict.
     *
     * @return false if an identical change is already recorded
     */
    public boolean appendChange(ConflictingChange change) {
        if (resolved) {
            throw new AlreadyResolvedException(id);
        }
        return addChange(change);
    }

    public void markResolved(ResolutionStrategy strategy, String userId, Instant at) {
        if (resolved) {
            throw new AlreadyResolvedException(id);
        }
        this.resolution = strategy;
        this.resolvedBy = userId;
        this.resolvedAt = at;
        this.resolved = true;
    }

    /**
     * The change with the latest timestamp; on a tie the one recorded last wins.
     */
    public ConflictingChange latestChange() {
        ConflictingChange latest = conflictingChanges.get(0);
        for (ConflictingChange change : conflictingChanges) {
            if (!change.getTimestamp().isBefore(latest.getTimestamp())) {
                latest = change;
            }
        }
        return latest;
    }

    private boolean addChange(ConflictingChange change) {
        if (conflictingChanges.contains(change)) {
            return false;
        }
        conflictingChanges.add(change);
        if (!conflictingUsers.contains(change.getUserId())) {
            conflictingUsers.add(change.getUserId());
        }
        return true;
    }
}
