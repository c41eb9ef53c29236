package com.pmr.collab.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.pmr.collab.dto.ConflictDTO;
import com.pmr.collab.dto.ConflictingChangeDTO;
import com.pmr.collab.model.Conflict;
import com.pmr.collab.model.ConflictType;
import com.pmr.collab.model.ConflictingChange;
import com.pmr.collab.model.ResolutionStrategy;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Keeps the session's conflicts, at most one open conflict per section.
 */
@Slf4j
public class ConflictDetector {
    private final List<Conflict> conflicts = new ArrayList<>();
    private final ListenerRegistry listeners;
    private final Supplier<Instant> clock;

    public ConflictDetector(ListenerRegistry listeners, Supplier<Instant> clock) {
        this.listeners = listeners;
        this.clock = clock;
    }

    /**
     * Opens a conflict for the section, or accumulates into the one already open for it.
     */
    public Conflict detect(String sectionId, JsonNode originalContent, List<ConflictingChange> changes) {
        Optional<Conflict> open = findOpen(sectionId);
        if (open.isPresent()) {
            changes.forEach(change -> accumulate(open.get(), change));
            return open.get();
        }
        Conflict conflict = new Conflict(UUID.randomUUID().toString(), sectionId, ConflictType.SIMULTANEOUS_EDIT,
                originalContent, changes, clock.get());
        conflicts.add(conflict);
        log.info("Conflict {} detected on section {} between {}",
                conflict.getId(), sectionId, conflict.getConflictingUsers());
        listeners.fire(listener -> listener.onConflictDetected(conflict));
        return conflict;
    }

    public void accumulate(Conflict conflict, ConflictingChange change) {
        if (conflict.appendChange(change)) {
            log.debug("Conflict {} now holds {} changes", conflict.getId(), conflict.getConflictingChanges().size());
        }
    }

    /**
     * Takes over a conflict reported by the server. An open local conflict for the same
     * section is replaced by the server's, keeping the local changes the server did not list.
     */
    public Conflict adopt(ConflictDTO dto) {
        Optional<Conflict> known = find(dto.getId());
        if (known.isPresent()) {
            if (!known.get().isResolved()) {
                toChanges(dto, clock.get()).forEach(change -> accumulate(known.get(), change));
            }
            return known.get();
        }

        Conflict adopted = fromDTO(dto, clock.get());
        Optional<Conflict> local = findOpen(dto.getSectionId());
        if (local.isPresent() && !adopted.isResolved()) {
            local.get().getConflictingChanges().forEach(adopted::appendChange);
            conflicts.set(conflicts.indexOf(local.get()), adopted);
            log.info("Local conflict {} superseded by server conflict {}", local.get().getId(), adopted.getId());
        } else {
            conflicts.add(adopted);
        }
        listeners.fire(listener -> listener.onConflictDetected(adopted));
        return adopted;
    }

    public List<Conflict> replaceAll(List<ConflictDTO> snapshot) {
        conflicts.clear();
        Instant now = clock.get();
        snapshot.forEach(dto -> conflicts.add(fromDTO(dto, now)));
        return getConflicts();
    }

    public Optional<Conflict> find(String conflictId) {
        return conflicts.stream()
                .filter(conflict -> conflict.getId().equals(conflictId))
                .findFirst();
    }

    public Optional<Conflict> findOpen(String sectionId) {
        return conflicts.stream()
                .filter(conflict -> !conflict.isResolved() && conflict.getSectionId().equals(sectionId))
                .findFirst();
    }

    public List<Conflict> getConflicts() {
        return Collections.unmodifiableList(new ArrayList<>(conflicts));
    }

    public List<Conflict> getUnresolvedConflicts() {
        return conflicts.stream()
                .filter(conflict -> !conflict.isResolved())
                .collect(Collectors.toUnmodifiableList());
    }

    static Conflict fromDTO(ConflictDTO dto, Instant now) {
        Conflict conflict = new Conflict(dto.getId(), dto.getSectionId(), dto.getConflictType(),
                dto.getOriginalContent(), toChanges(dto, now),
                dto.getDetectedAt() != null ? dto.getDetectedAt() : now);
        if (dto.isResolved()) {
            ResolutionStrategy strategy = dto.getResolution() != null ? dto.getResolution() : ResolutionStrategy.MANUAL;
            conflict.markResolved(strategy, dto.getResolvedBy(), dto.getResolvedAt());
        }
        return conflict;
    }

    // changes without a timestamp count as made when the conflict was detected
    private static List<ConflictingChange> toChanges(ConflictDTO dto, Instant now) {
        Instant fallback = dto.getDetectedAt() != null ? dto.getDetectedAt() : now;
        List<ConflictingChange> changes = new ArrayList<>();
        for (ConflictingChangeDTO change : dto.getConflictingChanges()) {
            changes.add(new ConflictingChange(change.getUserId(), change.getContent(),
                    change.getTimestamp() != null ? change.getTimestamp() : fallback));
        }
        return changes;
    }
}
