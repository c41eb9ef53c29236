package com.pmr.collab.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.pmr.collab.model.ConflictingChange;

import java.util.List;

/**
 * Combines conflicting section contents. The collaboration core treats content as opaque,
 * so the merge semantics belong to the application.
 */
@FunctionalInterface
public interface MergeFunction {

    /**
     * @param original content of the section before the conflicting edits, may be null
     * @param changes  conflicting changes in arrival order
     * @return the merged content to broadcast as authoritative
     */
    JsonNode merge(JsonNode original, List<ConflictingChange> changes);
}
