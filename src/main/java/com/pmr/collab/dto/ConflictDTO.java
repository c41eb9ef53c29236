package com.pmr.collab.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.pmr.collab.model.ConflictType;
import com.pmr.collab.model.ResolutionStrategy;
import lombok.Data;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
public class ConflictDTO implements WirePayload {
    private String id;
    private String sectionId;
    private List<String> conflictingUsers = new ArrayList<>();
    private ConflictType conflictType;
    private JsonNode originalContent;
    private List<ConflictingChangeDTO> conflictingChanges = new ArrayList<>();
    private Instant detectedAt;
    private ResolutionStrategy resolution;
    private boolean resolved;
    private String resolvedBy;
    private Instant resolvedAt;

    @Override
    public void validate() {
        WirePayload.require(id, "id");
        WirePayload.require(sectionId, "section_id");
        WirePayload.require(conflictType, "conflict_type");
        if (conflictingChanges == null || conflictingChanges.size() < 2) {
            throw new IllegalArgumentException("conflicting_changes needs at least two entries");
        }
        WirePayload.requireEach(conflictingChanges, "conflicting_changes");
        conflictingChanges.forEach(ConflictingChangeDTO::validate);
    }
}
