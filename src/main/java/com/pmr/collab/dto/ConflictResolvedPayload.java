package com.pmr.collab.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.pmr.collab.model.ResolutionStrategy;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ConflictResolvedPayload implements WirePayload {
    private String conflictId;
    private String sectionId;
    private ResolutionStrategy resolution;
    private JsonNode content;

    @Override
    public void validate() {
        WirePayload.require(conflictId, "conflict_id");
        WirePayload.require(resolution, "resolution");
    }
}
