package com.pmr.collab.dto;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ConflictingChangeDTO {
    private String userId;
    private JsonNode content;
    private Instant timestamp;

    public void validate() {
        WirePayload.require(userId, "conflicting_changes.user_id");
    }
}
