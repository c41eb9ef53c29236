package com.pmr.collab.dto;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Raw wire envelope: {@code {type, user_id, timestamp, data}}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class EventEnvelope {
    private String type;
    private String userId;
    private Instant timestamp;
    private JsonNode data;
}
