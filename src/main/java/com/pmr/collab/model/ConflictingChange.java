package com.pmr.collab.model;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Value;

import java.time.Instant;

@Value
public class ConflictingChange {
    String userId;
    JsonNode content;
    Instant timestamp;
}
