package com.pmr.collab.model;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Value;

import java.time.Instant;

/**
 * Local view of one report section. The content is opaque and never interpreted here.
 */
@Value
public class SectionState {
    String sectionId;
    JsonNode content;
    Instant lastModified;
    String lastModifiedBy;
}
