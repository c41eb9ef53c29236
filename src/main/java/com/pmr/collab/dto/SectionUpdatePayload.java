package com.pmr.collab.dto;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SectionUpdatePayload implements WirePayload {
    private String sectionId;
    private JsonNode content;
    private String editorId;

    @Override
    public void validate() {
        WirePayload.require(sectionId, "section_id");
        WirePayload.require(content, "content");
    }
}
