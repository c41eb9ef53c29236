package com.pmr.collab.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CursorPayload implements WirePayload {
    private String sectionId;
    private Double x;
    private Double y;

    @Override
    public void validate() {
        WirePayload.require(sectionId, "section_id");
        WirePayload.require(x, "x");
        WirePayload.require(y, "y");
    }
}
