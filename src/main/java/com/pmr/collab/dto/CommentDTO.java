package com.pmr.collab.dto;

import lombok.Data;

import java.time.Instant;

@Data
public class CommentDTO implements WirePayload {
    private String id;
    private String authorId;
    private String authorName;
    private String content;
    private String sectionId;
    private Double x;
    private Double y;
    private Instant createdAt;
    private boolean resolved;
    private String resolvedBy;
    private Instant resolvedAt;

    @Override
    public void validate() {
        WirePayload.require(id, "id");
        WirePayload.require(authorId, "author_id");
        WirePayload.require(content, "content");
    }
}
