package com.pmr.collab.model;

import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * Threaded comment anchored to a section. Never deleted; resolution is its terminal state.
 */
@Getter
@ToString
public class Comment {
    private final String id;
    private final String authorId;
    private final String authorName;
    private final String content;
    private final String sectionId;
    private final Position position;
    private final Instant createdAt;
    private boolean resolved;
    private String resolvedBy;
    private Instant resolvedAt;

    public Comment(String id, String authorId, String authorName, String content,
                   String sectionId, Position position, Instant createdAt) {
        this.id = id;
        this.authorId = authorId;
        this.authorName = authorName;
        this.content = content;
        this.sectionId = sectionId;
        this.position = position;
        this.createdAt = createdAt;
    }

    /**
     * @return false if the comment was already resolved
     */
    public boolean resolve(String userId, Instant at) {
        if (resolved) {
            return false;
        }
        this.resolved = true;
        this.resolvedBy = userId;
        this.resolvedAt = at;
        return true;
    }
}
