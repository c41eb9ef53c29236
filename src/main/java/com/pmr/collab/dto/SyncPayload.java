package com.pmr.collab.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Full snapshot the server sends once after the handshake and on any later resync.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SyncPayload implements WirePayload {
    private List<UserPresencePayload> activeUsers = new ArrayList<>();
    private List<CommentDTO> comments = new ArrayList<>();
    private List<ConflictDTO> conflicts = new ArrayList<>();

    @Override
    public void validate() {
        WirePayload.requireEach(activeUsers, "active_users");
        WirePayload.requireEach(comments, "comments");
        WirePayload.requireEach(conflicts, "conflicts");
        activeUsers.forEach(UserPresencePayload::validate);
        comments.forEach(CommentDTO::validate);
        conflicts.forEach(ConflictDTO::validate);
    }
}
