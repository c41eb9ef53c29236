package com.pmr.collab.model;

import lombok.Value;

import java.util.List;

/**
 * Full server-side presence, comment and conflict state, as applied on (re)join.
 */
@Value
public class SessionSnapshot {
    List<ActiveUser> activeUsers;
    List<Comment> comments;
    List<Conflict> conflicts;
}
