package com.pmr.collab.model;

import lombok.Value;
import lombok.With;

import java.time.Instant;

/**
 * A collaborator currently joined to the session.
 */
@Value
public class ActiveUser {
    String userId;
    @With String name;
    @With String email;
    String color;
    @With Instant lastActivity;

    public boolean isIdleSince(Instant cutoff) {
        return lastActivity.isBefore(cutoff);
    }
}
