package com.pmr.collab.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class UserPresencePayload implements WirePayload {
    private String userId;
    private String name;
    private String email;
    private Instant lastActivity;

    public UserPresencePayload(String userId, String name, String email) {
        this(userId, name, email, null);
    }

    @Override
    public void validate() {
        WirePayload.require(userId, "user_id");
    }
}
