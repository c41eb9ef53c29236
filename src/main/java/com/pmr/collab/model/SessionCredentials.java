package com.pmr.collab.model;

import lombok.NonNull;
import lombok.Value;

/**
 * Identity the local client carries into a collaboration session.
 */
@Value
public class SessionCredentials {
    @NonNull String documentId;
    @NonNull String userId;
    @NonNull String userName;
    String userEmail;
    @NonNull String accessToken;
}
