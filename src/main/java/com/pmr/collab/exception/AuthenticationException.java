package com.pmr.collab.exception;

/**
 * The server rejected the session token. Never retried.
 */
public class AuthenticationException extends CollaborationException {

    public AuthenticationException(String message) {
        super(message);
    }

    public AuthenticationException(String message, Throwable cause) {
        super(message, cause);
    }
}
