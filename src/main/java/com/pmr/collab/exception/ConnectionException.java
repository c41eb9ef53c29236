package com.pmr.collab.exception;

/**
 * Network-level failure of the collaboration connection.
 */
public class ConnectionException extends CollaborationException {

    public ConnectionException(String message) {
        super(message);
    }

    public ConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
