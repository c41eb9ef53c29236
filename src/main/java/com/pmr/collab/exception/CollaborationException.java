package com.pmr.collab.exception;

/**
 * Base type for every failure raised by the collaboration core.
 */
public class CollaborationException extends RuntimeException {

    public CollaborationException(String message) {
        super(message);
    }

    public CollaborationException(String message, Throwable cause) {
        super(message, cause);
    }
}
