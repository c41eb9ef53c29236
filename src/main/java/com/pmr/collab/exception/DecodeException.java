package com.pmr.collab.exception;

/**
 * A single inbound frame could not be decoded. Scoped to that frame only.
 */
public class DecodeException extends CollaborationException {

    public DecodeException(String message) {
        super(message);
    }

    public DecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
