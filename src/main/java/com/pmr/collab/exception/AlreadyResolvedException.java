package com.pmr.collab.exception;

public class AlreadyResolvedException extends CollaborationException {

    public AlreadyResolvedException(String conflictId) {
        super("Conflict already resolved: " + conflictId);
    }
}
