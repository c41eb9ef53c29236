package com.pmr.collab.exception;

import com.pmr.collab.model.ConnectionState;

public class NotConnectedException extends CollaborationException {

    public NotConnectedException(ConnectionState state) {
        super("Cannot send while session is " + state);
    }
}
