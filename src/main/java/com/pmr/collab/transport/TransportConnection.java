package com.pmr.collab.transport;

import com.pmr.collab.exception.ConnectionException;

public interface TransportConnection {

    /** Normal closure. */
    int CLOSE_NORMAL = 1000;
    /** The server refused the credentials. */
    int CLOSE_POLICY_VIOLATION = 1008;
    int CLOSE_UNAUTHORIZED = 4401;
    int CLOSE_FORBIDDEN = 4403;

    void send(String frame) throws ConnectionException;

    void close(int code, String reason);

    boolean isOpen();

    static boolean isAuthenticationClose(int code) {
        return code == CLOSE_POLICY_VIOLATION || code == CLOSE_UNAUTHORIZED || code == CLOSE_FORBIDDEN;
    }
}
