package com.pmr.collab.transport;

/**
 * Callbacks of one connection attempt. Invoked on transport threads, in order.
 */
public interface TransportListener {

    void onOpen(TransportConnection connection);

    void onConnectFailed(Throwable cause);

    void onMessage(String frame);

    void onClose(int code, String reason);

    void onError(Throwable cause);
}
