package com.pmr.collab.service;

import java.time.Duration;
import java.time.Instant;

/**
 * Single logical thread on which one session processes inbound frames and timers.
 */
public interface SessionEventLoop {

    void execute(Runnable task);

    Cancellable schedule(Runnable task, Duration delay);

    Instant now();

    /** Stops accepting work. Pending timers are discarded. */
    void shutdown();

    @FunctionalInterface
    interface Cancellable {
        void cancel();
    }
}
