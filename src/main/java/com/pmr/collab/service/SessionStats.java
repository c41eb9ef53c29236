package com.pmr.collab.service;

import lombok.Value;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Traffic counters of one session.
 */
public class SessionStats {
    private final AtomicLong framesSent = new AtomicLong();
    private final AtomicLong framesReceived = new AtomicLong();
    private final AtomicLong decodeFailures = new AtomicLong();
    private final AtomicLong unknownEvents = new AtomicLong();
    private final AtomicLong reconnectAttempts = new AtomicLong();

    void frameSent() {
        framesSent.incrementAndGet();
    }

    void frameReceived() {
        framesReceived.incrementAndGet();
    }

    void decodeFailed() {
        decodeFailures.incrementAndGet();
    }

    void unknownEvent() {
        unknownEvents.incrementAndGet();
    }

    void reconnectAttempted() {
        reconnectAttempts.incrementAndGet();
    }

    public Snapshot snapshot() {
        return new Snapshot(framesSent.get(), framesReceived.get(), decodeFailures.get(),
                unknownEvents.get(), reconnectAttempts.get());
    }

    @Value
    public static class Snapshot {
        long framesSent;
        long framesReceived;
        long decodeFailures;
        long unknownEvents;
        long reconnectAttempts;
    }
}
