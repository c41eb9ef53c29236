package com.pmr.collab.service;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.List;

/**
 * Timing knobs of one session.
 */
@Value
@Builder
public class SessionSettings {
    @Builder.Default
    Duration heartbeatInterval = Duration.ofSeconds(30);
    @Builder.Default
    Duration heartbeatTimeout = Duration.ofSeconds(10);
    @Builder.Default
    Duration handshakeTimeout = Duration.ofSeconds(10);
    @Builder.Default
    List<Duration> reconnectBackoff = List.of(Duration.ofSeconds(1), Duration.ofSeconds(2),
            Duration.ofSeconds(4), Duration.ofSeconds(8), Duration.ofSeconds(10));
    @Builder.Default
    Duration cursorThrottle = Duration.ofMillis(100);
    @Builder.Default
    Duration presenceTimeout = Duration.ofMinutes(5);
    @Builder.Default
    Duration presenceSweepInterval = Duration.ofSeconds(30);
    @Builder.Default
    Duration remoteConflictWindow = Duration.ZERO;

    public static SessionSettings defaults() {
        return builder().build();
    }

    TransportSession.Timings transportTimings() {
        return new TransportSession.Timings(heartbeatInterval, heartbeatTimeout, handshakeTimeout,
                List.copyOf(reconnectBackoff));
    }
}
