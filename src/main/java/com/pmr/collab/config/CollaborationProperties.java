package com.pmr.collab.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * {@code collab.*} settings shared by every session this client opens.
 */
@Data
@ConfigurationProperties(prefix = "collab")
public class CollaborationProperties {

    /** Base WebSocket URL of the collaboration backend. */
    private String serverUrl = "ws://localhost:8000";

    private Duration heartbeatInterval = Duration.ofSeconds(30);

    /** How long to wait for the server's heartbeat reply before reconnecting. */
    private Duration heartbeatTimeout = Duration.ofSeconds(10);

    /** How long to wait for the sync snapshot after the socket opens. */
    private Duration handshakeTimeout = Duration.ofSeconds(10);

    /** Delay before each reconnect attempt; the session gives up after the last one. */
    private List<Duration> reconnectBackoff = new ArrayList<>(List.of(
            Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(4),
            Duration.ofSeconds(8), Duration.ofSeconds(10)));

    private Duration cursorThrottle = Duration.ofMillis(100);

    /** Remote users silent for longer than this are dropped from presence. */
    private Duration presenceTimeout = Duration.ofMinutes(5);

    private Duration presenceSweepInterval = Duration.ofSeconds(30);

    /** Two remote edits of one section this close together conflict. Zero disables the check. */
    private Duration remoteConflictWindow = Duration.ZERO;
}
