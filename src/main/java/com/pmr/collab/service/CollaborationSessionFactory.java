package com.pmr.collab.service;

import com.pmr.collab.codec.EventCodec;
import com.pmr.collab.config.CollaborationProperties;
import com.pmr.collab.model.SessionCredentials;
import com.pmr.collab.transport.Transport;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Clock;

/**
 * Builds independent sessions. Nothing is shared between sessions except the
 * transport, the codec and the clock.
 */
@Service
public class CollaborationSessionFactory {
    private final Transport transport;
    private final EventCodec codec;
    private final CollaborationProperties properties;
    private final Clock clock;

    @Autowired
    public CollaborationSessionFactory(Transport transport, EventCodec codec,
                                       CollaborationProperties properties, Clock clock) {
        this.transport = transport;
        this.codec = codec;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Creates an unopened session. Merge resolutions need an explicit merge function.
     */
    public CollaborationSession create(SessionCredentials credentials) {
        return create(credentials, null);
    }

    public CollaborationSession create(SessionCredentials credentials, MergeFunction defaultMergeFunction) {
        SessionEventLoop loop = new TaskSchedulerEventLoop("collab-" + credentials.getDocumentId(), clock);
        return new CollaborationSession(credentials, endpointFor(credentials.getDocumentId()), transport, codec,
                loop, settings(), defaultMergeFunction);
    }

    URI endpointFor(String documentId) {
        String base = properties.getServerUrl();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return UriComponentsBuilder.fromUriString(base)
                .pathSegment("ws", "reports", "pmr", documentId, "collaborate")
                .build()
                .encode()
                .toUri();
    }

    SessionSettings settings() {
        return SessionSettings.builder()
                .heartbeatInterval(properties.getHeartbeatInterval())
                .heartbeatTimeout(properties.getHeartbeatTimeout())
                .handshakeTimeout(properties.getHandshakeTimeout())
                .reconnectBackoff(properties.getReconnectBackoff())
                .cursorThrottle(properties.getCursorThrottle())
                .presenceTimeout(properties.getPresenceTimeout())
                .presenceSweepInterval(properties.getPresenceSweepInterval())
                .remoteConflictWindow(properties.getRemoteConflictWindow())
                .build();
    }
}
