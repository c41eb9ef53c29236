package com.pmr.collab.service;

import com.pmr.collab.codec.CollabEvent;
import com.pmr.collab.codec.EventCodec;
import com.pmr.collab.codec.EventType;
import com.pmr.collab.dto.HeartbeatPayload;
import com.pmr.collab.dto.SyncPayload;
import com.pmr.collab.dto.UserPresencePayload;
import com.pmr.collab.dto.WirePayload;
import com.pmr.collab.exception.AuthenticationException;
import com.pmr.collab.exception.CollaborationException;
import com.pmr.collab.exception.ConnectionException;
import com.pmr.collab.exception.DecodeException;
import com.pmr.collab.exception.NotConnectedException;
import com.pmr.collab.model.ConnectionState;
import com.pmr.collab.model.SessionCredentials;
import com.pmr.collab.transport.Transport;
import com.pmr.collab.transport.TransportConnection;
import com.pmr.collab.transport.TransportListener;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Sole owner of the wire connection of one session: handshake, snapshot gating,
 * heartbeat and reconnection with backoff.
 * <p>
 * Every method runs on the session's event loop, or under the session lock when called
 * by the host application, so no state here is shared between threads without it.
 */
@Slf4j
public class TransportSession implements EventPublisher {

    /**
     * Receives decoded traffic. A snapshot is always delivered before the events that follow it.
     */
    public interface Handler {

        void onSnapshot(SyncPayload snapshot);

        void onEvent(CollabEvent event);

        void onStateChanged(ConnectionState previous, ConnectionState current);

        void onFailure(CollaborationException error);
    }

    private final SessionCredentials credentials;
    private final URI endpoint;
    private final Transport transport;
    private final EventCodec codec;
    private final SessionEventLoop loop;
    private final Timings timings;
    private final SessionStats stats;
    private final Handler handler;

    private ConnectionState state = ConnectionState.DISCONNECTED;
    private TransportConnection connection;
    // bumped on every connection attempt so callbacks of abandoned connections are ignored
    private int generation;
    private int reconnectAttempts;
    private boolean synced;
    private boolean closed;
    private final List<CollabEvent> heldEvents = new ArrayList<>();
    private CompletableFuture<Void> openFuture;
    private CollaborationException lastError;

    private SessionEventLoop.Cancellable heartbeatTimer;
    private SessionEventLoop.Cancellable pongTimer;
    private SessionEventLoop.Cancellable handshakeTimer;
    private SessionEventLoop.Cancellable reconnectTimer;

    public TransportSession(SessionCredentials credentials, URI endpoint, Transport transport, EventCodec codec,
                            SessionEventLoop loop, Timings timings, SessionStats stats, Handler handler) {
        this.credentials = credentials;
        this.endpoint = endpoint;
        this.transport = transport;
        this.codec = codec;
        this.loop = loop;
        this.timings = timings;
        this.stats = stats;
        this.handler = handler;
    }

    /**
     * Connects and completes once the server's snapshot has been applied.
     * Fails with {@link AuthenticationException} or {@link ConnectionException}; a failed
     * first connection is not retried.
     */
    public CompletableFuture<Void> open() {
        if (closed) {
            throw new IllegalStateException("Session for document " + credentials.getDocumentId() + " is closed");
        }
        if (state != ConnectionState.DISCONNECTED) {
            throw new IllegalStateException("Session is already " + state);
        }
        lastError = null;
        reconnectAttempts = 0;
        openFuture = new CompletableFuture<>();
        transition(ConnectionState.CONNECTING);
        connect();
        return openFuture;
    }

    /**
     * Sends a leave notification if connected, cancels all timers and drops the connection.
     * Idempotent.
     */
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (state == ConnectionState.CONNECTED && connection != null) {
            try {
                sendFrame(EventType.USER_LEFT, presencePayload());
            } catch (CollaborationException e) {
                log.debug("Could not send leave notification for document {}", credentials.getDocumentId(), e);
            }
        }
        cancelTimers();
        abandonConnection("Client closed");
        heldEvents.clear();
        state = ConnectionState.DISCONNECTED;
        if (openFuture != null && !openFuture.isDone()) {
            openFuture.completeExceptionally(new ConnectionException("Session closed before it connected"));
        }
        log.info("Collaboration session for document {} closed", credentials.getDocumentId());
    }

    @Override
    public void publish(EventType type, WirePayload payload) {
        ensureConnected();
        sendFrame(type, payload);
    }

    @Override
    public boolean isConnected() {
        return state == ConnectionState.CONNECTED && connection != null;
    }

    @Override
    public void ensureConnected() {
        if (!isConnected()) {
            throw new NotConnectedException(state);
        }
    }

    public ConnectionState getState() {
        return state;
    }

    public int getReconnectAttempts() {
        return reconnectAttempts;
    }

    public Optional<CollaborationException> getLastError() {
        return Optional.ofNullable(lastError);
    }

    private void connect() {
        int attempt = ++generation;
        synced = false;
        heldEvents.clear();
        transport.connect(endpoint, credentials.getAccessToken(), new AttemptListener(attempt));
    }

    private void onOpen(int attempt, TransportConnection opened) {
        if (attempt != generation) {
            opened.close(TransportConnection.CLOSE_NORMAL, "Superseded");
            return;
        }
        connection = opened;
        log.debug("Connected to {}, awaiting snapshot", endpoint);
        try {
            sendFrame(EventType.USER_JOINED, presencePayload());
        } catch (ConnectionException e) {
            attemptFailed(e);
            return;
        }
        handshakeTimer = loop.schedule(() -> {
            handshakeTimer = null;
            attemptFailed(new ConnectionException("No snapshot received within " + timings.getHandshakeTimeout()));
        }, timings.getHandshakeTimeout());
    }

    private void onFrame(int attempt, String frame) {
        if (attempt != generation) {
            return;
        }
        stats.frameReceived();
        Optional<CollabEvent> decoded;
        try {
            decoded = codec.decode(frame);
        } catch (DecodeException e) {
            stats.decodeFailed();
            log.warn("Dropping undecodable frame ({} chars): {}", frame.length(), e.getMessage());
            return;
        }
        if (decoded.isEmpty()) {
            stats.unknownEvent();
            return;
        }

        CollabEvent event = decoded.get();
        if (event.getType() == EventType.HEARTBEAT && pongTimer != null) {
            pongTimer.cancel();
            pongTimer = null;
        }
        if (event.getType() == EventType.SYNC) {
            applySnapshot(event.payloadAs(SyncPayload.class));
        } else if (!synced) {
            heldEvents.add(event);
        } else {
            handler.onEvent(event);
        }
    }

    private void applySnapshot(SyncPayload snapshot) {
        handler.onSnapshot(snapshot);
        if (synced) {
            return;
        }
        synced = true;
        if (handshakeTimer != null) {
            handshakeTimer.cancel();
            handshakeTimer = null;
        }
        reconnectAttempts = 0;
        lastError = null;
        transition(ConnectionState.CONNECTED);
        scheduleHeartbeat();
        if (openFuture != null && !openFuture.isDone()) {
            openFuture.complete(null);
        }

        List<CollabEvent> held = new ArrayList<>(heldEvents);
        heldEvents.clear();
        held.forEach(handler::onEvent);
    }

    private void onClosed(int attempt, int code, String reason) {
        if (attempt != generation) {
            return;
        }
        connection = null;
        if (TransportConnection.isAuthenticationClose(code)) {
            fail(new AuthenticationException("Server closed the session: " + code + " " + reason));
        } else if (!synced) {
            attemptFailed(new ConnectionException("Connection closed during handshake: " + code + " " + reason));
        } else {
            log.warn("Connection to document {} lost ({} {})", credentials.getDocumentId(), code, reason);
            startReconnect();
        }
    }

    private void onConnectFailed(int attempt, Throwable cause) {
        if (attempt != generation) {
            return;
        }
        connection = null;
        if (cause instanceof CollaborationException) {
            attemptFailed((CollaborationException) cause);
        } else {
            attemptFailed(new ConnectionException("Cannot connect to " + endpoint, cause));
        }
    }

    private void attemptFailed(CollaborationException error) {
        if (handshakeTimer != null) {
            handshakeTimer.cancel();
            handshakeTimer = null;
        }
        abandonConnection("Handshake failed");
        if (error instanceof AuthenticationException || state != ConnectionState.RECONNECTING) {
            fail(error);
            return;
        }
        log.warn("Reconnect attempt {} for document {} failed: {}",
                reconnectAttempts, credentials.getDocumentId(), error.getMessage());
        lastError = error;
        scheduleReconnect();
    }

    private void startReconnect() {
        cancelTimers();
        abandonConnection("Reconnecting");
        reconnectAttempts = 0;
        transition(ConnectionState.RECONNECTING);
        scheduleReconnect();
    }

    private void scheduleReconnect() {
        List<Duration> backoff = timings.getReconnectBackoff();
        if (reconnectAttempts >= backoff.size()) {
            fail(new ConnectionException("Gave up reconnecting to document " + credentials.getDocumentId()
                    + " after " + reconnectAttempts + " attempts", lastError));
            return;
        }
        Duration delay = backoff.get(reconnectAttempts);
        log.info("Reconnecting to document {} in {}", credentials.getDocumentId(), delay);
        reconnectTimer = loop.schedule(() -> {
            reconnectTimer = null;
            reconnectAttempts++;
            stats.reconnectAttempted();
            connect();
        }, delay);
    }

    private void fail(CollaborationException error) {
        cancelTimers();
        abandonConnection("Session failed");
        lastError = error;
        log.error("Collaboration session for document {} disconnected: {}",
                credentials.getDocumentId(), error.getMessage());
        transition(ConnectionState.DISCONNECTED);
        if (openFuture != null && !openFuture.isDone()) {
            openFuture.completeExceptionally(error);
        }
        handler.onFailure(error);
    }

    private void scheduleHeartbeat() {
        heartbeatTimer = loop.schedule(this::sendHeartbeat, timings.getHeartbeatInterval());
    }

    private void sendHeartbeat() {
        heartbeatTimer = null;
        if (!isConnected()) {
            return;
        }
        try {
            sendFrame(EventType.HEARTBEAT, new HeartbeatPayload());
        } catch (ConnectionException e) {
            log.warn("Heartbeat failed for document {}", credentials.getDocumentId(), e);
            startReconnect();
            return;
        }
        if (pongTimer == null) {
            pongTimer = loop.schedule(this::onPongTimeout, timings.getHeartbeatTimeout());
        }
        scheduleHeartbeat();
    }

    private void onPongTimeout() {
        pongTimer = null;
        log.warn("No heartbeat reply from server within {}", timings.getHeartbeatTimeout());
        startReconnect();
    }

    private void sendFrame(EventType type, WirePayload payload) {
        if (connection == null) {
            throw new NotConnectedException(state);
        }
        connection.send(codec.encode(type, credentials.getUserId(), loop.now(), payload));
        stats.frameSent();
    }

    private void abandonConnection(String reason) {
        generation++;
        if (connection != null) {
            connection.close(TransportConnection.CLOSE_NORMAL, reason);
            connection = null;
        }
    }

    private void cancelTimers() {
        for (SessionEventLoop.Cancellable timer : new SessionEventLoop.Cancellable[]{
                heartbeatTimer, pongTimer, handshakeTimer, reconnectTimer}) {
            if (timer != null) {
                timer.cancel();
            }
        }
        heartbeatTimer = null;
        pongTimer = null;
        handshakeTimer = null;
        reconnectTimer = null;
    }

    private void transition(ConnectionState next) {
        ConnectionState previous = state;
        if (previous == next) {
            return;
        }
        state = next;
        log.info("Document {} session {} -> {}", credentials.getDocumentId(), previous, next);
        handler.onStateChanged(previous, next);
    }

    private UserPresencePayload presencePayload() {
        return new UserPresencePayload(credentials.getUserId(), credentials.getUserName(), credentials.getUserEmail());
    }

    /**
     * Forwards the callbacks of one connection attempt onto the event loop.
     */
    private final class AttemptListener implements TransportListener {
        private final int attempt;

        private AttemptListener(int attempt) {
            this.attempt = attempt;
        }

        @Override
        public void onOpen(TransportConnection opened) {
            loop.execute(() -> TransportSession.this.onOpen(attempt, opened));
        }

        @Override
        public void onConnectFailed(Throwable cause) {
            loop.execute(() -> TransportSession.this.onConnectFailed(attempt, cause));
        }

        @Override
        public void onMessage(String frame) {
            loop.execute(() -> onFrame(attempt, frame));
        }

        @Override
        public void onClose(int code, String reason) {
            loop.execute(() -> onClosed(attempt, code, reason));
        }

        @Override
        public void onError(Throwable cause) {
            log.debug("Transport error on document {}", credentials.getDocumentId(), cause);
        }
    }

    /**
     * Durations that drive the session's timers.
     */
    @Value
    public static class Timings {
        Duration heartbeatInterval;
        Duration heartbeatTimeout;
        Duration handshakeTimeout;
        List<Duration> reconnectBackoff;
    }
}
