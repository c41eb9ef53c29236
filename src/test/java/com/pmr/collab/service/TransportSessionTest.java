package com.pmr.collab.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.pmr.collab.codec.CollabEvent;
import com.pmr.collab.codec.EventType;
import com.pmr.collab.dto.SectionUpdatePayload;
import com.pmr.collab.dto.SyncPayload;
import com.pmr.collab.exception.AuthenticationException;
import com.pmr.collab.exception.CollaborationException;
import com.pmr.collab.exception.ConnectionException;
import com.pmr.collab.exception.NotConnectedException;
import com.pmr.collab.model.ConnectionState;
import com.pmr.collab.model.SessionCredentials;
import com.pmr.collab.support.FakeTransport;
import com.pmr.collab.support.Frames;
import com.pmr.collab.support.ManualEventLoop;
import com.pmr.collab.transport.TransportConnection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import static com.pmr.collab.support.Frames.text;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

public class TransportSessionTest {
    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");
    private static final URI ENDPOINT = URI.create("ws://localhost:8000/ws/reports/pmr/doc-1/collaborate");

    private ManualEventLoop loop;
    private FakeTransport transport;
    private SessionStats stats;
    private TransportSession.Handler handler;
    private TransportSession session;

    @BeforeEach
    public void setUp() {
        loop = new ManualEventLoop(T0);
        transport = new FakeTransport();
        stats = new SessionStats();
        handler = mock(TransportSession.Handler.class);
        SessionCredentials credentials = new SessionCredentials("doc-1", "me", "Me", "me@example.com", "secret");
        session = new TransportSession(credentials, ENDPOINT, transport, Frames.CODEC, loop,
                SessionSettings.defaults().transportTimings(), stats, handler);
    }

    private static String typeOf(String frame) {
        return Frames.decode(frame).get("type").asText();
    }

    private FakeTransport.Attempt connectAndSync() {
        session.open();
        FakeTransport.Attempt attempt = transport.lastAttempt();
        attempt.open();
        loop.runPending();
        attempt.receive(Frames.emptySync(loop.now(), "me"));
        loop.runPending();
        return attempt;
    }

    private String sectionUpdate(String userId, String text) {
        return Frames.frame(EventType.SECTION_UPDATE, userId, loop.now(),
                new SectionUpdatePayload("s1", text(text), userId));
    }

    @Test
    public void testOpenCompletesOnlyAfterSnapshot() {
        CompletableFuture<Void> opened = session.open();
        assertEquals(ConnectionState.CONNECTING, session.getState());

        FakeTransport.Attempt attempt = transport.lastAttempt();
        assertEquals(ENDPOINT, attempt.getEndpoint());
        assertEquals("secret", attempt.getAccessToken());

        attempt.open();
        loop.runPending();
        assertEquals(List.of("user_joined"), attempt.sent().stream().map(TransportSessionTest::typeOf).toList());
        assertFalse(opened.isDone());
        assertEquals(ConnectionState.CONNECTING, session.getState());

        attempt.receive(Frames.emptySync(T0, "me"));
        loop.runPending();

        assertTrue(opened.isDone());
        assertFalse(opened.isCompletedExceptionally());
        assertEquals(ConnectionState.CONNECTED, session.getState());
        InOrder order = inOrder(handler);
        order.verify(handler).onStateChanged(ConnectionState.DISCONNECTED, ConnectionState.CONNECTING);
        order.verify(handler).onSnapshot(any(SyncPayload.class));
        order.verify(handler).onStateChanged(ConnectionState.CONNECTING, ConnectionState.CONNECTED);
    }

    @Test
    public void testSnapshotWithNullUserIsDroppedAsUndecodable() {
        CompletableFuture<Void> opened = session.open();
        FakeTransport.Attempt attempt = transport.lastAttempt();
        attempt.open();
        loop.runPending();

        attempt.receive("{\"type\":\"sync\",\"user_id\":\"server\",\"data\":"
                + "{\"active_users\":[null],\"comments\":[],\"conflicts\":[]}}");
        loop.runPending();

        assertEquals(1, stats.snapshot().getDecodeFailures());
        assertFalse(opened.isDone());
        verify(handler, never()).onSnapshot(any());

        attempt.receive(Frames.emptySync(T0, "me"));
        loop.runPending();
        assertEquals(ConnectionState.CONNECTED, session.getState());
        assertTrue(opened.isDone());
    }

    @Test
    public void testJoinAnnouncementCarriesIdentity() {
        session.open();
        FakeTransport.Attempt attempt = transport.lastAttempt();
        attempt.open();
        loop.runPending();

        JsonNode joined = Frames.decode(attempt.sent().get(0));
        assertEquals("me", joined.get("user_id").asText());
        assertEquals("Me", joined.get("data").get("name").asText());
        assertEquals("me@example.com", joined.get("data").get("email").asText());
    }

    @Test
    public void testEventsBeforeSnapshotAreHeldThenReplayed() {
        session.open();
        FakeTransport.Attempt attempt = transport.lastAttempt();
        attempt.open();
        attempt.receive(sectionUpdate("b", "early"));
        loop.runPending();
        verify(handler, never()).onEvent(any());

        attempt.receive(Frames.emptySync(T0));
        loop.runPending();

        InOrder order = inOrder(handler);
        order.verify(handler).onSnapshot(any());
        order.verify(handler).onEvent(any(CollabEvent.class));
    }

    @Test
    public void testPublishRequiresConnection() {
        assertThrows(NotConnectedException.class, () -> session.publish(EventType.HEARTBEAT, null));
        session.open();
        assertThrows(NotConnectedException.class, () -> session.publish(EventType.HEARTBEAT, null));
        assertFalse(session.isConnected());
    }

    @Test
    public void testPublishSendsFrame() {
        FakeTransport.Attempt attempt = connectAndSync();
        session.publish(EventType.SECTION_UPDATE, new SectionUpdatePayload("s1", text("x"), "me"));

        assertEquals("section_update", typeOf(attempt.sent().get(attempt.sent().size() - 1)));
        assertEquals(2, stats.snapshot().getFramesSent());
    }

    @Test
    public void testHeartbeatTimeoutTriggersReconnect() {
        FakeTransport.Attempt first = connectAndSync();

        loop.advance(Duration.ofSeconds(30));
        assertEquals("heartbeat", typeOf(first.sent().get(first.sent().size() - 1)));
        assertEquals(ConnectionState.CONNECTED, session.getState());

        loop.advance(Duration.ofSeconds(10));
        assertEquals(ConnectionState.RECONNECTING, session.getState());
        assertFalse(first.getConnection().isOpen());
        verify(handler).onStateChanged(ConnectionState.CONNECTED, ConnectionState.RECONNECTING);

        loop.advance(Duration.ofMillis(999));
        assertEquals(1, transport.getAttempts().size());
        loop.advance(Duration.ofMillis(1));
        assertEquals(2, transport.getAttempts().size());

        FakeTransport.Attempt second = transport.lastAttempt();
        second.open();
        loop.runPending();
        second.receive(Frames.emptySync(loop.now(), "me"));
        loop.runPending();

        assertEquals(ConnectionState.CONNECTED, session.getState());
        assertEquals(0, session.getReconnectAttempts());
        assertEquals(1, stats.snapshot().getReconnectAttempts());
        verify(handler, times(2)).onSnapshot(any());
    }

    @Test
    public void testHeartbeatReplyKeepsSessionConnected() {
        FakeTransport.Attempt attempt = connectAndSync();

        loop.advance(Duration.ofSeconds(30));
        attempt.receive(Frames.heartbeat(loop.now()));
        loop.advance(Duration.ofSeconds(15));

        assertEquals(ConnectionState.CONNECTED, session.getState());
        assertEquals(1, transport.getAttempts().size());
    }

    @Test
    public void testBackoffExhaustionIsTerminal() {
        FakeTransport.Attempt attempt = connectAndSync();
        attempt.serverClose(1006, "abnormal");
        loop.runPending();
        assertEquals(ConnectionState.RECONNECTING, session.getState());

        for (int seconds : new int[]{1, 2, 4, 8, 10}) {
            int before = transport.getAttempts().size();
            loop.advance(Duration.ofSeconds(seconds).minusMillis(1));
            assertEquals(before, transport.getAttempts().size());
            loop.advance(Duration.ofMillis(1));
            assertEquals(before + 1, transport.getAttempts().size());
            transport.lastAttempt().fail(new ConnectionException("refused"));
            loop.runPending();
        }

        assertEquals(ConnectionState.DISCONNECTED, session.getState());
        assertInstanceOf(ConnectionException.class, session.getLastError().orElseThrow());
        verify(handler).onFailure(any(ConnectionException.class));
        verify(handler).onStateChanged(ConnectionState.RECONNECTING, ConnectionState.DISCONNECTED);

        loop.advance(Duration.ofMinutes(5));
        assertEquals(6, transport.getAttempts().size());
    }

    @Test
    public void testReconnectAfterDroppedHandshake() {
        FakeTransport.Attempt attempt = connectAndSync();
        attempt.serverClose(1001, "going away");
        loop.advance(Duration.ofSeconds(1));

        FakeTransport.Attempt retry = transport.lastAttempt();
        retry.open();
        retry.serverClose(1011, "internal error");
        loop.runPending();
        assertEquals(ConnectionState.RECONNECTING, session.getState());

        loop.advance(Duration.ofSeconds(2));
        assertEquals(3, transport.getAttempts().size());
    }

    @Test
    public void testRejectedTokenOnOpen() {
        CompletableFuture<Void> opened = session.open();
        transport.lastAttempt().fail(new AuthenticationException("Handshake rejected: 401"));
        loop.runPending();

        ExecutionException error = assertThrows(ExecutionException.class, opened::get);
        assertInstanceOf(AuthenticationException.class, error.getCause());
        assertEquals(ConnectionState.DISCONNECTED, session.getState());

        loop.advance(Duration.ofMinutes(1));
        assertEquals(1, transport.getAttempts().size());
    }

    @Test
    public void testAuthCloseBeforeSnapshot() {
        CompletableFuture<Void> opened = session.open();
        FakeTransport.Attempt attempt = transport.lastAttempt();
        attempt.open();
        attempt.serverClose(TransportConnection.CLOSE_UNAUTHORIZED, "bad token");
        loop.runPending();

        ExecutionException error = assertThrows(ExecutionException.class, opened::get);
        assertInstanceOf(AuthenticationException.class, error.getCause());
        verify(handler).onFailure(any(AuthenticationException.class));
    }

    @Test
    public void testInitialNetworkFailureIsNotRetried() {
        CompletableFuture<Void> opened = session.open();
        transport.lastAttempt().fail(new java.io.IOException("Connection refused"));
        loop.runPending();

        ExecutionException error = assertThrows(ExecutionException.class, opened::get);
        assertInstanceOf(ConnectionException.class, error.getCause());
        loop.advance(Duration.ofMinutes(1));
        assertEquals(1, transport.getAttempts().size());
    }

    @Test
    public void testMissingSnapshotTimesOut() {
        CompletableFuture<Void> opened = session.open();
        FakeTransport.Attempt attempt = transport.lastAttempt();
        attempt.open();
        loop.advance(Duration.ofSeconds(10));

        assertTrue(opened.isCompletedExceptionally());
        assertEquals(ConnectionState.DISCONNECTED, session.getState());
        assertFalse(attempt.getConnection().isOpen());
    }

    @Test
    public void testAuthFailureDuringReconnectIsTerminal() {
        FakeTransport.Attempt attempt = connectAndSync();
        attempt.serverClose(1006, "abnormal");
        loop.advance(Duration.ofSeconds(1));

        transport.lastAttempt().fail(new AuthenticationException("Handshake rejected: 403"));
        loop.runPending();

        assertEquals(ConnectionState.DISCONNECTED, session.getState());
        loop.advance(Duration.ofMinutes(1));
        assertEquals(2, transport.getAttempts().size());
    }

    @Test
    public void testMalformedFrameIsDropped() {
        FakeTransport.Attempt attempt = connectAndSync();

        attempt.receive("{\"type\":\"section_update\",\"user_id\":\"b\",\"data\":{\"section_id\":\"s1\"}}");
        attempt.receive("{\"type\":\"ai_suggestion\",\"user_id\":\"b\",\"data\":{}}");
        attempt.receive(sectionUpdate("b", "valid"));
        loop.runPending();

        assertEquals(ConnectionState.CONNECTED, session.getState());
        ArgumentCaptor<CollabEvent> events = ArgumentCaptor.forClass(CollabEvent.class);
        verify(handler).onEvent(events.capture());
        assertEquals(text("valid"), events.getValue().payloadAs(SectionUpdatePayload.class).getContent());
        assertEquals(1, stats.snapshot().getDecodeFailures());
        assertEquals(1, stats.snapshot().getUnknownEvents());
    }

    @Test
    public void testCloseAnnouncesLeaveAndStopsTimers() {
        FakeTransport.Attempt attempt = connectAndSync();

        session.close();
        session.close();

        List<String> sent = attempt.sent();
        assertEquals("user_left", typeOf(sent.get(sent.size() - 1)));
        assertEquals(TransportConnection.CLOSE_NORMAL, attempt.getConnection().getCloseCode());
        assertEquals(ConnectionState.DISCONNECTED, session.getState());
        verify(handler, never()).onStateChanged(ConnectionState.CONNECTED, ConnectionState.DISCONNECTED);

        int frames = sent.size();
        loop.advance(Duration.ofMinutes(2));
        assertEquals(frames, attempt.sent().size());
        assertEquals(1, transport.getAttempts().size());
        assertThrows(IllegalStateException.class, session::open);
    }

    @Test
    public void testCallbacksFromAbandonedConnectionIgnored() {
        FakeTransport.Attempt first = connectAndSync();
        loop.advance(Duration.ofSeconds(40));
        assertEquals(ConnectionState.RECONNECTING, session.getState());

        first.receive(sectionUpdate("b", "stale"));
        first.serverClose(1000, "late close");
        loop.runPending();

        verify(handler, never()).onEvent(any());
        assertEquals(ConnectionState.RECONNECTING, session.getState());
        verify(handler, never()).onFailure(any(CollaborationException.class));
    }
}
