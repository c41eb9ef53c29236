package com.pmr.collab.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.pmr.collab.codec.CollabEvent;
import com.pmr.collab.codec.EventCodec;
import com.pmr.collab.dto.CommentDTO;
import com.pmr.collab.dto.CommentResolvePayload;
import com.pmr.collab.dto.ConflictDTO;
import com.pmr.collab.dto.ConflictResolvedPayload;
import com.pmr.collab.dto.CursorPayload;
import com.pmr.collab.dto.SectionUpdatePayload;
import com.pmr.collab.dto.SyncPayload;
import com.pmr.collab.dto.UserPresencePayload;
import com.pmr.collab.exception.CollaborationException;
import com.pmr.collab.model.ActiveUser;
import com.pmr.collab.model.Comment;
import com.pmr.collab.model.Conflict;
import com.pmr.collab.model.ConnectionState;
import com.pmr.collab.model.CursorPosition;
import com.pmr.collab.model.Position;
import com.pmr.collab.model.ResolutionStrategy;
import com.pmr.collab.model.SectionState;
import com.pmr.collab.model.SessionCredentials;
import com.pmr.collab.model.SessionSnapshot;
import com.pmr.collab.transport.Transport;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * One user's collaboration session on one PMR document.
 * <p>
 * Inbound frames and timers run on the session's own event loop. Public methods lock the
 * session, so they may be called from any thread and never interleave with event processing.
 * After {@link #close()} returns no listener is called again.
 */
@Slf4j
public class CollaborationSession implements TransportSession.Handler {
    private final SessionCredentials credentials;
    private final SessionSettings settings;
    private final MergeFunction defaultMergeFunction;
    private final SessionEventLoop loop;
    private final ListenerRegistry listeners = new ListenerRegistry();
    private final SessionStats stats = new SessionStats();

    private final TransportSession transport;
    private final PresenceTracker presence;
    private final CursorBroadcaster cursors;
    private final ConflictDetector detector;
    private final SectionSynchronizer synchronizer;
    private final ConflictResolver resolver;
    private final CommentChannel comments;

    private SessionEventLoop.Cancellable sweepTimer;
    private boolean closed;

    public CollaborationSession(SessionCredentials credentials, URI endpoint, Transport wire, EventCodec codec,
                                SessionEventLoop eventLoop, SessionSettings settings,
                                MergeFunction defaultMergeFunction) {
        this.credentials = credentials;
        this.settings = settings;
        this.defaultMergeFunction = defaultMergeFunction;
        this.loop = new GuardedLoop(eventLoop);

        String userId = credentials.getUserId();
        this.transport = new TransportSession(credentials, endpoint, wire, codec, loop,
                settings.transportTimings(), stats, this);
        this.presence = new PresenceTracker(new ColorAssigner());
        this.cursors = new CursorBroadcaster(userId, transport, loop, presence, settings.getCursorThrottle());
        this.detector = new ConflictDetector(listeners, loop::now);
        this.synchronizer = new SectionSynchronizer(userId, transport, detector, listeners, loop::now,
                settings.getRemoteConflictWindow());
        this.resolver = new ConflictResolver(userId, transport, detector, synchronizer, listeners, loop::now);
        this.comments = new CommentChannel(credentials, transport, listeners, loop::now);
    }

    /**
     * Connects, announces the local user and completes once the server snapshot is applied.
     * May be called again after the session has given up.
     */
    public synchronized CompletableFuture<Void> open() {
        if (closed) {
            throw new IllegalStateException("Session for document " + credentials.getDocumentId() + " is closed");
        }
        log.info("Opening collaboration session on document {} as {}",
                credentials.getDocumentId(), credentials.getUserId());
        CompletableFuture<Void> opened = transport.open();
        if (sweepTimer == null) {
            scheduleSweep();
        }
        return opened;
    }

    public synchronized void close() {
        if (closed) {
            return;
        }
        transport.close();
        cursors.cancel();
        if (sweepTimer != null) {
            sweepTimer.cancel();
            sweepTimer = null;
        }
        listeners.close();
        closed = true;
        loop.shutdown();
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    public SessionCredentials getCredentials() {
        return credentials;
    }

    public synchronized ConnectionState getState() {
        return transport.getState();
    }

    public synchronized Optional<CollaborationException> getLastError() {
        return transport.getLastError();
    }

    public ListenerRegistry.Subscription addListener(CollaborationListener listener) {
        return listeners.add(listener);
    }

    /**
     * Applies a local edit and broadcasts it.
     *
     * @throws com.pmr.collab.exception.NotConnectedException if the session is not connected
     */
    public synchronized SectionState updateSection(String sectionId, JsonNode content) {
        transport.ensureConnected();
        return synchronizer.updateSection(sectionId, content);
    }

    public synchronized Optional<SectionState> getSection(String sectionId) {
        return synchronizer.getSection(sectionId);
    }

    public synchronized List<SectionState> getSections() {
        return synchronizer.getSections();
    }

    public synchronized List<SectionState> getRecentRemoteChanges() {
        return synchronizer.getRecentRemoteChanges();
    }

    public synchronized void updateCursor(String sectionId, double x, double y) {
        cursors.updateCursor(sectionId, x, y);
    }

    public synchronized List<CursorPosition> getRemoteCursors() {
        return cursors.getRemoteCursors();
    }

    public synchronized Comment addComment(String sectionId, String content) {
        return addComment(sectionId, content, null);
    }

    public synchronized Comment addComment(String sectionId, String content, Position position) {
        transport.ensureConnected();
        return comments.addComment(sectionId, content, position);
    }

    public synchronized void resolveComment(String commentId) {
        transport.ensureConnected();
        comments.resolveComment(commentId);
    }

    public synchronized List<Comment> getComments() {
        return comments.getComments();
    }

    /**
     * Resolves with the merge function this session was created with.
     */
    public synchronized Conflict resolveConflict(String conflictId, ResolutionStrategy strategy) {
        return resolver.resolve(conflictId, strategy, defaultMergeFunction);
    }

    public synchronized Conflict resolveConflict(String conflictId, ResolutionStrategy strategy,
                                                 MergeFunction mergeFunction) {
        return resolver.resolve(conflictId, strategy, mergeFunction);
    }

    public synchronized List<Conflict> getConflicts() {
        return detector.getConflicts();
    }

    public synchronized List<Conflict> getUnresolvedConflicts() {
        return detector.getUnresolvedConflicts();
    }

    public synchronized List<ActiveUser> getActiveUsers() {
        return presence.getActiveUsers();
    }

    public SessionStats.Snapshot getStats() {
        return stats.snapshot();
    }

    @Override
    public void onSnapshot(SyncPayload snapshot) {
        Instant now = loop.now();
        List<ActiveUser> users = presence.replaceAll(snapshot.getActiveUsers(), now);
        List<Comment> thread = comments.replaceAll(snapshot.getComments());
        Set<String> knownConflicts = detector.getConflicts().stream()
                .map(Conflict::getId)
                .collect(Collectors.toSet());
        List<Conflict> conflicts = detector.replaceAll(snapshot.getConflicts());
        cursors.clear();
        synchronizer.reset();
        log.info("Applied snapshot for document {}: {} users, {} comments, {} conflicts",
                credentials.getDocumentId(), users.size(), thread.size(), conflicts.size());

        SessionSnapshot applied = new SessionSnapshot(users, thread, conflicts);
        listeners.fire(listener -> listener.onSnapshotApplied(applied));
        // conflicts first seen in this snapshot are announced like live ones
        conflicts.stream()
                .filter(conflict -> !conflict.isResolved() && !knownConflicts.contains(conflict.getId()))
                .forEach(conflict -> listeners.fire(listener -> listener.onConflictDetected(conflict)));
    }

    @Override
    public void onEvent(CollabEvent event) {
        Instant at = event.getTimestamp() != null ? event.getTimestamp() : loop.now();
        presence.touch(event.getUserId(), loop.now());

        switch (event.getType()) {
            case USER_JOINED:
                presence.join(event.payloadAs(UserPresencePayload.class), loop.now())
                        .ifPresent(user -> listeners.fire(listener -> listener.onUserJoined(user)));
                break;
            case USER_LEFT:
                UserPresencePayload left = event.payloadAs(UserPresencePayload.class);
                userLeft(left.getUserId() != null ? left.getUserId() : event.getUserId());
                break;
            case CURSOR_POSITION:
                cursors.applyRemote(event.getUserId(), event.payloadAs(CursorPayload.class))
                        .ifPresent(cursor -> listeners.fire(listener -> listener.onCursorMoved(cursor)));
                break;
            case SECTION_UPDATE:
                synchronizer.applyRemote(event.getUserId(), at, event.payloadAs(SectionUpdatePayload.class));
                break;
            case CONFLICT_DETECTED:
                detector.adopt(event.payloadAs(ConflictDTO.class));
                break;
            case CONFLICT_RESOLVED:
                resolver.applyRemote(event.getUserId(), at, event.payloadAs(ConflictResolvedPayload.class));
                break;
            case COMMENT_ADD:
                comments.applyRemoteAdd(event.payloadAs(CommentDTO.class));
                break;
            case COMMENT_RESOLVE:
                comments.applyRemoteResolve(event.getUserId(), at, event.payloadAs(CommentResolvePayload.class));
                break;
            default:
                break;
        }
    }

    @Override
    public void onStateChanged(ConnectionState previous, ConnectionState current) {
        listeners.fire(listener -> listener.onConnectionStateChanged(previous, current));
    }

    @Override
    public void onFailure(CollaborationException error) {
        listeners.fire(listener -> listener.onError(error));
    }

    private void userLeft(String userId) {
        cursors.remove(userId);
        presence.leave(userId).ifPresent(user -> listeners.fire(listener -> listener.onUserLeft(user)));
    }

    private void scheduleSweep() {
        sweepTimer = loop.schedule(this::sweepIdleUsers, settings.getPresenceSweepInterval());
    }

    private void sweepIdleUsers() {
        Duration timeout = settings.getPresenceTimeout();
        for (ActiveUser idle : presence.removeIdle(loop.now(), timeout, credentials.getUserId())) {
            log.info("Removing {} from document {}: idle for more than {}",
                    idle.getUserId(), credentials.getDocumentId(), timeout);
            cursors.remove(idle.getUserId());
            listeners.fire(listener -> listener.onUserLeft(idle));
        }
        scheduleSweep();
    }

    /**
     * Runs loop work under the session lock and drops it once the session is closed.
     */
    private final class GuardedLoop implements SessionEventLoop {
        private final SessionEventLoop delegate;

        private GuardedLoop(SessionEventLoop delegate) {
            this.delegate = delegate;
        }

        @Override
        public void execute(Runnable task) {
            delegate.execute(() -> runGuarded(task));
        }

        @Override
        public Cancellable schedule(Runnable task, Duration delay) {
            return delegate.schedule(() -> runGuarded(task), delay);
        }

        @Override
        public Instant now() {
            return delegate.now();
        }

        @Override
        public void shutdown() {
            delegate.shutdown();
        }

        private void runGuarded(Runnable task) {
            synchronized (CollaborationSession.this) {
                if (closed) {
                    return;
                }
                try {
                    task.run();
                } catch (RuntimeException e) {
                    log.error("Collaboration session on document {} failed to process an event",
                            credentials.getDocumentId(), e);
                }
            }
        }
    }
}
