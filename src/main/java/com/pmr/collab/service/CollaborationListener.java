package com.pmr.collab.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.pmr.collab.exception.CollaborationException;
import com.pmr.collab.model.ActiveUser;
import com.pmr.collab.model.Comment;
import com.pmr.collab.model.Conflict;
import com.pmr.collab.model.ConnectionState;
import com.pmr.collab.model.CursorPosition;
import com.pmr.collab.model.SessionSnapshot;

/**
 * Observer of a collaboration session. Called synchronously on the session's event loop,
 * in the order events are processed. All methods default to no-ops.
 */
public interface CollaborationListener {

    /** A remote edit, or a conflict resolution, changed a section. */
    default void onSectionUpdate(String sectionId, JsonNode content, String editorId) {
    }

    /**
     * A conflict opened, whether detected locally, reported by the server, or first seen
     * unresolved in a snapshot.
     */
    default void onConflictDetected(Conflict conflict) {
    }

    default void onConflictResolved(Conflict conflict) {
    }

    default void onConnectionStateChanged(ConnectionState previous, ConnectionState current) {
    }

    default void onSnapshotApplied(SessionSnapshot snapshot) {
    }

    default void onUserJoined(ActiveUser user) {
    }

    default void onUserLeft(ActiveUser user) {
    }

    default void onCursorMoved(CursorPosition cursor) {
    }

    default void onCommentAdded(Comment comment) {
    }

    default void onCommentResolved(Comment comment) {
    }

    /** The session gave up: authentication was rejected or reconnection was exhausted. */
    default void onError(CollaborationException error) {
    }
}
