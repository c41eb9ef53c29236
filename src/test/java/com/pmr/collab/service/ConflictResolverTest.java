package com.pmr.collab.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.pmr.collab.codec.EventType;
import com.pmr.collab.dto.ConflictResolvedPayload;
import com.pmr.collab.dto.SectionUpdatePayload;
import com.pmr.collab.exception.AlreadyResolvedException;
import com.pmr.collab.exception.NotConnectedException;
import com.pmr.collab.model.Conflict;
import com.pmr.collab.model.ResolutionStrategy;
import com.pmr.collab.support.ManualEventLoop;
import com.pmr.collab.support.RecordingPublisher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static com.pmr.collab.support.Frames.text;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

public class ConflictResolverTest {
    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private RecordingPublisher publisher;
    private CollaborationListener listener;
    private ConflictDetector detector;
    private SectionSynchronizer synchronizer;
    private ConflictResolver resolver;

    @BeforeEach
    public void setUp() {
        ManualEventLoop loop = new ManualEventLoop(T0);
        publisher = new RecordingPublisher();
        ListenerRegistry listeners = new ListenerRegistry();
        listener = mock(CollaborationListener.class);
        listeners.add(listener);
        detector = new ConflictDetector(listeners, loop::now);
        synchronizer = new SectionSynchronizer("me", publisher, detector, listeners, loop::now,
                java.time.Duration.ZERO);
        resolver = new ConflictResolver("me", publisher, detector, synchronizer, listeners, loop::now);
    }

    /** Local edit at T0 collides with b's edit stamped one second later. */
    private Conflict collide() {
        synchronizer.updateSection("s1", text("mine"));
        synchronizer.applyRemote("b", T0.plusSeconds(1), new SectionUpdatePayload("s1", text("theirs"), "b"));
        publisher.getPublished().clear();
        return detector.getUnresolvedConflicts().get(0);
    }

    @Test
    public void testOverwriteTakesLatestChange() {
        Conflict conflict = collide();

        resolver.resolve(conflict.getId(), ResolutionStrategy.OVERWRITE, null);

        assertTrue(conflict.isResolved());
        assertEquals("me", conflict.getResolvedBy());
        assertEquals(List.of(EventType.CONFLICT_RESOLVED, EventType.SECTION_UPDATE), publisher.types());
        ConflictResolvedPayload resolved = publisher.last(EventType.CONFLICT_RESOLVED, ConflictResolvedPayload.class);
        assertEquals(conflict.getId(), resolved.getConflictId());
        assertEquals("s1", resolved.getSectionId());
        assertEquals(ResolutionStrategy.OVERWRITE, resolved.getResolution());
        assertEquals(text("theirs"), resolved.getContent());
        assertEquals(text("theirs"), publisher.last(EventType.SECTION_UPDATE, SectionUpdatePayload.class).getContent());
        assertEquals(text("theirs"), synchronizer.getSection("s1").orElseThrow().getContent());
        verify(listener).onConflictResolved(conflict);
    }

    @Test
    public void testMergeUsesCallerFunction() {
        Conflict conflict = collide();
        MergeFunction concat = (original, changes) -> text(changes.get(0).getContent().get("text").asText()
                + "+" + changes.get(1).getContent().get("text").asText());

        resolver.resolve(conflict.getId(), ResolutionStrategy.MERGE, concat);

        assertEquals(text("mine+theirs"), synchronizer.getSection("s1").orElseThrow().getContent());
        assertEquals(text("mine+theirs"),
                publisher.last(EventType.CONFLICT_RESOLVED, ConflictResolvedPayload.class).getContent());
    }

    @Test
    public void testMergeWithoutFunctionIsRejected() {
        Conflict conflict = collide();
        assertThrows(IllegalArgumentException.class,
                () -> resolver.resolve(conflict.getId(), ResolutionStrategy.MERGE, null));
        assertFalse(conflict.isResolved());
        assertTrue(publisher.getPublished().isEmpty());
    }

    @Test
    public void testManualLeavesContentUntouched() {
        Conflict conflict = collide();

        resolver.resolve(conflict.getId(), ResolutionStrategy.MANUAL, null);

        assertEquals(List.of(EventType.CONFLICT_RESOLVED), publisher.types());
        assertNull(publisher.last(EventType.CONFLICT_RESOLVED, ConflictResolvedPayload.class).getContent());
        assertEquals(text("mine"), synchronizer.getSection("s1").orElseThrow().getContent());
        assertFalse(synchronizer.hasPendingEdit("s1"));
    }

    @Test
    public void testSecondResolutionRejected() {
        Conflict conflict = collide();
        resolver.resolve(conflict.getId(), ResolutionStrategy.OVERWRITE, null);
        publisher.getPublished().clear();

        assertThrows(AlreadyResolvedException.class,
                () -> resolver.resolve(conflict.getId(), ResolutionStrategy.MANUAL, null));
        assertEquals(ResolutionStrategy.OVERWRITE, conflict.getResolution());
        assertTrue(publisher.getPublished().isEmpty());
    }

    @Test
    public void testUnknownConflictRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> resolver.resolve("nope", ResolutionStrategy.MANUAL, null));
    }

    @Test
    public void testResolveWhileDisconnectedChangesNothing() {
        Conflict conflict = collide();
        publisher.setConnected(false);

        assertThrows(NotConnectedException.class,
                () -> resolver.resolve(conflict.getId(), ResolutionStrategy.OVERWRITE, null));
        assertFalse(conflict.isResolved());
    }

    @Test
    public void testRemoteResolutionAppliesContent() {
        Conflict conflict = collide();
        JsonNode merged = text("merged by b");

        resolver.applyRemote("b", T0.plusSeconds(5), new ConflictResolvedPayload(
                conflict.getId(), "s1", ResolutionStrategy.MERGE, merged));

        assertTrue(conflict.isResolved());
        assertEquals("b", conflict.getResolvedBy());
        assertEquals(merged, synchronizer.getSection("s1").orElseThrow().getContent());
        assertFalse(synchronizer.hasPendingEdit("s1"));
        verify(listener).onSectionUpdate("s1", merged, "b");
        verify(listener).onConflictResolved(conflict);
    }

    @Test
    public void testRemoteResolutionMatchesLocalConflictBySection() {
        Conflict conflict = collide();

        resolver.applyRemote("b", T0, new ConflictResolvedPayload("their-id", "s1", ResolutionStrategy.MANUAL, null));

        assertTrue(conflict.isResolved());
        assertTrue(detector.findOpen("s1").isEmpty());
    }

    @Test
    public void testDuplicateRemoteResolutionIgnored() {
        Conflict conflict = collide();
        ConflictResolvedPayload payload =
                new ConflictResolvedPayload(conflict.getId(), "s1", ResolutionStrategy.OVERWRITE, text("x"));

        resolver.applyRemote("b", T0, payload);
        resolver.applyRemote("c", T0, payload);

        assertEquals("b", conflict.getResolvedBy());
        verify(listener, times(1)).onConflictResolved(any());
        verify(listener, times(1)).onSectionUpdate(eq("s1"), any(), any());
    }
}
