package com.pmr.collab.service;

import com.pmr.collab.codec.EventType;
import com.pmr.collab.dto.CommentDTO;
import com.pmr.collab.dto.CommentResolvePayload;
import com.pmr.collab.model.Comment;
import com.pmr.collab.model.Position;
import com.pmr.collab.model.SessionCredentials;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Append-only comment thread replicated to all peers. Concurrent adds never collide.
 */
@Slf4j
public class CommentChannel {
    private final SessionCredentials credentials;
    private final EventPublisher publisher;
    private final ListenerRegistry listeners;
    private final Supplier<Instant> clock;
    private final List<Comment> comments = new ArrayList<>();

    public CommentChannel(SessionCredentials credentials, EventPublisher publisher,
                          ListenerRegistry listeners, Supplier<Instant> clock) {
        this.credentials = credentials;
        this.publisher = publisher;
        this.listeners = listeners;
        this.clock = clock;
    }

    public Comment addComment(String sectionId, String content, Position position) {
        Comment comment = new Comment(UUID.randomUUID().toString(), credentials.getUserId(),
                credentials.getUserName(), content, sectionId, position, clock.get());
        comments.add(comment);
        publisher.publish(EventType.COMMENT_ADD, toDTO(comment));
        return comment;
    }

    /**
     * Marks a comment resolved and broadcasts it. Unknown or already resolved ids are
     * logged and otherwise ignored.
     */
    public void resolveComment(String commentId) {
        Optional<Comment> comment = find(commentId);
        if (comment.isEmpty()) {
            log.warn("Cannot resolve unknown comment {}", commentId);
            return;
        }
        if (!comment.get().resolve(credentials.getUserId(), clock.get())) {
            log.warn("Comment {} is already resolved", commentId);
            return;
        }
        publisher.publish(EventType.COMMENT_RESOLVE, new CommentResolvePayload(commentId));
    }

    public void applyRemoteAdd(CommentDTO dto) {
        if (find(dto.getId()).isPresent()) {
            log.debug("Comment {} already known", dto.getId());
            return;
        }
        Comment comment = fromDTO(dto, clock.get());
        comments.add(comment);
        listeners.fire(listener -> listener.onCommentAdded(comment));
    }

    public void applyRemoteResolve(String resolverId, Instant timestamp, CommentResolvePayload payload) {
        Optional<Comment> comment = find(payload.getCommentId());
        if (comment.isEmpty()) {
            log.warn("Resolution for unknown comment {}", payload.getCommentId());
            return;
        }
        if (!comment.get().resolve(resolverId, timestamp != null ? timestamp : clock.get())) {
            log.debug("Comment {} already resolved", payload.getCommentId());
            return;
        }
        listeners.fire(listener -> listener.onCommentResolved(comment.get()));
    }

    public List<Comment> replaceAll(List<CommentDTO> snapshot) {
        comments.clear();
        Instant now = clock.get();
        snapshot.forEach(dto -> comments.add(fromDTO(dto, now)));
        return getComments();
    }

    public Optional<Comment> find(String commentId) {
        return comments.stream()
                .filter(comment -> comment.getId().equals(commentId))
                .findFirst();
    }

    public List<Comment> getComments() {
        return Collections.unmodifiableList(new ArrayList<>(comments));
    }

    static CommentDTO toDTO(Comment comment) {
        CommentDTO dto = new CommentDTO();
        dto.setId(comment.getId());
        dto.setAuthorId(comment.getAuthorId());
        dto.setAuthorName(comment.getAuthorName());
        dto.setContent(comment.getContent());
        dto.setSectionId(comment.getSectionId());
        if (comment.getPosition() != null) {
            dto.setX(comment.getPosition().getX());
            dto.setY(comment.getPosition().getY());
        }
        dto.setCreatedAt(comment.getCreatedAt());
        dto.setResolved(comment.isResolved());
        dto.setResolvedBy(comment.getResolvedBy());
        dto.setResolvedAt(comment.getResolvedAt());
        return dto;
    }

    static Comment fromDTO(CommentDTO dto, Instant now) {
        Position position = dto.getX() != null && dto.getY() != null ? new Position(dto.getX(), dto.getY()) : null;
        Comment comment = new Comment(dto.getId(), dto.getAuthorId(), dto.getAuthorName(), dto.getContent(),
                dto.getSectionId(), position, dto.getCreatedAt() != null ? dto.getCreatedAt() : now);
        if (dto.isResolved()) {
            comment.resolve(dto.getResolvedBy(), dto.getResolvedAt());
        }
        return comment;
    }
}
