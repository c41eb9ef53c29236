package com.pmr.collab.service;

import com.pmr.collab.dto.UserPresencePayload;
import com.pmr.collab.model.ActiveUser;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Live set of collaborators joined to the session, keyed by user id.
 */
@Slf4j
public class PresenceTracker {
    private final Map<String, ActiveUser> activeUsers = new LinkedHashMap<>();
    private final ColorAssigner colorAssigner;

    public PresenceTracker(ColorAssigner colorAssigner) {
        this.colorAssigner = colorAssigner;
    }

    /**
     * Inserts or refreshes a collaborator.
     *
     * @return the user if this join added a new entry, empty if it only refreshed one
     */
    public Optional<ActiveUser> join(UserPresencePayload payload, Instant now) {
        ActiveUser existing = activeUsers.get(payload.getUserId());
        if (existing != null) {
            activeUsers.put(existing.getUserId(), existing
                    .withName(payload.getName() != null ? payload.getName() : existing.getName())
                    .withEmail(payload.getEmail() != null ? payload.getEmail() : existing.getEmail())
                    .withLastActivity(now));
            return Optional.empty();
        }
        ActiveUser user = toActiveUser(payload, now);
        activeUsers.put(user.getUserId(), user);
        log.debug("User {} joined", user.getUserId());
        return Optional.of(user);
    }

    public Optional<ActiveUser> leave(String userId) {
        return Optional.ofNullable(activeUsers.remove(userId));
    }

    /** Refreshes the last activity of a known user; unknown ids are ignored. */
    public void touch(String userId, Instant now) {
        if (userId == null) {
            return;
        }
        activeUsers.computeIfPresent(userId, (id, user) -> user.withLastActivity(now));
    }

    /**
     * Removes collaborators idle for longer than the timeout. The local user is never removed.
     */
    public List<ActiveUser> removeIdle(Instant now, Duration timeout, String localUserId) {
        Instant cutoff = now.minus(timeout);
        List<ActiveUser> removed = new ArrayList<>();
        activeUsers.values().removeIf(user -> {
            if (!user.getUserId().equals(localUserId) && user.isIdleSince(cutoff)) {
                removed.add(user);
                return true;
            }
            return false;
        });
        return removed;
    }

    public List<ActiveUser> replaceAll(List<UserPresencePayload> users, Instant now) {
        activeUsers.clear();
        for (UserPresencePayload payload : users) {
            ActiveUser user = toActiveUser(payload, now);
            activeUsers.put(user.getUserId(), user);
        }
        return getActiveUsers();
    }

    public Optional<ActiveUser> find(String userId) {
        return Optional.ofNullable(activeUsers.get(userId));
    }

    public List<ActiveUser> getActiveUsers() {
        return Collections.unmodifiableList(new ArrayList<>(activeUsers.values()));
    }

    public String colorFor(String userId) {
        return colorAssigner.colorFor(userId);
    }

    private ActiveUser toActiveUser(UserPresencePayload payload, Instant now) {
        String name = payload.getName() != null ? payload.getName() : payload.getUserId();
        Instant lastActivity = payload.getLastActivity() != null ? payload.getLastActivity() : now;
        return new ActiveUser(payload.getUserId(), name, payload.getEmail(),
                colorAssigner.colorFor(payload.getUserId()), lastActivity);
    }
}
