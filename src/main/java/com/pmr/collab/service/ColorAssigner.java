package com.pmr.collab.service;

import java.util.List;

/**
 * Derives a display color from a user id, so the same user keeps the same color across redraws.
 */
public class ColorAssigner {
    static final List<String> PALETTE = List.of(
            "#3b82f6", "#ef4444", "#10b981", "#f59e0b", "#8b5cf6",
            "#ec4899", "#14b8a6", "#f97316", "#6366f1", "#84cc16");

    public String colorFor(String userId) {
        return PALETTE.get(Math.floorMod(userId.hashCode(), PALETTE.size()));
    }
}
