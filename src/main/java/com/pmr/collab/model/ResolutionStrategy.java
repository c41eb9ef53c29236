package com.pmr.collab.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum ResolutionStrategy {
    /** Combine the conflicting contents with a caller-supplied merge function. */
    MERGE("merge"),
    /** Keep only the most recently timestamped change. */
    OVERWRITE("overwrite"),
    /** The caller already applied its own resolution; no content change. */
    MANUAL("manual");

    private final String wireName;

    ResolutionStrategy(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static ResolutionStrategy fromWireName(String value) {
        return Arrays.stream(values())
                .filter(strategy -> strategy.wireName.equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown resolution strategy: " + value));
    }
}
