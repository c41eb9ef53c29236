package com.pmr.collab.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum ConflictType {
    SIMULTANEOUS_EDIT("simultaneous_edit"),
    VERSION_MISMATCH("version_mismatch"),
    PERMISSION_CONFLICT("permission_conflict");

    private final String wireName;

    ConflictType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static ConflictType fromWireName(String value) {
        return Arrays.stream(values())
                .filter(type -> type.wireName.equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown conflict type: " + value));
    }
}
