package io.syncmesh.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum SyncStatus {
    SYNCED("synced"),
    PENDING("pending"),
    CONFLICT("conflict");

    private final String wire;

    SyncStatus(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    @JsonCreator
    public static SyncStatus fromString(String raw) {
        for (SyncStatus value : values()) {
            if (value.wire.equalsIgnoreCase(raw) || value.name().equalsIgnoreCase(raw)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown sync status: " + raw);
    }
}
