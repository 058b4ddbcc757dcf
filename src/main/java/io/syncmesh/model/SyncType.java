package io.syncmesh.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum SyncType {
    SCHEMA_UPDATE("schema_update"),
    CONTENT_UPDATE("content_update"),
    STRUCTURE_CHANGE("structure_change");

    private final String wire;

    SyncType(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    @JsonCreator
    public static SyncType fromString(String raw) {
        for (SyncType value : values()) {
            if (value.wire.equalsIgnoreCase(raw) || value.name().equalsIgnoreCase(raw)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown sync type: " + raw);
    }
}
