package io.syncmesh.model;

import java.util.Optional;

public enum WebhookEventType {
    PAGE_CONTENT_UPDATED("page.content_updated", SyncType.CONTENT_UPDATE),
    DATA_SOURCE_SCHEMA_UPDATED("data_source.schema_updated", SyncType.SCHEMA_UPDATE),
    DATABASE_SCHEMA_UPDATED("database.schema_updated", SyncType.STRUCTURE_CHANGE),
    COMMENT_CREATED("comment.created", SyncType.CONTENT_UPDATE);

    private final String wire;
    private final SyncType syncType;

    WebhookEventType(String wire, SyncType syncType) {
        this.wire = wire;
        this.syncType = syncType;
    }

    public String wire() {
        return wire;
    }

    public SyncType syncType() {
        return syncType;
    }

    public static Optional<WebhookEventType> fromWire(String raw) {
        for (WebhookEventType value : values()) {
            if (value.wire.equals(raw)) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }
}
