package io.syncmesh.model;

import com.fasterxml.jackson.databind.JsonNode;

public record WebhookEvent(
        String id,
        String createdTime,
        String lastEditedTime,
        WebhookEventType type,
        Parent parent,
        Data data
) {
    public String targetResourceId() {
        if (parent != null && parent.databaseId() != null && !parent.databaseId().isBlank()) {
            return parent.databaseId();
        }
        return data.id();
    }

    public String operationId() {
        return id + "-" + type.wire() + "-" + lastEditedTime;
    }

    public record Parent(String type, String databaseId, String pageId) {
    }

    public record Data(String object, String id, String lastEditedTime, JsonNode properties, JsonNode schema) {
    }
}
