package io.syncmesh.webhook;

import com.fasterxml.jackson.databind.JsonNode;
import io.syncmesh.model.WebhookEvent;
import io.syncmesh.model.WebhookEventType;
import io.syncmesh.util.Jsons;

import java.io.IOException;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Set;

public final class WebhookEventParser {
    private static final Set<String> PARENT_TYPES = Set.of("database_id", "page_id", "workspace");
    private static final Set<String> DATA_OBJECTS = Set.of("page", "database", "comment");

    public WebhookEvent parse(byte[] body) throws WebhookValidationException {
        JsonNode root;
        try {
            root = Jsons.compact().readTree(body);
        } catch (IOException e) {
            throw new WebhookValidationException("body is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new WebhookValidationException("body must be a JSON object");
        }
        if (!"event".equals(root.path("object").asText(null))) {
            throw new WebhookValidationException("object must be \"event\"");
        }
        String id = requiredText(root, "id");
        String createdTime = requiredTimestamp(root, "created_time");
        String lastEditedTime = requiredTimestamp(root, "last_edited_time");
        String rawType = requiredText(root, "type");
        WebhookEventType type = WebhookEventType.fromWire(rawType)
                .orElseThrow(() -> new WebhookValidationException("unsupported event type: " + rawType));

        JsonNode parentNode = requiredObject(root, "parent");
        String parentType = requiredText(parentNode, "type", "parent.type");
        if (!PARENT_TYPES.contains(parentType)) {
            throw new WebhookValidationException("unsupported parent.type: " + parentType);
        }
        String databaseId = optionalText(parentNode, "database_id", "parent.database_id");
        String pageId = optionalText(parentNode, "page_id", "parent.page_id");
        if ("database_id".equals(parentType) && databaseId == null) {
            throw new WebhookValidationException("parent.database_id is required for parent.type database_id");
        }
        if ("page_id".equals(parentType) && pageId == null) {
            throw new WebhookValidationException("parent.page_id is required for parent.type page_id");
        }

        JsonNode dataNode = requiredObject(root, "data");
        String dataObject = requiredText(dataNode, "object", "data.object");
        if (!DATA_OBJECTS.contains(dataObject)) {
            throw new WebhookValidationException("unsupported data.object: " + dataObject);
        }
        String dataId = requiredText(dataNode, "id", "data.id");
        String dataEdited = requiredTimestamp(dataNode, "last_edited_time", "data.last_edited_time");
        JsonNode properties = optionalObject(dataNode, "properties", "data.properties");
        JsonNode schema = optionalObject(dataNode, "schema", "data.schema");

        return new WebhookEvent(
                id,
                createdTime,
                lastEditedTime,
                type,
                new WebhookEvent.Parent(parentType, databaseId, pageId),
                new WebhookEvent.Data(dataObject, dataId, dataEdited, properties, schema)
        );
    }

    private static String requiredText(JsonNode node, String field) throws WebhookValidationException {
        return requiredText(node, field, field);
    }

    private static String requiredText(JsonNode node, String field, String label) throws WebhookValidationException {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            throw new WebhookValidationException(label + " must be a non-empty string");
        }
        return value.asText();
    }

    private static String optionalText(JsonNode node, String field, String label) throws WebhookValidationException {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isTextual()) {
            throw new WebhookValidationException(label + " must be a string");
        }
        return value.asText().isBlank() ? null : value.asText();
    }

    private static String requiredTimestamp(JsonNode node, String field) throws WebhookValidationException {
        return requiredTimestamp(node, field, field);
    }

    private static String requiredTimestamp(JsonNode node, String field, String label) throws WebhookValidationException {
        String raw = requiredText(node, field, label);
        try {
            Instant.parse(raw);
        } catch (DateTimeParseException e) {
            throw new WebhookValidationException(label + " must be an ISO-8601 timestamp", e);
        }
        return raw;
    }

    private static JsonNode requiredObject(JsonNode node, String field) throws WebhookValidationException {
        JsonNode value = node.get(field);
        if (value == null || !value.isObject()) {
            throw new WebhookValidationException(field + " must be an object");
        }
        return value;
    }

    private static JsonNode optionalObject(JsonNode node, String field, String label) throws WebhookValidationException {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isObject()) {
            throw new WebhookValidationException(label + " must be an object");
        }
        return value;
    }
}
