package io.syncmesh.processor;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.syncmesh.model.SyncOperation;
import io.syncmesh.model.SyncType;
import io.syncmesh.util.Jsons;

import java.util.Iterator;
import java.util.Map;
import java.util.Optional;

public final class ContentUpdateHandler extends AbstractSyncHandler {

    public ContentUpdateHandler(ExternalSource source, CanonicalStore store) {
        super(source, store);
    }

    @Override
    public SyncType type() {
        return SyncType.CONTENT_UPDATE;
    }

    @Override
    protected ObjectNode transform(SyncOperation operation, JsonNode external, Optional<JsonNode> current) {
        JsonNode changes = external.get("properties");
        if (changes != null && !changes.isNull() && !changes.isObject()) {
            throw new IllegalArgumentException("properties of " + operation.targetResourceId() + " must be an object");
        }
        ObjectNode canonical = current.filter(JsonNode::isObject)
                .map(node -> (ObjectNode) node.deepCopy())
                .orElseGet(() -> Jsons.compact().createObjectNode());
        JsonNode existing = canonical.get("properties");
        ObjectNode properties = existing != null && existing.isObject()
                ? (ObjectNode) existing
                : canonical.putObject("properties");
        if (changes != null && changes.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> it = changes.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> change = it.next();
                properties.set(change.getKey(), change.getValue());
            }
        }
        canonical.put("source_object", external.path("object").asText("page"));
        return canonical;
    }
}
