package io.syncmesh.processor;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.syncmesh.model.SyncOperation;
import io.syncmesh.util.Jsons;

import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

public abstract class AbstractSyncHandler implements SyncHandler {
    protected final ExternalSource source;
    protected final CanonicalStore store;

    protected AbstractSyncHandler(ExternalSource source, CanonicalStore store) {
        this.source = source;
        this.store = store;
    }

    @Override
    public final void handle(SyncOperation operation) throws Exception {
        String identity = operation.associatedIdentity();
        String resourceId = operation.targetResourceId();
        JsonNode external = source.fetch(operation);
        Optional<JsonNode> current = store.read(identity, resourceId);
        ObjectNode canonical = transform(operation, external, current);
        canonical.put("resource_id", resourceId);
        canonical.put("identity", identity);
        canonical.put("last_operation_id", operation.operationId());
        store.write(identity, resourceId, canonical);
        JsonNode persisted = store.read(identity, resourceId)
                .orElseThrow(() -> new IllegalStateException("canonical record for " + resourceId + " missing after write"));
        validate(operation, canonical, persisted);
    }

    protected abstract ObjectNode transform(SyncOperation operation, JsonNode external, Optional<JsonNode> current)
            throws Exception;

    protected void validate(SyncOperation operation, JsonNode expected, JsonNode persisted) {
        if (!expected.equals(persisted)) {
            throw new IllegalStateException("canonical record for " + operation.targetResourceId()
                    + " does not match what was written");
        }
    }

    protected static ArrayNode fieldsOf(JsonNode schema) {
        TreeMap<String, String> sorted = new TreeMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = schema.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> field = it.next();
            JsonNode def = field.getValue();
            String type = def.isObject() ? def.path("type").asText("unknown") : def.asText("unknown");
            sorted.put(field.getKey(), type.isBlank() ? "unknown" : type);
        }
        ArrayNode out = Jsons.compact().createArrayNode();
        for (Map.Entry<String, String> e : sorted.entrySet()) {
            ObjectNode f = out.addObject();
            f.put("name", e.getKey());
            f.put("type", e.getValue());
        }
        return out;
    }

    protected static JsonNode requireSchema(SyncOperation operation, JsonNode external) {
        JsonNode schema = external.get("schema");
        if (schema == null || !schema.isObject()) {
            throw new IllegalStateException("operation " + operation.operationId() + " has no schema to apply");
        }
        return schema;
    }
}
