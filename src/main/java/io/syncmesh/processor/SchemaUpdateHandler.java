package io.syncmesh.processor;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.syncmesh.model.SyncOperation;
import io.syncmesh.model.SyncType;
import io.syncmesh.util.Jsons;

import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

public final class SchemaUpdateHandler extends AbstractSyncHandler {

    public SchemaUpdateHandler(ExternalSource source, CanonicalStore store) {
        super(source, store);
    }

    @Override
    public SyncType type() {
        return SyncType.SCHEMA_UPDATE;
    }

    @Override
    protected ObjectNode transform(SyncOperation operation, JsonNode external, Optional<JsonNode> current) {
        JsonNode schema = requireSchema(operation, external);
        ObjectNode canonical = current.filter(JsonNode::isObject)
                .map(node -> (ObjectNode) node.deepCopy())
                .orElseGet(() -> Jsons.compact().createObjectNode());
        canonical.set("fields", fieldsOf(schema));
        return canonical;
    }

    @Override
    protected void validate(SyncOperation operation, JsonNode expected, JsonNode persisted) {
        super.validate(operation, expected, persisted);
        if (!names(expected).equals(names(persisted))) {
            throw new IllegalStateException("schema fields diverged after update of " + operation.targetResourceId());
        }
    }

    private static Set<String> names(JsonNode canonical) {
        Set<String> out = new HashSet<>();
        for (JsonNode f : canonical.path("fields")) {
            out.add(f.path("name").asText());
        }
        return out;
    }
}
