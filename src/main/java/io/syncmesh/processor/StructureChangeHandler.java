package io.syncmesh.processor;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.syncmesh.model.SyncOperation;
import io.syncmesh.model.SyncType;
import io.syncmesh.util.Jsons;

import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

public final class StructureChangeHandler extends AbstractSyncHandler {

    public StructureChangeHandler(ExternalSource source, CanonicalStore store) {
        super(source, store);
    }

    @Override
    public SyncType type() {
        return SyncType.STRUCTURE_CHANGE;
    }

    @Override
    protected ObjectNode transform(SyncOperation operation, JsonNode external, Optional<JsonNode> current) {
        ArrayNode next = fieldsOf(requireSchema(operation, external));
        Set<String> before = names(current.map(node -> node.path("fields")).orElse(null));
        Set<String> after = names(next);
        if (after.isEmpty() && !before.isEmpty()) {
            throw new IllegalArgumentException("structure change on " + operation.targetResourceId()
                    + " removes every field");
        }
        ObjectNode canonical = current.filter(JsonNode::isObject)
                .map(node -> (ObjectNode) node.deepCopy())
                .orElseGet(() -> Jsons.compact().createObjectNode());
        canonical.set("fields", next);
        ObjectNode change = canonical.putObject("last_change");
        ArrayNode added = change.putArray("added");
        ArrayNode removed = change.putArray("removed");
        for (String name : after) {
            if (!before.contains(name)) {
                added.add(name);
            }
        }
        for (String name : before) {
            if (!after.contains(name)) {
                removed.add(name);
            }
        }
        return canonical;
    }

    private static Set<String> names(JsonNode fields) {
        Set<String> out = new TreeSet<>();
        if (fields != null) {
            for (JsonNode f : fields) {
                out.add(f.path("name").asText());
            }
        }
        return out;
    }
}
