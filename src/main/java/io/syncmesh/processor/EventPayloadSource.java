package io.syncmesh.processor;

import com.fasterxml.jackson.databind.JsonNode;
import io.syncmesh.model.SyncOperation;

public final class EventPayloadSource implements ExternalSource {
    @Override
    public JsonNode fetch(SyncOperation operation) {
        JsonNode data = operation.payload() == null ? null : operation.payload().get("data");
        if (data == null || !data.isObject()) {
            throw new IllegalStateException("operation " + operation.operationId() + " carries no data block");
        }
        return data;
    }
}
