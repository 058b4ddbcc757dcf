package io.syncmesh.processor;

import com.fasterxml.jackson.databind.JsonNode;
import io.syncmesh.model.SyncOperation;

@FunctionalInterface
public interface ExternalSource {
    JsonNode fetch(SyncOperation operation) throws Exception;
}
