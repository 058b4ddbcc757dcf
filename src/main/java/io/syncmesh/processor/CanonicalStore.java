package io.syncmesh.processor;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

public interface CanonicalStore {
    Optional<JsonNode> read(String identity, String resourceId);

    void write(String identity, String resourceId, JsonNode document);
}
