package io.syncmesh.processor;

import com.fasterxml.jackson.databind.JsonNode;
import io.syncmesh.storage.Namespaces;
import io.syncmesh.storage.StateStore;
import io.syncmesh.util.Jsons;

import java.io.IOException;
import java.util.Optional;

public final class StateStoreCanonicalStore implements CanonicalStore {
    private final StateStore store;

    public StateStoreCanonicalStore(StateStore store) {
        this.store = store;
    }

    @Override
    public Optional<JsonNode> read(String identity, String resourceId) {
        Optional<String> raw = store.get(Namespaces.canonical(identity, resourceId));
        if (raw.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Jsons.compact().readTree(raw.get()));
        } catch (IOException e) {
            throw new RuntimeException("Failed to read canonical record for " + identity + "/" + resourceId, e);
        }
    }

    @Override
    public void write(String identity, String resourceId, JsonNode document) {
        store.put(Namespaces.canonical(identity, resourceId), Jsons.toCompactJson(document), Namespaces.NO_EXPIRY);
    }
}
