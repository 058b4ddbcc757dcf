package io.syncmesh.webhook;

import io.syncmesh.storage.Namespaces;
import io.syncmesh.storage.StateStore;

import java.util.Optional;

public final class StoredIdentityResolver implements IdentityResolver {
    private final StateStore store;

    public StoredIdentityResolver(StateStore store) {
        this.store = store;
    }

    @Override
    public Optional<String> resolve(String resourceId) {
        if (resourceId == null || resourceId.isBlank()) {
            return Optional.empty();
        }
        return store.get(Namespaces.identity(resourceId.trim())).filter(v -> !v.isBlank());
    }

    public void map(String resourceId, String identity) {
        if (resourceId == null || resourceId.isBlank() || identity == null || identity.isBlank()) {
            throw new IllegalArgumentException("resourceId and identity are required");
        }
        store.put(Namespaces.identity(resourceId.trim()), identity.trim(), Namespaces.NO_EXPIRY);
    }

    public boolean unmap(String resourceId) {
        return store.delete(Namespaces.identity(resourceId.trim()));
    }
}
