package io.syncmesh.processor;

import io.syncmesh.model.SyncOperation;
import io.syncmesh.storage.Namespaces;
import io.syncmesh.storage.StateStore;
import io.syncmesh.util.Jsons;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public final class OperationRepository {
    private final StateStore store;
    private final Duration ttl;

    public OperationRepository(StateStore store) {
        this(store, Namespaces.QUEUE_TTL);
    }

    public OperationRepository(StateStore store, Duration ttl) {
        this.store = store;
        this.ttl = ttl;
    }

    public Optional<SyncOperation> find(String operationId) {
        return store.get(Namespaces.queue(operationId))
                .map(json -> Jsons.fromJson(json, SyncOperation.class));
    }

    public boolean exists(String operationId) {
        return store.get(Namespaces.queue(operationId)).isPresent();
    }

    public boolean createIfAbsent(SyncOperation operation) {
        return store.putIfAbsent(Namespaces.queue(operation.operationId()), Jsons.toCompactJson(operation), ttl);
    }

    public void save(SyncOperation operation) {
        store.put(Namespaces.queue(operation.operationId()), Jsons.toCompactJson(operation), ttl);
    }

    public boolean delete(String operationId) {
        return store.delete(Namespaces.queue(operationId));
    }

    public List<SyncOperation> listAll() {
        List<SyncOperation> out = new ArrayList<>();
        for (String key : store.list(Namespaces.QUEUE)) {
            store.get(key).ifPresent(json -> out.add(Jsons.fromJson(json, SyncOperation.class)));
        }
        return out;
    }
}
