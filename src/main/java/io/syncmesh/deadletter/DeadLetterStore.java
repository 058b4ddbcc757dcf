package io.syncmesh.deadletter;

import io.syncmesh.model.SyncOperation;
import io.syncmesh.storage.Namespaces;
import io.syncmesh.storage.StateStore;
import io.syncmesh.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public final class DeadLetterStore {
    private static final Logger log = LoggerFactory.getLogger(DeadLetterStore.class);

    private final StateStore store;
    private final Duration ttl;

    public DeadLetterStore(StateStore store) {
        this(store, Namespaces.DEAD_LETTER_TTL);
    }

    public DeadLetterStore(StateStore store, Duration ttl) {
        this.store = store;
        this.ttl = ttl;
    }

    public String add(SyncOperation operation, Instant now) {
        long epochMs = now.toEpochMilli();
        String json = Jsons.toCompactJson(operation);
        String key = Namespaces.deadLetter(operation.operationId(), epochMs);
        while (!store.putIfAbsent(key, json, ttl)) {
            epochMs++;
            key = Namespaces.deadLetter(operation.operationId(), epochMs);
        }
        store.put(Namespaces.deadLetteredId(operation.operationId()), key, ttl);
        return key;
    }

    public boolean isDeadLettered(String operationId) {
        return store.get(Namespaces.deadLetteredId(operationId)).isPresent();
    }

    // Only an explicit replay clears the marker; a recovered entry keeps blocking redelivery.
    public void clearDeadLettered(String operationId) {
        store.delete(Namespaces.deadLetteredId(operationId));
    }

    public Optional<DeadLetterEntry> get(String key) {
        return store.get(key).map(json -> toEntry(key, json));
    }

    public List<DeadLetterEntry> list() {
        List<DeadLetterEntry> out = new ArrayList<>();
        for (String key : store.list(Namespaces.DEAD_LETTER)) {
            store.get(key).ifPresent(json -> out.add(toEntry(key, json)));
        }
        return out;
    }

    public int size() {
        return store.list(Namespaces.DEAD_LETTER).size();
    }

    public boolean remove(String key) {
        return store.delete(key);
    }

    private static DeadLetterEntry toEntry(String key, String json) {
        SyncOperation operation = Jsons.fromJson(json, SyncOperation.class);
        return new DeadLetterEntry(key, operation, timestampOf(key, operation));
    }

    private static Instant timestampOf(String key, SyncOperation operation) {
        int idx = key.lastIndexOf(':');
        if (idx > 0) {
            try {
                return Instant.ofEpochMilli(Long.parseLong(key.substring(idx + 1)));
            } catch (NumberFormatException e) {
                log.debug("Dead-letter key {} has no epoch suffix", key);
            }
        }
        return operation.updatedAt();
    }
}
