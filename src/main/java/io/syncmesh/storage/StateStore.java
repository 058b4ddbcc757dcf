package io.syncmesh.storage;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

public interface StateStore {

    Optional<String> get(String key);

    void put(String key, String value, Duration ttl);

    boolean putIfAbsent(String key, String value, Duration ttl);

    boolean compareAndSet(String key, String expectedValue, String newValue, Duration ttl);

    boolean delete(String key);

    List<String> list(String prefix);

    int purgeExpired();
}
