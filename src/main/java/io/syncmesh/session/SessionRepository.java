package io.syncmesh.session;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.syncmesh.model.SessionContext;
import io.syncmesh.security.SessionCipher;
import io.syncmesh.storage.Namespaces;
import io.syncmesh.storage.StateStore;
import io.syncmesh.util.Jsons;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public final class SessionRepository {
    private final StateStore store;
    private final SessionCipher cipher;
    private final Duration cacheTtl;

    public SessionRepository(StateStore store, SessionCipher cipher) {
        this(store, cipher, Namespaces.SESSION_TTL);
    }

    public SessionRepository(StateStore store, SessionCipher cipher, Duration cacheTtl) {
        this.store = store;
        this.cipher = cipher;
        this.cacheTtl = cacheTtl;
    }

    public Optional<Versioned> load(String sessionId) {
        Optional<String> raw = store.get(Namespaces.session(sessionId));
        if (raw.isEmpty()) {
            return Optional.empty();
        }
        StoredSession stored = Jsons.fromJson(cipher.decrypt(raw.get()), StoredSession.class);
        return Optional.of(new Versioned(stored, raw.get()));
    }

    public void save(StoredSession stored, Instant now) {
        store.put(key(stored), seal(stored), ttlFor(stored, now));
    }

    public boolean replace(Versioned expected, StoredSession next, Instant now) {
        return store.compareAndSet(key(next), expected.token(), seal(next), ttlFor(next, now));
    }

    public boolean insert(StoredSession stored, Instant now) {
        return store.putIfAbsent(key(stored), seal(stored), ttlFor(stored, now));
    }

    public boolean delete(String sessionId) {
        return store.delete(Namespaces.session(sessionId));
    }

    public Optional<String> indexedSessionFor(String subjectId) {
        if (subjectId == null || subjectId.isBlank()) {
            return Optional.empty();
        }
        return store.get(Namespaces.subject(subjectId));
    }

    public void indexSubject(String subjectId, String sessionId) {
        store.put(Namespaces.subject(subjectId), sessionId, cacheTtl);
    }

    public boolean indexSubjectIfAbsent(String subjectId, String sessionId) {
        return store.putIfAbsent(Namespaces.subject(subjectId), sessionId, cacheTtl);
    }

    public void unindexSubject(String subjectId, String sessionId) {
        String key = Namespaces.subject(subjectId);
        if (store.get(key).filter(sessionId::equals).isPresent()) {
            store.delete(key);
        }
    }

    public List<String> sessionIds() {
        List<String> out = new ArrayList<>();
        for (String key : store.list(Namespaces.SESSION)) {
            out.add(key.substring(Namespaces.SESSION.length()));
        }
        return out;
    }

    private String seal(StoredSession stored) {
        return cipher.encrypt(Jsons.toCompactJson(stored));
    }

    private static String key(StoredSession stored) {
        return Namespaces.session(stored.session().sessionId());
    }

    // Keep the cache row at least until the session itself expires.
    private Duration ttlFor(StoredSession stored, Instant now) {
        Duration untilExpiry = Duration.between(now, stored.session().expiresAt());
        return untilExpiry.compareTo(cacheTtl) > 0 ? untilExpiry : cacheTtl;
    }

    public record StoredSession(
            @JsonProperty("session") SessionContext session,
            @JsonProperty("last_synced_at_ms") long lastSyncedAtMs
    ) {
        public StoredSession withSession(SessionContext next) {
            return new StoredSession(next, lastSyncedAtMs);
        }

        public StoredSession syncedAt(SessionContext next, Instant now) {
            return new StoredSession(next, now.toEpochMilli());
        }
    }

    public record Versioned(StoredSession value, String token) {
        public SessionContext session() {
            return value.session();
        }
    }
}
