package io.syncmesh.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

public record SessionContext(
        @JsonProperty("session_id") String sessionId,
        @JsonProperty("subject_id") String subjectId,
        @JsonProperty("owner_node_id") String ownerNodeId,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("expires_at") Instant expiresAt,
        @JsonProperty("trust_level") int trustLevel,
        @JsonProperty("permissions") Set<String> permissions,
        @JsonProperty("vector_clock") VectorClock vectorClock,
        @JsonProperty("sync_status") SyncStatus syncStatus
) {
    public SessionContext {
        Objects.requireNonNull(sessionId, "sessionId");
        Objects.requireNonNull(createdAt, "createdAt");
        Objects.requireNonNull(expiresAt, "expiresAt");
        if (expiresAt.isBefore(createdAt)) {
            throw new IllegalArgumentException("expires_at must not precede created_at for session " + sessionId);
        }
        permissions = sortedCopy(permissions);
        vectorClock = vectorClock == null ? VectorClock.empty() : vectorClock;
        syncStatus = syncStatus == null ? SyncStatus.PENDING : syncStatus;
    }

    public boolean expiredAt(Instant now) {
        return !expiresAt.isAfter(now);
    }

    public SessionContext withSyncStatus(SyncStatus status) {
        return new SessionContext(sessionId, subjectId, ownerNodeId, createdAt, expiresAt, trustLevel, permissions, vectorClock, status);
    }

    public SessionContext withVectorClock(VectorClock clock) {
        return new SessionContext(sessionId, subjectId, ownerNodeId, createdAt, expiresAt, trustLevel, permissions, clock, syncStatus);
    }

    public SessionContext apply(SessionUpdate update) {
        if (update == null) {
            return this;
        }
        return new SessionContext(
                sessionId,
                subjectId,
                ownerNodeId,
                createdAt,
                update.expiresAt() == null ? expiresAt : update.expiresAt(),
                update.trustLevel() == null ? trustLevel : update.trustLevel(),
                update.permissions() == null ? permissions : update.permissions(),
                vectorClock,
                syncStatus
        );
    }

    public SessionContext mergeWith(SessionContext other) {
        Set<String> union = new TreeSet<>(permissions);
        union.addAll(other.permissions());
        return new SessionContext(
                sessionId,
                subjectId,
                ownerNodeId,
                createdAt,
                expiresAt.isAfter(other.expiresAt()) ? expiresAt : other.expiresAt(),
                Math.max(trustLevel, other.trustLevel()),
                union,
                vectorClock.merge(other.vectorClock()),
                syncStatus
        );
    }

    private static SortedSet<String> sortedCopy(Set<String> raw) {
        TreeSet<String> out = new TreeSet<>();
        if (raw != null) {
            for (String value : raw) {
                if (value != null && !value.isBlank()) {
                    out.add(value.trim());
                }
            }
        }
        return Collections.unmodifiableSortedSet(out);
    }
}
