package io.syncmesh.model;

import java.time.Instant;
import java.util.Set;

public record SessionUpdate(Integer trustLevel, Set<String> permissions, Instant expiresAt) {

    public static SessionUpdate permissions(Set<String> permissions) {
        return new SessionUpdate(null, permissions, null);
    }

    public static SessionUpdate trustLevel(int trustLevel) {
        return new SessionUpdate(trustLevel, null, null);
    }

    public boolean empty() {
        return trustLevel == null && permissions == null && expiresAt == null;
    }
}
