package io.syncmesh.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class SyncMeshConfig {
    public static final String DEFAULT_NAMESPACE = "default";
    public static final String DEFAULT_NAMESPACES_DIR = "namespaces";
    public static final String DEFAULT_NODE_ID = "node-local";
    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final long DEFAULT_BASE_BACKOFF_MS = 1_000L;
    public static final long DEFAULT_MAX_BACKOFF_MS = 30_000L;
    public static final double DEFAULT_JITTER_RATIO = 0.1d;
    public static final long DEFAULT_SESSION_LIFETIME_MS = 24L * 60L * 60L * 1000L;
    public static final long DEFAULT_SYNC_FRESHNESS_MS = 5L * 60L * 1000L;
    public static final long DEFAULT_REMOTE_TIMEOUT_MS = 10_000L;
    public static final int DEFAULT_PROPAGATION_POOL_SIZE = 4;
    public static final int DEFAULT_PROPAGATION_QUEUE_CAPACITY = 100;
    public static final int DEFAULT_PROCESSOR_POOL_SIZE = 4;
    public static final long DEFAULT_COURTESY_DELAY_MS = 100L;
    public static final long DEFAULT_COURTESY_JITTER_MS = 50L;
    public static final long DEFAULT_QUEUE_TTL_MS = 24L * 60L * 60L * 1000L;
    public static final long DEFAULT_DEAD_LETTER_TTL_MS = 7L * 24L * 60L * 60L * 1000L;
    public static final long DEFAULT_RECONCILE_INTERVAL_MS = 5L * 60L * 1000L;
    public static final long DEFAULT_STALL_AFTER_MS = 10L * 60L * 1000L;
    public static final String DEFAULT_SIGNATURE_HEADER = "X-Notion-Signature";

    private final Path rootDir;
    private final Path rootBaseDir;
    private final String namespace;

    public SyncMeshConfig(Path rootDir, Path rootBaseDir, String namespace) {
        this.rootDir = rootDir;
        this.rootBaseDir = rootBaseDir;
        this.namespace = namespace;
    }

    public static SyncMeshConfig fromRoot(String root) {
        return fromRoot(root, DEFAULT_NAMESPACE);
    }

    public static SyncMeshConfig fromRoot(String root, String namespace) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get("data")
                : Paths.get(root);
        Path base = resolved.toAbsolutePath().normalize();
        String safeNamespace = sanitizeNamespace(namespace);
        Path scoped = DEFAULT_NAMESPACE.equals(safeNamespace)
                ? base
                : base.resolve(DEFAULT_NAMESPACES_DIR).resolve(safeNamespace);
        return new SyncMeshConfig(scoped, base, safeNamespace);
    }

    private static String sanitizeNamespace(String raw) {
        String normalized = raw == null || raw.isBlank() ? DEFAULT_NAMESPACE : raw.trim().toLowerCase();
        StringBuilder sb = new StringBuilder(normalized.length());
        for (int i = 0; i < normalized.length(); i++) {
            char ch = normalized.charAt(i);
            boolean ok = (ch >= 'a' && ch <= 'z')
                    || (ch >= '0' && ch <= '9')
                    || ch == '_' || ch == '-' || ch == '.';
            sb.append(ok ? ch : '-');
        }
        String value = sb.toString();
        if (value.isBlank()) {
            return DEFAULT_NAMESPACE;
        }
        while (value.contains("--")) {
            value = value.replace("--", "-");
        }
        if (value.startsWith(".")) {
            value = "ns" + value;
        }
        return value;
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path rootBaseDir() {
        return rootBaseDir;
    }

    public String namespace() {
        return namespace;
    }

    public Path dbFile() {
        return rootDir.resolve("syncmesh.db");
    }

    public Path settingsFile() {
        return rootDir.resolve("syncmesh-settings.json");
    }

    public Path auditRoot() {
        return rootDir.resolve("audit");
    }

    public Path securityRoot() {
        return rootDir.resolve("security");
    }

    public Path alertsRoot() {
        return rootDir.resolve("alerts");
    }

    public Path sessionKeyFile() {
        return securityRoot().resolve("session-keys.json");
    }

    public Path auditSigningKeyFile() {
        return securityRoot().resolve("audit-signing.key");
    }
}
