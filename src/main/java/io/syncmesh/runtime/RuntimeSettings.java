package io.syncmesh.runtime;

import io.syncmesh.config.SyncMeshConfig;
import io.syncmesh.retry.RetryPolicy;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public record RuntimeSettings(
        String nodeId,
        String remoteAuthorityUrl,
        String remoteAuthorityToken,
        long remoteTimeoutMs,
        String webhookSecret,
        String signatureHeader,
        int maxAttempts,
        long baseBackoffMs,
        long maxBackoffMs,
        double jitterRatio,
        long sessionLifetimeMs,
        long syncFreshnessMs,
        int propagationPoolSize,
        int propagationQueueCapacity,
        int processorPoolSize,
        long courtesyDelayMs,
        long courtesyJitterMs,
        long queueTtlMs,
        long deadLetterTtlMs,
        long reconcileIntervalMs
) {
    public static final String ENV_WEBHOOK_SECRET = "SYNCMESH_WEBHOOK_SECRET";
    public static final String ENV_REMOTE_TOKEN = "SYNCMESH_REMOTE_TOKEN";

    public static RuntimeSettings defaults() {
        return new RuntimeSettings(
                SyncMeshConfig.DEFAULT_NODE_ID,
                "",
                "",
                SyncMeshConfig.DEFAULT_REMOTE_TIMEOUT_MS,
                "",
                SyncMeshConfig.DEFAULT_SIGNATURE_HEADER,
                SyncMeshConfig.DEFAULT_MAX_ATTEMPTS,
                SyncMeshConfig.DEFAULT_BASE_BACKOFF_MS,
                SyncMeshConfig.DEFAULT_MAX_BACKOFF_MS,
                SyncMeshConfig.DEFAULT_JITTER_RATIO,
                SyncMeshConfig.DEFAULT_SESSION_LIFETIME_MS,
                SyncMeshConfig.DEFAULT_SYNC_FRESHNESS_MS,
                SyncMeshConfig.DEFAULT_PROPAGATION_POOL_SIZE,
                SyncMeshConfig.DEFAULT_PROPAGATION_QUEUE_CAPACITY,
                SyncMeshConfig.DEFAULT_PROCESSOR_POOL_SIZE,
                SyncMeshConfig.DEFAULT_COURTESY_DELAY_MS,
                SyncMeshConfig.DEFAULT_COURTESY_JITTER_MS,
                SyncMeshConfig.DEFAULT_QUEUE_TTL_MS,
                SyncMeshConfig.DEFAULT_DEAD_LETTER_TTL_MS,
                SyncMeshConfig.DEFAULT_RECONCILE_INTERVAL_MS
        );
    }

    static RuntimeSettings fromFile(RuntimeSettingsFile file, RuntimeSettings defaults) {
        if (file == null) {
            return defaults;
        }
        long baseBackoff = sanitizeLong(file.baseBackoffMs(), defaults.baseBackoffMs(), 1L);
        return new RuntimeSettings(
                sanitizeText(file.nodeId(), defaults.nodeId()),
                sanitizeText(file.remoteAuthorityUrl(), defaults.remoteAuthorityUrl()),
                sanitizeText(file.remoteAuthorityToken(), defaults.remoteAuthorityToken()),
                sanitizeLong(file.remoteTimeoutMs(), defaults.remoteTimeoutMs(), 100L),
                sanitizeText(file.webhookSecret(), defaults.webhookSecret()),
                sanitizeText(file.signatureHeader(), defaults.signatureHeader()),
                sanitizeInt(file.maxAttempts(), defaults.maxAttempts(), 1),
                baseBackoff,
                sanitizeLong(file.maxBackoffMs(), defaults.maxBackoffMs(), baseBackoff),
                sanitizeRatio(file.jitterRatio(), defaults.jitterRatio()),
                sanitizeLong(file.sessionLifetimeMs(), defaults.sessionLifetimeMs(), 1_000L),
                sanitizeLong(file.syncFreshnessMs(), defaults.syncFreshnessMs(), 0L),
                sanitizeInt(file.propagationPoolSize(), defaults.propagationPoolSize(), 1),
                sanitizeInt(file.propagationQueueCapacity(), defaults.propagationQueueCapacity(), 1),
                sanitizeInt(file.processorPoolSize(), defaults.processorPoolSize(), 1),
                sanitizeLong(file.courtesyDelayMs(), defaults.courtesyDelayMs(), 0L),
                sanitizeLong(file.courtesyJitterMs(), defaults.courtesyJitterMs(), 0L),
                sanitizeLong(file.queueTtlMs(), defaults.queueTtlMs(), 1_000L),
                sanitizeLong(file.deadLetterTtlMs(), defaults.deadLetterTtlMs(), 1_000L),
                sanitizeLong(file.reconcileIntervalMs(), defaults.reconcileIntervalMs(), 1_000L)
        );
    }

    RuntimeSettings withEnvironment(Map<String, String> env) {
        String secret = sanitizeText(env.get(ENV_WEBHOOK_SECRET), webhookSecret);
        String token = sanitizeText(env.get(ENV_REMOTE_TOKEN), remoteAuthorityToken);
        return new RuntimeSettings(nodeId, remoteAuthorityUrl, token, remoteTimeoutMs, secret, signatureHeader,
                maxAttempts, baseBackoffMs, maxBackoffMs, jitterRatio, sessionLifetimeMs, syncFreshnessMs,
                propagationPoolSize, propagationQueueCapacity, processorPoolSize, courtesyDelayMs, courtesyJitterMs,
                queueTtlMs, deadLetterTtlMs, reconcileIntervalMs);
    }

    public RetryPolicy retryPolicy() {
        return new RetryPolicy(maxAttempts, baseBackoffMs, maxBackoffMs, jitterRatio);
    }

    public Map<String, Object> toView() {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("nodeId", nodeId);
        view.put("remoteAuthorityUrl", remoteAuthorityUrl);
        view.put("remoteAuthorityTokenConfigured", !remoteAuthorityToken.isBlank());
        view.put("remoteTimeoutMs", remoteTimeoutMs);
        view.put("webhookSecretConfigured", !webhookSecret.isBlank());
        view.put("signatureHeader", signatureHeader);
        view.put("maxAttempts", maxAttempts);
        view.put("baseBackoffMs", baseBackoffMs);
        view.put("maxBackoffMs", maxBackoffMs);
        view.put("jitterRatio", jitterRatio);
        view.put("sessionLifetimeMs", sessionLifetimeMs);
        view.put("syncFreshnessMs", syncFreshnessMs);
        view.put("propagationPoolSize", propagationPoolSize);
        view.put("propagationQueueCapacity", propagationQueueCapacity);
        view.put("processorPoolSize", processorPoolSize);
        view.put("courtesyDelayMs", courtesyDelayMs);
        view.put("courtesyJitterMs", courtesyJitterMs);
        view.put("queueTtlMs", queueTtlMs);
        view.put("deadLetterTtlMs", deadLetterTtlMs);
        view.put("reconcileIntervalMs", reconcileIntervalMs);
        return view;
    }

    static List<String> diffFields(RuntimeSettings before, RuntimeSettings after) {
        List<String> changed = new ArrayList<>();
        Map<String, Object> a = before.toView();
        Map<String, Object> b = after.toView();
        for (Map.Entry<String, Object> e : b.entrySet()) {
            if (!Objects.equals(a.get(e.getKey()), e.getValue())) {
                changed.add(e.getKey());
            }
        }
        if (!before.webhookSecret.equals(after.webhookSecret) && !changed.contains("webhookSecretConfigured")) {
            changed.add("webhookSecret");
        }
        if (!before.remoteAuthorityToken.equals(after.remoteAuthorityToken)
                && !changed.contains("remoteAuthorityTokenConfigured")) {
            changed.add("remoteAuthorityToken");
        }
        return changed;
    }

    private static int sanitizeInt(Integer value, int fallback, int min) {
        if (value == null) {
            return fallback;
        }
        return Math.max(min, value);
    }

    private static long sanitizeLong(Long value, long fallback, long min) {
        if (value == null) {
            return fallback;
        }
        return Math.max(min, value);
    }

    private static double sanitizeRatio(Double value, double fallback) {
        if (value == null || value.isNaN()) {
            return fallback;
        }
        return Math.max(0d, Math.min(RetryPolicy.MAX_JITTER_RATIO, value));
    }

    private static String sanitizeText(String value, String fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        return value.trim();
    }
}
