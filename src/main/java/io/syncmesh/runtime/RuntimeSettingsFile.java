package io.syncmesh.runtime;

record RuntimeSettingsFile(
        String nodeId,
        String remoteAuthorityUrl,
        String remoteAuthorityToken,
        Long remoteTimeoutMs,
        String webhookSecret,
        String signatureHeader,
        Integer maxAttempts,
        Long baseBackoffMs,
        Long maxBackoffMs,
        Double jitterRatio,
        Long sessionLifetimeMs,
        Long syncFreshnessMs,
        Integer propagationPoolSize,
        Integer propagationQueueCapacity,
        Integer processorPoolSize,
        Long courtesyDelayMs,
        Long courtesyJitterMs,
        Long queueTtlMs,
        Long deadLetterTtlMs,
        Long reconcileIntervalMs
) {
}
