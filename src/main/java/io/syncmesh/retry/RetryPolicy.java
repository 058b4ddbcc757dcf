package io.syncmesh.retry;

public record RetryPolicy(int maxAttempts, long baseDelayMs, long maxDelayMs, double jitterRatio) {
    public static final double MAX_JITTER_RATIO = 0.1d;

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (baseDelayMs < 0 || maxDelayMs < 0) {
            throw new IllegalArgumentException("delays must be >= 0");
        }
        if (maxDelayMs < baseDelayMs) {
            maxDelayMs = baseDelayMs;
        }
        if (Double.isNaN(jitterRatio) || jitterRatio < 0) {
            jitterRatio = 0d;
        }
        jitterRatio = Math.min(MAX_JITTER_RATIO, jitterRatio);
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(3, 1_000L, 30_000L, MAX_JITTER_RATIO);
    }

    public RetryPolicy withoutJitter() {
        return new RetryPolicy(maxAttempts, baseDelayMs, maxDelayMs, 0d);
    }
}
