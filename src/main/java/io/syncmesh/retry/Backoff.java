package io.syncmesh.retry;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential delay schedule: {@code min(base * 2^attempt, max)} plus up to
 * {@code jitterRatio} of that value as random extra delay.
 */
public final class Backoff {
    private final RetryPolicy policy;
    private final DoubleSupplier random;

    public Backoff(RetryPolicy policy) {
        this(policy, () -> ThreadLocalRandom.current().nextDouble());
    }

    public Backoff(RetryPolicy policy, DoubleSupplier random) {
        this.policy = policy;
        this.random = random;
    }

    public RetryPolicy policy() {
        return policy;
    }

    public long baseDelay(int attempt) {
        long base = policy.baseDelayMs();
        long max = policy.maxDelayMs();
        if (base <= 0) {
            return 0L;
        }
        int exp = Math.max(0, attempt);
        // 2^62 already exceeds any sane cap; avoid shifting into the sign bit.
        if (exp >= 62 || base > (max >> Math.min(exp, 62))) {
            return max;
        }
        return Math.min(base << exp, max);
    }

    public long delay(int attempt) {
        long computed = baseDelay(attempt);
        double sample = random.getAsDouble();
        if (Double.isNaN(sample) || sample < 0) {
            sample = 0d;
        }
        long jitter = (long) Math.floor(computed * policy.jitterRatio() * Math.min(1d, sample));
        return computed + Math.max(0L, jitter);
    }
}
