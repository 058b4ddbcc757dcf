package io.syncmesh.retry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;

public final class RetryExecutor {
    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

    private final Backoff backoff;
    private final Sleeper sleeper;

    public RetryExecutor(Backoff backoff) {
        this(backoff, Sleeper.SYSTEM);
    }

    public RetryExecutor(Backoff backoff, Sleeper sleeper) {
        this.backoff = backoff;
        this.sleeper = sleeper;
    }

    public RetryPolicy policy() {
        return backoff.policy();
    }

    public Backoff backoff() {
        return backoff;
    }

    public <T> T execute(String operation, Callable<T> action) throws RetryExhaustedException {
        int maxAttempts = backoff.policy().maxAttempts();
        Exception lastError = null;
        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            try {
                return action.call();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new RetryExhaustedException(operation, attempt + 1, e);
            } catch (Exception e) {
                lastError = e;
                if (attempt + 1 >= maxAttempts) {
                    break;
                }
                long waitMs = backoff.delay(attempt);
                log.debug("{} failed on attempt {}/{}, retrying in {} ms: {}",
                        operation, attempt + 1, maxAttempts, waitMs, e.getMessage());
                try {
                    sleeper.sleep(waitMs);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new RetryExhaustedException(operation, attempt + 1, e);
                }
            }
        }
        throw new RetryExhaustedException(operation, maxAttempts, lastError);
    }

    public void run(String operation, CheckedRunnable action) throws RetryExhaustedException {
        execute(operation, () -> {
            action.run();
            return null;
        });
    }

    @FunctionalInterface
    public interface CheckedRunnable {
        void run() throws Exception;
    }
}
