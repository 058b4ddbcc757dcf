package io.syncmesh.retry;

public final class RetryExhaustedException extends Exception {
    private final int attempts;

    public RetryExhaustedException(String operation, int attempts, Throwable lastError) {
        super("Retries exhausted for " + operation + " after " + attempts + " attempt(s): "
                + (lastError == null ? "unknown error" : lastError.getMessage()), lastError);
        this.attempts = attempts;
    }

    public int attempts() {
        return attempts;
    }
}
