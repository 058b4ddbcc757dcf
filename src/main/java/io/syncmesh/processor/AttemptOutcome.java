package io.syncmesh.processor;

public enum AttemptOutcome {
    COMPLETED,
    RETRY_SCHEDULED,
    DEAD_LETTERED,
    FAILED,
    SKIPPED
}
