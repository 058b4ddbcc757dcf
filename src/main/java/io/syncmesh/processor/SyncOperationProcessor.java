package io.syncmesh.processor;

import io.syncmesh.deadletter.DeadLetterStore;
import io.syncmesh.model.OperationStatus;
import io.syncmesh.model.SyncOperation;
import io.syncmesh.observability.AuditLogger;
import io.syncmesh.observability.SyncMetrics;
import io.syncmesh.retry.Backoff;
import io.syncmesh.retry.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

/**
 * Drives queued operations through {@code pending -> processing -> completed | pending | dlq}.
 *
 * <p>Each attempt re-reads the stored record first, so a record that reached a terminal state
 * is never processed again. Retry accounting uses the shared {@link Backoff} policy: after a
 * failure {@code retry_count} is incremented and the operation is rescheduled while it is below
 * {@code maxAttempts}; otherwise it moves to the dead-letter store.
 */
public final class SyncOperationProcessor {
    private static final Logger log = LoggerFactory.getLogger(SyncOperationProcessor.class);

    private final OperationRepository operations;
    private final DeadLetterStore deadLetters;
    private final HandlerRegistry handlers;
    private final Backoff backoff;
    private final ScheduledExecutorService scheduler;
    private final Sleeper sleeper;
    private final AuditLogger audit;
    private final SyncMetrics metrics;
    private final Clock clock;
    private final Options options;
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();
    private final Set<String> scheduled = ConcurrentHashMap.newKeySet();

    public SyncOperationProcessor(
            OperationRepository operations,
            DeadLetterStore deadLetters,
            HandlerRegistry handlers,
            Backoff backoff,
            ScheduledExecutorService scheduler,
            Sleeper sleeper,
            AuditLogger audit,
            SyncMetrics metrics,
            Clock clock,
            Options options
    ) {
        this.operations = operations;
        this.deadLetters = deadLetters;
        this.handlers = handlers;
        this.backoff = backoff;
        this.scheduler = scheduler;
        this.sleeper = sleeper;
        this.audit = audit;
        this.metrics = metrics;
        this.clock = clock;
        this.options = options;
    }

    public void submit(SyncOperation operation) {
        String operationId = operation.operationId();
        try {
            scheduler.execute(() -> runAttempt(operationId));
        } catch (RejectedExecutionException e) {
            log.warn("Processor is not accepting work; operation {} stays queued", operationId);
            markFailed(operationId, "processor rejected submission");
        }
    }

    public AttemptOutcome attempt(String operationId) {
        if (!inFlight.add(operationId)) {
            return AttemptOutcome.SKIPPED;
        }
        try {
            return doAttempt(operationId);
        } finally {
            inFlight.remove(operationId);
        }
    }

    public int recoverStalled() {
        Instant now = clock.instant();
        int dispatched = 0;
        for (SyncOperation operation : operations.listAll()) {
            String id = operation.operationId();
            if (inFlight.contains(id) || scheduled.contains(id)) {
                continue;
            }
            boolean stalled = operation.status() == OperationStatus.PROCESSING
                    && operation.updatedAt() != null
                    && operation.updatedAt().plus(options.stallAfter()).isBefore(now);
            if (operation.status() == OperationStatus.PENDING
                    || operation.status() == OperationStatus.FAILED
                    || stalled) {
                submit(operation);
                dispatched++;
            }
        }
        if (dispatched > 0) {
            log.info("Re-dispatched {} queued operation(s)", dispatched);
        }
        return dispatched;
    }

    public int maxAttempts() {
        return backoff.policy().maxAttempts();
    }

    private void runAttempt(String operationId) {
        scheduled.remove(operationId);
        try {
            attempt(operationId);
        } catch (RuntimeException e) {
            log.error("Attempt for operation {} failed unexpectedly", operationId, e);
        }
    }

    private AttemptOutcome doAttempt(String operationId) {
        Optional<SyncOperation> stored = operations.find(operationId);
        if (stored.isEmpty() || stored.get().status().terminal()) {
            return AttemptOutcome.SKIPPED;
        }
        SyncOperation processing = stored.get().withStatus(OperationStatus.PROCESSING, clock.instant());
        operations.save(processing);
        try {
            courtesyPause();
            SyncHandler handler = handlers.find(processing.syncType())
                    .orElseThrow(() -> new IllegalStateException("no handler registered for " + processing.syncType().wire()));
            handler.handle(processing);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return onFailure(processing, e);
        } catch (Exception e) {
            return onFailure(processing, e);
        }
        operations.save(processing.withStatus(OperationStatus.COMPLETED, clock.instant()));
        metrics.operationsCompleted.incrementAndGet();
        audit.log(AuditLogger.AuditEvent.of("operation.completed", "operation:" + operationId, "ok",
                details(processing, null)));
        log.debug("Operation {} completed after {} retr(y/ies)", operationId, processing.retryCount());
        return AttemptOutcome.COMPLETED;
    }

    private AttemptOutcome onFailure(SyncOperation processing, Exception error) {
        Instant now = clock.instant();
        String message = error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
        SyncOperation failed = processing.failedAttempt(message, now);
        if (failed.retryCount() < maxAttempts()) {
            SyncOperation pending = failed.withStatus(OperationStatus.PENDING, now);
            operations.save(pending);
            long delayMs = backoff.delay(failed.retryCount());
            metrics.operationsRetried.incrementAndGet();
            log.warn("Operation {} failed (attempt {}/{}), retrying in {} ms: {}",
                    failed.operationId(), failed.retryCount(), maxAttempts(), delayMs, message);
            if (scheduleRetry(failed.operationId(), delayMs)) {
                return AttemptOutcome.RETRY_SCHEDULED;
            }
            operations.save(failed.withStatus(OperationStatus.FAILED, now));
            return AttemptOutcome.FAILED;
        }
        deadLetter(failed.withStatus(OperationStatus.DLQ, now));
        return AttemptOutcome.DEAD_LETTERED;
    }

    private boolean scheduleRetry(String operationId, long delayMs) {
        if (scheduler.isShutdown()) {
            log.warn("Processor is shut down; operation {} left for recovery", operationId);
            return false;
        }
        scheduled.add(operationId);
        try {
            scheduler.schedule(() -> runAttempt(operationId), delayMs, TimeUnit.MILLISECONDS);
            return true;
        } catch (RejectedExecutionException e) {
            scheduled.remove(operationId);
            log.warn("Retry for operation {} could not be scheduled: {}", operationId, e.getMessage());
            return false;
        }
    }

    private void deadLetter(SyncOperation operation) {
        String key = deadLetters.add(operation, clock.instant());
        operations.delete(operation.operationId());
        metrics.operationsDeadLettered.incrementAndGet();
        Map<String, Object> details = details(operation, operation.errorDetail());
        details.put("dlq_key", key);
        audit.log(AuditLogger.AuditEvent.of("operation.dead_lettered", "operation:" + operation.operationId(),
                "dlq", details));
        log.error("Operation moved to dead-letter store: operation_id={} associated_identity={} retry_count={} error={}",
                operation.operationId(), operation.associatedIdentity(), operation.retryCount(), operation.errorDetail());
    }

    private void markFailed(String operationId, String reason) {
        operations.find(operationId)
                .filter(op -> !op.status().terminal())
                .ifPresent(op -> operations.save(op.withStatus(OperationStatus.FAILED, clock.instant()).withErrorDetail(reason)));
    }

    private void courtesyPause() throws InterruptedException {
        long jitter = options.courtesyJitterMs() <= 0
                ? 0L
                : ThreadLocalRandom.current().nextLong(options.courtesyJitterMs() + 1);
        long waitMs = Math.max(0L, options.courtesyDelayMs()) + jitter;
        if (waitMs > 0) {
            sleeper.sleep(waitMs);
        }
    }

    private static Map<String, Object> details(SyncOperation operation, String error) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("sync_type", operation.syncType().wire());
        details.put("target_resource_id", operation.targetResourceId());
        details.put("associated_identity", operation.associatedIdentity());
        details.put("retry_count", operation.retryCount());
        if (error != null) {
            details.put("error", error);
        }
        return details;
    }

    public record Options(long courtesyDelayMs, long courtesyJitterMs, Duration stallAfter) {
        public Options {
            stallAfter = stallAfter == null ? Duration.ofMinutes(10) : stallAfter;
        }
    }
}
