package io.syncmesh.deadletter;

import io.syncmesh.model.SyncOperation;
import io.syncmesh.observability.AuditLogger;
import io.syncmesh.observability.SyncMetrics;
import io.syncmesh.processor.OperationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Walks the dead-letter store and runs the recovery hook on each entry. Entries are only
 * ever put back into the active queue through {@link #replay(String, String)}.
 */
public final class DeadLetterReconciler implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(DeadLetterReconciler.class);

    private final DeadLetterStore deadLetters;
    private final RecoveryHook hook;
    private final OperationRepository operations;
    private final Consumer<SyncOperation> dispatcher;
    private final AuditLogger audit;
    private final SyncMetrics metrics;
    private final Clock clock;
    private ScheduledExecutorService scheduler;

    public DeadLetterReconciler(
            DeadLetterStore deadLetters,
            RecoveryHook hook,
            OperationRepository operations,
            Consumer<SyncOperation> dispatcher,
            AuditLogger audit,
            SyncMetrics metrics,
            Clock clock
    ) {
        this.deadLetters = deadLetters;
        this.hook = hook;
        this.operations = operations;
        this.dispatcher = dispatcher;
        this.audit = audit;
        this.metrics = metrics;
        this.clock = clock;
    }

    public ReconcileSummary reconcileOnce() {
        int scanned = 0;
        int recovered = 0;
        int retained = 0;
        for (DeadLetterEntry entry : deadLetters.list()) {
            scanned++;
            String failure;
            try {
                failure = hook.recover(entry) ? null : "recovery hook declined";
            } catch (Exception e) {
                failure = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            }
            if (failure == null) {
                deadLetters.remove(entry.key());
                recovered++;
                metrics.deadLettersRecovered.incrementAndGet();
                audit.log(AuditLogger.AuditEvent.of("deadletter.recovered", entry.key(), "ok", details(entry, null)));
                log.info("Dead-letter entry {} recovered", entry.key());
            } else {
                retained++;
                metrics.deadLettersRetained.incrementAndGet();
                audit.log(AuditLogger.AuditEvent.of("deadletter.retained", entry.key(), "failed", details(entry, failure)));
                log.warn("Dead-letter entry {} kept for the next pass: {}", entry.key(), failure);
            }
        }
        return new ReconcileSummary(scanned, recovered, retained);
    }

    public Optional<SyncOperation> replay(String dlqKey, String actor) {
        Optional<DeadLetterEntry> entry = deadLetters.get(dlqKey);
        if (entry.isEmpty()) {
            return Optional.empty();
        }
        SyncOperation replayed = entry.get().operation().replayed(clock.instant());
        operations.save(replayed);
        deadLetters.remove(dlqKey);
        deadLetters.clearDeadLettered(replayed.operationId());
        audit.log(AuditLogger.AuditEvent.ofActor("operation.replayed", actor, "operation:" + replayed.operationId(), "ok",
                details(entry.get(), null)));
        log.info("Replayed dead-letter entry {} as operation {}", dlqKey, replayed.operationId());
        dispatcher.accept(replayed);
        return Optional.of(replayed);
    }

    public synchronized void start(Duration interval) {
        if (scheduler != null) {
            return;
        }
        long periodMs = Math.max(1_000L, interval.toMillis());
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "syncmesh-dlq-reconciler");
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleWithFixedDelay(this::scheduledPass, periodMs, periodMs, TimeUnit.MILLISECONDS);
        log.info("Dead-letter reconciler scheduled every {} ms", periodMs);
    }

    @Override
    public synchronized void close() {
        if (scheduler != null) {
            scheduler.shutdownNow();
            scheduler = null;
        }
    }

    private void scheduledPass() {
        try {
            ReconcileSummary summary = reconcileOnce();
            if (summary.scanned() > 0) {
                log.info("Reconcile pass: scanned={} recovered={} retained={}",
                        summary.scanned(), summary.recovered(), summary.retained());
            }
        } catch (RuntimeException e) {
            log.error("Reconcile pass failed", e);
        }
    }

    private static Map<String, Object> details(DeadLetterEntry entry, String error) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("operation_id", entry.operation().operationId());
        details.put("associated_identity", entry.operation().associatedIdentity());
        details.put("retry_count", entry.operation().retryCount());
        if (error != null) {
            details.put("error", error);
        }
        return details;
    }

    public record ReconcileSummary(int scanned, int recovered, int retained) {
    }
}
