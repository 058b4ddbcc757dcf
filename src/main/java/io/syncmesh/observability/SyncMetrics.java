package io.syncmesh.observability;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

public final class SyncMetrics {
    public final AtomicLong sessionsCreated = new AtomicLong();
    public final AtomicLong sessionsUpdated = new AtomicLong();
    public final AtomicLong sessionSyncs = new AtomicLong();
    public final AtomicLong sessionMerges = new AtomicLong();
    public final AtomicLong sessionConflicts = new AtomicLong();
    public final AtomicLong propagationFailures = new AtomicLong();
    public final AtomicLong webhooksAccepted = new AtomicLong();
    public final AtomicLong webhooksDuplicate = new AtomicLong();
    public final AtomicLong webhooksRejectedSignature = new AtomicLong();
    public final AtomicLong webhooksRejectedSchema = new AtomicLong();
    public final AtomicLong webhooksDropped = new AtomicLong();
    public final AtomicLong operationsCompleted = new AtomicLong();
    public final AtomicLong operationsRetried = new AtomicLong();
    public final AtomicLong operationsDeadLettered = new AtomicLong();
    public final AtomicLong deadLettersRecovered = new AtomicLong();
    public final AtomicLong deadLettersRetained = new AtomicLong();

    public Map<String, Long> snapshot() {
        Map<String, Long> out = new LinkedHashMap<>();
        out.put("sessions_created", sessionsCreated.get());
        out.put("sessions_updated", sessionsUpdated.get());
        out.put("session_syncs", sessionSyncs.get());
        out.put("session_merges", sessionMerges.get());
        out.put("session_conflicts", sessionConflicts.get());
        out.put("propagation_failures", propagationFailures.get());
        out.put("webhooks_accepted", webhooksAccepted.get());
        out.put("webhooks_duplicate", webhooksDuplicate.get());
        out.put("webhooks_rejected_signature", webhooksRejectedSignature.get());
        out.put("webhooks_rejected_schema", webhooksRejectedSchema.get());
        out.put("webhooks_dropped", webhooksDropped.get());
        out.put("operations_completed", operationsCompleted.get());
        out.put("operations_retried", operationsRetried.get());
        out.put("operations_dead_lettered", operationsDeadLettered.get());
        out.put("dead_letters_recovered", deadLettersRecovered.get());
        out.put("dead_letters_retained", deadLettersRetained.get());
        return out;
    }
}
