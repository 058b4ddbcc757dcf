package io.syncmesh.session;

import io.syncmesh.model.ClockOrder;
import io.syncmesh.model.SessionContext;
import io.syncmesh.model.SessionUpdate;
import io.syncmesh.model.SyncStatus;
import io.syncmesh.model.VectorClock;
import io.syncmesh.observability.AuditLogger;
import io.syncmesh.observability.SyncMetrics;
import io.syncmesh.remote.RemoteAuthorityClient;
import io.syncmesh.remote.RemoteAuthorityException;
import io.syncmesh.retry.RetryExecutor;
import io.syncmesh.retry.RetryExhaustedException;
import io.syncmesh.session.SessionRepository.StoredSession;
import io.syncmesh.session.SessionRepository.Versioned;
import io.syncmesh.util.KeyedLocks;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Owns the session lifecycle on one node: local cache, vector-clock bookkeeping and
 * reconciliation with the remote authority.
 *
 * <p>Writes to one session id are serialized through striped locks and committed with
 * compare-and-set, so concurrent callers on this node never lose a clock increment and a
 * second process sharing the data root cannot silently overwrite one either.
 */
public final class SessionSynchronizer {
    private static final Logger log = LoggerFactory.getLogger(SessionSynchronizer.class);
    private static final int MAX_CAS_ATTEMPTS = 5;

    private final SessionRepository repository;
    private final RemoteAuthorityClient remote;
    private final RetryExecutor retry;
    private final Executor propagationExecutor;
    private final AuditLogger audit;
    private final SyncMetrics metrics;
    private final Clock clock;
    private final Options options;
    private final KeyedLocks locks = new KeyedLocks(64);

    public SessionSynchronizer(
            SessionRepository repository,
            RemoteAuthorityClient remote,
            RetryExecutor retry,
            Executor propagationExecutor,
            AuditLogger audit,
            SyncMetrics metrics,
            Clock clock,
            Options options
    ) {
        this.repository = Objects.requireNonNull(repository, "repository");
        this.remote = Objects.requireNonNull(remote, "remote");
        this.retry = Objects.requireNonNull(retry, "retry");
        this.propagationExecutor = Objects.requireNonNull(propagationExecutor, "propagationExecutor");
        this.audit = Objects.requireNonNull(audit, "audit");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.options = Objects.requireNonNull(options, "options");
    }

    public String nodeId() {
        return options.nodeId();
    }

    public Optional<SessionContext> getSession(String sessionId) {
        Instant now = clock.instant();
        Optional<Versioned> cached = repository.load(sessionId);
        if (cached.isEmpty()) {
            return fetchAndCache(sessionId, now);
        }
        StoredSession stored = cached.get().value();
        SessionContext session = stored.session();
        if (session.expiredAt(now)) {
            discard(session);
            return Optional.empty();
        }
        if (superseded(session)) {
            repository.delete(sessionId);
            return Optional.empty();
        }
        if (isStale(stored, now)) {
            return Optional.of(syncSession(session));
        }
        return Optional.of(session);
    }

    public SessionContext createSession(String subjectId, int trustLevel, Set<String> permissions)
            throws PropagationException {
        if (subjectId == null || subjectId.isBlank()) {
            throw new IllegalArgumentException("subject_id is required");
        }
        Instant now = clock.instant();
        String sessionId = UUID.randomUUID().toString();
        SessionContext session = new SessionContext(
                sessionId,
                subjectId.trim(),
                options.nodeId(),
                now,
                now.plus(options.sessionLifetime()),
                trustLevel,
                permissions,
                VectorClock.of(options.nodeId(), 1L),
                SyncStatus.SYNCED
        );
        repository.save(new StoredSession(session, 0L), now);
        try {
            push(session);
        } catch (RetryExhaustedException e) {
            repository.delete(sessionId);
            metrics.propagationFailures.incrementAndGet();
            audit("session.create", sessionId, "propagation_failed", details(session, e.getMessage()));
            log.error("Session {} for subject {} was not created: {}", sessionId, session.subjectId(), e.getMessage());
            throw new PropagationException("Failed to propagate new session " + sessionId, e);
        }
        Instant confirmed = clock.instant();
        repository.save(new StoredSession(session, confirmed.toEpochMilli()), confirmed);
        Optional<String> previous = repository.indexedSessionFor(session.subjectId());
        repository.indexSubject(session.subjectId(), sessionId);
        if (previous.isPresent() && !previous.get().equals(sessionId)) {
            repository.delete(previous.get());
            log.info("Session {} superseded by {} for subject {}", previous.get(), sessionId, session.subjectId());
        }
        metrics.sessionsCreated.incrementAndGet();
        audit("session.create", sessionId, "ok", details(session, null));
        log.info("Created session {} for subject {}", sessionId, session.subjectId());
        return session;
    }

    public SessionContext updateSession(String sessionId, SessionUpdate update) {
        SessionContext next = locks.withLock(sessionId, () -> applyUpdate(sessionId, update));
        metrics.sessionsUpdated.incrementAndGet();
        submitPropagation(next);
        return next;
    }

    public SessionContext syncSession(SessionContext local) {
        metrics.sessionSyncs.incrementAndGet();
        String sessionId = local.sessionId();
        try {
            Optional<SessionContext> remoteCopy = remote.fetch(sessionId);
            if (remoteCopy.isEmpty()) {
                push(local);
                return commitSync(local, local.withSyncStatus(SyncStatus.SYNCED), "remote_missing");
            }
            SessionContext theirs = remoteCopy.get();
            ClockOrder order = local.vectorClock().compare(theirs.vectorClock());
            if (order == ClockOrder.AFTER) {
                push(local);
                return commitSync(local, local.withSyncStatus(SyncStatus.SYNCED), "local_dominates");
            }
            if (order == ClockOrder.BEFORE) {
                return commitSync(local, theirs.withSyncStatus(SyncStatus.SYNCED), "remote_dominates");
            }
            SessionContext merged = local.mergeWith(theirs).withSyncStatus(SyncStatus.SYNCED);
            metrics.sessionMerges.incrementAndGet();
            return commitSync(local, merged, order == ClockOrder.CONCURRENT ? "merged" : "merged_equal");
        } catch (RemoteAuthorityException | RetryExhaustedException e) {
            log.warn("Sync of session {} failed: {}", sessionId, e.getMessage());
            markConflict(local, e.getMessage());
            return local.withSyncStatus(SyncStatus.CONFLICT);
        }
    }

    public Optional<SessionContext> syncSession(String sessionId) {
        return repository.load(sessionId).map(cached -> syncSession(cached.session()));
    }

    public int purgeExpiredSessions() {
        Instant now = clock.instant();
        int removed = 0;
        for (String sessionId : repository.sessionIds()) {
            Optional<Versioned> cached;
            try {
                cached = repository.load(sessionId);
            } catch (IllegalStateException e) {
                log.warn("Skipping unreadable session {}: {}", sessionId, e.getMessage());
                continue;
            }
            if (cached.isPresent() && cached.get().session().expiredAt(now)) {
                discard(cached.get().session());
                removed++;
            }
        }
        if (removed > 0) {
            log.info("Purged {} expired session(s)", removed);
        }
        return removed;
    }

    private Optional<SessionContext> fetchAndCache(String sessionId, Instant now) {
        Optional<SessionContext> fetched;
        try {
            fetched = remote.fetch(sessionId);
        } catch (RemoteAuthorityException e) {
            log.warn("Session {} is not cached and the remote authority is unreachable: {}", sessionId, e.getMessage());
            return Optional.empty();
        }
        if (fetched.isEmpty() || fetched.get().expiredAt(now)) {
            return Optional.empty();
        }
        SessionContext adopted = fetched.get().withSyncStatus(SyncStatus.SYNCED);
        if (adopted.subjectId() != null && !adopted.subjectId().isBlank()) {
            repository.indexSubjectIfAbsent(adopted.subjectId(), sessionId);
        }
        if (superseded(adopted)) {
            return Optional.empty();
        }
        if (!repository.insert(new StoredSession(adopted, now.toEpochMilli()), now)) {
            return repository.load(sessionId).map(Versioned::session);
        }
        return Optional.of(adopted);
    }

    private SessionContext applyUpdate(String sessionId, SessionUpdate update) {
        for (int attempt = 0; attempt < MAX_CAS_ATTEMPTS; attempt++) {
            Instant now = clock.instant();
            Versioned current = repository.load(sessionId)
                    .orElseThrow(() -> new SessionNotFoundException(sessionId));
            SessionContext base = current.session();
            if (base.expiredAt(now)) {
                throw new SessionNotFoundException(sessionId);
            }
            SessionContext next = base.apply(update)
                    .withVectorClock(base.vectorClock().increment(options.nodeId()))
                    .withSyncStatus(SyncStatus.PENDING);
            if (repository.replace(current, current.value().withSession(next), now)) {
                return next;
            }
            log.debug("Session {} changed during update, retrying (attempt {})", sessionId, attempt + 1);
        }
        throw new IllegalStateException("Session " + sessionId + " kept changing during update; gave up after "
                + MAX_CAS_ATTEMPTS + " attempts");
    }

    private void submitPropagation(SessionContext session) {
        try {
            propagationExecutor.execute(() -> propagateInBackground(session));
        } catch (RejectedExecutionException e) {
            metrics.propagationFailures.incrementAndGet();
            markConflict(session, "propagation queue is full");
        }
    }

    // The push runs under the session lock, so a sync cannot commit a merge between the check and the write.
    private void propagateInBackground(SessionContext session) {
        String sessionId = session.sessionId();
        Optional<String> failure = locks.withLock(sessionId, () -> {
            Optional<Versioned> current = repository.load(sessionId);
            if (current.isEmpty()) {
                return Optional.empty();
            }
            SessionContext stored = current.get().session();
            if (!stored.vectorClock().equals(session.vectorClock()) || stored.syncStatus() == SyncStatus.SYNCED) {
                log.debug("Skipping propagation of session {} at {}; cached copy is now {}",
                        sessionId, session.vectorClock(), stored.vectorClock());
                return Optional.empty();
            }
            try {
                push(session);
            } catch (RetryExhaustedException e) {
                return Optional.of(e.getMessage() == null ? "remote write failed" : e.getMessage());
            }
            Instant now = clock.instant();
            repository.replace(current.get(),
                    current.get().value().syncedAt(stored.withSyncStatus(SyncStatus.SYNCED), now), now);
            return Optional.empty();
        });
        if (failure.isPresent()) {
            metrics.propagationFailures.incrementAndGet();
            markConflict(session, failure.get());
        }
    }

    private void markConflict(SessionContext failed, String reason) {
        String sessionId = failed.sessionId();
        boolean marked = locks.withLock(sessionId, () -> {
            Optional<Versioned> current = repository.load(sessionId);
            if (current.isEmpty()) {
                return false;
            }
            SessionContext stored = current.get().session();
            if (!stored.vectorClock().equals(failed.vectorClock())) {
                return false;
            }
            if (stored.syncStatus() == SyncStatus.CONFLICT) {
                return true;
            }
            return repository.replace(current.get(),
                    current.get().value().withSession(stored.withSyncStatus(SyncStatus.CONFLICT)), clock.instant());
        });
        if (!marked) {
            log.info("Session {} moved on after a failed remote write ({}); newer state kept", sessionId, reason);
            return;
        }
        metrics.sessionConflicts.incrementAndGet();
        audit("session.conflict", sessionId, "conflict", details(failed, reason));
        log.warn("Session {} marked conflict: {}", sessionId, reason);
    }

    private SessionContext commitSync(SessionContext base, SessionContext result, String outcome) {
        String sessionId = base.sessionId();
        SessionContext committed = locks.withLock(sessionId, () -> {
            Instant now = clock.instant();
            Optional<Versioned> current = repository.load(sessionId);
            if (current.isEmpty()) {
                repository.insert(new StoredSession(result, now.toEpochMilli()), now);
                return result;
            }
            SessionContext stored = current.get().session();
            if (!stored.vectorClock().equals(base.vectorClock())) {
                log.debug("Session {} was written during sync; keeping the newer local copy", sessionId);
                return stored;
            }
            if (repository.replace(current.get(), current.get().value().syncedAt(result, now), now)) {
                return result;
            }
            return repository.load(sessionId).map(Versioned::session).orElse(result);
        });
        Map<String, Object> details = details(committed, null);
        details.put("outcome", outcome);
        audit("session.sync", sessionId, "ok", details);
        log.debug("Session {} synced ({}), clock={}", sessionId, outcome, committed.vectorClock());
        return committed;
    }

    private void push(SessionContext session) throws RetryExhaustedException {
        retry.run("push session " + session.sessionId(), () -> remote.push(session));
    }

    private boolean isStale(StoredSession stored, Instant now) {
        if (stored.session().syncStatus() == SyncStatus.PENDING || stored.lastSyncedAtMs() <= 0L) {
            return true;
        }
        return now.toEpochMilli() - stored.lastSyncedAtMs() > options.syncFreshness().toMillis();
    }

    private boolean superseded(SessionContext session) {
        Optional<String> indexed = repository.indexedSessionFor(session.subjectId());
        return indexed.isPresent() && !indexed.get().equals(session.sessionId());
    }

    private void discard(SessionContext session) {
        repository.delete(session.sessionId());
        if (session.subjectId() != null && !session.subjectId().isBlank()) {
            repository.unindexSubject(session.subjectId(), session.sessionId());
        }
    }

    private Map<String, Object> details(SessionContext session, String error) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("subject_id", session.subjectId());
        details.put("vector_clock", session.vectorClock().entries());
        details.put("trust_level", session.trustLevel());
        if (error != null) {
            details.put("error", error);
        }
        return details;
    }

    private void audit(String action, String sessionId, String result, Map<String, Object> details) {
        audit.log(AuditLogger.AuditEvent.of(action, "session:" + sessionId, result, details));
    }

    public record Options(String nodeId, Duration sessionLifetime, Duration syncFreshness) {
        public Options {
            if (nodeId == null || nodeId.isBlank()) {
                throw new IllegalArgumentException("nodeId is required");
            }
            nodeId = nodeId.trim();
            sessionLifetime = sessionLifetime == null ? Duration.ofHours(24) : sessionLifetime;
            syncFreshness = syncFreshness == null ? Duration.ofMinutes(5) : syncFreshness;
        }
    }
}
