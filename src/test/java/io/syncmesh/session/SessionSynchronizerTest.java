package io.syncmesh.session;

import io.syncmesh.MutableClock;
import io.syncmesh.config.SyncMeshConfig;
import io.syncmesh.model.SessionContext;
import io.syncmesh.model.SessionUpdate;
import io.syncmesh.model.SyncStatus;
import io.syncmesh.model.VectorClock;
import io.syncmesh.observability.AuditLogger;
import io.syncmesh.observability.SyncMetrics;
import io.syncmesh.retry.Backoff;
import io.syncmesh.retry.RetryExecutor;
import io.syncmesh.retry.RetryPolicy;
import io.syncmesh.security.SessionCipher;
import io.syncmesh.storage.Database;
import io.syncmesh.storage.SqliteStateStore;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.RejectedExecutionException;
import java.util.stream.Stream;

final class SessionSynchronizerTest {

    @Test
    void createUpdateAndPropagateKeepsBothSidesInStep() throws Exception {
        Path root = Files.createTempDirectory("syncmesh-session-flow");
        try {
            Fixture f = new Fixture(root);

            SessionContext created = f.sync.createSession("PEO-001", 3, Set.of("read"));
            Assertions.assertEquals(SyncStatus.SYNCED, created.syncStatus());
            Assertions.assertEquals(Map.of("node-a", 1L), created.vectorClock().entries());
            Assertions.assertEquals(created.vectorClock(), f.remote.get(created.sessionId()).orElseThrow().vectorClock());

            SessionContext updated = f.sync.updateSession(created.sessionId(), SessionUpdate.permissions(Set.of("read", "write")));
            Assertions.assertEquals(SyncStatus.PENDING, updated.syncStatus());
            Assertions.assertEquals(2L, updated.vectorClock().get("node-a"));
            Assertions.assertEquals(1, f.executor.pending());

            f.executor.runAll();

            SessionContext remoteCopy = f.remote.get(created.sessionId()).orElseThrow();
            Assertions.assertEquals(Set.of("read", "write"), remoteCopy.permissions());
            SessionContext cached = f.repository.load(created.sessionId()).orElseThrow().session();
            Assertions.assertEquals(SyncStatus.SYNCED, cached.syncStatus());
            Assertions.assertEquals(updated.vectorClock(), cached.vectorClock());
            Assertions.assertEquals(1L, f.metrics.sessionsCreated.get());
            Assertions.assertEquals(1L, f.metrics.sessionsUpdated.get());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void failedCreateSurfacesAndLeavesNothingCached() throws Exception {
        Path root = Files.createTempDirectory("syncmesh-session-create-fail");
        try {
            Fixture f = new Fixture(root);
            f.remote.failNextPushes(Integer.MAX_VALUE);

            Assertions.assertThrows(PropagationException.class,
                    () -> f.sync.createSession("PEO-002", 1, Set.of()));

            Assertions.assertEquals(3, f.remote.pushes.get());
            Assertions.assertTrue(f.repository.sessionIds().isEmpty());
            Assertions.assertTrue(f.repository.indexedSessionFor("PEO-002").isEmpty());
            Assertions.assertEquals(1L, f.metrics.propagationFailures.get());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void exhaustedBackgroundPropagationMarksConflict() throws Exception {
        Path root = Files.createTempDirectory("syncmesh-session-conflict");
        try {
            Fixture f = new Fixture(root);
            SessionContext created = f.sync.createSession("PEO-003", 2, Set.of("read"));

            f.sync.updateSession(created.sessionId(), SessionUpdate.trustLevel(4));
            f.remote.failNextPushes(3);
            f.executor.runAll();

            SessionContext cached = f.repository.load(created.sessionId()).orElseThrow().session();
            Assertions.assertEquals(SyncStatus.CONFLICT, cached.syncStatus());
            Assertions.assertEquals(4, cached.trustLevel());
            Assertions.assertEquals(1L, f.metrics.sessionConflicts.get());
            Assertions.assertEquals(2, f.remote.get(created.sessionId()).orElseThrow().trustLevel());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void supersededPropagationIsSkippedAndNewestWriteWins() throws Exception {
        Path root = Files.createTempDirectory("syncmesh-session-newer");
        try {
            Fixture f = new Fixture(root);
            SessionContext created = f.sync.createSession("PEO-004", 1, Set.of());
            int pushesAfterCreate = f.remote.pushes.get();

            f.sync.updateSession(created.sessionId(), SessionUpdate.trustLevel(2));
            SessionContext second = f.sync.updateSession(created.sessionId(), SessionUpdate.trustLevel(3));
            Assertions.assertEquals(3L, second.vectorClock().get("node-a"));

            f.executor.runNext();
            Assertions.assertEquals(pushesAfterCreate, f.remote.pushes.get());
            SessionContext afterSkip = f.repository.load(created.sessionId()).orElseThrow().session();
            Assertions.assertEquals(SyncStatus.PENDING, afterSkip.syncStatus());
            Assertions.assertEquals(second.vectorClock(), afterSkip.vectorClock());
            Assertions.assertEquals(1, f.remote.get(created.sessionId()).orElseThrow().trustLevel());

            f.executor.runNext();
            SessionContext settled = f.repository.load(created.sessionId()).orElseThrow().session();
            Assertions.assertEquals(SyncStatus.SYNCED, settled.syncStatus());
            Assertions.assertEquals(pushesAfterCreate + 1, f.remote.pushes.get());
            Assertions.assertEquals(3, f.remote.get(created.sessionId()).orElseThrow().trustLevel());
            Assertions.assertEquals(0L, f.metrics.sessionConflicts.get());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void rejectedPropagationMarksConflict() throws Exception {
        Path root = Files.createTempDirectory("syncmesh-session-rejected");
        try {
            Fixture f = new Fixture(root, command -> {
                throw new RejectedExecutionException("full");
            });
            SessionContext created = f.sync.createSession("PEO-005", 1, Set.of());

            SessionContext updated = f.sync.updateSession(created.sessionId(), SessionUpdate.trustLevel(5));

            Assertions.assertEquals(SyncStatus.PENDING, updated.syncStatus());
            Assertions.assertEquals(SyncStatus.CONFLICT,
                    f.repository.load(created.sessionId()).orElseThrow().session().syncStatus());
            Assertions.assertEquals(1L, f.metrics.propagationFailures.get());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void syncPushesWhenRemoteHasNoCopy() throws Exception {
        Path root = Files.createTempDirectory("syncmesh-session-missing");
        try {
            Fixture f = new Fixture(root);
            SessionContext created = f.sync.createSession("PEO-006", 1, Set.of("read"));
            f.remote.clear(created.sessionId());

            SessionContext synced = f.sync.syncSession(created.sessionId()).orElseThrow();

            Assertions.assertEquals(SyncStatus.SYNCED, synced.syncStatus());
            Assertions.assertEquals(created.vectorClock(), f.remote.get(created.sessionId()).orElseThrow().vectorClock());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void syncAdoptsDominatingRemoteCopy() throws Exception {
        Path root = Files.createTempDirectory("syncmesh-session-remote-wins");
        try {
            Fixture f = new Fixture(root);
            SessionContext created = f.sync.createSession("PEO-007", 1, Set.of("read"));
            SessionContext newer = new SessionContext(created.sessionId(), "PEO-007", "node-b", created.createdAt(),
                    created.expiresAt(), 9, Set.of("admin"), VectorClock.of(Map.of("node-a", 1, "node-b", 3)),
                    SyncStatus.SYNCED);
            f.remote.put(newer);

            SessionContext synced = f.sync.syncSession(created.sessionId()).orElseThrow();

            Assertions.assertEquals(9, synced.trustLevel());
            Assertions.assertEquals(Set.of("admin"), synced.permissions());
            Assertions.assertEquals(newer.vectorClock(), synced.vectorClock());
            Assertions.assertEquals(newer.vectorClock(),
                    f.repository.load(created.sessionId()).orElseThrow().session().vectorClock());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void concurrentCopiesMergeWithoutPushing() throws Exception {
        Path root = Files.createTempDirectory("syncmesh-session-merge");
        try {
            Fixture f = new Fixture(root);
            SessionContext created = f.sync.createSession("PEO-008", 2, Set.of("read"));
            f.sync.updateSession(created.sessionId(), SessionUpdate.permissions(Set.of("read", "write")));
            f.remote.put(new SessionContext(created.sessionId(), "PEO-008", "node-b", created.createdAt(),
                    created.expiresAt(), 5, Set.of("admin"), VectorClock.of(Map.of("node-a", 1, "node-b", 1)),
                    SyncStatus.SYNCED));
            int pushesBefore = f.remote.pushes.get();

            SessionContext merged = f.sync.syncSession(created.sessionId()).orElseThrow();

            Assertions.assertEquals(Map.of("node-a", 2L, "node-b", 1L), merged.vectorClock().entries());
            Assertions.assertEquals(Set.of("read", "write", "admin"), merged.permissions());
            Assertions.assertEquals(5, merged.trustLevel());
            Assertions.assertEquals(SyncStatus.SYNCED, merged.syncStatus());
            Assertions.assertEquals(pushesBefore, f.remote.pushes.get());
            Assertions.assertEquals(1L, f.metrics.sessionMerges.get());

            // The queued propagation belongs to a clock that is no longer cached.
            f.executor.runAll();
            Assertions.assertEquals(merged.vectorClock(),
                    f.repository.load(created.sessionId()).orElseThrow().session().vectorClock());
            Assertions.assertEquals(pushesBefore, f.remote.pushes.get());
            SessionContext authority = f.remote.get(created.sessionId()).orElseThrow();
            Assertions.assertEquals(Map.of("node-a", 1L, "node-b", 1L), authority.vectorClock().entries());
            Assertions.assertEquals(Set.of("admin"), authority.permissions());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void unreachableRemoteDuringSyncReturnsLocalAsConflict() throws Exception {
        Path root = Files.createTempDirectory("syncmesh-session-offline");
        try {
            Fixture f = new Fixture(root);
            SessionContext created = f.sync.createSession("PEO-009", 1, Set.of("read"));
            f.remote.fetchDown(true);

            SessionContext result = f.sync.syncSession(created.sessionId()).orElseThrow();

            Assertions.assertEquals(SyncStatus.CONFLICT, result.syncStatus());
            Assertions.assertEquals(created.vectorClock(), result.vectorClock());
            Assertions.assertEquals(SyncStatus.CONFLICT,
                    f.repository.load(created.sessionId()).orElseThrow().session().syncStatus());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void getResyncsOnlyWhenStale() throws Exception {
        Path root = Files.createTempDirectory("syncmesh-session-stale");
        try {
            Fixture f = new Fixture(root);
            SessionContext created = f.sync.createSession("PEO-010", 1, Set.of());

            Assertions.assertTrue(f.sync.getSession(created.sessionId()).isPresent());
            Assertions.assertEquals(0, f.remote.fetches.get());

            f.clock.advance(Duration.ofMinutes(6));
            Assertions.assertTrue(f.sync.getSession(created.sessionId()).isPresent());
            Assertions.assertEquals(1, f.remote.fetches.get());

            Assertions.assertTrue(f.sync.getSession(created.sessionId()).isPresent());
            Assertions.assertEquals(1, f.remote.fetches.get());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void expiredSessionsAreDroppedOnRead() throws Exception {
        Path root = Files.createTempDirectory("syncmesh-session-expiry");
        try {
            Fixture f = new Fixture(root);
            SessionContext created = f.sync.createSession("PEO-011", 1, Set.of());

            f.clock.advance(Duration.ofHours(2));

            Assertions.assertTrue(f.sync.getSession(created.sessionId()).isEmpty());
            Assertions.assertTrue(f.repository.load(created.sessionId()).isEmpty());
            Assertions.assertTrue(f.repository.indexedSessionFor("PEO-011").isEmpty());
            Assertions.assertThrows(SessionNotFoundException.class,
                    () -> f.sync.updateSession(created.sessionId(), SessionUpdate.trustLevel(2)));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void purgeRemovesOnlyExpiredSessions() throws Exception {
        Path root = Files.createTempDirectory("syncmesh-session-purge");
        try {
            Fixture f = new Fixture(root);
            f.sync.createSession("PEO-012", 1, Set.of());
            f.clock.advance(Duration.ofMinutes(90));
            SessionContext fresh = f.sync.createSession("PEO-013", 1, Set.of());

            Assertions.assertEquals(1, f.sync.purgeExpiredSessions());
            Assertions.assertEquals(java.util.List.of(fresh.sessionId()), f.repository.sessionIds());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void newSessionForSameSubjectSupersedesTheOldOne() throws Exception {
        Path root = Files.createTempDirectory("syncmesh-session-supersede");
        try {
            Fixture f = new Fixture(root);
            SessionContext first = f.sync.createSession("PEO-014", 1, Set.of());
            SessionContext second = f.sync.createSession("PEO-014", 2, Set.of());

            Assertions.assertTrue(f.sync.getSession(first.sessionId()).isEmpty());
            Assertions.assertEquals(second.sessionId(), f.sync.getSession(second.sessionId()).orElseThrow().sessionId());
            Assertions.assertEquals(Optional.of(second.sessionId()), f.repository.indexedSessionFor("PEO-014"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void uncachedSessionIsFetchedAndCachedFromRemote() throws Exception {
        Path root = Files.createTempDirectory("syncmesh-session-fallback");
        try {
            Fixture f = new Fixture(root);
            Instant now = f.clock.instant();
            SessionContext foreign = new SessionContext("remote-1", "PEO-015", "node-b", now, now.plusSeconds(3600),
                    4, Set.of("read"), VectorClock.of("node-b", 4), SyncStatus.PENDING);
            f.remote.put(foreign);

            SessionContext adopted = f.sync.getSession("remote-1").orElseThrow();
            Assertions.assertEquals(SyncStatus.SYNCED, adopted.syncStatus());
            Assertions.assertEquals("node-b", adopted.ownerNodeId());
            Assertions.assertEquals(1, f.remote.fetches.get());

            Assertions.assertTrue(f.sync.getSession("remote-1").isPresent());
            Assertions.assertEquals(1, f.remote.fetches.get());

            f.remote.fetchDown(true);
            Assertions.assertTrue(f.sync.getSession("missing").isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    private static final class Fixture {
        final MutableClock clock = new MutableClock(Instant.parse("2026-10-19T09:00:00Z"));
        final InMemoryRemoteAuthority remote = new InMemoryRemoteAuthority();
        final ManualExecutor executor = new ManualExecutor();
        final SyncMetrics metrics = new SyncMetrics();
        final SessionRepository repository;
        final SessionSynchronizer sync;

        Fixture(Path root) {
            this(root, null);
        }

        Fixture(Path root, java.util.concurrent.Executor override) {
            SyncMeshConfig config = SyncMeshConfig.fromRoot(root.toString());
            Database database = new Database(config);
            database.init();
            repository = new SessionRepository(new SqliteStateStore(database, clock),
                    new SessionCipher(config.sessionKeyFile()));
            RetryExecutor retry = new RetryExecutor(new Backoff(RetryPolicy.defaults()), millis -> {
            });
            AuditLogger audit = new AuditLogger(config.auditRoot().resolve("audit.log"), "default", "node-a", "");
            sync = new SessionSynchronizer(repository, remote, retry, override == null ? executor : override,
                    audit, metrics, clock,
                    new SessionSynchronizer.Options("node-a", Duration.ofHours(1), Duration.ofMinutes(5)));
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            walk.sorted(Comparator.comparingInt(Path::getNameCount).reversed()).forEach(p -> {
                try {
                    Files.deleteIfExists(p);
                } catch (IOException ignored) {
                }
            });
        }
    }
}
