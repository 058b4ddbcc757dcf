package io.syncmesh.runtime;

import io.syncmesh.config.SyncMeshConfig;
import io.syncmesh.deadletter.AlertFileRecoveryHook;
import io.syncmesh.deadletter.DeadLetterReconciler;
import io.syncmesh.deadletter.DeadLetterStore;
import io.syncmesh.model.SessionContext;
import io.syncmesh.observability.AuditLogger;
import io.syncmesh.observability.PrometheusFormatter;
import io.syncmesh.observability.SyncMetrics;
import io.syncmesh.processor.EventPayloadSource;
import io.syncmesh.processor.HandlerRegistry;
import io.syncmesh.processor.OperationRepository;
import io.syncmesh.processor.StateStoreCanonicalStore;
import io.syncmesh.processor.SyncOperationProcessor;
import io.syncmesh.remote.HttpRemoteAuthorityClient;
import io.syncmesh.remote.RemoteAuthorityClient;
import io.syncmesh.remote.RemoteAuthorityException;
import io.syncmesh.retry.Backoff;
import io.syncmesh.retry.RetryExecutor;
import io.syncmesh.retry.Sleeper;
import io.syncmesh.security.SessionCipher;
import io.syncmesh.session.SessionRepository;
import io.syncmesh.session.SessionSynchronizer;
import io.syncmesh.storage.Database;
import io.syncmesh.storage.SqliteStateStore;
import io.syncmesh.storage.StateStore;
import io.syncmesh.util.Jsons;
import io.syncmesh.webhook.SignatureVerifier;
import io.syncmesh.webhook.StoredIdentityResolver;
import io.syncmesh.webhook.WebhookGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

public final class SyncMeshRuntime implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SyncMeshRuntime.class);

    private final SyncMeshConfig config;
    private final Map<String, String> environment;
    private final Clock clock;
    private final Database database;
    private final StateStore store;
    private final SessionCipher cipher;
    private final AuditLogger audit;
    private final SyncMetrics metrics = new SyncMetrics();
    private final ThreadPoolExecutor propagationExecutor;
    private final ScheduledThreadPoolExecutor processorExecutor;
    private final OperationRepository operations;
    private final DeadLetterStore deadLetters;
    private final StoredIdentityResolver identities;
    private final SessionSynchronizer sessions;
    private final SyncOperationProcessor processor;
    private final DeadLetterReconciler reconciler;
    private volatile RuntimeSettings settings;
    private volatile long settingsFileMtimeMs;
    private volatile WebhookGateway gateway;

    public SyncMeshRuntime(SyncMeshConfig config) {
        this(config, null, System.getenv(), Clock.systemUTC());
    }

    public SyncMeshRuntime(SyncMeshConfig config, RemoteAuthorityClient remoteOverride,
                           Map<String, String> environment, Clock clock) {
        this.config = config;
        this.environment = environment == null ? Map.of() : Map.copyOf(environment);
        this.clock = clock;
        this.database = new Database(config);
        this.database.init();
        this.settingsFileMtimeMs = fileMtimeMs(config.settingsFile());
        this.settings = readSettings(config.settingsFile(), this.environment);
        RuntimeSettings s = this.settings;

        this.store = new SqliteStateStore(database, clock);
        this.cipher = new SessionCipher(config.sessionKeyFile());
        this.audit = new AuditLogger(
                config.auditRoot().resolve("audit.log"),
                config.namespace(),
                s.nodeId(),
                AuditLogger.loadOrCreateSigningSecret(config.auditSigningKeyFile())
        );

        this.propagationExecutor = new ThreadPoolExecutor(
                s.propagationPoolSize(),
                s.propagationPoolSize(),
                60L,
                TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(s.propagationQueueCapacity()),
                daemonThreads("syncmesh-propagation"),
                new ThreadPoolExecutor.AbortPolicy()
        );
        this.processorExecutor = new ScheduledThreadPoolExecutor(s.processorPoolSize(), daemonThreads("syncmesh-processor"));
        this.processorExecutor.setRemoveOnCancelPolicy(true);
        // Delayed retries stay pending in the store and are re-dispatched by recoverStalled().
        this.processorExecutor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);

        Backoff backoff = new Backoff(s.retryPolicy());
        RemoteAuthorityClient remote = remoteOverride != null ? remoteOverride : remoteClient(s);
        this.sessions = new SessionSynchronizer(
                new SessionRepository(store, cipher),
                remote,
                new RetryExecutor(backoff),
                propagationExecutor,
                audit,
                metrics,
                clock,
                new SessionSynchronizer.Options(
                        s.nodeId(),
                        Duration.ofMillis(s.sessionLifetimeMs()),
                        Duration.ofMillis(s.syncFreshnessMs())
                )
        );

        this.operations = new OperationRepository(store, Duration.ofMillis(s.queueTtlMs()));
        this.deadLetters = new DeadLetterStore(store, Duration.ofMillis(s.deadLetterTtlMs()));
        this.identities = new StoredIdentityResolver(store);
        this.processor = new SyncOperationProcessor(
                operations,
                deadLetters,
                HandlerRegistry.defaults(new EventPayloadSource(), new StateStoreCanonicalStore(store)),
                backoff,
                processorExecutor,
                Sleeper.SYSTEM,
                audit,
                metrics,
                clock,
                new SyncOperationProcessor.Options(
                        s.courtesyDelayMs(),
                        s.courtesyJitterMs(),
                        Duration.ofMillis(SyncMeshConfig.DEFAULT_STALL_AFTER_MS)
                )
        );
        this.reconciler = new DeadLetterReconciler(
                deadLetters,
                new AlertFileRecoveryHook(config.alertsRoot(), clock),
                operations,
                processor::submit,
                audit,
                metrics,
                clock
        );
        this.gateway = buildGateway(s);
        audit.log(AuditLogger.AuditEvent.of("runtime.start", "runtime/" + config.namespace(), "ok",
                Map.of("settings", s.toView())));
    }

    public SyncMeshConfig config() {
        return config;
    }

    public RuntimeSettings settings() {
        return settings;
    }

    public StateStore store() {
        return store;
    }

    public SessionSynchronizer sessions() {
        return sessions;
    }

    public WebhookGateway gateway() {
        return gateway;
    }

    public SyncOperationProcessor processor() {
        return processor;
    }

    public DeadLetterReconciler reconciler() {
        return reconciler;
    }

    public DeadLetterStore deadLetters() {
        return deadLetters;
    }

    public OperationRepository operations() {
        return operations;
    }

    public StoredIdentityResolver identities() {
        return identities;
    }

    public SessionCipher cipher() {
        return cipher;
    }

    public AuditLogger audit() {
        return audit;
    }

    public SyncMetrics metrics() {
        return metrics;
    }

    public synchronized SettingsReloadOutcome reloadSettings(boolean force) {
        Path file = config.settingsFile();
        long mtime = fileMtimeMs(file);
        RuntimeSettings current = settings;
        if (!force && mtime == settingsFileMtimeMs) {
            return new SettingsReloadOutcome(false, mtime >= 0L, file.toString(), current.toView(), List.of());
        }
        RuntimeSettings next = readSettings(file, environment);
        settingsFileMtimeMs = mtime;
        List<String> changedFields = RuntimeSettings.diffFields(current, next);
        boolean changed = !changedFields.isEmpty();
        if (changed) {
            settings = next;
            gateway = buildGateway(next);
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("config", file.toString());
            details.put("source", mtime >= 0L ? "file" : "defaults");
            details.put("changed_fields", changedFields);
            audit.log(AuditLogger.AuditEvent.of("runtime.settings.load", "runtime/settings", "ok", details));
            log.info("Settings reloaded from {}: changed {}", file, changedFields);
        }
        return new SettingsReloadOutcome(changed, mtime >= 0L, file.toString(), next.toView(), changedFields);
    }

    public boolean writeDefaultSettingsIfMissing() {
        Path file = config.settingsFile();
        if (Files.exists(file)) {
            return false;
        }
        RuntimeSettings d = RuntimeSettings.defaults();
        RuntimeSettingsFile template = new RuntimeSettingsFile(
                d.nodeId(), d.remoteAuthorityUrl(), null, d.remoteTimeoutMs(), null, d.signatureHeader(),
                d.maxAttempts(), d.baseBackoffMs(), d.maxBackoffMs(), d.jitterRatio(), d.sessionLifetimeMs(),
                d.syncFreshnessMs(), d.propagationPoolSize(), d.propagationQueueCapacity(), d.processorPoolSize(),
                d.courtesyDelayMs(), d.courtesyJitterMs(), d.queueTtlMs(), d.deadLetterTtlMs(), d.reconcileIntervalMs()
        );
        try {
            Files.createDirectories(file.getParent());
            Jsons.mapper().writeValue(file.toFile(), template);
            return true;
        } catch (IOException e) {
            throw new RuntimeException("Failed to write settings file: " + file, e);
        }
    }

    public PurgeOutcome purgeExpired() {
        int sessionsRemoved = sessions.purgeExpiredSessions();
        int rowsRemoved = store.purgeExpired();
        audit.log(AuditLogger.AuditEvent.of("maintenance.purge", "runtime/" + config.namespace(), "ok",
                Map.of("expired_sessions", sessionsRemoved, "expired_rows", rowsRemoved)));
        return new PurgeOutcome(sessionsRemoved, rowsRemoved);
    }

    public boolean acknowledgeDeadLetter(String dlqKey, String actor) {
        if (deadLetters.get(dlqKey).isEmpty()) {
            return false;
        }
        try {
            AlertFileRecoveryHook.acknowledge(config.alertsRoot(), dlqKey, actor, clock);
        } catch (IOException e) {
            throw new RuntimeException("Failed to acknowledge dead-letter entry " + dlqKey, e);
        }
        audit.log(AuditLogger.AuditEvent.ofActor("deadletter.acknowledged", actor, dlqKey, "ok", Map.of()));
        log.info("Dead-letter entry {} acknowledged by {}", dlqKey, actor);
        return true;
    }

    public Map<String, Object> health() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("status", "ok");
        out.put("namespace", config.namespace());
        out.put("node_id", settings.nodeId());
        out.put("timestamp", Instant.now(clock).toString());
        out.put("webhook_secret_configured", !settings.webhookSecret().isBlank());
        out.put("remote_authority_configured", !settings.remoteAuthorityUrl().isBlank());
        out.put("propagation_queue", propagationExecutor.getQueue().size());
        out.put("dead_letters", deadLetters.size());
        return out;
    }

    public String metricsText() {
        return PrometheusFormatter.format(metrics, operations.listAll().size(), deadLetters.size(), config.namespace());
    }

    public Optional<SessionContext> session(String sessionId) {
        return sessions.getSession(sessionId);
    }

    @Override
    public void close() {
        reconciler.close();
        propagationExecutor.shutdown();
        processorExecutor.shutdown();
        try {
            if (!propagationExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Propagation tasks still running at shutdown; {} queued", propagationExecutor.getQueue().size());
                propagationExecutor.shutdownNow();
            }
            if (!processorExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Processor tasks still running at shutdown; queued operations resume on next start");
                processorExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            propagationExecutor.shutdownNow();
            processorExecutor.shutdownNow();
        }
    }

    private WebhookGateway buildGateway(RuntimeSettings s) {
        return new WebhookGateway(
                new SignatureVerifier(s.webhookSecret()),
                s.signatureHeader(),
                identities,
                operations,
                deadLetters,
                processor::submit,
                audit,
                metrics,
                clock
        );
    }

    private static RemoteAuthorityClient remoteClient(RuntimeSettings s) {
        if (s.remoteAuthorityUrl().isBlank()) {
            return new UnconfiguredRemoteAuthority();
        }
        return new HttpRemoteAuthorityClient(
                s.remoteAuthorityUrl(),
                s.remoteAuthorityToken(),
                s.nodeId(),
                Duration.ofMillis(s.remoteTimeoutMs())
        );
    }

    static RuntimeSettings readSettings(Path file, Map<String, String> environment) {
        RuntimeSettings defaults = RuntimeSettings.defaults();
        RuntimeSettings loaded = defaults;
        if (Files.exists(file)) {
            try {
                RuntimeSettingsFile raw = Jsons.mapper().readValue(file.toFile(), RuntimeSettingsFile.class);
                loaded = RuntimeSettings.fromFile(raw, defaults);
            } catch (IOException e) {
                throw new RuntimeException("Failed to read settings file: " + file, e);
            }
        }
        return loaded.withEnvironment(environment);
    }

    private static long fileMtimeMs(Path file) {
        try {
            return Files.exists(file) ? Files.getLastModifiedTime(file).toMillis() : -1L;
        } catch (IOException e) {
            throw new RuntimeException("Failed to stat " + file, e);
        }
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    public record SettingsReloadOutcome(
            boolean changed,
            boolean fileExists,
            String path,
            Map<String, Object> settings,
            List<String> changedFields
    ) {
    }

    public record PurgeOutcome(int expiredSessions, int expiredRows) {
    }

    private static final class UnconfiguredRemoteAuthority implements RemoteAuthorityClient {
        @Override
        public Optional<SessionContext> fetch(String sessionId) throws RemoteAuthorityException {
            throw new RemoteAuthorityException("remote authority url is not configured", (Throwable) null);
        }

        @Override
        public void push(SessionContext session) throws RemoteAuthorityException {
            throw new RemoteAuthorityException("remote authority url is not configured", (Throwable) null);
        }
    }
}
