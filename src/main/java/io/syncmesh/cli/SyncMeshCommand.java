package io.syncmesh.cli;

import io.syncmesh.config.SyncMeshConfig;
import io.syncmesh.deadletter.DeadLetterEntry;
import io.syncmesh.deadletter.DeadLetterReconciler;
import io.syncmesh.http.SyncMeshHttpServer;
import io.syncmesh.model.SessionContext;
import io.syncmesh.model.SessionUpdate;
import io.syncmesh.model.SyncOperation;
import io.syncmesh.runtime.SyncMeshRuntime;
import io.syncmesh.security.SessionCipher;
import io.syncmesh.session.PropagationException;
import io.syncmesh.session.SessionNotFoundException;
import io.syncmesh.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;

@Command(
        name = "syncmesh",
        mixinStandardHelpOptions = true,
        description = "SyncMesh node CLI: sessions, webhook intake, operation queue and dead letters",
        subcommands = {
                SyncMeshCommand.InitCommand.class,
                SyncMeshCommand.ServeCommand.class,
                SyncMeshCommand.SessionCreateCommand.class,
                SyncMeshCommand.SessionGetCommand.class,
                SyncMeshCommand.SessionUpdateCommand.class,
                SyncMeshCommand.SessionSyncCommand.class,
                SyncMeshCommand.IdentityMapCommand.class,
                SyncMeshCommand.QueueCommand.class,
                SyncMeshCommand.DeadListCommand.class,
                SyncMeshCommand.DeadAckCommand.class,
                SyncMeshCommand.ReconcileCommand.class,
                SyncMeshCommand.ReplayCommand.class,
                SyncMeshCommand.PurgeCommand.class,
                SyncMeshCommand.MetricsCommand.class,
                SyncMeshCommand.KeyRotateCommand.class
        }
)
public final class SyncMeshCommand implements Runnable {

    @Option(names = {"--root"}, description = "Data root directory", defaultValue = "data")
    String root;

    @Option(names = {"--namespace"}, description = "Namespace (tenant scope)", defaultValue = "default")
    String namespace;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | serve | session-create | session-get | session-update | session-sync | identity-map | queue | dead-list | dead-ack | reconcile | replay | purge | metrics | key-rotate");
    }

    SyncMeshRuntime runtime() {
        return new SyncMeshRuntime(SyncMeshConfig.fromRoot(root, namespace));
    }

    @Command(name = "init", description = "Create the data root, SQLite schema and a default settings file")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        SyncMeshCommand parent;

        @Override
        public Integer call() {
            try (SyncMeshRuntime runtime = parent.runtime()) {
                boolean written = runtime.writeDefaultSettingsIfMissing();
                System.out.println("Initialized SyncMesh at: " + runtime.config().rootDir()
                        + (written ? " (wrote " + runtime.config().settingsFile().getFileName() + ")" : ""));
            }
            return 0;
        }
    }

    @Command(name = "serve", description = "Serve webhook ingress, /health and /metrics; reconcile dead letters on a schedule")
    static final class ServeCommand implements Callable<Integer> {
        @ParentCommand
        SyncMeshCommand parent;

        @Option(names = {"--port"}, defaultValue = "8080", description = "Bind port")
        int port;

        @Option(names = {"--bind"}, defaultValue = "0.0.0.0", description = "Bind address")
        String bind;

        @Option(names = {"--no-reconcile"}, description = "Do not run the scheduled dead-letter reconciler")
        boolean noReconcile;

        @Override
        public Integer call() throws Exception {
            SyncMeshRuntime runtime = parent.runtime();
            runtime.processor().recoverStalled();
            if (!noReconcile) {
                runtime.reconciler().start(Duration.ofMillis(runtime.settings().reconcileIntervalMs()));
            }
            SyncMeshHttpServer server = new SyncMeshHttpServer(runtime, new InetSocketAddress(bind, port));
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                server.close();
                runtime.close();
            }, "syncmesh-shutdown"));
            server.start();
            System.out.println("SyncMesh listening on http://" + bind + ":" + server.port()
                    + " (POST /webhook/notion, GET /health, GET /metrics)");
            Thread.currentThread().join();
            return 0;
        }
    }

    @Command(name = "session-create", description = "Create a session and propagate it to the remote authority")
    static final class SessionCreateCommand implements Callable<Integer> {
        @ParentCommand
        SyncMeshCommand parent;

        @Option(names = {"--subject"}, required = true, description = "Subject (external identity) id")
        String subject;

        @Option(names = {"--trust"}, defaultValue = "0", description = "Trust level")
        int trust;

        @Option(names = {"--permission"}, description = "Capability string (repeatable)")
        List<String> permissions;

        @Override
        public Integer call() {
            try (SyncMeshRuntime runtime = parent.runtime()) {
                SessionContext session = runtime.sessions().createSession(subject, trust,
                        permissions == null ? Set.of() : new LinkedHashSet<>(permissions));
                System.out.println(Jsons.toJson(session));
                return 0;
            } catch (PropagationException e) {
                System.err.println(e.getMessage());
                return 2;
            }
        }
    }

    @Command(name = "session-get", description = "Read a session, resyncing it first when stale")
    static final class SessionGetCommand implements Callable<Integer> {
        @ParentCommand
        SyncMeshCommand parent;

        @Parameters(index = "0", description = "Session id")
        String sessionId;

        @Override
        public Integer call() {
            try (SyncMeshRuntime runtime = parent.runtime()) {
                Optional<SessionContext> session = runtime.sessions().getSession(sessionId);
                if (session.isEmpty()) {
                    System.err.println("Session not found: " + sessionId);
                    return 1;
                }
                System.out.println(Jsons.toJson(session.get()));
                return 0;
            }
        }
    }

    @Command(name = "session-update", description = "Change trust, permissions or expiry of a cached session")
    static final class SessionUpdateCommand implements Callable<Integer> {
        @ParentCommand
        SyncMeshCommand parent;

        @Parameters(index = "0", description = "Session id")
        String sessionId;

        @Option(names = {"--trust"}, description = "New trust level")
        Integer trust;

        @Option(names = {"--permission"}, description = "Replacement permission set (repeatable)")
        List<String> permissions;

        @Option(names = {"--expires-at"}, description = "New expiry (ISO-8601 instant)")
        String expiresAt;

        @Override
        public Integer call() {
            SessionUpdate update = new SessionUpdate(
                    trust,
                    permissions == null ? null : new LinkedHashSet<>(permissions),
                    expiresAt == null ? null : Instant.parse(expiresAt)
            );
            try (SyncMeshRuntime runtime = parent.runtime()) {
                SessionContext session = runtime.sessions().updateSession(sessionId, update);
                System.out.println(Jsons.toJson(session));
                return 0;
            } catch (SessionNotFoundException e) {
                System.err.println(e.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "session-sync", description = "Reconcile a cached session with the remote authority now")
    static final class SessionSyncCommand implements Callable<Integer> {
        @ParentCommand
        SyncMeshCommand parent;

        @Parameters(index = "0", description = "Session id")
        String sessionId;

        @Override
        public Integer call() {
            try (SyncMeshRuntime runtime = parent.runtime()) {
                Optional<SessionContext> session = runtime.sessions().syncSession(sessionId);
                if (session.isEmpty()) {
                    System.err.println("Session not cached on this node: " + sessionId);
                    return 1;
                }
                System.out.println(Jsons.toJson(session.get()));
                return 0;
            }
        }
    }

    @Command(name = "identity-map", description = "Attribute an external resource to an internal identity")
    static final class IdentityMapCommand implements Callable<Integer> {
        @ParentCommand
        SyncMeshCommand parent;

        @Option(names = {"--resource"}, required = true, description = "External resource id (database or page id)")
        String resource;

        @Option(names = {"--identity"}, description = "Internal identity; omit together with --remove")
        String identity;

        @Option(names = {"--remove"}, description = "Delete the mapping instead")
        boolean remove;

        @Override
        public Integer call() {
            try (SyncMeshRuntime runtime = parent.runtime()) {
                if (remove) {
                    boolean removed = runtime.identities().unmap(resource);
                    System.out.println(Jsons.toJson(Map.of("resource", resource, "removed", removed)));
                    return removed ? 0 : 1;
                }
                if (identity == null || identity.isBlank()) {
                    System.err.println("--identity is required unless --remove is given");
                    return 2;
                }
                runtime.identities().map(resource, identity);
                System.out.println(Jsons.toJson(Map.of("resource", resource, "identity", identity)));
                return 0;
            }
        }
    }

    @Command(name = "queue", description = "List operations in the active queue")
    static final class QueueCommand implements Callable<Integer> {
        @ParentCommand
        SyncMeshCommand parent;

        @Option(names = {"--recover"}, description = "Re-dispatch pending, failed and stalled operations before listing")
        boolean recover;

        @Override
        public Integer call() {
            try (SyncMeshRuntime runtime = parent.runtime()) {
                if (recover) {
                    int dispatched = runtime.processor().recoverStalled();
                    System.out.println("Re-dispatched " + dispatched + " operation(s)");
                }
                List<SyncOperation> operations = runtime.operations().listAll();
                System.out.println(Jsons.toJson(operations));
                return 0;
            }
        }
    }

    @Command(name = "dead-list", description = "List dead-lettered operations")
    static final class DeadListCommand implements Callable<Integer> {
        @ParentCommand
        SyncMeshCommand parent;

        @Override
        public Integer call() {
            try (SyncMeshRuntime runtime = parent.runtime()) {
                List<DeadLetterEntry> entries = runtime.deadLetters().list();
                System.out.println(Jsons.toJson(entries));
                return 0;
            }
        }
    }

    @Command(name = "dead-ack", description = "Acknowledge a dead-letter alert so the next reconcile pass removes the entry")
    static final class DeadAckCommand implements Callable<Integer> {
        @ParentCommand
        SyncMeshCommand parent;

        @Parameters(index = "0", description = "Dead-letter key (dlq:<operation_id>:<epoch_ms>)")
        String dlqKey;

        @Option(names = {"--actor"}, defaultValue = "cli", description = "Operator recorded in the audit trail")
        String actor;

        @Override
        public Integer call() {
            try (SyncMeshRuntime runtime = parent.runtime()) {
                boolean acknowledged = runtime.acknowledgeDeadLetter(dlqKey, actor);
                Map<String, Object> out = new LinkedHashMap<>();
                out.put("dlq_key", dlqKey);
                out.put("acknowledged", acknowledged);
                System.out.println(Jsons.toJson(out));
                return acknowledged ? 0 : 1;
            }
        }
    }

    @Command(name = "reconcile", description = "Run the dead-letter recovery hook over every entry; "
            + "entries stay until their alert is acknowledged with dead-ack")
    static final class ReconcileCommand implements Callable<Integer> {
        @ParentCommand
        SyncMeshCommand parent;

        @Option(names = {"--loop"}, description = "Keep running on the configured interval")
        boolean loop;

        @Override
        public Integer call() throws Exception {
            SyncMeshRuntime runtime = parent.runtime();
            if (loop) {
                runtime.reconciler().start(Duration.ofMillis(runtime.settings().reconcileIntervalMs()));
                Runtime.getRuntime().addShutdownHook(new Thread(runtime::close, "syncmesh-shutdown"));
                System.out.println("Reconciling every " + runtime.settings().reconcileIntervalMs() + " ms");
                Thread.currentThread().join();
                return 0;
            }
            try (runtime) {
                DeadLetterReconciler.ReconcileSummary summary = runtime.reconciler().reconcileOnce();
                System.out.println(Jsons.toJson(summary));
                return summary.retained() == 0 ? 0 : 1;
            }
        }
    }

    @Command(name = "replay", description = "Put a dead-lettered operation back into the queue")
    static final class ReplayCommand implements Callable<Integer> {
        @ParentCommand
        SyncMeshCommand parent;

        @Parameters(index = "0", description = "Dead-letter key (dlq:<operation_id>:<epoch_ms>)")
        String dlqKey;

        @Option(names = {"--actor"}, defaultValue = "cli", description = "Operator recorded in the audit trail")
        String actor;

        @Override
        public Integer call() {
            try (SyncMeshRuntime runtime = parent.runtime()) {
                Optional<SyncOperation> replayed = runtime.reconciler().replay(dlqKey, actor);
                Map<String, Object> out = new LinkedHashMap<>();
                out.put("dlq_key", dlqKey);
                out.put("replayed", replayed.isPresent());
                replayed.ifPresent(op -> out.put("operation_id", op.operationId()));
                System.out.println(Jsons.toJson(out));
                return replayed.isPresent() ? 0 : 1;
            }
        }
    }

    @Command(name = "purge", description = "Delete expired sessions and expired store rows")
    static final class PurgeCommand implements Callable<Integer> {
        @ParentCommand
        SyncMeshCommand parent;

        @Override
        public Integer call() {
            try (SyncMeshRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.purgeExpired()));
                return 0;
            }
        }
    }

    @Command(name = "metrics", description = "Print Prometheus metrics")
    static final class MetricsCommand implements Callable<Integer> {
        @ParentCommand
        SyncMeshCommand parent;

        @Override
        public Integer call() {
            try (SyncMeshRuntime runtime = parent.runtime()) {
                System.out.print(runtime.metricsText());
                return 0;
            }
        }
    }

    @Command(name = "key-rotate", description = "Add a new session encryption key and make it active")
    static final class KeyRotateCommand implements Callable<Integer> {
        @ParentCommand
        SyncMeshCommand parent;

        @Override
        public Integer call() {
            try (SyncMeshRuntime runtime = parent.runtime()) {
                SessionCipher.RotationOutcome outcome = runtime.cipher().rotate();
                System.out.println(Jsons.toJson(outcome));
                return 0;
            }
        }
    }
}
