package io.syncmesh.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import io.syncmesh.config.SyncMeshConfig;
import io.syncmesh.model.OperationStatus;
import io.syncmesh.model.SessionContext;
import io.syncmesh.model.SyncOperation;
import io.syncmesh.processor.StateStoreCanonicalStore;
import io.syncmesh.remote.RemoteAuthorityClient;
import io.syncmesh.webhook.SignatureVerifier;
import io.syncmesh.webhook.WebhookRequest;
import io.syncmesh.webhook.WebhookResponse;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.util.Comparator;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

final class SyncMeshRuntimeTest {

    @Test
    void environmentSecretsOverrideSettingsFile() throws Exception {
        Path root = Files.createTempDirectory("syncmesh-runtime-env");
        try {
            SyncMeshConfig config = SyncMeshConfig.fromRoot(root.toString());
            writeSettings(config, "{\"nodeId\":\"node-x\",\"webhookSecret\":\"file-secret\",\"maxAttempts\":0,\"jitterRatio\":0.9}");

            try (SyncMeshRuntime runtime = new SyncMeshRuntime(config, new MapRemote(),
                    Map.of(RuntimeSettings.ENV_WEBHOOK_SECRET, "env-secret"), Clock.systemUTC())) {
                RuntimeSettings settings = runtime.settings();
                Assertions.assertEquals("node-x", settings.nodeId());
                Assertions.assertEquals("env-secret", settings.webhookSecret());
                Assertions.assertEquals(1, settings.maxAttempts());
                Assertions.assertEquals(0.1d, settings.retryPolicy().jitterRatio());
                Assertions.assertEquals(true, settings.toView().get("webhookSecretConfigured"));
                Assertions.assertFalse(settings.toView().containsKey("webhookSecret"));
                Assertions.assertEquals("node-x", runtime.health().get("node_id"));
            }
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void reloadPicksUpNewWebhookSettings() throws Exception {
        Path root = Files.createTempDirectory("syncmesh-runtime-reload");
        try {
            SyncMeshConfig config = SyncMeshConfig.fromRoot(root.toString());
            try (SyncMeshRuntime runtime = new SyncMeshRuntime(config, new MapRemote(), Map.of(), Clock.systemUTC())) {
                Assertions.assertTrue(runtime.writeDefaultSettingsIfMissing());
                Assertions.assertFalse(runtime.writeDefaultSettingsIfMissing());

                writeSettings(config, "{\"webhookSecret\":\"s3\",\"signatureHeader\":\"X-Hook-Signature\"}");
                Files.setLastModifiedTime(config.settingsFile(),
                        FileTime.fromMillis(System.currentTimeMillis() + 5_000L));

                SyncMeshRuntime.SettingsReloadOutcome outcome = runtime.reloadSettings(false);
                Assertions.assertTrue(outcome.changed());
                Assertions.assertTrue(outcome.changedFields().contains("signatureHeader"));
                Assertions.assertTrue(outcome.changedFields().contains("webhookSecretConfigured"));
                Assertions.assertFalse(runtime.reloadSettings(false).changed());

                byte[] body = "{}".getBytes(StandardCharsets.UTF_8);
                WebhookResponse response = runtime.gateway().processWebhook(WebhookRequest.post(
                        Map.of("X-Hook-Signature", new SignatureVerifier("s3").sign(body)), body));
                Assertions.assertEquals(400, response.status());
            }
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void signedWebhookFlowsThroughToCanonicalStore() throws Exception {
        Path root = Files.createTempDirectory("syncmesh-runtime-e2e");
        try {
            SyncMeshConfig config = SyncMeshConfig.fromRoot(root.toString());
            writeSettings(config, "{\"webhookSecret\":\"s3\",\"courtesyDelayMs\":0,\"courtesyJitterMs\":0,"
                    + "\"baseBackoffMs\":10,\"maxBackoffMs\":40}");
            try (SyncMeshRuntime runtime = new SyncMeshRuntime(config, new MapRemote(), Map.of(), Clock.systemUTC())) {
                runtime.identities().map("db-1", "PEO-001");
                byte[] body = ("{\"object\":\"event\",\"id\":\"evt-1\",\"created_time\":\"2026-10-19T08:00:00Z\","
                        + "\"last_edited_time\":\"2026-10-19T08:00:00Z\",\"type\":\"database.schema_updated\","
                        + "\"parent\":{\"type\":\"database_id\",\"database_id\":\"db-1\"},"
                        + "\"data\":{\"object\":\"database\",\"id\":\"db-1\",\"last_edited_time\":\"2026-10-19T08:00:00Z\","
                        + "\"schema\":{\"Name\":{\"type\":\"title\"}}}}").getBytes(StandardCharsets.UTF_8);

                WebhookResponse response = runtime.gateway().processWebhook(WebhookRequest.post(
                        Map.of("X-Notion-Signature", new SignatureVerifier("s3").sign(body)), body));
                Assertions.assertEquals(200, response.status());

                long deadline = System.currentTimeMillis() + 10_000L;
                Optional<SyncOperation> op = runtime.operations().find(response.operationId());
                while (System.currentTimeMillis() < deadline
                        && op.map(SyncOperation::status).orElse(null) != OperationStatus.COMPLETED) {
                    Thread.sleep(20L);
                    op = runtime.operations().find(response.operationId());
                }
                Assertions.assertEquals(OperationStatus.COMPLETED, op.orElseThrow().status());

                JsonNode canonical = new StateStoreCanonicalStore(runtime.store()).read("PEO-001", "db-1").orElseThrow();
                Assertions.assertEquals("Name", canonical.path("fields").get(0).path("name").asText());
                Assertions.assertEquals("Name", canonical.path("last_change").path("added").get(0).asText());
                Assertions.assertTrue(runtime.metricsText().contains("syncmesh_operations_completed_total{namespace=\"default\"} 1"));
            }
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void redeliveredDeadLetteredEventIsNotRunAgain() throws Exception {
        Path root = Files.createTempDirectory("syncmesh-runtime-dlq");
        try {
            SyncMeshConfig config = SyncMeshConfig.fromRoot(root.toString());
            writeSettings(config, "{\"webhookSecret\":\"s3\",\"courtesyDelayMs\":0,\"courtesyJitterMs\":0,"
                    + "\"baseBackoffMs\":10,\"maxBackoffMs\":40}");
            try (SyncMeshRuntime runtime = new SyncMeshRuntime(config, new MapRemote(), Map.of(), Clock.systemUTC())) {
                runtime.identities().map("db-2", "PEO-002");
                byte[] body = ("{\"object\":\"event\",\"id\":\"evt-2\",\"created_time\":\"2026-10-19T08:00:00Z\","
                        + "\"last_edited_time\":\"2026-10-19T08:00:00Z\",\"type\":\"data_source.schema_updated\","
                        + "\"parent\":{\"type\":\"database_id\",\"database_id\":\"db-2\"},"
                        + "\"data\":{\"object\":\"database\",\"id\":\"db-2\",\"last_edited_time\":\"2026-10-19T08:00:00Z\"}}")
                        .getBytes(StandardCharsets.UTF_8);
                WebhookRequest request = WebhookRequest.post(
                        Map.of("X-Notion-Signature", new SignatureVerifier("s3").sign(body)), body);

                WebhookResponse first = runtime.gateway().processWebhook(request);
                Assertions.assertEquals("accepted", first.outcome());
                long deadline = System.currentTimeMillis() + 10_000L;
                while (System.currentTimeMillis() < deadline && (runtime.deadLetters().size() == 0
                        || runtime.operations().find(first.operationId()).isPresent())) {
                    Thread.sleep(20L);
                }
                Assertions.assertEquals(1, runtime.deadLetters().size());
                Assertions.assertTrue(runtime.operations().find(first.operationId()).isEmpty());

                WebhookResponse again = runtime.gateway().processWebhook(request);

                Assertions.assertEquals(200, again.status());
                Assertions.assertEquals("duplicate", again.outcome());
                Assertions.assertTrue(runtime.operations().find(first.operationId()).isEmpty());
                Assertions.assertEquals(1, runtime.deadLetters().size());
                Assertions.assertTrue(runtime.deadLetters().isDeadLettered(first.operationId()));
            }
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void sessionsAreCreatedThroughTheWiredSynchronizer() throws Exception {
        Path root = Files.createTempDirectory("syncmesh-runtime-session");
        try {
            SyncMeshConfig config = SyncMeshConfig.fromRoot(root.toString(), "Tenant A");
            MapRemote remote = new MapRemote();
            try (SyncMeshRuntime runtime = new SyncMeshRuntime(config, remote, Map.of(), Clock.systemUTC())) {
                SessionContext created = runtime.sessions().createSession("PEO-042", 2, Set.of("read"));

                Assertions.assertTrue(remote.sessions.containsKey(created.sessionId()));
                Assertions.assertEquals(created.sessionId(), runtime.session(created.sessionId()).orElseThrow().sessionId());
                Assertions.assertEquals("tenant-a", config.namespace());
                Assertions.assertTrue(runtime.metricsText().contains("syncmesh_sessions_created_total{namespace=\"tenant-a\"} 1"));
                Assertions.assertEquals(0, runtime.purgeExpired().expiredSessions());
            }
        } finally {
            deleteRecursively(root);
        }
    }

    private static void writeSettings(SyncMeshConfig config, String json) throws IOException {
        Files.createDirectories(config.settingsFile().getParent());
        Files.writeString(config.settingsFile(), json, StandardCharsets.UTF_8);
    }

    private static final class MapRemote implements RemoteAuthorityClient {
        final Map<String, SessionContext> sessions = new ConcurrentHashMap<>();

        @Override
        public Optional<SessionContext> fetch(String sessionId) {
            return Optional.ofNullable(sessions.get(sessionId));
        }

        @Override
        public void push(SessionContext session) {
            sessions.put(session.sessionId(), session);
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
