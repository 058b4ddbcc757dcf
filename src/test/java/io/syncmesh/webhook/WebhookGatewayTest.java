package io.syncmesh.webhook;

import io.syncmesh.MutableClock;
import io.syncmesh.config.SyncMeshConfig;
import io.syncmesh.deadletter.DeadLetterStore;
import io.syncmesh.model.OperationStatus;
import io.syncmesh.model.SyncOperation;
import io.syncmesh.model.SyncType;
import io.syncmesh.observability.AuditLogger;
import io.syncmesh.observability.SyncMetrics;
import io.syncmesh.processor.OperationRepository;
import io.syncmesh.storage.Database;
import io.syncmesh.storage.SqliteStateStore;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

final class WebhookGatewayTest {
    private static final String SECRET = "whsec-test";

    @Test
    void signedEventIsQueuedOnceAndDispatched() throws Exception {
        Path root = Files.createTempDirectory("syncmesh-webhook-accept");
        try {
            Fixture f = new Fixture(root);
            byte[] body = WebhookFixtures.pageEvent("evt-1", "db-1", "2026-10-19T08:00:00Z").getBytes(StandardCharsets.UTF_8);

            WebhookResponse first = f.gateway.processWebhook(f.signed(body));
            WebhookResponse second = f.gateway.processWebhook(f.signed(body));

            Assertions.assertEquals(200, first.status());
            Assertions.assertEquals(200, second.status());
            Assertions.assertEquals(first.operationId(), second.operationId());
            Assertions.assertNotEquals(first.outcome(), second.outcome());
            Assertions.assertEquals(1, f.operations.listAll().size());
            Assertions.assertEquals(1, f.dispatched.size());

            SyncOperation queued = f.operations.find(first.operationId()).orElseThrow();
            Assertions.assertEquals(OperationStatus.PENDING, queued.status());
            Assertions.assertEquals(SyncType.CONTENT_UPDATE, queued.syncType());
            Assertions.assertEquals("PEO-001", queued.associatedIdentity());
            Assertions.assertEquals("db-1", queued.targetResourceId());
            Assertions.assertEquals("Ada", queued.payload().path("data").path("properties").path("Name").asText());
            Assertions.assertEquals(1L, f.metrics.webhooksAccepted.get());
            Assertions.assertEquals(1L, f.metrics.webhooksDuplicate.get());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void newEditOfSameEventIsANewOperation() throws Exception {
        Path root = Files.createTempDirectory("syncmesh-webhook-versions");
        try {
            Fixture f = new Fixture(root);
            f.gateway.processWebhook(f.signed(WebhookFixtures.pageEvent("evt-1", "db-1", "2026-10-19T08:00:00Z")
                    .getBytes(StandardCharsets.UTF_8)));
            f.gateway.processWebhook(f.signed(WebhookFixtures.pageEvent("evt-1", "db-1", "2026-10-19T08:05:00Z")
                    .getBytes(StandardCharsets.UTF_8)));

            Assertions.assertEquals(2, f.operations.listAll().size());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void redeliveryOfDeadLetteredEventIsNotQueuedAgain() throws Exception {
        Path root = Files.createTempDirectory("syncmesh-webhook-dead-lettered");
        try {
            Fixture f = new Fixture(root);
            byte[] body = WebhookFixtures.pageEvent("evt-9", "db-1", "2026-10-19T08:00:00Z").getBytes(StandardCharsets.UTF_8);
            WebhookResponse accepted = f.gateway.processWebhook(f.signed(body));
            SyncOperation queued = f.operations.find(accepted.operationId()).orElseThrow();
            f.deadLetters.add(queued.withStatus(OperationStatus.DLQ, f.clock.instant()), f.clock.instant());
            f.operations.delete(queued.operationId());

            WebhookResponse redelivered = f.gateway.processWebhook(f.signed(body));

            Assertions.assertEquals(200, redelivered.status());
            Assertions.assertEquals(accepted.operationId(), redelivered.operationId());
            Assertions.assertNotEquals(accepted.outcome(), redelivered.outcome());
            Assertions.assertTrue(f.operations.find(queued.operationId()).isEmpty());
            Assertions.assertEquals(1, f.dispatched.size());
            Assertions.assertEquals(1, f.deadLetters.size());
            Assertions.assertEquals(1L, f.metrics.webhooksDuplicate.get());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void badSignatureIsRejectedWithoutSideEffects() throws Exception {
        Path root = Files.createTempDirectory("syncmesh-webhook-signature");
        try {
            Fixture f = new Fixture(root);
            byte[] body = WebhookFixtures.pageEvent("evt-2", "db-1", "2026-10-19T08:00:00Z").getBytes(StandardCharsets.UTF_8);

            WebhookResponse missing = f.gateway.processWebhook(WebhookRequest.post(Map.of(), body));
            WebhookResponse wrong = f.gateway.processWebhook(WebhookRequest.post(
                    Map.of("X-Notion-Signature", new SignatureVerifier("other").sign(body)), body));

            Assertions.assertEquals(401, missing.status());
            Assertions.assertEquals(401, wrong.status());
            Assertions.assertTrue(f.operations.listAll().isEmpty());
            Assertions.assertTrue(f.dispatched.isEmpty());
            Assertions.assertEquals(2L, f.metrics.webhooksRejectedSignature.get());
            Assertions.assertEquals("webhook.rejected", f.audit.tail(1).get(0).path("action").asText());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void signatureHeaderIsCaseInsensitiveAndAcceptsPrefix() throws Exception {
        Path root = Files.createTempDirectory("syncmesh-webhook-prefix");
        try {
            Fixture f = new Fixture(root);
            byte[] body = WebhookFixtures.pageEvent("evt-3", "db-1", "2026-10-19T08:00:00Z").getBytes(StandardCharsets.UTF_8);
            String signature = "sha256=" + new SignatureVerifier(SECRET).sign(body);

            WebhookResponse response = f.gateway.processWebhook(
                    WebhookRequest.post(Map.of("x-notion-signature", signature), body));

            Assertions.assertEquals(200, response.status());
            Assertions.assertEquals(1, f.dispatched.size());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void malformedSignedBodyIsABadRequest() throws Exception {
        Path root = Files.createTempDirectory("syncmesh-webhook-invalid");
        try {
            Fixture f = new Fixture(root);

            WebhookResponse response = f.gateway.processWebhook(f.signed("{\"object\":\"event\"}".getBytes(StandardCharsets.UTF_8)));

            Assertions.assertEquals(400, response.status());
            Assertions.assertTrue(f.operations.listAll().isEmpty());
            Assertions.assertEquals(1L, f.metrics.webhooksRejectedSchema.get());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void unmappedResourceIsAcknowledgedButDropped() throws Exception {
        Path root = Files.createTempDirectory("syncmesh-webhook-dropped");
        try {
            Fixture f = new Fixture(root);
            byte[] body = WebhookFixtures.pageEvent("evt-4", "db-unknown", "2026-10-19T08:00:00Z").getBytes(StandardCharsets.UTF_8);

            WebhookResponse response = f.gateway.processWebhook(f.signed(body));

            Assertions.assertEquals(200, response.status());
            Assertions.assertTrue(f.operations.listAll().isEmpty());
            Assertions.assertEquals(1L, f.metrics.webhooksDropped.get());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void nonPostIsRejected() throws Exception {
        Path root = Files.createTempDirectory("syncmesh-webhook-method");
        try {
            Fixture f = new Fixture(root);
            WebhookResponse response = f.gateway.processWebhook(new WebhookRequest("get", Map.of(), new byte[0]));
            Assertions.assertEquals(405, response.status());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void dispatchFailureLeavesOperationQueued() throws Exception {
        Path root = Files.createTempDirectory("syncmesh-webhook-handoff");
        try {
            Fixture f = new Fixture(root, op -> {
                throw new IllegalStateException("processor stopped");
            });
            byte[] body = WebhookFixtures.pageEvent("evt-5", "db-1", "2026-10-19T08:00:00Z").getBytes(StandardCharsets.UTF_8);

            WebhookResponse response = f.gateway.processWebhook(f.signed(body));

            Assertions.assertEquals(200, response.status());
            Assertions.assertEquals(OperationStatus.PENDING,
                    f.operations.find(response.operationId()).orElseThrow().status());
        } finally {
            deleteRecursively(root);
        }
    }

    private static final class Fixture {
        final MutableClock clock = new MutableClock(Instant.parse("2026-10-19T08:01:00Z"));
        final SyncMetrics metrics = new SyncMetrics();
        final List<SyncOperation> dispatched = new ArrayList<>();
        final OperationRepository operations;
        final DeadLetterStore deadLetters;
        final AuditLogger audit;
        final WebhookGateway gateway;

        Fixture(Path root) {
            this(root, null);
        }

        Fixture(Path root, java.util.function.Consumer<SyncOperation> dispatcher) {
            SyncMeshConfig config = SyncMeshConfig.fromRoot(root.toString());
            Database database = new Database(config);
            database.init();
            SqliteStateStore store = new SqliteStateStore(database, clock);
            StoredIdentityResolver identities = new StoredIdentityResolver(store);
            identities.map("db-1", "PEO-001");
            operations = new OperationRepository(store);
            deadLetters = new DeadLetterStore(store);
            audit = new AuditLogger(config.auditRoot().resolve("audit.log"), "default", "node-a", "");
            gateway = new WebhookGateway(new SignatureVerifier(SECRET), SyncMeshConfig.DEFAULT_SIGNATURE_HEADER,
                    identities, operations, deadLetters, dispatcher == null ? dispatched::add : dispatcher, audit, metrics, clock);
        }

        WebhookRequest signed(byte[] body) {
            return WebhookRequest.post(Map.of("X-Notion-Signature", new SignatureVerifier(SECRET).sign(body)), body);
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
