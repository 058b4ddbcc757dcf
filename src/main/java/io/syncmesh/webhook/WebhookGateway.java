package io.syncmesh.webhook;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.syncmesh.deadletter.DeadLetterStore;
import io.syncmesh.model.SyncOperation;
import io.syncmesh.model.WebhookEvent;
import io.syncmesh.observability.AuditLogger;
import io.syncmesh.observability.SyncMetrics;
import io.syncmesh.processor.OperationRepository;
import io.syncmesh.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Intake for signed change events. Turns each distinct event version into exactly one queued
 * {@link SyncOperation} and hands it off without waiting for processing.
 */
public final class WebhookGateway {
    private static final Logger log = LoggerFactory.getLogger(WebhookGateway.class);

    private final SignatureVerifier verifier;
    private final String signatureHeader;
    private final WebhookEventParser parser;
    private final IdentityResolver identityResolver;
    private final OperationRepository operations;
    private final DeadLetterStore deadLetters;
    private final Consumer<SyncOperation> dispatcher;
    private final AuditLogger audit;
    private final SyncMetrics metrics;
    private final Clock clock;

    public WebhookGateway(
            SignatureVerifier verifier,
            String signatureHeader,
            IdentityResolver identityResolver,
            OperationRepository operations,
            DeadLetterStore deadLetters,
            Consumer<SyncOperation> dispatcher,
            AuditLogger audit,
            SyncMetrics metrics,
            Clock clock
    ) {
        this.verifier = verifier;
        this.signatureHeader = signatureHeader;
        this.parser = new WebhookEventParser();
        this.identityResolver = identityResolver;
        this.operations = operations;
        this.deadLetters = deadLetters;
        this.dispatcher = dispatcher;
        this.audit = audit;
        this.metrics = metrics;
        this.clock = clock;
    }

    public WebhookResponse processWebhook(WebhookRequest request) {
        if (!"POST".equals(request.method())) {
            return WebhookResponse.methodNotAllowed();
        }
        try {
            if (!verifier.verify(request.body(), request.header(signatureHeader))) {
                metrics.webhooksRejectedSignature.incrementAndGet();
                audit.log(AuditLogger.AuditEvent.of("webhook.rejected", "webhook", "invalid_signature",
                        Map.of("configured", verifier.configured())));
                log.warn("Rejected webhook delivery with missing or invalid {} header", signatureHeader);
                return WebhookResponse.unauthorized();
            }
            WebhookEvent event = parser.parse(request.body());
            String operationId = event.operationId();
            if (operations.exists(operationId)) {
                metrics.webhooksDuplicate.incrementAndGet();
                log.debug("Duplicate delivery for operation {}", operationId);
                return WebhookResponse.duplicate(operationId);
            }
            // Checked after the queue: dead-lettering writes the marker before it deletes the queue row.
            if (deadLetters.isDeadLettered(operationId)) {
                metrics.webhooksDuplicate.incrementAndGet();
                log.info("Redelivery for dead-lettered operation {} ignored; use replay to run it again", operationId);
                return WebhookResponse.duplicate(operationId);
            }
            String resourceId = event.targetResourceId();
            Optional<String> identity = identityResolver.resolve(resourceId);
            if (identity.isEmpty()) {
                metrics.webhooksDropped.incrementAndGet();
                log.warn("Dropping event {} ({}): no identity mapped for resource {}",
                        event.id(), event.type().wire(), resourceId);
                return WebhookResponse.dropped("no identity mapped for resource " + resourceId);
            }
            SyncOperation operation = SyncOperation.pending(
                    operationId,
                    event.id(),
                    event.type().syncType(),
                    resourceId,
                    identity.get(),
                    payloadOf(event),
                    clock.instant()
            );
            if (!operations.createIfAbsent(operation)) {
                metrics.webhooksDuplicate.incrementAndGet();
                return WebhookResponse.duplicate(operationId);
            }
            metrics.webhooksAccepted.incrementAndGet();
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("event_id", event.id());
            details.put("event_type", event.type().wire());
            details.put("sync_type", operation.syncType().wire());
            details.put("associated_identity", operation.associatedIdentity());
            audit.log(AuditLogger.AuditEvent.of("operation.queued", "operation:" + operationId, "ok", details));
            handOff(operation);
            return WebhookResponse.accepted(operationId);
        } catch (WebhookValidationException e) {
            metrics.webhooksRejectedSchema.incrementAndGet();
            log.warn("Rejected malformed webhook delivery: {}", e.getMessage());
            return WebhookResponse.invalid(e.getMessage());
        } catch (RuntimeException e) {
            log.error("Webhook processing failed", e);
            return WebhookResponse.failed();
        }
    }

    // A queued operation that could not be handed off stays pending and is picked up by recovery.
    private void handOff(SyncOperation operation) {
        try {
            dispatcher.accept(operation);
        } catch (RuntimeException e) {
            log.warn("Operation {} queued but not dispatched: {}", operation.operationId(), e.getMessage());
        }
    }

    private static ObjectNode payloadOf(WebhookEvent event) {
        ObjectNode payload = Jsons.compact().createObjectNode();
        payload.put("event_type", event.type().wire());
        ObjectNode data = payload.putObject("data");
        data.put("object", event.data().object());
        data.put("id", event.data().id());
        data.put("last_edited_time", event.data().lastEditedTime());
        if (event.data().properties() != null) {
            data.set("properties", event.data().properties());
        }
        if (event.data().schema() != null) {
            data.set("schema", event.data().schema());
        }
        ObjectNode parent = payload.putObject("parent");
        parent.put("type", event.parent().type());
        if (event.parent().databaseId() != null) {
            parent.put("database_id", event.parent().databaseId());
        }
        if (event.parent().pageId() != null) {
            parent.put("page_id", event.parent().pageId());
        }
        return payload;
    }
}
