package io.syncmesh.webhook;

import io.syncmesh.util.Jsons;

import java.util.LinkedHashMap;
import java.util.Map;

public record WebhookResponse(int status, String outcome, String operationId, String message) {

    static WebhookResponse accepted(String operationId) {
        return new WebhookResponse(200, "accepted", operationId, "operation queued");
    }

    static WebhookResponse duplicate(String operationId) {
        return new WebhookResponse(200, "duplicate", operationId, "event already processed");
    }

    static WebhookResponse dropped(String message) {
        return new WebhookResponse(200, "dropped", null, message);
    }

    static WebhookResponse unauthorized() {
        return new WebhookResponse(401, "rejected", null, "invalid signature");
    }

    static WebhookResponse invalid(String message) {
        return new WebhookResponse(400, "invalid", null, message);
    }

    static WebhookResponse methodNotAllowed() {
        return new WebhookResponse(405, "rejected", null, "method not allowed");
    }

    static WebhookResponse failed() {
        return new WebhookResponse(500, "error", null, "internal error");
    }

    public String toJson() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", outcome);
        if (operationId != null) {
            body.put("operation_id", operationId);
        }
        body.put("message", message);
        return Jsons.toCompactJson(body);
    }
}
