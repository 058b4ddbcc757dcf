package io.syncmesh.webhook;

public final class WebhookValidationException extends Exception {
    public WebhookValidationException(String message) {
        super(message);
    }

    public WebhookValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
