package io.syncmesh.session;

public final class PropagationException extends Exception {
    public PropagationException(String message, Throwable cause) {
        super(message, cause);
    }
}
