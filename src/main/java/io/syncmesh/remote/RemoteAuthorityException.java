package io.syncmesh.remote;

public final class RemoteAuthorityException extends Exception {
    private final int statusCode;

    public RemoteAuthorityException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    public RemoteAuthorityException(String message, int statusCode) {
        super(message + " (status=" + statusCode + ")");
        this.statusCode = statusCode;
    }

    public int statusCode() {
        return statusCode;
    }
}
