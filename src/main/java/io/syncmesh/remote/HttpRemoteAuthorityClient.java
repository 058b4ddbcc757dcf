package io.syncmesh.remote;

import io.syncmesh.model.SessionContext;
import io.syncmesh.util.Jsons;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;

public final class HttpRemoteAuthorityClient implements RemoteAuthorityClient {
    private final URI baseUri;
    private final String bearerToken;
    private final String nodeId;
    private final Duration timeout;
    private final HttpClient http;

    public HttpRemoteAuthorityClient(String baseUrl, String bearerToken, String nodeId, Duration timeout) {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalArgumentException("remote authority url is required");
        }
        String trimmed = baseUrl.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        this.baseUri = URI.create(trimmed);
        this.bearerToken = bearerToken == null ? "" : bearerToken.trim();
        this.nodeId = nodeId;
        this.timeout = timeout;
        this.http = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .build();
    }

    @Override
    public Optional<SessionContext> fetch(String sessionId) throws RemoteAuthorityException {
        URI uri = URI.create(baseUri + "/session/" + URLEncoder.encode(sessionId, StandardCharsets.UTF_8));
        HttpRequest request = authorized(HttpRequest.newBuilder(uri))
                .timeout(timeout)
                .GET()
                .build();
        HttpResponse<String> response = send(request, "fetch " + sessionId);
        if (response.statusCode() == 404) {
            return Optional.empty();
        }
        if (response.statusCode() / 100 != 2) {
            throw new RemoteAuthorityException("fetch " + sessionId + " failed", response.statusCode());
        }
        try {
            return Optional.of(Jsons.compact().readValue(response.body(), SessionContext.class));
        } catch (IOException | RuntimeException e) {
            throw new RemoteAuthorityException("fetch " + sessionId + " returned an unreadable session", e);
        }
    }

    @Override
    public void push(SessionContext session) throws RemoteAuthorityException {
        String body = Jsons.toCompactJson(session);
        HttpRequest request = authorized(HttpRequest.newBuilder(URI.create(baseUri + "/session")))
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .PUT(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8))
                .build();
        HttpResponse<String> response = send(request, "push " + session.sessionId());
        if (response.statusCode() / 100 != 2) {
            throw new RemoteAuthorityException("push " + session.sessionId() + " failed", response.statusCode());
        }
    }

    private HttpRequest.Builder authorized(HttpRequest.Builder builder) {
        if (!bearerToken.isEmpty()) {
            builder.header("Authorization", "Bearer " + bearerToken);
        }
        if (nodeId != null && !nodeId.isBlank()) {
            builder.header("X-Service-ID", nodeId);
        }
        return builder;
    }

    private HttpResponse<String> send(HttpRequest request, String what) throws RemoteAuthorityException {
        try {
            return http.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new RemoteAuthorityException(what + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RemoteAuthorityException(what + " interrupted", e);
        }
    }
}
