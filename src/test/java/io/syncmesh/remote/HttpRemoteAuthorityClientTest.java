package io.syncmesh.remote;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.syncmesh.model.SessionContext;
import io.syncmesh.model.SyncStatus;
import io.syncmesh.model.VectorClock;
import io.syncmesh.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

final class HttpRemoteAuthorityClientTest {
    private static final Instant CREATED = Instant.parse("2026-10-19T10:00:00Z");

    @Test
    void fetchAndPushSpeakJsonWithServiceHeaders() throws Exception {
        Map<String, String> stored = new ConcurrentHashMap<>();
        AtomicReference<String> authorization = new AtomicReference<>();
        AtomicReference<String> serviceId = new AtomicReference<>();
        HttpServer server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/session", exchange -> {
            authorization.set(exchange.getRequestHeaders().getFirst("Authorization"));
            serviceId.set(exchange.getRequestHeaders().getFirst("X-Service-ID"));
            String path = exchange.getRequestURI().getPath();
            if ("PUT".equals(exchange.getRequestMethod()) && "/session".equals(path)) {
                String body = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
                stored.put(Jsons.compact().readTree(body).path("session_id").asText(), body);
                respond(exchange, 204, "");
                return;
            }
            String id = path.substring("/session/".length());
            String body = stored.get(id);
            respond(exchange, body == null ? 404 : 200, body == null ? "{}" : body);
        });
        server.start();
        try {
            HttpRemoteAuthorityClient client = new HttpRemoteAuthorityClient(
                    "http://127.0.0.1:" + server.getAddress().getPort() + "/", "tok-1", "node-a", Duration.ofSeconds(5));
            SessionContext session = session("s-1");

            Assertions.assertTrue(client.fetch("s-1").isEmpty());
            client.push(session);
            SessionContext fetched = client.fetch("s-1").orElseThrow();

            Assertions.assertEquals(session, fetched);
            Assertions.assertEquals("Bearer tok-1", authorization.get());
            Assertions.assertEquals("node-a", serviceId.get());
        } finally {
            server.stop(0);
        }
    }

    @Test
    void serverErrorsSurfaceWithStatus() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        HttpServer server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/session", exchange -> {
            calls.incrementAndGet();
            exchange.getRequestBody().readAllBytes();
            respond(exchange, 503, "{\"error\":\"busy\"}");
        });
        server.start();
        try {
            HttpRemoteAuthorityClient client = new HttpRemoteAuthorityClient(
                    "http://127.0.0.1:" + server.getAddress().getPort(), "", "node-a", Duration.ofSeconds(5));

            RemoteAuthorityException fetchError = Assertions.assertThrows(RemoteAuthorityException.class,
                    () -> client.fetch("s-2"));
            RemoteAuthorityException pushError = Assertions.assertThrows(RemoteAuthorityException.class,
                    () -> client.push(session("s-2")));

            Assertions.assertEquals(503, fetchError.statusCode());
            Assertions.assertEquals(503, pushError.statusCode());
            Assertions.assertEquals(2, calls.get());
        } finally {
            server.stop(0);
        }
    }

    @Test
    void unreachableAuthorityIsANetworkError() {
        HttpRemoteAuthorityClient client = new HttpRemoteAuthorityClient(
                "http://127.0.0.1:1", "", "node-a", Duration.ofSeconds(2));

        RemoteAuthorityException error = Assertions.assertThrows(RemoteAuthorityException.class,
                () -> client.fetch("s-3"));
        Assertions.assertEquals(-1, error.statusCode());
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> new HttpRemoteAuthorityClient(" ", "", "node-a", Duration.ofSeconds(1)));
    }

    private static SessionContext session(String id) {
        return new SessionContext(id, "PEO-001", "node-a", CREATED, CREATED.plusSeconds(3600), 3,
                Set.of("read", "write"), VectorClock.of(Map.of("node-a", 2, "node-b", 1)), SyncStatus.PENDING);
    }

    private static void respond(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length == 0 ? -1 : bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }
}
