package io.syncmesh.http;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.syncmesh.runtime.SyncMeshRuntime;
import io.syncmesh.util.Jsons;
import io.syncmesh.webhook.WebhookRequest;
import io.syncmesh.webhook.WebhookResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Map;

public final class SyncMeshHttpServer implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SyncMeshHttpServer.class);
    private static final int MAX_BODY_BYTES = 1 << 20;

    private final SyncMeshRuntime runtime;
    private final HttpServer server;

    public SyncMeshHttpServer(SyncMeshRuntime runtime, InetSocketAddress bind) throws IOException {
        this.runtime = runtime;
        this.server = HttpServer.create(bind, 0);
        server.createContext("/webhook/notion", this::handleWebhook);
        server.createContext("/webhook/events", this::handleWebhook);
        server.createContext("/health", this::handleHealth);
        server.createContext("/metrics", this::handleMetrics);
        server.setExecutor(null);
    }

    public void start() {
        server.start();
        log.info("Listening on http://{}:{}", server.getAddress().getHostString(), port());
    }

    public int port() {
        return server.getAddress().getPort();
    }

    @Override
    public void close() {
        server.stop(0);
    }

    private void handleWebhook(HttpExchange exchange) throws IOException {
        try {
            byte[] body = readBody(exchange.getRequestBody());
            if (body == null) {
                writeJson(exchange, Map.of("status", "invalid", "message", "body too large"), 413);
                return;
            }
            WebhookResponse response = runtime.gateway().processWebhook(
                    new WebhookRequest(exchange.getRequestMethod(), exchange.getRequestHeaders(), body));
            if (response.status() == 405) {
                exchange.getResponseHeaders().set("Allow", "POST");
            }
            write(exchange, response.status(), "application/json; charset=utf-8", response.toJson());
        } catch (RuntimeException e) {
            log.error("Unhandled error on {}", exchange.getRequestURI(), e);
            writeJson(exchange, Map.of("status", "error", "message", "internal error"), 500);
        }
    }

    private void handleHealth(HttpExchange exchange) throws IOException {
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
            exchange.getResponseHeaders().set("Allow", "GET");
            writeJson(exchange, Map.of("error", "method_not_allowed"), 405);
            return;
        }
        writeJson(exchange, runtime.health(), 200);
    }

    private void handleMetrics(HttpExchange exchange) throws IOException {
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
            exchange.getResponseHeaders().set("Allow", "GET");
            writeJson(exchange, Map.of("error", "method_not_allowed"), 405);
            return;
        }
        write(exchange, 200, "text/plain; version=0.0.4; charset=utf-8", runtime.metricsText());
    }

    private static byte[] readBody(InputStream in) throws IOException {
        try (in) {
            byte[] bytes = in.readNBytes(MAX_BODY_BYTES + 1);
            return bytes.length > MAX_BODY_BYTES ? null : bytes;
        }
    }

    private static void writeJson(HttpExchange exchange, Object body, int status) throws IOException {
        write(exchange, status, "application/json; charset=utf-8", Jsons.toCompactJson(body));
    }

    private static void write(HttpExchange exchange, int status, String contentType, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", contentType);
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }
}
