package io.syncmesh.webhook;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

public record WebhookRequest(String method, Map<String, List<String>> headers, byte[] body) {
    public WebhookRequest {
        method = method == null ? "" : method.trim().toUpperCase(Locale.ROOT);
        TreeMap<String, List<String>> normalized = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (headers != null) {
            for (Map.Entry<String, List<String>> e : headers.entrySet()) {
                if (e.getKey() != null && e.getValue() != null) {
                    normalized.put(e.getKey(), List.copyOf(e.getValue()));
                }
            }
        }
        headers = normalized;
        body = body == null ? new byte[0] : body;
    }

    public static WebhookRequest post(Map<String, String> headers, byte[] body) {
        TreeMap<String, List<String>> multi = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        headers.forEach((k, v) -> multi.put(k, List.of(v)));
        return new WebhookRequest("POST", multi, body);
    }

    public String header(String name) {
        List<String> values = headers.get(name);
        return values == null || values.isEmpty() ? null : values.get(0);
    }
}
