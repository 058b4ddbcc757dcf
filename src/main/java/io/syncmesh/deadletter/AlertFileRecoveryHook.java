package io.syncmesh.deadletter;

import io.syncmesh.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

public final class AlertFileRecoveryHook implements RecoveryHook {
    private final Path alertsDir;
    private final Clock clock;

    public AlertFileRecoveryHook(Path alertsDir, Clock clock) {
        this.alertsDir = alertsDir;
        this.clock = clock;
    }

    @Override
    public boolean recover(DeadLetterEntry entry) throws Exception {
        Files.createDirectories(alertsDir);
        Path file = alertsDir.resolve(fileName(entry.key()));
        if (!Files.exists(file)) {
            Map<String, Object> alert = new LinkedHashMap<>();
            alert.put("alert", "operation_dead_lettered");
            alert.put("dlq_key", entry.key());
            alert.put("operation_id", entry.operation().operationId());
            alert.put("associated_identity", entry.operation().associatedIdentity());
            alert.put("sync_type", entry.operation().syncType().wire());
            alert.put("target_resource_id", entry.operation().targetResourceId());
            alert.put("retry_count", entry.operation().retryCount());
            alert.put("error", entry.operation().errorDetail());
            alert.put("dead_lettered_at", entry.deadLetteredAt() == null ? null : entry.deadLetteredAt().toString());
            alert.put("escalated_at", clock.instant().toString());
            Jsons.mapper().writeValue(file.toFile(), alert);
        }
        return Files.exists(ackFile(alertsDir, entry.key()));
    }

    public static Path acknowledge(Path alertsDir, String dlqKey, String actor, Clock clock) throws IOException {
        Files.createDirectories(alertsDir);
        Path ack = ackFile(alertsDir, dlqKey);
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("dlq_key", dlqKey);
        row.put("actor", actor);
        row.put("acknowledged_at", clock.instant().toString());
        Files.writeString(ack, Jsons.toJson(row), StandardCharsets.UTF_8);
        return ack;
    }

    static Path ackFile(Path alertsDir, String key) {
        return alertsDir.resolve(baseName(key) + ".ack");
    }

    static String fileName(String key) {
        return baseName(key) + ".json";
    }

    private static String baseName(String key) {
        StringBuilder sb = new StringBuilder(key.length());
        for (int i = 0; i < key.length(); i++) {
            char ch = key.charAt(i);
            boolean ok = Character.isLetterOrDigit(ch) || ch == '-' || ch == '_' || ch == '.';
            sb.append(ok ? ch : '_');
        }
        return sb.toString();
    }
}
