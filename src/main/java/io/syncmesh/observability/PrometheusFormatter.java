package io.syncmesh.observability;

import java.util.Map;

public final class PrometheusFormatter {
    private PrometheusFormatter() {
    }

    public static String format(SyncMetrics metrics, int queueDepth, int deadLetterDepth, String namespace) {
        StringBuilder sb = new StringBuilder();
        String ns = namespace == null || namespace.isBlank() ? null : namespace.trim();
        for (Map.Entry<String, Long> e : metrics.snapshot().entrySet()) {
            appendSample(sb, "syncmesh_" + e.getKey() + "_total", "Counter " + e.getKey().replace('_', ' '), "counter", ns, e.getValue());
        }
        appendSample(sb, "syncmesh_queue_depth", "Operations currently in the active queue", "gauge", ns, queueDepth);
        appendSample(sb, "syncmesh_dead_letter_depth", "Entries waiting in the dead-letter store", "gauge", ns, deadLetterDepth);
        return sb.toString();
    }

    private static void appendSample(StringBuilder sb, String metric, String help, String type, String namespace, long value) {
        sb.append("# HELP ").append(metric).append(' ').append(help).append('\n');
        sb.append("# TYPE ").append(metric).append(' ').append(type).append('\n');
        sb.append(metric);
        if (namespace != null) {
            sb.append("{namespace=\"").append(escapeLabel(namespace)).append("\"}");
        }
        sb.append(' ').append(value).append('\n');
    }

    private static String escapeLabel(String v) {
        return v.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
