package io.shiplog.observability;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

public final class PrometheusFormatter {
    private PrometheusFormatter() {
    }

    public static String format(MetricsRegistry.Snapshot snapshot, String vehicleId) {
        StringBuilder sb = new StringBuilder();
        Set<String> described = new HashSet<>();
        for (MetricsRegistry.Sample sample : snapshot.counters()) {
            appendSample(sb, described, "counter", sample);
        }
        for (MetricsRegistry.Sample sample : snapshot.gauges()) {
            appendSample(sb, described, "gauge", sample);
        }
        if (vehicleId != null && !vehicleId.isBlank()) {
            sb.append("# HELP shiplog_vehicle_info Vehicle this daemon ships logs for\n");
            sb.append("# TYPE shiplog_vehicle_info gauge\n");
            sb.append("shiplog_vehicle_info{vehicle_id=\"").append(escapeLabel(vehicleId.trim())).append("\"} 1\n");
        }
        return sb.toString();
    }

    private static void appendSample(StringBuilder sb, Set<String> described, String type, MetricsRegistry.Sample sample) {
        String metric = sample.metric();
        if (described.add(metric)) {
            sb.append("# HELP ").append(metric).append(' ').append(Metrics.help(metric)).append('\n');
            sb.append("# TYPE ").append(metric).append(' ').append(type).append('\n');
        }
        sb.append(metric);
        if (sample.label() != null && sample.labelValue() != null) {
            sb.append('{').append(sample.label()).append("=\"").append(escapeLabel(sample.labelValue())).append("\"}");
        }
        sb.append(' ').append(formatValue(sample.value())).append('\n');
    }

    private static String formatValue(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value)) {
            return Long.toString((long) value);
        }
        return String.format(Locale.ROOT, "%.2f", value);
    }

    private static String escapeLabel(String v) {
        return v.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
