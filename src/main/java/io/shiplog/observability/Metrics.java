package io.shiplog.observability;

import java.util.Map;

public final class Metrics {
    public static final String FILES_ENQUEUED = "shiplog_files_enqueued_total";
    public static final String FILES_UPLOADED = "shiplog_files_uploaded_total";
    public static final String BYTES_UPLOADED = "shiplog_bytes_uploaded_total";
    public static final String UPLOAD_FAILURES = "shiplog_upload_failures_total";
    public static final String QUEUE_DEPTH = "shiplog_queue_depth";
    public static final String DISK_USAGE_PERCENT = "shiplog_disk_usage_percent";
    public static final String FILES_DELETED = "shiplog_files_deleted_total";

    public static final String LABEL_KIND = "kind";
    public static final String LABEL_POLICY = "policy";

    static final Map<String, String> HELP = Map.of(
            FILES_ENQUEUED, "Stable files added to the upload queue",
            FILES_UPLOADED, "Files uploaded to the remote store",
            BYTES_UPLOADED, "Bytes uploaded to the remote store",
            UPLOAD_FAILURES, "Failed upload attempts grouped by error kind",
            QUEUE_DEPTH, "Queue entries not permanently failed",
            DISK_USAGE_PERCENT, "Used space on the watched filesystem in percent",
            FILES_DELETED, "Local files deleted grouped by policy"
    );

    private Metrics() {
    }

    static String help(String metric) {
        return HELP.getOrDefault(metric, metric);
    }
}
