package io.shiplog.config;

import io.shiplog.schedule.DrainSchedule;
import io.shiplog.schedule.OperationalHours;

import java.time.ZoneId;
import java.util.List;
import java.util.Objects;

public record ShipLogConfig(
        String vehicleId,
        List<WatchRule> watchRules,
        RemoteStoreSettings remote,
        UploadSettings upload,
        DrainSchedule drainSchedule,
        OperationalHours operationalHours,
        DiskThresholds disk,
        DeletionPolicy deletion,
        MonitoringSettings monitoring,
        ZoneId zone
) {
    public static final int DEFAULT_MAX_ATTEMPTS = 10;
    public static final long DEFAULT_BASE_BACKOFF_MS = 1_000L;
    public static final long DEFAULT_MAX_BACKOFF_MS = 512_000L;
    public static final int DEFAULT_STABLE_SECONDS = 60;
    public static final int DEFAULT_SCAN_MAX_AGE_DAYS = 3;
    public static final int DEFAULT_REGISTRY_RETENTION_DAYS = 30;
    public static final int DEFAULT_BATCH_SIZE = 64;
    public static final int DEFAULT_PARALLELISM = 4;
    public static final int DEFAULT_REQUEST_TIMEOUT_SECONDS = 300;
    public static final int DEFAULT_MULTIPART_THRESHOLD_MB = 5;
    public static final int DEFAULT_PART_SIZE_MB = 5;
    public static final int DEFAULT_MAX_OBJECT_GB = 5 * 1024;
    public static final int DEFAULT_PUBLISH_INTERVAL_SECONDS = 60;
    public static final String DEFAULT_STATE_DIR = "/var/lib/shiplog";

    public ShipLogConfig {
        Objects.requireNonNull(vehicleId, "vehicleId");
        watchRules = List.copyOf(watchRules);
        Objects.requireNonNull(remote, "remote");
        Objects.requireNonNull(upload, "upload");
        Objects.requireNonNull(drainSchedule, "drainSchedule");
        Objects.requireNonNull(operationalHours, "operationalHours");
        Objects.requireNonNull(disk, "disk");
        Objects.requireNonNull(deletion, "deletion");
        Objects.requireNonNull(monitoring, "monitoring");
        zone = zone == null ? ZoneId.systemDefault() : zone;
    }
}
