package io.shiplog.config;

import java.nio.file.Path;
import java.time.Duration;

public record UploadSettings(
        Duration stableQuietPeriod,
        BacklogScan backlogScan,
        Path queueFile,
        Path registryFile,
        int registryRetentionDays,
        boolean uploadOnStart,
        RetrySettings retry,
        TransferSettings transfer
) {
    // maxAgeDays == 0 scans without an age limit
    public record BacklogScan(boolean enabled, int maxAgeDays) {
    }

    public record RetrySettings(int maxAttempts, Duration baseBackoff, Duration maxBackoff) {
    }

    public record TransferSettings(
            int batchSize,
            int parallelism,
            Duration requestTimeout,
            long multipartThreshold,
            long partSize,
            long maxObjectBytes
    ) {
    }
}
