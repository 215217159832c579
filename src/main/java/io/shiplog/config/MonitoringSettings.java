package io.shiplog.config;

import java.nio.file.Path;
import java.time.Duration;

public record MonitoringSettings(Path metricsFile, Path auditFile, Duration publishInterval) {
}
