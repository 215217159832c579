package io.shiplog.config;

public record DiskThresholds(double warning, double critical, long reservedBytes) {
    public DiskThresholds {
        if (warning <= 0.0d || warning >= 1.0d) {
            throw new ConfigValidationException("disk.warning_threshold", "must be between 0 and 1, got " + warning);
        }
        if (critical <= 0.0d || critical > 1.0d) {
            throw new ConfigValidationException("disk.critical_threshold", "must be between 0 and 1, got " + critical);
        }
        if (critical <= warning) {
            throw new ConfigValidationException("disk.critical_threshold",
                    "must be greater than warning_threshold (" + critical + " <= " + warning + ")");
        }
        if (reservedBytes < 0L) {
            throw new ConfigValidationException("disk.reserved_gb", "must be >= 0");
        }
    }
}
