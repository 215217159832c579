package io.shiplog.deletion;

import java.io.IOException;

@FunctionalInterface
public interface DiskUsageProbe {
    DiskUsage probe() throws IOException;

    record DiskUsage(long totalBytes, long usableBytes) {
        public double usedFraction() {
            if (totalBytes <= 0L) {
                return 0.0d;
            }
            return (double) (totalBytes - usableBytes) / (double) totalBytes;
        }

        public double usedPercent() {
            return usedFraction() * 100.0d;
        }

        public DiskUsage freed(long bytes) {
            return new DiskUsage(totalBytes, Math.min(totalBytes, usableBytes + bytes));
        }
    }
}
