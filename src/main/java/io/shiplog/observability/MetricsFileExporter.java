package io.shiplog.observability;

import io.shiplog.util.AtomicFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;

public final class MetricsFileExporter {
    private static final Logger log = LoggerFactory.getLogger(MetricsFileExporter.class);

    private final Path file;
    private final MetricsRegistry registry;
    private final String vehicleId;

    public MetricsFileExporter(Path file, MetricsRegistry registry, String vehicleId) {
        this.file = file;
        this.registry = registry;
        this.vehicleId = vehicleId;
    }

    public Path file() {
        return file;
    }

    public boolean publish() {
        try {
            AtomicFiles.writeString(file, PrometheusFormatter.format(registry.snapshot(), vehicleId));
            return true;
        } catch (IOException e) {
            log.warn("Failed to publish metrics to {}: {}", file, e.toString());
            return false;
        }
    }
}
