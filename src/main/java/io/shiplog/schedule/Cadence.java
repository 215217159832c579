package io.shiplog.schedule;

import java.time.Duration;
import java.time.LocalTime;

public record Cadence(
        Duration tick,
        Duration deferredSweep,
        Duration emergencyCheck,
        Duration registryPrune,
        Duration metricsPublish,
        LocalTime ageSweepTime
) {
    public static Cadence standard(Duration metricsPublish, LocalTime ageSweepTime) {
        return new Cadence(Duration.ofSeconds(1), Duration.ofHours(1), Duration.ofMinutes(1), Duration.ofHours(1),
                metricsPublish, ageSweepTime);
    }
}
