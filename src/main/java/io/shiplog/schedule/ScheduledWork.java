package io.shiplog.schedule;

public interface ScheduledWork {
    void detectorTick();

    void drain();

    void deferredSweep();

    void ageSweep();

    void emergencyCheck();

    void pruneRegistry();

    void publishMetrics();
}
