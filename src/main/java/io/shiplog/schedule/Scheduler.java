package io.shiplog.schedule;

import io.shiplog.util.Threads;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drives every time-based transition of the daemon from one {@link #tick()}.
 *
 * <p>Drain timing and drain permission are separate: a due schedule only raises a drain
 * request, and a request is served on the first tick where the operational-hours window
 * permits. Enqueueing is never gated.
 */
public final class Scheduler implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    private final Clock clock;
    private final ZoneId zone;
    private final DrainSchedule schedule;
    private final OperationalHours hours;
    private final boolean uploadOnStart;
    private final Cadence cadence;
    private final ScheduledWork work;
    private final Executor drainExecutor;
    private final AtomicBoolean drainRequested = new AtomicBoolean(false);
    private final AtomicBoolean draining = new AtomicBoolean(false);
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private final DrainSchedule ageSweepSchedule;

    private ScheduledExecutorService ticker;
    private ScheduledFuture<?> tickFuture;
    private Instant lastDrainFire;
    private Instant lastAgeSweep;
    private volatile Instant lastDeferredSweep;
    private Instant lastEmergencyCheck;
    private Instant lastPrune;
    private Instant lastMetricsPublish;
    private boolean deferralLogged;

    public Scheduler(
            Clock clock,
            ZoneId zone,
            DrainSchedule schedule,
            OperationalHours hours,
            boolean uploadOnStart,
            Cadence cadence,
            ScheduledWork work,
            Executor drainExecutor
    ) {
        this.clock = clock;
        this.zone = zone;
        this.schedule = schedule;
        this.hours = hours;
        this.uploadOnStart = uploadOnStart;
        this.cadence = cadence;
        this.work = work;
        this.drainExecutor = drainExecutor;
        this.ageSweepSchedule = cadence.ageSweepTime() == null ? null : DrainSchedule.daily(cadence.ageSweepTime());
    }

    public static Scheduler withDrainThread(
            Clock clock,
            ZoneId zone,
            DrainSchedule schedule,
            OperationalHours hours,
            boolean uploadOnStart,
            Cadence cadence,
            ScheduledWork work
    ) {
        ExecutorService drains = Executors.newSingleThreadExecutor(Threads.daemonFactory("shiplog-drain"));
        return new Scheduler(clock, zone, schedule, hours, uploadOnStart, cadence, work, drains);
    }

    public synchronized void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        Instant now = clock.instant();
        lastDrainFire = now;
        lastAgeSweep = now;
        lastDeferredSweep = now;
        lastEmergencyCheck = now;
        lastPrune = now;
        lastMetricsPublish = now;
        if (uploadOnStart) {
            drainRequested.set(true);
            log.info("Upload on start: drain requested");
        }
        log.info("Scheduler started: drain {}, operational hours {}", schedule.describe(),
                hours.enabled() ? hours.start() + "-" + hours.end() : "always");
    }

    public synchronized void startTicking() {
        start();
        if (ticker != null) {
            return;
        }
        ticker = Executors.newSingleThreadScheduledExecutor(Threads.daemonFactory("shiplog-tick"));
        long periodMs = cadence.tick().toMillis();
        tickFuture = ticker.scheduleWithFixedDelay(this::tick, 0L, periodMs, TimeUnit.MILLISECONDS);
    }

    public synchronized void tick() {
        if (stopped.get()) {
            return;
        }
        if (!started.get()) {
            start();
        }
        Instant now = clock.instant();
        run("detector", work::detectorTick);
        checkDrain(now);
        if (ageSweepSchedule != null && ageSweepSchedule.isDue(lastAgeSweep, now, zone)) {
            lastAgeSweep = now;
            run("age sweep", work::ageSweep);
        }
        if (elapsed(lastDeferredSweep, now, cadence.deferredSweep())) {
            lastDeferredSweep = now;
            run("deferred sweep", work::deferredSweep);
        }
        if (elapsed(lastEmergencyCheck, now, cadence.emergencyCheck())) {
            lastEmergencyCheck = now;
            run("emergency check", work::emergencyCheck);
        }
        if (elapsed(lastPrune, now, cadence.registryPrune())) {
            lastPrune = now;
            run("registry prune", work::pruneRegistry);
        }
        if (elapsed(lastMetricsPublish, now, cadence.metricsPublish())) {
            lastMetricsPublish = now;
            run("metrics publish", work::publishMetrics);
        }
    }

    private void checkDrain(Instant now) {
        if (schedule.isDue(lastDrainFire, now, zone)) {
            lastDrainFire = now;
            if (drainRequested.compareAndSet(false, true)) {
                log.info("Scheduled drain due ({})", schedule.describe());
            }
        }
        if (!drainRequested.get()) {
            return;
        }
        LocalTime local = now.atZone(zone).toLocalTime();
        if (!hours.permits(local)) {
            if (!deferralLogged) {
                log.info("Drain deferred: {} is outside operational hours {}-{}", local.withNano(0), hours.start(), hours.end());
                deferralLogged = true;
            }
            return;
        }
        deferralLogged = false;
        if (!draining.compareAndSet(false, true)) {
            return;
        }
        drainRequested.set(false);
        try {
            drainExecutor.execute(() -> {
                try {
                    run("drain", work::drain);
                    lastDeferredSweep = clock.instant();
                    run("deferred sweep", work::deferredSweep);
                } finally {
                    draining.set(false);
                }
            });
        } catch (RejectedExecutionException e) {
            draining.set(false);
            drainRequested.set(true);
            log.warn("Drain rejected, executor is shutting down");
        }
    }

    public boolean isDrainRequested() {
        return drainRequested.get();
    }

    public boolean isDraining() {
        return draining.get();
    }

    public void requestDrain() {
        drainRequested.set(true);
    }

    public synchronized void stop(Duration grace) {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        long deadline = System.nanoTime() + grace.toNanos();
        if (tickFuture != null) {
            tickFuture.cancel(false);
        }
        if (ticker != null) {
            ticker.shutdown();
        }
        if (drainExecutor instanceof ExecutorService) {
            ExecutorService drains = (ExecutorService) drainExecutor;
            drains.shutdown();
            try {
                if (!drains.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                    log.warn("Drain still running after {} grace period", grace);
                    drains.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                drains.shutdownNow();
            }
        }
        if (ticker != null) {
            try {
                ticker.awaitTermination(Math.max(0L, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        log.info("Scheduler stopped");
    }

    @Override
    public void close() {
        stop(Duration.ZERO);
    }

    private static boolean elapsed(Instant last, Instant now, Duration period) {
        return !now.isBefore(last.plus(period));
    }

    private static void run(String name, Runnable activity) {
        try {
            activity.run();
        } catch (RuntimeException e) {
            log.error("Scheduled {} failed", name, e);
        }
    }
}
