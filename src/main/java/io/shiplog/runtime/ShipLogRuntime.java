package io.shiplog.runtime;

import io.shiplog.config.ShipLogConfig;
import io.shiplog.config.WatchRule;
import io.shiplog.deletion.DeletionDecision;
import io.shiplog.deletion.DeletionSafetyManager;
import io.shiplog.deletion.DiskUsageProbe;
import io.shiplog.deletion.FileStoreDiskUsageProbe;
import io.shiplog.deletion.SweepResult;
import io.shiplog.detect.BacklogScanner;
import io.shiplog.detect.DirectoryWatcher;
import io.shiplog.detect.RuleMatcher;
import io.shiplog.detect.StabilityDetector;
import io.shiplog.model.FileIdentity;
import io.shiplog.model.QueueEntry;
import io.shiplog.model.QueueStatus;
import io.shiplog.observability.AuditLogger;
import io.shiplog.observability.Metrics;
import io.shiplog.observability.MetricsFileExporter;
import io.shiplog.observability.MetricsRegistry;
import io.shiplog.remote.ObjectStoreClient;
import io.shiplog.remote.ObjectStoreFactory;
import io.shiplog.schedule.Cadence;
import io.shiplog.schedule.ScheduledWork;
import io.shiplog.schedule.Scheduler;
import io.shiplog.storage.PersistentQueue;
import io.shiplog.storage.ProcessedFileRegistry;
import io.shiplog.upload.DrainResult;
import io.shiplog.upload.RemoteKeyBuilder;
import io.shiplog.upload.UploadEngine;
import io.shiplog.util.ByteSizes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;

public final class ShipLogRuntime implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ShipLogRuntime.class);

    private final ShipLogConfig config;
    private final Clock clock;
    private final RuleMatcher rules;
    private final PersistentQueue queue;
    private final ProcessedFileRegistry registry;
    private final MetricsRegistry metrics;
    private final MetricsFileExporter exporter;
    private final AuditLogger audit;
    private final StabilityDetector detector;
    private final BacklogScanner backlog;
    private final DirectoryWatcher watcher;
    private final UploadEngine engine;
    private final DeletionSafetyManager deletion;
    private final ObjectStoreClient store;
    private final Scheduler scheduler;
    private final AtomicBoolean stateLoaded = new AtomicBoolean(false);
    private final AtomicBoolean initialized = new AtomicBoolean(false);
    private final AtomicBoolean running = new AtomicBoolean(false);
    private Instant startedAt;

    public ShipLogRuntime(ShipLogConfig config, Clock clock, ObjectStoreClient store, DiskUsageProbe diskProbe, Executor drainExecutor) {
        this.config = config;
        this.clock = clock;
        this.store = store;
        this.rules = new RuleMatcher(config.watchRules());
        this.queue = new PersistentQueue(
                config.upload().queueFile(),
                config.upload().retry().maxAttempts(),
                config.upload().retry().baseBackoff().toMillis(),
                config.upload().retry().maxBackoff().toMillis());
        this.registry = new ProcessedFileRegistry(config.upload().registryFile(), config.upload().registryRetentionDays());
        this.metrics = new MetricsRegistry();
        this.exporter = new MetricsFileExporter(config.monitoring().metricsFile(), metrics, config.vehicleId());
        this.audit = new AuditLogger(config.monitoring().auditFile(), config.vehicleId(), clock);
        this.detector = new StabilityDetector(clock, rules, config.upload().stableQuietPeriod(), this::onFileStable);
        this.backlog = new BacklogScanner(clock, rules, detector);
        this.watcher = new DirectoryWatcher(rules, detector);
        this.engine = new UploadEngine(
                queue,
                registry,
                store,
                new RemoteKeyBuilder(config.vehicleId(), rules, config.zone()),
                rules,
                config.upload().transfer(),
                config.upload().stableQuietPeriod(),
                clock,
                metrics,
                audit);
        this.deletion = new DeletionSafetyManager(
                rules, registry, config.deletion(), config.disk(), diskProbe, clock, metrics, audit);
        this.engine.setListener(deletion::onUploaded);
        Cadence cadence = Cadence.standard(
                config.monitoring().publishInterval(),
                config.deletion().ageBased().enabled() ? config.deletion().ageBased().scheduleTime() : null);
        Work work = new Work();
        this.scheduler = drainExecutor == null
                ? Scheduler.withDrainThread(clock, config.zone(), config.drainSchedule(), config.operationalHours(),
                config.upload().uploadOnStart(), cadence, work)
                : new Scheduler(clock, config.zone(), config.drainSchedule(), config.operationalHours(),
                config.upload().uploadOnStart(), cadence, work, drainExecutor);
    }

    public static ShipLogRuntime create(ShipLogConfig config) {
        ObjectStoreClient store = ObjectStoreFactory.create(config.remote(), config.upload().transfer().requestTimeout());
        return new ShipLogRuntime(config, Clock.systemUTC(), store, new FileStoreDiskUsageProbe(diskProbePath(config)), null);
    }

    private static Path diskProbePath(ShipLogConfig config) {
        for (WatchRule rule : config.watchRules()) {
            if (Files.isDirectory(rule.rootPath())) {
                return rule.rootPath();
            }
        }
        Path parent = config.upload().queueFile().getParent();
        return parent != null && Files.isDirectory(parent) ? parent : Path.of("/");
    }

    public void loadState() {
        if (!stateLoaded.compareAndSet(false, true)) {
            return;
        }
        int recovered = queue.load();
        registry.load();
        metrics.gauge(Metrics.QUEUE_DEPTH, queue.depth());
        if (recovered > 0) {
            log.info("{} uploads interrupted by the previous shutdown will be retried", recovered);
        }
    }

    public void init() {
        if (!initialized.compareAndSet(false, true)) {
            return;
        }
        loadState();
        deletion.runEmergencyCleanup(false);
        if (config.upload().backlogScan().enabled()) {
            backlog.scan(config.upload().backlogScan().maxAgeDays());
        }
    }

    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        init();
        startedAt = clock.instant();
        watcher.start();
        scheduler.startTicking();
        log.info("shiplog started for vehicle {} watching {} directories", config.vehicleId(), config.watchRules().size());
    }

    public void startManual() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        init();
        startedAt = clock.instant();
        scheduler.start();
    }

    public void tick() {
        scheduler.tick();
    }

    public ShutdownSummary stop(Duration grace) {
        if (!running.compareAndSet(true, false)) {
            return summary();
        }
        log.info("Stopping shiplog (grace period {})", grace);
        long deadline = System.nanoTime() + grace.toNanos();
        engine.requestStop();
        scheduler.stop(remaining(deadline));
        watcher.close(remaining(deadline));
        engine.stop(remaining(deadline));
        store.close();
        queue.flush();
        registry.flush();
        metrics.gauge(Metrics.QUEUE_DEPTH, queue.depth());
        exporter.publish();
        ShutdownSummary summary = summary();
        log.info("Statistics: uploaded {} files ({}), {} failed attempts, {} files deleted, {} entries still queued, uptime {}",
                summary.filesUploaded(), ByteSizes.format(summary.bytesUploaded()), summary.uploadFailures(),
                summary.filesDeleted(), summary.queueDepth(), summary.uptime());
        return summary;
    }

    @Override
    public void close() {
        if (running.get()) {
            stop(Duration.ZERO);
            return;
        }
        if (stateLoaded.get()) {
            engine.close();
        }
        store.close();
    }

    private static Duration remaining(long deadlineNanos) {
        return Duration.ofNanos(Math.max(0L, deadlineNanos - System.nanoTime()));
    }

    void onFileStable(FileIdentity identity) {
        long now = clock.millis();
        if (registry.shouldSkip(identity, now)) {
            log.debug("Stable file already uploaded, not queueing: {}", identity.path());
            return;
        }
        PersistentQueue.EnqueueResult result = queue.enqueue(identity, now);
        if (result != PersistentQueue.EnqueueResult.DUPLICATE) {
            metrics.increment(Metrics.FILES_ENQUEUED, 1L);
            metrics.gauge(Metrics.QUEUE_DEPTH, queue.depth());
            log.info("Queued {} ({}){}", identity.path(), ByteSizes.format(identity.sizeBytes()),
                    result == PersistentQueue.EnqueueResult.SUPERSEDED ? ", replacing older version" : "");
        }
    }

    public DrainResult drainNow() {
        loadState();
        return engine.drain();
    }

    public SweepResult cleanup(String policy, boolean dryRun) {
        loadState();
        switch (policy.toLowerCase(Locale.ROOT)) {
            case DeletionSafetyManager.POLICY_DEFERRED:
                return deletion.runDeferredSweep(dryRun);
            case DeletionSafetyManager.POLICY_AGE:
                return deletion.runAgeSweep(dryRun);
            case DeletionSafetyManager.POLICY_EMERGENCY:
                return deletion.runEmergencyCleanup(dryRun);
            default:
                throw new IllegalArgumentException("Unknown cleanup policy: " + policy + " (deferred|age|emergency)");
        }
    }

    public DeletionDecision evaluateDeletion(Path file) {
        return deletion.evaluate(file);
    }

    public int retryFailed() {
        loadState();
        int count = queue.retryFailed(clock.millis());
        log.info("Reset {} permanently failed entries to pending", count);
        return count;
    }

    public int pruneRegistry() {
        loadState();
        return registry.prune(clock.millis(), queue.identityHashes());
    }

    public List<QueueEntry> queueEntries(boolean failedOnly) {
        loadState();
        List<QueueEntry> all = queue.snapshot();
        if (!failedOnly) {
            return all;
        }
        return all.stream().filter(e -> e.status() == QueueStatus.PERMANENTLY_FAILED).toList();
    }

    public StatusOutcome status() {
        loadState();
        DiskUsageProbe.DiskUsage usage = deletion.probeDisk();
        return new StatusOutcome(
                config.vehicleId(),
                queue.count(QueueStatus.PENDING),
                queue.count(QueueStatus.IN_FLIGHT),
                queue.count(QueueStatus.PERMANENTLY_FAILED),
                registry.size(),
                usage == null ? -1.0d : usage.usedPercent(),
                usage == null ? -1L : usage.usableBytes(),
                engine.isHalted());
    }

    public ShutdownSummary summary() {
        Duration uptime = startedAt == null ? Duration.ZERO : Duration.between(startedAt, clock.instant());
        return new ShutdownSummary(
                metrics.counter(Metrics.FILES_UPLOADED),
                metrics.counter(Metrics.BYTES_UPLOADED),
                metrics.counterTotal(Metrics.UPLOAD_FAILURES),
                metrics.counterTotal(Metrics.FILES_DELETED),
                stateLoaded.get() ? queue.depth() : 0,
                uptime);
    }

    public ShipLogConfig config() {
        return config;
    }

    public PersistentQueue queue() {
        return queue;
    }

    public ProcessedFileRegistry registry() {
        return registry;
    }

    public MetricsRegistry metrics() {
        return metrics;
    }

    public StabilityDetector detector() {
        return detector;
    }

    public Scheduler scheduler() {
        return scheduler;
    }

    public UploadEngine engine() {
        return engine;
    }

    public DeletionSafetyManager deletion() {
        return deletion;
    }

    public AuditLogger audit() {
        return audit;
    }

    private final class Work implements ScheduledWork {
        @Override
        public void detectorTick() {
            detector.tick();
        }

        @Override
        public void drain() {
            engine.drain();
        }

        @Override
        public void deferredSweep() {
            deletion.runDeferredSweep(false);
        }

        @Override
        public void ageSweep() {
            deletion.runAgeSweep(false);
        }

        @Override
        public void emergencyCheck() {
            deletion.runEmergencyCleanup(false);
        }

        @Override
        public void pruneRegistry() {
            registry.prune(clock.millis(), queue.identityHashes());
        }

        @Override
        public void publishMetrics() {
            metrics.gauge(Metrics.QUEUE_DEPTH, queue.depth());
            deletion.probeDisk();
            exporter.publish();
        }
    }

    public record StatusOutcome(
            String vehicleId,
            int pending,
            int inFlight,
            int permanentlyFailed,
            int registryRecords,
            double diskUsagePercent,
            long diskFreeBytes,
            boolean uploadsHalted
    ) {
    }

    public record ShutdownSummary(
            long filesUploaded,
            long bytesUploaded,
            long uploadFailures,
            long filesDeleted,
            int queueDepth,
            Duration uptime
    ) {
    }
}
