package io.shiplog.runtime;

import io.shiplog.config.DeletionPolicy;
import io.shiplog.config.ShipLogConfig;
import io.shiplog.config.WatchRule;
import io.shiplog.model.FileIdentity;
import io.shiplog.model.QueueStatus;
import io.shiplog.schedule.OperationalHours;
import io.shiplog.storage.PersistentQueue;
import io.shiplog.storage.StateCorruptedException;
import io.shiplog.support.FakeDiskProbe;
import io.shiplog.support.InMemoryObjectStore;
import io.shiplog.support.MutableClock;
import io.shiplog.support.TestConfigs;
import io.shiplog.support.TestFiles;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

final class ShipLogRuntimeScenarioTest {
    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");
    private static final String KEY = "veh-test/2024-03-01/ros/a.log";

    @Test
    void backlogFileIsUploadedOnceAcrossRestarts() throws Exception {
        Path dir = Files.createTempDirectory("shiplog-runtime-");
        try {
            Path root = Files.createDirectories(dir.resolve("logs"));
            TestFiles.write(root.resolve("a.log"), "first run", NOW.minus(Duration.ofHours(1)));
            ShipLogConfig config = TestConfigs.in(dir.resolve("state")).rules(rule(root)).uploadOnStart(true).build();
            InMemoryObjectStore store = new InMemoryObjectStore();

            MutableClock clock = new MutableClock(NOW);
            ShipLogRuntime first = runtime(config, clock, store, dir);
            first.startManual();
            first.tick();
            Assertions.assertEquals(0, store.putCalls());

            clock.advance(Duration.ofSeconds(60));
            first.tick();
            Assertions.assertEquals(1, first.queue().depth());

            clock.advance(Duration.ofMinutes(5));
            first.tick();
            Assertions.assertEquals(List.of(KEY), store.writes());
            ShipLogRuntime.ShutdownSummary summary = first.stop(Duration.ofSeconds(1));
            Assertions.assertEquals(1L, summary.filesUploaded());
            Assertions.assertEquals(0, summary.queueDepth());
            Assertions.assertTrue(Files.readString(config.monitoring().metricsFile()).contains("shiplog_files_uploaded_total 1"));

            ShipLogRuntime second = runtime(config, clock, store, dir);
            second.startManual();
            clock.advance(Duration.ofSeconds(60));
            second.tick();
            Assertions.assertEquals(0, second.queue().depth());
            Assertions.assertEquals(0, second.drainNow().attempted());
            Assertions.assertEquals(List.of(KEY), store.writes());
            second.stop(Duration.ofSeconds(1));
        } finally {
            TestFiles.deleteRecursively(dir);
        }
    }

    @Test
    void claimsLeftByACrashAreUploadedAfterRestart() throws Exception {
        Path dir = Files.createTempDirectory("shiplog-runtime-");
        try {
            Path root = Files.createDirectories(dir.resolve("logs"));
            Path file = TestFiles.write(root.resolve("a.log"), "crashed", NOW.minus(Duration.ofHours(1)));
            ShipLogConfig config = TestConfigs.in(dir.resolve("state")).rules(rule(root)).backlog(false, 3).build();
            PersistentQueue crashed = new PersistentQueue(config.upload().queueFile(), 3, 1_000L, 60_000L);
            crashed.load();
            crashed.enqueue(FileIdentity.of(file), NOW.toEpochMilli());
            crashed.dequeueBatch(10, NOW.toEpochMilli());
            Assertions.assertEquals(1, crashed.count(QueueStatus.IN_FLIGHT));

            InMemoryObjectStore store = new InMemoryObjectStore();
            ShipLogRuntime runtime = runtime(config, new MutableClock(NOW), store, dir);
            runtime.loadState();
            Assertions.assertEquals(1, runtime.queue().count(QueueStatus.PENDING));

            Assertions.assertEquals(1, runtime.drainNow().uploaded());
            Assertions.assertEquals(List.of(KEY), store.writes());
            Assertions.assertEquals(0, runtime.queue().depth());
            runtime.stop(Duration.ZERO);
        } finally {
            TestFiles.deleteRecursively(dir);
        }
    }

    @Test
    void uploadsWaitForOperationalHoursButQueueingDoesNot() throws Exception {
        Path dir = Files.createTempDirectory("shiplog-runtime-");
        try {
            Path root = Files.createDirectories(dir.resolve("logs"));
            ShipLogConfig config = TestConfigs.in(dir.resolve("state")).rules(rule(root))
                    .hours(new OperationalHours(true, LocalTime.of(22, 0), LocalTime.of(6, 0)))
                    .uploadOnStart(true)
                    .build();
            InMemoryObjectStore store = new InMemoryObjectStore();
            MutableClock clock = new MutableClock(NOW);
            ShipLogRuntime runtime = runtime(config, clock, store, dir);
            runtime.startManual();

            runtime.detector().onEvent(TestFiles.write(root.resolve("a.log"), "daytime", NOW));
            clock.advance(Duration.ofSeconds(60));
            runtime.tick();
            Assertions.assertEquals(1, runtime.queue().depth());

            clock.set(Instant.parse("2024-03-01T21:59:59Z"));
            runtime.tick();
            Assertions.assertEquals(0, store.putCalls());
            Assertions.assertTrue(runtime.scheduler().isDrainRequested());

            clock.set(Instant.parse("2024-03-01T22:00:00Z"));
            runtime.tick();
            Assertions.assertEquals(List.of(KEY), store.writes());
            runtime.stop(Duration.ZERO);
        } finally {
            TestFiles.deleteRecursively(dir);
        }
    }

    @Test
    void keepDaysZeroRemovesTheLocalCopyAfterUpload() throws Exception {
        Path dir = Files.createTempDirectory("shiplog-runtime-");
        try {
            Path root = Files.createDirectories(dir.resolve("logs"));
            Path file = TestFiles.write(root.resolve("a.log"), "ship and drop", NOW.minus(Duration.ofHours(1)));
            ShipLogConfig config = TestConfigs.in(dir.resolve("state")).rules(rule(root)).backlog(false, 3)
                    .deletion(new DeletionPolicy(
                            new DeletionPolicy.AfterUpload(true, 0),
                            new DeletionPolicy.AgeBased(false, 7, LocalTime.of(2, 0)),
                            new DeletionPolicy.Emergency(false)))
                    .build();
            InMemoryObjectStore store = new InMemoryObjectStore();
            ShipLogRuntime runtime = runtime(config, new MutableClock(NOW), store, dir);
            runtime.loadState();
            runtime.onFileStable(FileIdentity.of(file));

            Assertions.assertEquals(1, runtime.drainNow().uploaded());
            Assertions.assertFalse(Files.exists(file));
            Assertions.assertEquals(1, runtime.registry().size());
            Assertions.assertEquals(2, runtime.audit().verify());
            runtime.stop(Duration.ZERO);
        } finally {
            TestFiles.deleteRecursively(dir);
        }
    }

    @Test
    void operatorActionsReportQueueState() throws Exception {
        Path dir = Files.createTempDirectory("shiplog-runtime-");
        try {
            Path root = Files.createDirectories(dir.resolve("logs"));
            Path file = TestFiles.write(root.resolve("a.log"), "gone soon", NOW);
            ShipLogConfig config = TestConfigs.in(dir.resolve("state")).rules(rule(root)).backlog(false, 3).build();
            ShipLogRuntime runtime = runtime(config, new MutableClock(NOW), new InMemoryObjectStore(), dir);
            runtime.loadState();
            runtime.onFileStable(FileIdentity.of(file));
            Files.delete(file);
            runtime.drainNow();

            Assertions.assertEquals(1, runtime.queueEntries(true).size());
            ShipLogRuntime.StatusOutcome status = runtime.status();
            Assertions.assertEquals("veh-test", status.vehicleId());
            Assertions.assertEquals(1, status.permanentlyFailed());
            Assertions.assertEquals(0, status.pending());
            Assertions.assertFalse(status.uploadsHalted());
            Assertions.assertTrue(status.diskUsagePercent() >= 0.0d);

            Assertions.assertEquals(1, runtime.retryFailed());
            Assertions.assertEquals(1, runtime.status().pending());
            Assertions.assertThrows(IllegalArgumentException.class, () -> runtime.cleanup("everything", true));
            Assertions.assertEquals("deferred", runtime.cleanup("DEFERRED", true).policy());
        } finally {
            TestFiles.deleteRecursively(dir);
        }
    }

    @Test
    void corruptQueueStopsStartup() throws Exception {
        Path dir = Files.createTempDirectory("shiplog-runtime-");
        try {
            Path root = Files.createDirectories(dir.resolve("logs"));
            ShipLogConfig config = TestConfigs.in(dir.resolve("state")).rules(rule(root)).build();
            Files.createDirectories(config.upload().queueFile().getParent());
            Files.writeString(config.upload().queueFile(), "{\"entries\": [}");
            ShipLogRuntime runtime = runtime(config, new MutableClock(NOW), new InMemoryObjectStore(), dir);

            Assertions.assertThrows(StateCorruptedException.class, runtime::startManual);
        } finally {
            TestFiles.deleteRecursively(dir);
        }
    }

    @Test
    void stopKeepsWithinOneGracePeriodAndReleasesTheRunningUpload() throws Exception {
        Path dir = Files.createTempDirectory("shiplog-runtime-");
        ExecutorService drains = Executors.newSingleThreadExecutor();
        try {
            Path root = Files.createDirectories(dir.resolve("logs"));
            Path file = TestFiles.write(root.resolve("a.log"), "slow upload", NOW.minus(Duration.ofHours(1)));
            ShipLogConfig config = TestConfigs.in(dir.resolve("state")).rules(rule(root))
                    .backlog(false, 0).uploadOnStart(true).build();
            InMemoryObjectStore store = new InMemoryObjectStore();
            store.delayPuts(Duration.ofSeconds(5));
            ShipLogRuntime runtime = new ShipLogRuntime(config, new MutableClock(NOW), store,
                    new FakeDiskProbe(1_000_000L, 0L, dir), drains);
            runtime.startManual();
            FileIdentity id = FileIdentity.of(file);
            runtime.onFileStable(id);
            runtime.tick();
            long deadline = System.currentTimeMillis() + 5_000L;
            while (store.putCalls() == 0 && System.currentTimeMillis() < deadline) {
                Thread.sleep(20L);
            }
            Assertions.assertEquals(1, store.putCalls());

            long started = System.nanoTime();
            runtime.stop(Duration.ofSeconds(1));
            long elapsedMs = Duration.ofNanos(System.nanoTime() - started).toMillis();

            Assertions.assertTrue(elapsedMs < 1_800L, "stop took " + elapsedMs + " ms");
            Assertions.assertTrue(drains.awaitTermination(2, TimeUnit.SECONDS));
            Assertions.assertEquals(QueueStatus.PENDING, runtime.queue().find(id).orElseThrow().status());
            Assertions.assertEquals(0, runtime.queue().find(id).orElseThrow().attemptCount());
            Assertions.assertTrue(store.writes().isEmpty());
        } finally {
            drains.shutdownNow();
            TestFiles.deleteRecursively(dir);
        }
    }

    private static WatchRule rule(Path root) {
        return new WatchRule(root, "ros", null, true, true);
    }

    private static ShipLogRuntime runtime(ShipLogConfig config, MutableClock clock, InMemoryObjectStore store, Path dir) {
        return new ShipLogRuntime(config, clock, store, new FakeDiskProbe(1_000_000L, 0L, dir), Runnable::run);
    }
}
