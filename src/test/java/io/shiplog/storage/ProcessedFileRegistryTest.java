package io.shiplog.storage;

import io.shiplog.model.FileIdentity;
import io.shiplog.model.RegistryRecord;
import io.shiplog.support.TestFiles;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Set;

final class ProcessedFileRegistryTest {
    private static final long DAY = Duration.ofDays(1).toMillis();

    @Test
    void skipsOnlyTheExactUploadedIdentity() throws Exception {
        Path dir = Files.createTempDirectory("shiplog-registry-");
        try {
            ProcessedFileRegistry registry = open(dir);
            FileIdentity uploaded = new FileIdentity("/logs/a.log", 10L, 1_000L);
            RegistryRecord record = registry.record(uploaded, "veh/2024-01-01/ros/a.log", 5_000L);

            Assertions.assertEquals(5_000L + 30 * DAY, record.expiresAtMs());
            Assertions.assertTrue(registry.shouldSkip(uploaded, 6_000L));
            Assertions.assertFalse(registry.shouldSkip(new FileIdentity("/logs/a.log", 11L, 1_000L), 6_000L));
            Assertions.assertFalse(registry.shouldSkip(new FileIdentity("/logs/a.log", 10L, 1_001L), 6_000L));
            Assertions.assertFalse(registry.shouldSkip(uploaded, record.expiresAtMs()));
        } finally {
            TestFiles.deleteRecursively(dir);
        }
    }

    @Test
    void recordsSurviveReload() throws Exception {
        Path dir = Files.createTempDirectory("shiplog-registry-");
        try {
            FileIdentity id = new FileIdentity("/logs/a.log", 10L, 1_000L);
            open(dir).record(id, "key", 5_000L);

            ProcessedFileRegistry reloaded = open(dir);
            Assertions.assertEquals(1, reloaded.size());
            Assertions.assertEquals("key", reloaded.find(id).orElseThrow().remoteKey());
            Assertions.assertTrue(reloaded.shouldSkip(id, 6_000L));
        } finally {
            TestFiles.deleteRecursively(dir);
        }
    }

    @Test
    void pruneKeepsLiveAndQueuedRecords() throws Exception {
        Path dir = Files.createTempDirectory("shiplog-registry-");
        try {
            ProcessedFileRegistry registry = open(dir);
            FileIdentity old = new FileIdentity("/logs/old.log", 1L, 1L);
            FileIdentity queued = new FileIdentity("/logs/queued.log", 1L, 1L);
            FileIdentity fresh = new FileIdentity("/logs/fresh.log", 1L, 1L);
            registry.record(old, "k1", 0L);
            registry.record(queued, "k2", 0L);
            registry.record(fresh, "k3", 20 * DAY);

            Assertions.assertEquals(1, registry.prune(31 * DAY, Set.of(queued.hash())));
            Assertions.assertTrue(registry.find(old).isEmpty());
            Assertions.assertTrue(registry.find(queued).isPresent());
            Assertions.assertTrue(registry.find(fresh).isPresent());
            Assertions.assertEquals(2, open(dir).size());
        } finally {
            TestFiles.deleteRecursively(dir);
        }
    }

    @Test
    void failedWriteDoesNotRegisterInMemory() throws Exception {
        Path dir = Files.createTempDirectory("shiplog-registry-");
        try {
            ProcessedFileRegistry registry = open(dir);
            FileIdentity id = new FileIdentity("/logs/a.log", 10L, 1_000L);
            Path blocker = Files.createDirectory(dir.resolve("registry.json.tmp"));

            Assertions.assertThrows(RuntimeException.class, () -> registry.record(id, "key", 5_000L));
            Assertions.assertFalse(registry.shouldSkip(id, 6_000L));

            Files.delete(blocker);
            registry.record(id, "key", 5_000L);
            Assertions.assertTrue(open(dir).shouldSkip(id, 6_000L));
        } finally {
            TestFiles.deleteRecursively(dir);
        }
    }

    @Test
    void corruptDocumentStopsStartup() throws Exception {
        Path dir = Files.createTempDirectory("shiplog-registry-");
        try {
            Files.writeString(dir.resolve("registry.json"), "not json");
            ProcessedFileRegistry registry = new ProcessedFileRegistry(dir.resolve("registry.json"), 30);
            Assertions.assertThrows(StateCorruptedException.class, registry::load);
        } finally {
            TestFiles.deleteRecursively(dir);
        }
    }

    private static ProcessedFileRegistry open(Path dir) {
        ProcessedFileRegistry registry = new ProcessedFileRegistry(dir.resolve("registry.json"), 30);
        registry.load();
        return registry;
    }
}
