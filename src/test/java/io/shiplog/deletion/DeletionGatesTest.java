package io.shiplog.deletion;

import io.shiplog.config.DeletionPolicy;
import io.shiplog.config.DiskThresholds;
import io.shiplog.config.WatchRule;
import io.shiplog.detect.RuleMatcher;
import io.shiplog.storage.ProcessedFileRegistry;
import io.shiplog.support.MutableClock;
import io.shiplog.support.TestFiles;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

final class DeletionGatesTest {

    @Test
    void systemLocationsAreProtected() {
        Assertions.assertTrue(DeletionGates.isProtected(Path.of("/etc/passwd")));
        Assertions.assertTrue(DeletionGates.isProtected(Path.of("/usr/lib/x86_64/libc.so")));
        Assertions.assertTrue(DeletionGates.isProtected(Path.of("/var/log/syslog")));
        Assertions.assertTrue(DeletionGates.isProtected(Path.of("/opt/install.log")));
        Assertions.assertTrue(DeletionGates.isProtected(Path.of("/vmlinuz")));
        Assertions.assertTrue(DeletionGates.isProtected(Path.of("/")));
        Assertions.assertFalse(DeletionGates.isProtected(Path.of("/var/log/autoware/planning.log")));
        Assertions.assertFalse(DeletionGates.isProtected(Path.of("/opt/stack/logs/run.log")));
        Assertions.assertFalse(DeletionGates.isProtected(Path.of("/data/logs/a.log")));
    }

    @Test
    void eachRuleGateVetoesIndependently() {
        Path root = Path.of("/data/logs");
        Path nested = Path.of("/data/logs/sub/a.bag");

        Assertions.assertFalse(DeletionGates.ALLOW_DELETION.gate()
                .check(nested, new WatchRule(root, "r", null, true, false)).allowed());
        Assertions.assertFalse(DeletionGates.RECURSIVE.gate()
                .check(nested, new WatchRule(root, "r", null, false, true)).allowed());
        Assertions.assertTrue(DeletionGates.RECURSIVE.gate()
                .check(Path.of("/data/logs/a.bag"), new WatchRule(root, "r", null, false, true)).allowed());
        Assertions.assertFalse(DeletionGates.PATTERN.gate()
                .check(nested, new WatchRule(root, "r", "*.log", true, true)).allowed());
        Assertions.assertTrue(DeletionGates.PATTERN.gate()
                .check(nested, new WatchRule(root, "r", "*.bag", true, true)).allowed());
    }

    @Test
    void firstVetoWinsAndThrowingGateCountsAsVeto() throws Exception {
        Path root = Files.createTempDirectory("shiplog-gates-");
        try {
            Path file = TestFiles.write(root.resolve("a.log"), "x", Instant.now());
            WatchRule rule = new WatchRule(root, "logs", "*.bag", true, true);

            DeletionSafetyManager standard = manager(root, rule, DeletionGates.standard());
            DeletionDecision decision = standard.evaluate(file);
            Assertions.assertFalse(decision.allowed());
            Assertions.assertEquals("pattern", decision.gate());

            DeletionSafetyManager broken = manager(root, rule, List.of(
                    new DeletionGates.NamedGate("exploding", (f, r) -> {
                        throw new IllegalStateException("boom");
                    }),
                    DeletionGates.PATTERN));
            DeletionDecision vetoed = broken.evaluate(file);
            Assertions.assertFalse(vetoed.allowed());
            Assertions.assertEquals("exploding", vetoed.gate());

            Assertions.assertFalse(broken.deleteIfSafe(file, "manual"));
            Assertions.assertTrue(Files.exists(file));
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void fileOutsideEveryRuleHasNoOwner() throws Exception {
        Path root = Files.createTempDirectory("shiplog-gates-");
        try {
            Path watched = Files.createDirectories(root.resolve("watched"));
            Path stray = TestFiles.write(root.resolve("stray.log"), "x", Instant.now());
            DeletionSafetyManager manager = manager(root, new WatchRule(watched, "logs", null, true, true), DeletionGates.standard());

            DeletionDecision decision = manager.evaluate(stray);
            Assertions.assertEquals("owner", decision.gate());
            Assertions.assertTrue(manager.evaluate(watched.resolve("x.log")).allowed());
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    private static DeletionSafetyManager manager(Path dir, WatchRule rule, List<DeletionGates.NamedGate> gates) {
        ProcessedFileRegistry registry = new ProcessedFileRegistry(dir.resolve("registry.json"), 30);
        registry.load();
        return new DeletionSafetyManager(new RuleMatcher(List.of(rule)), registry, DeletionPolicy.defaults(),
                new DiskThresholds(0.8d, 0.9d, 0L), () -> new DiskUsageProbe.DiskUsage(100L, 50L),
                new MutableClock(Instant.now()), null, null, gates);
    }
}
