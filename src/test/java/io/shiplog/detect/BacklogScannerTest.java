package io.shiplog.detect;

import io.shiplog.config.WatchRule;
import io.shiplog.support.MutableClock;
import io.shiplog.support.TestFiles;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

final class BacklogScannerTest {
    private static final Instant NOW = Instant.parse("2024-03-10T12:00:00Z");

    @Test
    void includesFilesUpToMaxAgeInclusive() throws Exception {
        Path root = Files.createTempDirectory("shiplog-backlog-");
        try {
            TestFiles.write(root.resolve("fresh.log"), "a", NOW.minus(Duration.ofHours(1)));
            TestFiles.write(root.resolve("boundary.log"), "b", NOW.minus(Duration.ofDays(3)));
            TestFiles.write(root.resolve("old.log"), "c", NOW.minus(Duration.ofDays(3)).minusSeconds(1));
            TestFiles.write(root.resolve("nested/deep/run.log"), "d", NOW.minus(Duration.ofDays(1)));
            TestFiles.write(root.resolve(".cache/skip.log"), "e", NOW);

            StabilityDetector detector = detector(new WatchRule(root, "logs", null, true, true));
            BacklogScanner scanner = new BacklogScanner(new MutableClock(NOW),
                    new RuleMatcher(List.of(new WatchRule(root, "logs", null, true, true))), detector);

            Assertions.assertEquals(3, scanner.scan(3));
            Assertions.assertTrue(detector.isPending(root.resolve("boundary.log")));
            Assertions.assertTrue(detector.isPending(root.resolve("nested/deep/run.log")));
            Assertions.assertFalse(detector.isPending(root.resolve("old.log")));
            Assertions.assertFalse(detector.isPending(root.resolve(".cache/skip.log")));
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void zeroMaxAgeScansEverything() throws Exception {
        Path root = Files.createTempDirectory("shiplog-backlog-");
        try {
            TestFiles.write(root.resolve("ancient.log"), "a", NOW.minus(Duration.ofDays(400)));
            TestFiles.write(root.resolve("fresh.log"), "b", NOW);
            WatchRule rule = new WatchRule(root, "logs", null, true, true);
            StabilityDetector detector = detector(rule);
            BacklogScanner scanner = new BacklogScanner(new MutableClock(NOW), new RuleMatcher(List.of(rule)), detector);

            Assertions.assertEquals(2, scanner.scan(0));
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void nonRecursiveRuleStaysAtTopLevel() throws Exception {
        Path root = Files.createTempDirectory("shiplog-backlog-");
        try {
            TestFiles.write(root.resolve("top.log"), "a", NOW);
            TestFiles.write(root.resolve("sub/inner.log"), "b", NOW);
            WatchRule rule = new WatchRule(root, "logs", "*.log", false, true);
            StabilityDetector detector = detector(rule);
            BacklogScanner scanner = new BacklogScanner(new MutableClock(NOW), new RuleMatcher(List.of(rule)), detector);

            Assertions.assertEquals(1, scanner.scan(3));
            Assertions.assertTrue(detector.isPending(root.resolve("top.log")));
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void missingRootIsSkipped() throws Exception {
        Path root = Files.createTempDirectory("shiplog-backlog-");
        try {
            WatchRule rule = new WatchRule(root.resolve("absent"), "logs", null, true, true);
            BacklogScanner scanner = new BacklogScanner(new MutableClock(NOW), new RuleMatcher(List.of(rule)), detector(rule));
            Assertions.assertEquals(0, scanner.scan(3));
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    private static StabilityDetector detector(WatchRule rule) {
        return new StabilityDetector(new MutableClock(NOW), new RuleMatcher(List.of(rule)), Duration.ofSeconds(60), id -> { });
    }
}
