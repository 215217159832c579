package io.shiplog.detect;

import io.shiplog.config.WatchRule;
import io.shiplog.model.FileIdentity;
import io.shiplog.support.MutableClock;
import io.shiplog.support.TestFiles;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

final class StabilityDetectorTest {
    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

    @Test
    void emitsOnceAfterQuietPeriod() throws Exception {
        Path root = Files.createTempDirectory("shiplog-stable-");
        try {
            MutableClock clock = new MutableClock(T0);
            List<FileIdentity> sink = new ArrayList<>();
            StabilityDetector detector = detector(root, clock, sink);
            Path file = TestFiles.write(root.resolve("a.log"), "hello", T0.minusSeconds(5));

            Assertions.assertTrue(detector.onEvent(file));
            clock.advance(Duration.ofSeconds(59));
            Assertions.assertTrue(detector.tick().isEmpty());

            clock.advance(Duration.ofSeconds(1));
            List<FileIdentity> emitted = detector.tick();
            Assertions.assertEquals(1, emitted.size());
            Assertions.assertEquals(emitted, sink);
            Assertions.assertEquals(5L, emitted.get(0).sizeBytes());
            Assertions.assertEquals(T0.minusSeconds(5).toEpochMilli(), emitted.get(0).modifiedAtMs());

            clock.advance(Duration.ofMinutes(5));
            Assertions.assertTrue(detector.tick().isEmpty());
            Assertions.assertEquals(0, detector.pendingCount());
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void newEventRestartsTheTimer() throws Exception {
        Path root = Files.createTempDirectory("shiplog-stable-");
        try {
            MutableClock clock = new MutableClock(T0);
            List<FileIdentity> sink = new ArrayList<>();
            StabilityDetector detector = detector(root, clock, sink);
            Path file = TestFiles.write(root.resolve("a.log"), "1", T0);

            detector.onEvent(file);
            clock.advance(Duration.ofSeconds(40));
            TestFiles.write(file, "12", T0.plusSeconds(40));
            detector.onEvent(file);
            clock.advance(Duration.ofSeconds(40));
            Assertions.assertTrue(detector.tick().isEmpty());

            clock.advance(Duration.ofSeconds(20));
            Assertions.assertEquals(2L, detector.tick().get(0).sizeBytes());
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void changeWithoutEventRearmsInsteadOfEmitting() throws Exception {
        Path root = Files.createTempDirectory("shiplog-stable-");
        try {
            MutableClock clock = new MutableClock(T0);
            List<FileIdentity> sink = new ArrayList<>();
            StabilityDetector detector = detector(root, clock, sink);
            Path file = TestFiles.write(root.resolve("a.log"), "1", T0);

            detector.onEvent(file);
            TestFiles.write(file, "123", T0.plusSeconds(30));
            clock.advance(Duration.ofSeconds(60));
            Assertions.assertTrue(detector.tick().isEmpty());
            Assertions.assertTrue(detector.isPending(file));

            clock.advance(Duration.ofSeconds(60));
            Assertions.assertEquals(3L, detector.tick().get(0).sizeBytes());
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void vanishedFileIsForgotten() throws Exception {
        Path root = Files.createTempDirectory("shiplog-stable-");
        try {
            MutableClock clock = new MutableClock(T0);
            List<FileIdentity> sink = new ArrayList<>();
            StabilityDetector detector = detector(root, clock, sink);
            Path file = TestFiles.write(root.resolve("a.log"), "1", T0);

            detector.onEvent(file);
            Files.delete(file);
            clock.advance(Duration.ofSeconds(61));
            Assertions.assertTrue(detector.tick().isEmpty());
            Assertions.assertEquals(0, detector.pendingCount());
            Assertions.assertTrue(sink.isEmpty());
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void ignoresFilesTheRuleDoesNotAdmit() throws Exception {
        Path root = Files.createTempDirectory("shiplog-stable-");
        try {
            MutableClock clock = new MutableClock(T0);
            StabilityDetector detector = new StabilityDetector(clock,
                    new RuleMatcher(List.of(new WatchRule(root, "ros", "*.bag", true, true))),
                    Duration.ofSeconds(60), id -> { });

            Assertions.assertFalse(detector.onEvent(TestFiles.write(root.resolve("a.txt"), "x", T0)));
            Assertions.assertFalse(detector.onEvent(TestFiles.write(root.resolve(".hidden.bag"), "x", T0)));
            Assertions.assertFalse(detector.onEvent(root.resolve("missing.bag")));
            Assertions.assertFalse(detector.onEvent(Files.createDirectories(root.resolve("dir.bag"))));
            Assertions.assertTrue(detector.onEvent(TestFiles.write(root.resolve("run.bag"), "x", T0)));
            Assertions.assertEquals(1, detector.pendingCount());
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void sinkFailureDoesNotStopOtherFiles() throws Exception {
        Path root = Files.createTempDirectory("shiplog-stable-");
        try {
            MutableClock clock = new MutableClock(T0);
            List<FileIdentity> accepted = new ArrayList<>();
            StabilityDetector detector = new StabilityDetector(clock,
                    new RuleMatcher(List.of(new WatchRule(root, "logs", null, true, true))),
                    Duration.ofSeconds(1), id -> {
                        if (id.path().endsWith("bad.log")) {
                            throw new IllegalStateException("boom");
                        }
                        accepted.add(id);
                    });
            detector.onEvent(TestFiles.write(root.resolve("bad.log"), "x", T0));
            detector.onEvent(TestFiles.write(root.resolve("good.log"), "x", T0));
            clock.advance(Duration.ofSeconds(1));

            Assertions.assertEquals(2, detector.tick().size());
            Assertions.assertEquals(1, accepted.size());
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    private static StabilityDetector detector(Path root, MutableClock clock, List<FileIdentity> sink) {
        RuleMatcher rules = new RuleMatcher(List.of(new WatchRule(root, "logs", null, true, true)));
        return new StabilityDetector(clock, rules, Duration.ofSeconds(60), sink::add);
    }
}
