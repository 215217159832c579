package io.shiplog.detect;

import io.shiplog.config.WatchRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Clock;
import java.time.Duration;
import java.util.EnumSet;

public final class BacklogScanner {
    private static final Logger log = LoggerFactory.getLogger(BacklogScanner.class);

    private final Clock clock;
    private final RuleMatcher rules;
    private final StabilityDetector detector;

    public BacklogScanner(Clock clock, RuleMatcher rules, StabilityDetector detector) {
        this.clock = clock;
        this.rules = rules;
        this.detector = detector;
    }

    public int scan(int maxAgeDays) {
        long now = clock.millis();
        long maxAgeMs = Duration.ofDays(maxAgeDays).toMillis();
        int total = 0;
        for (WatchRule rule : rules.rules()) {
            total += scanRule(rule, now, maxAgeDays == 0 ? Long.MAX_VALUE : maxAgeMs);
        }
        log.info("Backlog scan handed {} files to the stability detector (max_age_days={})", total, maxAgeDays);
        return total;
    }

    private int scanRule(WatchRule rule, long now, long maxAgeMs) {
        Path root = rule.rootPath();
        if (!Files.isDirectory(root)) {
            log.warn("Watched directory does not exist, skipping backlog scan: {}", root);
            return 0;
        }
        int[] count = {0};
        int depth = rule.recursive() ? Integer.MAX_VALUE : 1;
        try {
            Files.walkFileTree(root, EnumSet.noneOf(FileVisitOption.class), depth, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (!dir.equals(root) && WatchRule.isHidden(dir.getFileName().toString())) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (!attrs.isRegularFile()) {
                        return FileVisitResult.CONTINUE;
                    }
                    long age = now - attrs.lastModifiedTime().toMillis();
                    if (age > maxAgeMs) {
                        return FileVisitResult.CONTINUE;
                    }
                    if (detector.onEvent(file)) {
                        count[0]++;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    log.warn("Backlog scan cannot read {}: {}", file, exc.toString());
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            log.warn("Backlog scan of {} failed: {}", root, e.toString());
        }
        return count[0];
    }
}
