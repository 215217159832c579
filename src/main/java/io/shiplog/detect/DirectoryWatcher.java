package io.shiplog.detect;

import io.shiplog.config.WatchRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;

import static java.nio.file.StandardWatchEventKinds.ENTRY_CREATE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_MODIFY;
import static java.nio.file.StandardWatchEventKinds.OVERFLOW;

public final class DirectoryWatcher implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(DirectoryWatcher.class);
    private static final long POLL_TIMEOUT_MS = 500L;

    private final RuleMatcher rules;
    private final StabilityDetector detector;
    private final WatchService watchService;
    private final Map<WatchKey, WatchedDir> keys = new ConcurrentHashMap<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private Thread thread;

    public DirectoryWatcher(RuleMatcher rules, StabilityDetector detector) {
        this.rules = rules;
        this.detector = detector;
        try {
            this.watchService = FileSystems.getDefault().newWatchService();
        } catch (IOException e) {
            throw new RuntimeException("Failed to create watch service", e);
        }
    }

    public synchronized void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        for (WatchRule rule : rules.rules()) {
            if (!Files.isDirectory(rule.rootPath())) {
                log.warn("Watched directory does not exist: {}", rule.rootPath());
                continue;
            }
            register(rule, rule.rootPath());
        }
        thread = new Thread(this::loop, "shiplog-watcher");
        thread.setDaemon(true);
        thread.start();
        log.info("Directory watcher started on {} directories", keys.size());
    }

    public int watchedDirectoryCount() {
        return keys.size();
    }

    private void loop() {
        while (running.get()) {
            WatchKey key;
            try {
                key = watchService.poll(POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (ClosedWatchServiceException e) {
                return;
            }
            if (key == null) {
                continue;
            }
            WatchedDir watched = keys.get(key);
            if (watched != null) {
                for (WatchEvent<?> event : key.pollEvents()) {
                    handle(watched, event);
                }
            }
            if (!key.reset()) {
                keys.remove(key);
            }
        }
    }

    private void handle(WatchedDir watched, WatchEvent<?> event) {
        if (event.kind() == OVERFLOW) {
            log.warn("Watch event overflow in {}, rescanning", watched.dir());
            feedExisting(watched.rule(), watched.dir());
            return;
        }
        Path child = watched.dir().resolve((Path) event.context());
        if (Files.isDirectory(child, LinkOption.NOFOLLOW_LINKS)) {
            if (event.kind() == ENTRY_CREATE && watched.rule().recursive()
                    && !WatchRule.isHidden(child.getFileName().toString())) {
                register(watched.rule(), child);
                feedExisting(watched.rule(), child);
            }
            return;
        }
        detector.onEvent(child);
    }

    private void register(WatchRule rule, Path start) {
        try {
            Files.walkFileTree(start, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (!dir.equals(rule.rootPath()) && WatchRule.isHidden(dir.getFileName().toString())) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    try {
                        WatchKey key = dir.register(watchService, ENTRY_CREATE, ENTRY_MODIFY);
                        keys.put(key, new WatchedDir(rule, dir));
                    } catch (IOException | SecurityException e) {
                        log.warn("Cannot watch {}: {}", dir, e.toString());
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return rule.recursive() ? FileVisitResult.CONTINUE : FileVisitResult.SKIP_SUBTREE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
            });
        } catch (IOException e) {
            log.warn("Failed to register {}: {}", start, e.toString());
        }
    }

    private void feedExisting(WatchRule rule, Path dir) {
        int depth = rule.recursive() ? Integer.MAX_VALUE : 1;
        try (Stream<Path> files = Files.walk(dir, depth)) {
            files.filter(p -> Files.isRegularFile(p, LinkOption.NOFOLLOW_LINKS)).forEach(detector::onEvent);
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to rescan {}: {}", dir, e.toString());
        }
    }

    @Override
    public void close() {
        close(Duration.ofSeconds(2));
    }

    public synchronized void close(Duration wait) {
        running.set(false);
        try {
            watchService.close();
        } catch (IOException e) {
            log.warn("Failed to close watch service: {}", e.toString());
        }
        if (thread != null) {
            try {
                thread.join(Math.max(1L, wait.toMillis()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        keys.clear();
    }

    private record WatchedDir(WatchRule rule, Path dir) {
    }
}
