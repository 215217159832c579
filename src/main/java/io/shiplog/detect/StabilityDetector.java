package io.shiplog.detect;

import io.shiplog.config.WatchRule;
import io.shiplog.model.FileIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Debounces filesystem activity into "this file has stopped changing" signals.
 *
 * <p>Each admitted path owns one timer. {@link #onEvent(Path)} arms or re-arms it;
 * {@link #tick()} fires expired timers, re-stats the file and either emits its
 * identity, re-arms (size or mtime moved) or forgets it (file gone). Time comes from
 * the injected clock only.
 */
public final class StabilityDetector {
    private static final Logger log = LoggerFactory.getLogger(StabilityDetector.class);

    private final Clock clock;
    private final RuleMatcher rules;
    private final long quietPeriodMs;
    private final Consumer<FileIdentity> sink;
    private final Map<Path, PendingFile> pending = new HashMap<>();

    public StabilityDetector(Clock clock, RuleMatcher rules, Duration quietPeriod, Consumer<FileIdentity> sink) {
        this.clock = clock;
        this.rules = rules;
        this.quietPeriodMs = quietPeriod.toMillis();
        this.sink = sink;
    }

    public boolean onEvent(Path path) {
        Path normalized = path.toAbsolutePath().normalize();
        Optional<WatchRule> rule = rules.admitting(normalized);
        if (rule.isEmpty()) {
            return false;
        }
        Observed observed = stat(normalized);
        if (observed == null) {
            synchronized (this) {
                pending.remove(normalized);
            }
            return false;
        }
        synchronized (this) {
            pending.put(normalized, new PendingFile(observed.size(), observed.modifiedAtMs(), clock.millis() + quietPeriodMs));
        }
        return true;
    }

    public List<FileIdentity> tick() {
        long now = clock.millis();
        Map<Path, PendingFile> expired = new HashMap<>();
        synchronized (this) {
            Iterator<Map.Entry<Path, PendingFile>> it = pending.entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<Path, PendingFile> entry = it.next();
                if (entry.getValue().deadlineMs() <= now) {
                    expired.put(entry.getKey(), entry.getValue());
                    it.remove();
                }
            }
        }
        List<FileIdentity> emitted = new ArrayList<>();
        for (Map.Entry<Path, PendingFile> entry : expired.entrySet()) {
            Path path = entry.getKey();
            PendingFile armed = entry.getValue();
            Observed current = stat(path);
            if (current == null) {
                log.debug("File vanished before becoming stable: {}", path);
                continue;
            }
            if (current.size() != armed.sizeBytes() || current.modifiedAtMs() != armed.modifiedAtMs()) {
                synchronized (this) {
                    pending.putIfAbsent(path, new PendingFile(current.size(), current.modifiedAtMs(), now + quietPeriodMs));
                }
                continue;
            }
            FileIdentity identity = new FileIdentity(path.toString(), current.size(), current.modifiedAtMs());
            emitted.add(identity);
            try {
                sink.accept(identity);
            } catch (RuntimeException e) {
                log.error("Failed to hand over stable file {}", path, e);
            }
        }
        return emitted;
    }

    public synchronized int pendingCount() {
        return pending.size();
    }

    public synchronized boolean isPending(Path path) {
        return pending.containsKey(path.toAbsolutePath().normalize());
    }

    private static Observed stat(Path path) {
        try {
            BasicFileAttributes attrs = Files.readAttributes(path, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
            if (!attrs.isRegularFile()) {
                return null;
            }
            return new Observed(attrs.size(), attrs.lastModifiedTime().toMillis());
        } catch (NoSuchFileException e) {
            return null;
        } catch (IOException e) {
            log.warn("Cannot stat {}: {}", path, e.toString());
            return null;
        }
    }

    private record PendingFile(long sizeBytes, long modifiedAtMs, long deadlineMs) {
    }

    private record Observed(long size, long modifiedAtMs) {
    }
}
