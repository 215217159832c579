package io.shiplog.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.shiplog.model.ErrorKind;
import io.shiplog.model.FileIdentity;
import io.shiplog.model.QueueEntry;
import io.shiplog.model.QueueStatus;
import io.shiplog.util.AtomicFiles;
import io.shiplog.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Crash-safe list of files waiting for upload, one entry per {@link FileIdentity}.
 *
 * <p>Every mutation builds the next state, writes it through a temp file and an atomic
 * rename, and only then replaces the in-memory state. A failed write leaves both the
 * file and memory at the previous state. Entries that were in flight when the process
 * died come back as pending on {@link #load()}.
 */
public final class PersistentQueue {
    private static final Logger log = LoggerFactory.getLogger(PersistentQueue.class);
    private static final int DOCUMENT_VERSION = 1;

    public enum EnqueueResult {
        ADDED,
        DUPLICATE,
        SUPERSEDED
    }

    private final Path file;
    private final int maxAttempts;
    private final long baseBackoffMs;
    private final long maxBackoffMs;
    private Map<String, QueueEntry> entries = new LinkedHashMap<>();
    private boolean loaded;

    public PersistentQueue(Path file, int maxAttempts, long baseBackoffMs, long maxBackoffMs) {
        this.file = file;
        this.maxAttempts = maxAttempts;
        this.baseBackoffMs = baseBackoffMs;
        this.maxBackoffMs = maxBackoffMs;
    }

    public Path file() {
        return file;
    }

    public synchronized int load() {
        entries = new LinkedHashMap<>();
        loaded = true;
        if (!Files.exists(file)) {
            log.info("No queue file at {}, starting empty", file);
            return 0;
        }
        QueueDocument document;
        try {
            document = Jsons.mapper().readValue(file.toFile(), QueueDocument.class);
        } catch (IOException | RuntimeException e) {
            throw new StateCorruptedException(file, e);
        }
        if (document == null || document.entries() == null) {
            throw new StateCorruptedException(file, new IOException("missing entries array"));
        }
        Map<String, QueueEntry> restoredEntries = new LinkedHashMap<>();
        int recovered = 0;
        for (QueueEntry entry : document.entries()) {
            if (entry == null || entry.identity() == null || entry.status() == null) {
                throw new StateCorruptedException(file, new IOException("malformed queue entry"));
            }
            QueueEntry restored = entry;
            if (entry.status() == QueueStatus.IN_FLIGHT) {
                restored = entry.withStatus(QueueStatus.PENDING);
                recovered++;
            }
            restoredEntries.put(restored.identity().hash(), restored);
        }
        if (recovered > 0) {
            commit(restoredEntries);
            log.info("Recovered {} in-flight entries from previous run", recovered);
        } else {
            entries = restoredEntries;
        }
        log.info("Loaded queue with {} entries from {}", entries.size(), file);
        return recovered;
    }

    public synchronized EnqueueResult enqueue(FileIdentity identity, long nowMs) {
        return enqueue(identity, nowMs, nowMs);
    }

    public synchronized EnqueueResult enqueue(FileIdentity identity, long nowMs, long notBeforeMs) {
        ensureLoaded();
        String hash = identity.hash();
        if (entries.containsKey(hash)) {
            return EnqueueResult.DUPLICATE;
        }
        Map<String, QueueEntry> next = new LinkedHashMap<>(entries);
        boolean superseded = next.values().removeIf(e ->
                e.status() == QueueStatus.PENDING && e.identity().samePath(identity));
        QueueEntry entry = QueueEntry.pending(identity, nowMs);
        if (notBeforeMs > nowMs) {
            entry = new QueueEntry(identity, nowMs, 0, null, null, notBeforeMs, QueueStatus.PENDING);
        }
        next.put(hash, entry);
        commit(next);
        return superseded ? EnqueueResult.SUPERSEDED : EnqueueResult.ADDED;
    }

    public synchronized List<QueueEntry> dequeueBatch(int max, long nowMs) {
        ensureLoaded();
        List<QueueEntry> due = entries.values().stream()
                .filter(e -> e.dueAt(nowMs))
                .sorted(Comparator.comparingLong(QueueEntry::enqueuedAtMs))
                .limit(Math.max(0, max))
                .toList();
        if (due.isEmpty()) {
            return List.of();
        }
        Map<String, QueueEntry> next = new LinkedHashMap<>(entries);
        List<QueueEntry> claimed = new ArrayList<>(due.size());
        for (QueueEntry entry : due) {
            QueueEntry inFlight = entry.withStatus(QueueStatus.IN_FLIGHT);
            next.put(entry.identity().hash(), inFlight);
            claimed.add(inFlight);
        }
        commit(next);
        return claimed;
    }

    public synchronized boolean complete(FileIdentity identity) {
        ensureLoaded();
        if (!entries.containsKey(identity.hash())) {
            return false;
        }
        Map<String, QueueEntry> next = new LinkedHashMap<>(entries);
        next.remove(identity.hash());
        commit(next);
        return true;
    }

    public synchronized boolean remove(FileIdentity identity) {
        return complete(identity);
    }

    public synchronized Optional<QueueEntry> fail(FileIdentity identity, ErrorKind kind, long nowMs) {
        ensureLoaded();
        QueueEntry current = entries.get(identity.hash());
        if (current == null) {
            return Optional.empty();
        }
        int attempt = current.attemptCount() + 1;
        QueueEntry next;
        if (kind.permanent()) {
            next = current.failed(kind, nowMs, nowMs, QueueStatus.PERMANENTLY_FAILED);
        } else if (attempt >= maxAttempts) {
            next = current.failed(ErrorKind.RETRIES_EXHAUSTED, nowMs, nowMs, QueueStatus.PERMANENTLY_FAILED);
        } else {
            long retryAt = nowMs + computeBackoffMs(attempt, baseBackoffMs, maxBackoffMs);
            next = current.failed(kind, nowMs, retryAt, QueueStatus.PENDING);
        }
        commit(with(identity, next));
        return Optional.of(next);
    }

    public synchronized boolean release(FileIdentity identity) {
        return release(identity, Long.MIN_VALUE);
    }

    public synchronized boolean release(FileIdentity identity, long notBeforeMs) {
        ensureLoaded();
        QueueEntry current = entries.get(identity.hash());
        if (current == null || current.status() != QueueStatus.IN_FLIGHT) {
            return false;
        }
        QueueEntry pending = current.withStatus(QueueStatus.PENDING);
        if (notBeforeMs > pending.nextAttemptAtMs()) {
            pending = pending.notBefore(notBeforeMs);
        }
        commit(with(identity, pending));
        return true;
    }

    public synchronized int retryFailed(long nowMs) {
        ensureLoaded();
        Map<String, QueueEntry> next = new LinkedHashMap<>(entries);
        int count = 0;
        for (Map.Entry<String, QueueEntry> e : next.entrySet()) {
            if (e.getValue().status() == QueueStatus.PERMANENTLY_FAILED) {
                e.setValue(e.getValue().requeued(nowMs));
                count++;
            }
        }
        if (count > 0) {
            commit(next);
        }
        return count;
    }

    public synchronized List<QueueEntry> snapshot() {
        ensureLoaded();
        return List.copyOf(entries.values());
    }

    public synchronized Optional<QueueEntry> find(FileIdentity identity) {
        ensureLoaded();
        return Optional.ofNullable(entries.get(identity.hash()));
    }

    public synchronized int depth() {
        ensureLoaded();
        return (int) entries.values().stream().filter(e -> e.status() != QueueStatus.PERMANENTLY_FAILED).count();
    }

    public synchronized int count(QueueStatus status) {
        ensureLoaded();
        return (int) entries.values().stream().filter(e -> e.status() == status).count();
    }

    public synchronized Set<String> identityHashes() {
        ensureLoaded();
        return new LinkedHashSet<>(entries.keySet());
    }

    public synchronized void flush() {
        if (loaded) {
            write(entries);
        }
    }

    public static long computeBackoffMs(int attempt, long baseBackoffMs, long maxBackoffMs) {
        int exponent = Math.max(0, Math.min(30, attempt - 1));
        long delay = baseBackoffMs * (1L << exponent);
        return Math.min(delay, maxBackoffMs);
    }

    private void ensureLoaded() {
        if (!loaded) {
            throw new IllegalStateException("Queue not loaded: " + file);
        }
    }

    private Map<String, QueueEntry> with(FileIdentity identity, QueueEntry entry) {
        Map<String, QueueEntry> next = new LinkedHashMap<>(entries);
        next.put(identity.hash(), entry);
        return next;
    }

    private void commit(Map<String, QueueEntry> next) {
        write(next);
        entries = next;
    }

    private void write(Map<String, QueueEntry> state) {
        try {
            AtomicFiles.writeString(file, mapper().writeValueAsString(new QueueDocument(DOCUMENT_VERSION, List.copyOf(state.values()))));
        } catch (IOException e) {
            throw new RuntimeException("Failed to persist queue: " + file, e);
        }
    }

    private static ObjectMapper mapper() {
        return Jsons.mapper();
    }

    public record QueueDocument(int version, List<QueueEntry> entries) {
    }
}
