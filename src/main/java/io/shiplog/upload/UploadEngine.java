package io.shiplog.upload;

import io.shiplog.config.UploadSettings;
import io.shiplog.config.WatchRule;
import io.shiplog.detect.RuleMatcher;
import io.shiplog.model.ErrorKind;
import io.shiplog.model.FileIdentity;
import io.shiplog.model.QueueEntry;
import io.shiplog.model.QueueStatus;
import io.shiplog.model.RegistryRecord;
import io.shiplog.observability.AuditLogger;
import io.shiplog.observability.Metrics;
import io.shiplog.observability.MetricsPublisher;
import io.shiplog.remote.ObjectStoreClient;
import io.shiplog.storage.PersistentQueue;
import io.shiplog.storage.ProcessedFileRegistry;
import io.shiplog.util.ByteSizes;
import io.shiplog.util.Threads;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drains the persistent queue into the object store.
 *
 * <p>Per entry the file is re-checked (still there, unchanged, inside its rule root, not
 * already registered) before any bytes move. Worker threads only transfer and report an
 * {@link Outcome}; the draining thread is the only one that writes outcomes to the queue
 * and registry. A successful transfer is recorded in the registry first and only then
 * removed from the queue, so a crash in between can at worst leave a queue entry that
 * the registry already covers.
 */
public final class UploadEngine implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(UploadEngine.class);
    private static final long WATCHDOG_SLACK_MS = 1_000L;

    private final PersistentQueue queue;
    private final ProcessedFileRegistry registry;
    private final ObjectStoreClient store;
    private final RemoteKeyBuilder keys;
    private final RuleMatcher rules;
    private final UploadSettings.TransferSettings transfer;
    private final Duration requeueDelay;
    private final Clock clock;
    private final MetricsPublisher metrics;
    private final AuditLogger audit;
    private final ExecutorService uploadPool;
    private final ExecutorService partPool;
    private final MultipartTransfer multipart;
    private final Set<String> activeAttempts = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean halted = new AtomicBoolean(false);
    private final AtomicBoolean stopping = new AtomicBoolean(false);
    private volatile UploadListener listener = UploadListener.NONE;

    public UploadEngine(
            PersistentQueue queue,
            ProcessedFileRegistry registry,
            ObjectStoreClient store,
            RemoteKeyBuilder keys,
            RuleMatcher rules,
            UploadSettings.TransferSettings transfer,
            Duration requeueDelay,
            Clock clock,
            MetricsPublisher metrics,
            AuditLogger audit
    ) {
        this.queue = queue;
        this.registry = registry;
        this.store = store;
        this.keys = keys;
        this.rules = rules;
        this.transfer = transfer;
        this.requeueDelay = requeueDelay;
        this.clock = clock;
        this.metrics = metrics == null ? MetricsPublisher.NOOP : metrics;
        this.audit = audit;
        this.uploadPool = Executors.newFixedThreadPool(transfer.parallelism(), Threads.daemonFactory("shiplog-upload"));
        this.partPool = Executors.newFixedThreadPool(transfer.parallelism(), Threads.daemonFactory("shiplog-part"));
        this.multipart = new MultipartTransfer(store, transfer.partSize(), partPool, transfer.requestTimeout());
    }

    public void setListener(UploadListener listener) {
        this.listener = listener == null ? UploadListener.NONE : listener;
    }

    int activeAttemptCount() {
        return activeAttempts.size();
    }

    public boolean isHalted() {
        return halted.get();
    }

    public DrainResult drain() {
        if (halted.get()) {
            log.warn("Upload draining halted after an authentication failure; fix credentials and restart");
            return DrainResult.empty(true);
        }
        long drainStart = clock.millis();
        Tally tally = new Tally();
        boolean interrupted = false;
        while (!halted.get() && !stopping.get() && !interrupted && !Thread.currentThread().isInterrupted()) {
            List<QueueEntry> batch = queue.dequeueBatch(transfer.batchSize(), drainStart);
            if (batch.isEmpty()) {
                break;
            }
            Map<QueueEntry, Future<Outcome>> running = new LinkedHashMap<>();
            boolean rejected = false;
            for (QueueEntry entry : batch) {
                if (rejected) {
                    queue.release(entry.identity());
                } else if (activeAttempts.contains(entry.identity().hash())) {
                    log.warn("Previous attempt for {} is still running, deferring", entry.identity().path());
                    queue.release(entry.identity(), clock.millis() + requeueDelay.toMillis());
                } else {
                    try {
                        running.put(entry, uploadPool.submit(() -> attempt(entry)));
                    } catch (RejectedExecutionException e) {
                        rejected = true;
                        queue.release(entry.identity());
                    }
                }
            }
            for (Map.Entry<QueueEntry, Future<Outcome>> e : running.entrySet()) {
                Outcome outcome = interrupted ? abandon(e.getValue()) : await(e.getKey(), e.getValue());
                if (outcome.status() == Status.INTERRUPTED) {
                    interrupted = true;
                }
                apply(e.getKey(), outcome);
                tally.add(outcome);
            }
            if (rejected) {
                break;
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
        metrics.gauge(Metrics.QUEUE_DEPTH, queue.depth());
        DrainResult result = tally.result(halted.get());
        if (result.attempted() > 0) {
            log.info("Drain finished: uploaded={} ({}), skipped={}, changed={}, failed={}",
                    result.uploaded(), ByteSizes.format(result.bytesUploaded()), result.skipped(),
                    result.changed(), result.failed());
        }
        return result;
    }

    private Outcome attempt(QueueEntry entry) {
        String hash = entry.identity().hash();
        activeAttempts.add(hash);
        try {
            return uploadOne(entry);
        } finally {
            activeAttempts.remove(hash);
        }
    }

    Duration budgetFor(FileIdentity identity) {
        long calls = identity.sizeBytes() > transfer.multipartThreshold()
                ? MultipartTransfer.partCount(identity.sizeBytes(), transfer.partSize()) + 3L
                : 2L;
        return transfer.requestTimeout().multipliedBy(calls).plusMillis(WATCHDOG_SLACK_MS);
    }

    private Outcome await(QueueEntry entry, Future<Outcome> future) {
        Duration budget = budgetFor(entry.identity());
        try {
            return future.get(budget.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            return Outcome.failed(ErrorKind.NETWORK_TIMEOUT, "upload exceeded " + budget);
        } catch (InterruptedException e) {
            future.cancel(true);
            return Outcome.interrupted();
        } catch (CancellationException e) {
            return Outcome.interrupted();
        } catch (ExecutionException e) {
            return Outcome.failed(FailureClassifier.classify(e), String.valueOf(e.getCause()));
        }
    }

    private Outcome abandon(Future<Outcome> future) {
        if (future.cancel(true) || future.isCancelled()) {
            return Outcome.interrupted();
        }
        try {
            return future.get(0L, TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            return Outcome.failed(FailureClassifier.classify(e), String.valueOf(e.getCause()));
        } catch (InterruptedException | TimeoutException | CancellationException e) {
            return Outcome.interrupted();
        }
    }

    Outcome uploadOne(QueueEntry entry) {
        FileIdentity identity = entry.identity();
        Path path = identity.asPath();
        try {
            WatchRule rule = rules.owner(path)
                    .orElseThrow(() -> new UploadFailure(ErrorKind.PATH_ESCAPE, "No watch rule owns " + path));
            FileIdentity current = statForUpload(path, rule);
            if (!current.equals(identity)) {
                return Outcome.changed(current);
            }
            if (registry.shouldSkip(identity, clock.millis())) {
                return Outcome.skipped();
            }
            if (identity.sizeBytes() > transfer.maxObjectBytes()) {
                throw new UploadFailure(ErrorKind.OBJECT_TOO_LARGE,
                        "File exceeds maximum object size (" + ByteSizes.format(identity.sizeBytes()) + "): " + path);
            }
            if (!Files.isReadable(path)) {
                throw new UploadFailure(ErrorKind.PERMISSION_DENIED, "File is not readable: " + path);
            }
            String key = keys.keyFor(identity);
            if (storedCopyMatches(key, identity)) {
                return Outcome.alreadyStored(key);
            }
            if (identity.sizeBytes() > transfer.multipartThreshold()) {
                multipart.transfer(key, path, identity.sizeBytes());
            } else {
                store.putObject(key, path);
            }
            FileIdentity after = statForUpload(path, rule);
            if (!after.equals(identity)) {
                return Outcome.changed(after);
            }
            return Outcome.uploaded(key, identity.sizeBytes());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Outcome.interrupted();
        } catch (Exception e) {
            if (Thread.currentThread().isInterrupted()) {
                return Outcome.interrupted();
            }
            return Outcome.failed(FailureClassifier.classify(e), e.getMessage());
        }
    }

    private boolean storedCopyMatches(String key, FileIdentity identity) throws InterruptedIOException {
        try {
            Optional<ObjectStoreClient.ObjectSummary> existing = store.head(key);
            return existing.isPresent() && existing.get().size() == identity.sizeBytes();
        } catch (InterruptedIOException e) {
            throw e;
        } catch (IOException e) {
            log.debug("Could not check remote copy of {}, uploading: {}", key, e.toString());
            return false;
        }
    }

    private void apply(QueueEntry entry, Outcome outcome) {
        FileIdentity identity = entry.identity();
        switch (outcome.status()) {
            case UPLOADED -> onSuccess(identity, outcome.key(), "ok");
            case ALREADY_STORED -> onSuccess(identity, outcome.key(), "already-stored");
            case SKIPPED -> {
                queue.complete(identity);
                log.info("Already uploaded, skipping {}", identity.path());
            }
            case CHANGED -> requeueChanged(identity, outcome.current(), clock.millis());
            case FAILED -> recordFailure(identity, outcome.kind(), outcome.detail());
            case INTERRUPTED -> queue.release(identity);
        }
    }

    private void onSuccess(FileIdentity identity, String key, String result) {
        RegistryRecord record = registry.record(identity, key, clock.millis());
        queue.complete(identity);
        if ("ok".equals(result)) {
            log.info("Uploaded {} -> {} ({})", identity.path(), key, ByteSizes.format(identity.sizeBytes()));
            metrics.increment(Metrics.FILES_UPLOADED, 1L);
            metrics.increment(Metrics.BYTES_UPLOADED, identity.sizeBytes());
        } else {
            log.info("Remote copy of {} already present at {}, registered without upload", identity.path(), key);
        }
        try {
            listener.onUploaded(record);
        } catch (RuntimeException e) {
            log.warn("Post-upload hook failed for {}: {}", identity.path(), e.toString());
        }
        if (audit != null) {
            audit.logQuietly(AuditLogger.AuditEvent.of("upload", identity.path(), result, Map.of(
                    "key", key,
                    "size_bytes", identity.sizeBytes(),
                    "identity", identity.hash())));
        }
    }

    private void requeueChanged(FileIdentity stale, FileIdentity current, long now) {
        queue.remove(stale);
        queue.enqueue(current, now, now + requeueDelay.toMillis());
        log.info("File changed since it was queued, requeued current version: {}", stale.path());
    }

    private void recordFailure(FileIdentity identity, ErrorKind kind, String detail) {
        if (kind == ErrorKind.AUTH_FAILED && halted.compareAndSet(false, true)) {
            log.error("Authentication rejected by object store, halting uploads for this run: {}", detail);
        }
        metrics.increment(Metrics.UPLOAD_FAILURES, Metrics.LABEL_KIND, kind.label(), 1L);
        Optional<QueueEntry> updated = queue.fail(identity, kind, clock.millis());
        if (updated.isEmpty()) {
            return;
        }
        QueueEntry entry = updated.get();
        if (entry.status() == QueueStatus.PERMANENTLY_FAILED) {
            log.error("Upload permanently failed ({}) after {} attempts: {} - {}",
                    entry.lastErrorKind(), entry.attemptCount(), identity.path(), detail);
            if (audit != null) {
                audit.logQuietly(AuditLogger.AuditEvent.of("upload", identity.path(), "failed", Map.of(
                        "kind", entry.lastErrorKind().name(),
                        "attempts", entry.attemptCount())));
            }
        } else {
            log.warn("Upload attempt {} failed ({}), retrying after backoff: {} - {}",
                    entry.attemptCount(), kind, identity.path(), detail);
        }
    }

    private static FileIdentity statForUpload(Path path, WatchRule rule) throws IOException {
        BasicFileAttributes attrs;
        try {
            attrs = Files.readAttributes(path, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
        } catch (NoSuchFileException e) {
            throw new UploadFailure(ErrorKind.SOURCE_MISSING, "File no longer exists: " + path, e);
        }
        if (attrs.isSymbolicLink()) {
            throw new UploadFailure(ErrorKind.PATH_ESCAPE, "Refusing to upload symbolic link: " + path);
        }
        if (!attrs.isRegularFile()) {
            throw new UploadFailure(ErrorKind.SOURCE_MISSING, "Not a regular file: " + path);
        }
        Path real = path.toRealPath();
        Path realRoot = rule.rootPath().toRealPath();
        if (!real.startsWith(realRoot)) {
            throw new UploadFailure(ErrorKind.PATH_ESCAPE, "File resolves outside " + rule.rootPath() + ": " + real);
        }
        return new FileIdentity(path.toString(), attrs.size(), attrs.lastModifiedTime().toMillis());
    }

    public void requestStop() {
        stopping.set(true);
    }

    public void stop(Duration grace) {
        stopping.set(true);
        uploadPool.shutdown();
        partPool.shutdown();
        try {
            if (!uploadPool.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Uploads still running after {} grace period, interrupting", grace);
                uploadPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            uploadPool.shutdownNow();
        }
        partPool.shutdownNow();
        List<QueueEntry> leftovers = new ArrayList<>();
        for (QueueEntry entry : queue.snapshot()) {
            if (entry.status() == QueueStatus.IN_FLIGHT) {
                leftovers.add(entry);
            }
        }
        for (QueueEntry entry : leftovers) {
            queue.release(entry.identity());
        }
    }

    @Override
    public void close() {
        stop(Duration.ZERO);
    }

    enum Status {
        UPLOADED,
        ALREADY_STORED,
        SKIPPED,
        CHANGED,
        FAILED,
        INTERRUPTED
    }

    record Outcome(Status status, String key, long bytes, FileIdentity current, ErrorKind kind, String detail) {
        static Outcome uploaded(String key, long bytes) {
            return new Outcome(Status.UPLOADED, key, bytes, null, null, null);
        }

        static Outcome alreadyStored(String key) {
            return new Outcome(Status.ALREADY_STORED, key, 0L, null, null, null);
        }

        static Outcome skipped() {
            return new Outcome(Status.SKIPPED, null, 0L, null, null, null);
        }

        static Outcome changed(FileIdentity current) {
            return new Outcome(Status.CHANGED, null, 0L, current, null, null);
        }

        static Outcome failed(ErrorKind kind, String detail) {
            return new Outcome(Status.FAILED, null, 0L, null, kind, detail);
        }

        static Outcome interrupted() {
            return new Outcome(Status.INTERRUPTED, null, 0L, null, null, null);
        }
    }

    private static final class Tally {
        private int uploaded;
        private int skipped;
        private int changed;
        private int failed;
        private long bytes;

        void add(Outcome outcome) {
            switch (outcome.status()) {
                case UPLOADED -> {
                    uploaded++;
                    bytes += outcome.bytes();
                }
                case ALREADY_STORED, SKIPPED -> skipped++;
                case CHANGED -> changed++;
                case FAILED -> failed++;
                case INTERRUPTED -> {
                }
            }
        }

        DrainResult result(boolean halted) {
            return new DrainResult(uploaded, skipped, changed, failed, bytes, halted);
        }
    }
}
