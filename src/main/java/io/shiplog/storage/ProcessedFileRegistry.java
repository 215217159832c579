package io.shiplog.storage;

import io.shiplog.model.FileIdentity;
import io.shiplog.model.RegistryRecord;
import io.shiplog.util.AtomicFiles;
import io.shiplog.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Durable ledger of uploaded file identities. An identity with a live record is never
 * uploaded again; a record expires {@code retentionDays} after its upload. Memory only
 * changes after the new document is on disk.
 */
public final class ProcessedFileRegistry {
    private static final Logger log = LoggerFactory.getLogger(ProcessedFileRegistry.class);
    private static final int DOCUMENT_VERSION = 1;

    private final Path file;
    private final long retentionMs;
    private Map<String, RegistryRecord> records = new LinkedHashMap<>();
    private boolean loaded;

    public ProcessedFileRegistry(Path file, int retentionDays) {
        this.file = file;
        this.retentionMs = Duration.ofDays(retentionDays).toMillis();
    }

    public Path file() {
        return file;
    }

    public synchronized void load() {
        records = new LinkedHashMap<>();
        loaded = true;
        if (!Files.exists(file)) {
            log.info("No registry file at {}, starting empty", file);
            return;
        }
        RegistryDocument document;
        try {
            document = Jsons.mapper().readValue(file.toFile(), RegistryDocument.class);
        } catch (IOException | RuntimeException e) {
            throw new StateCorruptedException(file, e);
        }
        if (document == null || document.records() == null) {
            throw new StateCorruptedException(file, new IOException("missing records array"));
        }
        Map<String, RegistryRecord> loadedRecords = new LinkedHashMap<>();
        for (RegistryRecord record : document.records()) {
            if (record == null || record.identityHash() == null || record.path() == null) {
                throw new StateCorruptedException(file, new IOException("malformed registry record"));
            }
            loadedRecords.put(record.identityHash(), record);
        }
        records = loadedRecords;
        log.info("Loaded registry with {} records from {}", records.size(), file);
    }

    public synchronized boolean shouldSkip(FileIdentity identity, long nowMs) {
        ensureLoaded();
        RegistryRecord record = records.get(identity.hash());
        return record != null && !record.expiredAt(nowMs) && record.matches(identity);
    }

    public synchronized RegistryRecord record(FileIdentity identity, String remoteKey, long nowMs) {
        ensureLoaded();
        RegistryRecord record = new RegistryRecord(
                identity.hash(),
                identity.path(),
                identity.sizeBytes(),
                identity.modifiedAtMs(),
                remoteKey,
                nowMs,
                nowMs + retentionMs
        );
        Map<String, RegistryRecord> next = new LinkedHashMap<>(records);
        next.put(record.identityHash(), record);
        commit(next);
        return record;
    }

    public synchronized Optional<RegistryRecord> find(FileIdentity identity) {
        ensureLoaded();
        return Optional.ofNullable(records.get(identity.hash())).filter(r -> r.matches(identity));
    }

    public synchronized List<RegistryRecord> records() {
        ensureLoaded();
        return List.copyOf(records.values());
    }

    public synchronized int size() {
        ensureLoaded();
        return records.size();
    }

    public synchronized int prune(long nowMs, Set<String> protectedHashes) {
        ensureLoaded();
        Map<String, RegistryRecord> next = new LinkedHashMap<>(records);
        int removed = 0;
        Iterator<RegistryRecord> it = next.values().iterator();
        while (it.hasNext()) {
            RegistryRecord record = it.next();
            if (record.expiredAt(nowMs) && !protectedHashes.contains(record.identityHash())) {
                it.remove();
                removed++;
            }
        }
        if (removed > 0) {
            commit(next);
            log.info("Pruned {} expired registry records", removed);
        }
        return removed;
    }

    public synchronized void flush() {
        if (loaded) {
            write(records);
        }
    }

    private void ensureLoaded() {
        if (!loaded) {
            throw new IllegalStateException("Registry not loaded: " + file);
        }
    }

    private void commit(Map<String, RegistryRecord> next) {
        write(next);
        records = next;
    }

    private void write(Map<String, RegistryRecord> state) {
        try {
            AtomicFiles.writeString(file, Jsons.mapper().writeValueAsString(
                    new RegistryDocument(DOCUMENT_VERSION, List.copyOf(state.values()))));
        } catch (IOException e) {
            throw new RuntimeException("Failed to persist registry: " + file, e);
        }
    }

    public record RegistryDocument(int version, List<RegistryRecord> records) {
    }
}
