package io.shiplog.remote;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Narrow capability over a remote object store. Credentials and transport live in the
 * implementation; callers see keys, bytes and etags only.
 *
 * <p>Every method may throw {@link ObjectStoreException} for a rejection reported by
 * the store and a plain {@link IOException} for transport problems.
 */
public interface ObjectStoreClient extends AutoCloseable {
    String putObject(String key, Path source) throws IOException;

    String createMultipart(String key) throws IOException;

    String uploadPart(String uploadId, int partNumber, byte[] data) throws IOException;

    String completeMultipart(String uploadId, List<CompletedPart> parts) throws IOException;

    // idempotent
    void abortMultipart(String uploadId) throws IOException;

    List<ObjectSummary> list(String prefix) throws IOException;

    Optional<ObjectSummary> head(String key) throws IOException;

    void delete(String key) throws IOException;

    @Override
    default void close() {
    }

    record CompletedPart(int partNumber, String etag) {
    }

    record ObjectSummary(String key, long size, Instant lastModified) {
    }
}
