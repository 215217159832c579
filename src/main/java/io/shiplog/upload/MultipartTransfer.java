package io.shiplog.upload;

import io.shiplog.model.ErrorKind;
import io.shiplog.remote.ObjectStoreClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Uploads one file as fixed-size parts. Parts go out in parallel; completion is a single
 * serialized call. The whole transfer may take the per-call timeout once per part. Any failure after the upload was opened aborts it, so the store never
 * keeps half-finished uploads and the next attempt starts from scratch.
 */
public final class MultipartTransfer {
    private static final Logger log = LoggerFactory.getLogger(MultipartTransfer.class);

    private final ObjectStoreClient store;
    private final long partSize;
    private final ExecutorService partPool;
    private final Duration timeout;

    public MultipartTransfer(ObjectStoreClient store, long partSize, ExecutorService partPool, Duration timeout) {
        if (partSize <= 0L || partSize > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("partSize out of range: " + partSize);
        }
        this.store = store;
        this.partSize = partSize;
        this.partPool = partPool;
        this.timeout = timeout;
    }

    public static int partCount(long sizeBytes, long partSize) {
        return (int) Math.max(1L, (sizeBytes + partSize - 1L) / partSize);
    }

    public String transfer(String key, Path file, long sizeBytes) throws IOException, InterruptedException {
        String uploadId = store.createMultipart(key);
        List<Future<ObjectStoreClient.CompletedPart>> futures = new ArrayList<>();
        try {
            int parts = partCount(sizeBytes, partSize);
            for (int i = 0; i < parts; i++) {
                int partNumber = i + 1;
                long offset = i * partSize;
                int length = (int) Math.min(partSize, sizeBytes - offset);
                futures.add(partPool.submit(() -> uploadPart(uploadId, partNumber, file, offset, length)));
            }
            Duration allowed = timeout.multipliedBy(parts);
            long deadline = System.nanoTime() + allowed.toNanos();
            List<ObjectStoreClient.CompletedPart> completed = new ArrayList<>(parts);
            for (Future<ObjectStoreClient.CompletedPart> future : futures) {
                long remaining = deadline - System.nanoTime();
                completed.add(future.get(Math.max(0L, remaining), TimeUnit.NANOSECONDS));
            }
            String etag = store.completeMultipart(uploadId, completed);
            log.debug("Completed multipart upload {} for {} ({} parts)", uploadId, key, parts);
            return etag;
        } catch (TimeoutException e) {
            abort(uploadId, futures);
            throw new UploadFailure(ErrorKind.NETWORK_TIMEOUT,
                    "Multipart upload timed out after " + timeout.multipliedBy(partCount(sizeBytes, partSize)) + ": " + key, e);
        } catch (ExecutionException e) {
            abort(uploadId, futures);
            Throwable cause = e.getCause();
            if (cause instanceof IOException) {
                throw (IOException) cause;
            }
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new RuntimeException("Part upload failed for " + key, cause);
        } catch (IOException | RuntimeException | InterruptedException e) {
            abort(uploadId, futures);
            throw e;
        }
    }

    private ObjectStoreClient.CompletedPart uploadPart(String uploadId, int partNumber, Path file, long offset, int length)
            throws IOException {
        byte[] data = new byte[length];
        ByteBuffer buffer = ByteBuffer.wrap(data);
        try (FileChannel channel = FileChannel.open(file, StandardOpenOption.READ)) {
            long position = offset;
            while (buffer.hasRemaining()) {
                int read = channel.read(buffer, position);
                if (read < 0) {
                    throw new EOFException("File shrank during upload: " + file);
                }
                position += read;
            }
        }
        String etag = store.uploadPart(uploadId, partNumber, data);
        return new ObjectStoreClient.CompletedPart(partNumber, etag);
    }

    private void abort(String uploadId, List<Future<ObjectStoreClient.CompletedPart>> futures) {
        for (Future<ObjectStoreClient.CompletedPart> future : futures) {
            future.cancel(true);
        }
        try {
            store.abortMultipart(uploadId);
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to abort multipart upload {}: {}", uploadId, e.toString());
        }
    }
}
