package io.shiplog.remote;

import io.shiplog.util.Hashing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Stream;

public final class FileSystemObjectStore implements ObjectStoreClient {
    private static final Logger log = LoggerFactory.getLogger(FileSystemObjectStore.class);
    static final String STAGING_DIR = ".multipart";
    private static final String KEY_FILE = "key";

    private final Path bucketDir;

    public FileSystemObjectStore(Path bucketDir) {
        this.bucketDir = bucketDir.toAbsolutePath().normalize();
    }

    public Path bucketDir() {
        return bucketDir;
    }

    @Override
    public String putObject(String key, Path source) throws IOException {
        Path target = resolveKey(key);
        Path tmp = target.resolveSibling(target.getFileName() + "." + UUID.randomUUID() + ".upload");
        Files.createDirectories(target.getParent());
        try {
            Files.copy(source, tmp, StandardCopyOption.REPLACE_EXISTING);
            publish(tmp, target);
        } finally {
            Files.deleteIfExists(tmp);
        }
        return Hashing.md5Hex(target);
    }

    @Override
    public String createMultipart(String key) throws IOException {
        resolveKey(key);
        String uploadId = UUID.randomUUID().toString();
        Path staging = stagingDir(uploadId);
        Files.createDirectories(staging);
        Files.writeString(staging.resolve(KEY_FILE), key, StandardCharsets.UTF_8);
        return uploadId;
    }

    @Override
    public String uploadPart(String uploadId, int partNumber, byte[] data) throws IOException {
        Path staging = existingStaging(uploadId);
        if (partNumber < 1 || partNumber > 10_000) {
            throw new ObjectStoreException(400, "InvalidPart", "part number out of range: " + partNumber);
        }
        Files.write(staging.resolve(partFileName(partNumber)), data);
        return Hashing.md5Hex(data, 0, data.length);
    }

    @Override
    public String completeMultipart(String uploadId, List<CompletedPart> parts) throws IOException {
        Path staging = existingStaging(uploadId);
        if (parts.isEmpty()) {
            throw new ObjectStoreException(400, "MalformedXML", "no parts supplied for " + uploadId);
        }
        String key = Files.readString(staging.resolve(KEY_FILE), StandardCharsets.UTF_8);
        Path target = resolveKey(key);
        Files.createDirectories(target.getParent());
        List<CompletedPart> ordered = new ArrayList<>(parts);
        ordered.sort(Comparator.comparingInt(CompletedPart::partNumber));
        Path assembled = staging.resolve("assembled");
        try (OutputStream out = Files.newOutputStream(assembled, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING)) {
            for (CompletedPart part : ordered) {
                Path partFile = staging.resolve(partFileName(part.partNumber()));
                if (!Files.exists(partFile)) {
                    throw new ObjectStoreException(400, "InvalidPart", "part " + part.partNumber() + " was never uploaded");
                }
                Files.copy(partFile, out);
            }
        }
        publish(assembled, target);
        deleteTree(staging);
        return Hashing.md5Hex(target) + "-" + ordered.size();
    }

    @Override
    public void abortMultipart(String uploadId) throws IOException {
        Path staging = stagingDir(uploadId);
        if (Files.exists(staging)) {
            deleteTree(staging);
            log.debug("Aborted multipart upload {}", uploadId);
        }
    }

    @Override
    public List<ObjectSummary> list(String prefix) throws IOException {
        requireBucket();
        String normalizedPrefix = prefix == null ? "" : prefix;
        Path staging = bucketDir.resolve(STAGING_DIR);
        List<ObjectSummary> out = new ArrayList<>();
        try (Stream<Path> files = Files.walk(bucketDir)) {
            for (Path file : (Iterable<Path>) files::iterator) {
                if (file.startsWith(staging) || !Files.isRegularFile(file)) {
                    continue;
                }
                String key = bucketDir.relativize(file).toString().replace('\\', '/');
                if (!key.startsWith(normalizedPrefix)) {
                    continue;
                }
                BasicFileAttributes attrs = Files.readAttributes(file, BasicFileAttributes.class);
                out.add(new ObjectSummary(key, attrs.size(), attrs.lastModifiedTime().toInstant()));
            }
        }
        out.sort(Comparator.comparing(ObjectSummary::key));
        return out;
    }

    @Override
    public Optional<ObjectSummary> head(String key) throws IOException {
        Path target = resolveKey(key);
        if (!Files.isRegularFile(target)) {
            return Optional.empty();
        }
        BasicFileAttributes attrs = Files.readAttributes(target, BasicFileAttributes.class);
        return Optional.of(new ObjectSummary(key, attrs.size(), attrs.lastModifiedTime().toInstant()));
    }

    @Override
    public void delete(String key) throws IOException {
        Files.deleteIfExists(resolveKey(key));
    }

    public List<String> openMultipartUploads() throws IOException {
        Path staging = bucketDir.resolve(STAGING_DIR);
        if (!Files.isDirectory(staging)) {
            return List.of();
        }
        try (Stream<Path> dirs = Files.list(staging)) {
            return dirs.map(p -> p.getFileName().toString()).sorted().toList();
        }
    }

    private Path resolveKey(String key) throws IOException {
        requireBucket();
        if (key == null || key.isBlank() || key.startsWith("/") || key.contains("\\")) {
            throw new ObjectStoreException(400, "InvalidKey", "invalid object key: " + key);
        }
        Path target = bucketDir.resolve(key).normalize();
        if (!target.startsWith(bucketDir) || target.startsWith(bucketDir.resolve(STAGING_DIR)) || target.equals(bucketDir)) {
            throw new ObjectStoreException(400, "InvalidKey", "object key escapes bucket: " + key);
        }
        return target;
    }

    private void requireBucket() throws ObjectStoreException {
        if (!Files.isDirectory(bucketDir)) {
            throw new ObjectStoreException(404, "NoSuchBucket", "bucket directory does not exist: " + bucketDir);
        }
    }

    private Path stagingDir(String uploadId) throws IOException {
        requireBucket();
        if (uploadId == null || !uploadId.matches("[0-9a-fA-F-]{36}")) {
            throw new ObjectStoreException(404, "NoSuchUpload", "unknown upload id: " + uploadId);
        }
        return bucketDir.resolve(STAGING_DIR).resolve(uploadId);
    }

    private Path existingStaging(String uploadId) throws IOException {
        Path staging = stagingDir(uploadId);
        if (!Files.isDirectory(staging)) {
            throw new ObjectStoreException(404, "NoSuchUpload", "unknown upload id: " + uploadId);
        }
        return staging;
    }

    private static String partFileName(int partNumber) {
        return String.format("part-%05d", partNumber);
    }

    private static void publish(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteTree(Path root) throws IOException {
        if (!Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted(Comparator.reverseOrder()).toList()) {
                try {
                    Files.deleteIfExists(path);
                } catch (NoSuchFileException ignored) {
                    // removed concurrently
                }
            }
        }
    }
}
