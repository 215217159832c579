package io.shiplog.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.shiplog.util.Hashing;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Objects;

/**
 * A logical file: the same path observed with the same size and modification
 * time. Any change of size or mtime yields a different identity.
 */
public record FileIdentity(String path, long sizeBytes, long modifiedAtMs) {
    public FileIdentity {
        Objects.requireNonNull(path, "path");
        if (sizeBytes < 0L) {
            throw new IllegalArgumentException("sizeBytes must be >= 0");
        }
    }

    public static FileIdentity of(Path path) throws IOException {
        Path absolute = path.toAbsolutePath().normalize();
        BasicFileAttributes attrs = Files.readAttributes(absolute, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
        return new FileIdentity(absolute.toString(), attrs.size(), attrs.lastModifiedTime().toMillis());
    }

    @JsonIgnore
    public Path asPath() {
        return Path.of(path);
    }

    @JsonIgnore
    public String hash() {
        return Hashing.sha256Hex(path + "|" + sizeBytes + "|" + modifiedAtMs);
    }

    public boolean samePath(FileIdentity other) {
        return other != null && path.equals(other.path);
    }
}
