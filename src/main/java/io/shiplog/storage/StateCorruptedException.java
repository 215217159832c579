package io.shiplog.storage;

import java.nio.file.Path;

public final class StateCorruptedException extends RuntimeException {
    private final Path file;

    public StateCorruptedException(Path file, Throwable cause) {
        super("State file is unreadable or corrupt: " + file, cause);
        this.file = file;
    }

    public Path file() {
        return file;
    }
}
