package io.shiplog.deletion;

import java.io.IOException;
import java.nio.file.FileStore;
import java.nio.file.Files;
import java.nio.file.Path;

public final class FileStoreDiskUsageProbe implements DiskUsageProbe {
    private final Path path;

    public FileStoreDiskUsageProbe(Path path) {
        this.path = path;
    }

    @Override
    public DiskUsage probe() throws IOException {
        FileStore store = Files.getFileStore(path);
        return new DiskUsage(store.getTotalSpace(), store.getUsableSpace());
    }
}
