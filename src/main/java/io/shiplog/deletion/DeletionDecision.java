package io.shiplog.deletion;

import java.nio.file.Path;

public record DeletionDecision(Path file, boolean allowed, String gate, String reason) {
    public static DeletionDecision allowed(Path file) {
        return new DeletionDecision(file, true, null, "");
    }

    public static DeletionDecision vetoed(Path file, String gate, String reason) {
        return new DeletionDecision(file, false, gate, reason);
    }
}
