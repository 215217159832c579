package io.shiplog.deletion;

import java.nio.file.Path;
import java.util.List;

public record SweepResult(String policy, int examined, int deleted, int vetoed, List<Path> deletedPaths) {
    public static SweepResult skipped(String policy) {
        return new SweepResult(policy, 0, 0, 0, List.of());
    }
}
