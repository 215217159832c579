package io.shiplog.deletion;

import io.shiplog.config.WatchRule;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

public final class DeletionGates {
    // never deletion targets
    static final List<Path> PROTECTED_TREES = List.of(
            Path.of("/bin"), Path.of("/boot"), Path.of("/dev"), Path.of("/etc"), Path.of("/lib"),
            Path.of("/lib64"), Path.of("/proc"), Path.of("/sbin"), Path.of("/sys"), Path.of("/usr"));
    // own files protected, application subdirectories below them are not
    static final List<Path> PROTECTED_TOP_LEVEL = List.of(Path.of("/"), Path.of("/opt"), Path.of("/var/log"));

    public static final NamedGate SYSTEM_DIRECTORY = new NamedGate("system-directory", DeletionGates::systemDirectory);
    public static final NamedGate ALLOW_DELETION = new NamedGate("allow-deletion", (file, rule) -> rule.allowDeletion()
            ? DeletionGate.Verdict.allow()
            : DeletionGate.Verdict.deny("allow_deletion is false for " + rule.rootPath()));
    public static final NamedGate RECURSIVE = new NamedGate("recursive", (file, rule) -> rule.recursive() || rule.isDirectChild(file)
            ? DeletionGate.Verdict.allow()
            : DeletionGate.Verdict.deny("rule is not recursive and file is in a subdirectory"));
    public static final NamedGate PATTERN = new NamedGate("pattern", (file, rule) -> rule.matchesName(file.getFileName().toString())
            ? DeletionGate.Verdict.allow()
            : DeletionGate.Verdict.deny("file name does not match pattern " + rule.globPattern()));

    private DeletionGates() {
    }

    public static List<NamedGate> standard() {
        return List.of(SYSTEM_DIRECTORY, ALLOW_DELETION, RECURSIVE, PATTERN);
    }

    static DeletionGate.Verdict systemDirectory(Path file, WatchRule rule) {
        Path normalized = file.toAbsolutePath().normalize();
        if (isProtected(normalized)) {
            return DeletionGate.Verdict.deny("protected system path: " + normalized);
        }
        Path parent = normalized.getParent();
        if (parent != null) {
            try {
                Path realParent = parent.toRealPath();
                if (isProtected(realParent.resolve(normalized.getFileName()))) {
                    return DeletionGate.Verdict.deny("resolves to protected system path: " + realParent);
                }
            } catch (IOException e) {
                return DeletionGate.Verdict.deny("cannot resolve parent directory: " + e.getMessage());
            }
        }
        return DeletionGate.Verdict.allow();
    }

    static boolean isProtected(Path path) {
        if (path.getParent() == null) {
            return true;
        }
        for (Path tree : PROTECTED_TREES) {
            if (path.startsWith(tree)) {
                return true;
            }
        }
        for (Path dir : PROTECTED_TOP_LEVEL) {
            if (path.equals(dir) || dir.equals(path.getParent())) {
                return true;
            }
        }
        return false;
    }

    public record NamedGate(String name, DeletionGate gate) {
    }
}
