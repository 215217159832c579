package io.shiplog.config;

import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.Objects;

public record WatchRule(Path rootPath, String sourceLabel, String globPattern, boolean recursive, boolean allowDeletion) {
    public WatchRule {
        Objects.requireNonNull(rootPath, "rootPath");
        Objects.requireNonNull(sourceLabel, "sourceLabel");
        rootPath = rootPath.toAbsolutePath().normalize();
        globPattern = globPattern == null || globPattern.isBlank() ? null : globPattern.trim();
    }

    public boolean contains(Path file) {
        return file.toAbsolutePath().normalize().startsWith(rootPath);
    }

    public boolean isDirectChild(Path file) {
        Path parent = file.toAbsolutePath().normalize().getParent();
        return rootPath.equals(parent);
    }

    public boolean matchesName(String fileName) {
        if (globPattern == null) {
            return true;
        }
        PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + globPattern);
        return matcher.matches(Path.of(fileName));
    }

    public boolean admits(Path file) {
        Path normalized = file.toAbsolutePath().normalize();
        if (!contains(normalized) || normalized.equals(rootPath)) {
            return false;
        }
        if (!recursive && !isDirectChild(normalized)) {
            return false;
        }
        String name = normalized.getFileName().toString();
        return !isHidden(name) && matchesName(name);
    }

    public Path relativize(Path file) {
        return rootPath.relativize(file.toAbsolutePath().normalize());
    }

    public static boolean isHidden(String fileName) {
        return fileName.startsWith(".");
    }
}
