package io.shiplog.deletion;

import io.shiplog.config.WatchRule;

import java.nio.file.Path;

@FunctionalInterface
public interface DeletionGate {
    Verdict check(Path file, WatchRule rule);

    record Verdict(boolean allowed, String reason) {
        public static Verdict allow() {
            return new Verdict(true, "");
        }

        public static Verdict deny(String reason) {
            return new Verdict(false, reason);
        }
    }
}
