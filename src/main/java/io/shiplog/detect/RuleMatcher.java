package io.shiplog.detect;

import io.shiplog.config.WatchRule;

import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

public final class RuleMatcher {
    private final List<WatchRule> rules;

    public RuleMatcher(List<WatchRule> rules) {
        this.rules = rules.stream()
                .sorted(Comparator.comparingInt((WatchRule r) -> r.rootPath().getNameCount()).reversed())
                .toList();
    }

    public List<WatchRule> rules() {
        return rules;
    }

    public Optional<WatchRule> owner(Path file) {
        Path normalized = file.toAbsolutePath().normalize();
        for (WatchRule rule : rules) {
            if (rule.contains(normalized) && !normalized.equals(rule.rootPath())) {
                return Optional.of(rule);
            }
        }
        return Optional.empty();
    }

    public Optional<WatchRule> admitting(Path file) {
        return owner(file).filter(rule -> rule.admits(file));
    }
}
