package io.shiplog.upload;

import io.shiplog.config.WatchRule;
import io.shiplog.detect.RuleMatcher;
import io.shiplog.model.FileIdentity;

import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Optional;

/**
 * Builds {@code {vehicle}/{YYYY-MM-DD}/{source}/{relative path}} keys. The date is the
 * file's modification date in the configured zone, so a file written just before
 * midnight lands under that day even when uploaded the next morning.
 */
public final class RemoteKeyBuilder {
    static final String FALLBACK_SOURCE = "other";

    private final String vehicleId;
    private final RuleMatcher rules;
    private final ZoneId zone;

    public RemoteKeyBuilder(String vehicleId, RuleMatcher rules, ZoneId zone) {
        this.vehicleId = vehicleId;
        this.rules = rules;
        this.zone = zone;
    }

    public String keyFor(FileIdentity identity) {
        Path path = identity.asPath();
        LocalDate date = Instant.ofEpochMilli(identity.modifiedAtMs()).atZone(zone).toLocalDate();
        Optional<WatchRule> rule = rules.owner(path);
        String source = rule.map(WatchRule::sourceLabel).orElse(FALLBACK_SOURCE);
        String relative = rule.map(r -> r.relativize(path).toString())
                .orElse(path.getFileName().toString())
                .replace('\\', '/');
        return vehicleId + "/" + date + "/" + source + "/" + relative;
    }
}
