package io.shiplog.deletion;

import io.shiplog.config.DeletionPolicy;
import io.shiplog.config.DiskThresholds;
import io.shiplog.config.WatchRule;
import io.shiplog.detect.RuleMatcher;
import io.shiplog.model.FileIdentity;
import io.shiplog.model.RegistryRecord;
import io.shiplog.observability.AuditLogger;
import io.shiplog.observability.Metrics;
import io.shiplog.observability.MetricsPublisher;
import io.shiplog.storage.ProcessedFileRegistry;
import io.shiplog.util.ByteSizes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Owns every local file deletion. A file is only removed when its owning rule exists and
 * all {@link DeletionGates#standard() gates} allow it; the policies below only decide
 * which files to put in front of the gates.
 *
 * <p>Deletion never touches the registry or the queue.
 */
public final class DeletionSafetyManager {
    private static final Logger log = LoggerFactory.getLogger(DeletionSafetyManager.class);

    public static final String POLICY_DEFERRED = "deferred";
    public static final String POLICY_AGE = "age";
    public static final String POLICY_EMERGENCY = "emergency";

    private final RuleMatcher rules;
    private final ProcessedFileRegistry registry;
    private final DeletionPolicy policy;
    private final DiskThresholds thresholds;
    private final DiskUsageProbe probe;
    private final Clock clock;
    private final MetricsPublisher metrics;
    private final AuditLogger audit;
    private final List<DeletionGates.NamedGate> gates;

    public DeletionSafetyManager(
            RuleMatcher rules,
            ProcessedFileRegistry registry,
            DeletionPolicy policy,
            DiskThresholds thresholds,
            DiskUsageProbe probe,
            Clock clock,
            MetricsPublisher metrics,
            AuditLogger audit
    ) {
        this(rules, registry, policy, thresholds, probe, clock, metrics, audit, DeletionGates.standard());
    }

    DeletionSafetyManager(
            RuleMatcher rules,
            ProcessedFileRegistry registry,
            DeletionPolicy policy,
            DiskThresholds thresholds,
            DiskUsageProbe probe,
            Clock clock,
            MetricsPublisher metrics,
            AuditLogger audit,
            List<DeletionGates.NamedGate> gates
    ) {
        this.rules = rules;
        this.registry = registry;
        this.policy = policy;
        this.thresholds = thresholds;
        this.probe = probe;
        this.clock = clock;
        this.metrics = metrics == null ? MetricsPublisher.NOOP : metrics;
        this.audit = audit;
        this.gates = List.copyOf(gates);
    }

    public DeletionPolicy policy() {
        return policy;
    }

    public DeletionDecision evaluate(Path file) {
        Path normalized = file.toAbsolutePath().normalize();
        Optional<WatchRule> owner;
        try {
            owner = rules.owner(normalized);
        } catch (RuntimeException e) {
            return DeletionDecision.vetoed(normalized, "owner", "rule lookup failed: " + e);
        }
        if (owner.isEmpty()) {
            return DeletionDecision.vetoed(normalized, "owner", "no watch rule owns this file");
        }
        for (DeletionGates.NamedGate gate : gates) {
            DeletionGate.Verdict verdict;
            try {
                verdict = gate.gate().check(normalized, owner.get());
            } catch (RuntimeException e) {
                return DeletionDecision.vetoed(normalized, gate.name(), "gate failed: " + e);
            }
            if (verdict == null || !verdict.allowed()) {
                String reason = verdict == null ? "gate returned no verdict" : verdict.reason();
                return DeletionDecision.vetoed(normalized, gate.name(), reason);
            }
        }
        return DeletionDecision.allowed(normalized);
    }

    public boolean deleteIfSafe(Path file, String policyName) {
        DeletionDecision decision = evaluate(file);
        if (!decision.allowed()) {
            log.debug("Deletion vetoed by {} gate for {}: {}", decision.gate(), decision.file(), decision.reason());
            return false;
        }
        Path target = decision.file();
        long size;
        try {
            BasicFileAttributes attrs = Files.readAttributes(target, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
            if (!attrs.isRegularFile()) {
                log.warn("Not deleting non-regular file {}", target);
                return false;
            }
            size = attrs.size();
            Files.delete(target);
        } catch (NoSuchFileException e) {
            return false;
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to delete {}: {}", target, e.toString());
            return false;
        }
        metrics.increment(Metrics.FILES_DELETED, Metrics.LABEL_POLICY, policyName, 1L);
        if (audit != null) {
            audit.logQuietly(AuditLogger.AuditEvent.of("delete", target.toString(), "ok", Map.of(
                    "policy", policyName,
                    "size_bytes", size)));
        }
        log.info("Deleted {} ({}, policy={})", target, ByteSizes.format(size), policyName);
        return true;
    }

    public void onUploaded(RegistryRecord record) {
        DeletionPolicy.AfterUpload afterUpload = policy.afterUpload();
        if (!afterUpload.enabled() || afterUpload.keepDays() > 0) {
            return;
        }
        Path path = Path.of(record.path());
        if (currentIdentityMatches(path, record)) {
            deleteIfSafe(path, POLICY_DEFERRED);
        }
    }

    public SweepResult runDeferredSweep(boolean dryRun) {
        DeletionPolicy.AfterUpload afterUpload = policy.afterUpload();
        if (!afterUpload.enabled()) {
            return SweepResult.skipped(POLICY_DEFERRED);
        }
        long now = clock.millis();
        long keepMs = Duration.ofDays(afterUpload.keepDays()).toMillis();
        int examined = 0;
        int vetoed = 0;
        List<Path> deleted = new ArrayList<>();
        for (RegistryRecord record : registry.records()) {
            if (record.uploadedAtMs() + keepMs > now) {
                continue;
            }
            Path path = Path.of(record.path());
            if (!currentIdentityMatches(path, record)) {
                continue;
            }
            examined++;
            if (apply(path, POLICY_DEFERRED, dryRun)) {
                deleted.add(path);
            } else {
                vetoed++;
            }
        }
        return finish(new SweepResult(POLICY_DEFERRED, examined, deleted.size(), vetoed, List.copyOf(deleted)), dryRun);
    }

    public SweepResult runAgeSweep(boolean dryRun) {
        DeletionPolicy.AgeBased ageBased = policy.ageBased();
        if (!ageBased.enabled()) {
            return SweepResult.skipped(POLICY_AGE);
        }
        long now = clock.millis();
        long maxAgeMs = Duration.ofDays(ageBased.maxAgeDays()).toMillis();
        Set<Path> candidates = new LinkedHashSet<>();
        for (WatchRule rule : rules.rules()) {
            collectFiles(rule, (file, attrs) -> {
                if (now - attrs.lastModifiedTime().toMillis() > maxAgeMs) {
                    candidates.add(file.toAbsolutePath().normalize());
                }
            });
        }
        int vetoed = 0;
        List<Path> deleted = new ArrayList<>();
        for (Path file : candidates) {
            if (apply(file, POLICY_AGE, dryRun)) {
                deleted.add(file);
            } else {
                vetoed++;
            }
        }
        return finish(new SweepResult(POLICY_AGE, candidates.size(), deleted.size(), vetoed, List.copyOf(deleted)), dryRun);
    }

    public SweepResult runEmergencyCleanup(boolean dryRun) {
        if (!policy.emergency().enabled()) {
            return SweepResult.skipped(POLICY_EMERGENCY);
        }
        DiskUsageProbe.DiskUsage usage = probeDisk();
        if (usage == null || !needsEmergency(usage)) {
            return SweepResult.skipped(POLICY_EMERGENCY);
        }
        log.warn("Disk usage {}% with {} free, starting emergency cleanup",
                String.format(Locale.ROOT, "%.1f", usage.usedPercent()), ByteSizes.format(usage.usableBytes()));
        List<Candidate> candidates = new ArrayList<>();
        for (RegistryRecord record : registry.records()) {
            Path path = Path.of(record.path());
            if (currentIdentityMatches(path, record)) {
                candidates.add(new Candidate(path, record.modifiedAtMs(), record.sizeBytes()));
            }
        }
        candidates.sort(Comparator.comparingLong(Candidate::modifiedAtMs).thenComparing(c -> c.path().toString()));
        int examined = 0;
        int vetoed = 0;
        List<Path> deleted = new ArrayList<>();
        for (Candidate candidate : candidates) {
            if (cleanEnough(usage)) {
                break;
            }
            examined++;
            if (!apply(candidate.path(), POLICY_EMERGENCY, dryRun)) {
                vetoed++;
                continue;
            }
            deleted.add(candidate.path());
            if (dryRun) {
                usage = usage.freed(candidate.sizeBytes());
            } else {
                DiskUsageProbe.DiskUsage reprobed = probeDisk();
                usage = reprobed == null ? usage.freed(candidate.sizeBytes()) : reprobed;
            }
        }
        if (!cleanEnough(usage)) {
            log.error("Emergency cleanup could not bring disk usage below {}% (now {}%); no more uploaded files eligible",
                    Math.round(thresholds.warning() * 100.0d), String.format(Locale.ROOT, "%.1f", usage.usedPercent()));
        }
        return finish(new SweepResult(POLICY_EMERGENCY, examined, deleted.size(), vetoed, List.copyOf(deleted)), dryRun);
    }

    public DiskUsageProbe.DiskUsage probeDisk() {
        try {
            DiskUsageProbe.DiskUsage usage = probe.probe();
            metrics.gauge(Metrics.DISK_USAGE_PERCENT, usage.usedPercent());
            if (usage.usedFraction() >= thresholds.warning()) {
                log.warn("Disk usage {}% is above the warning threshold",
                        String.format(Locale.ROOT, "%.1f", usage.usedPercent()));
            }
            return usage;
        } catch (IOException | RuntimeException e) {
            log.warn("Disk usage probe failed: {}", e.toString());
            return null;
        }
    }

    boolean needsEmergency(DiskUsageProbe.DiskUsage usage) {
        return usage.usedFraction() >= thresholds.critical() || usage.usableBytes() < thresholds.reservedBytes();
    }

    boolean cleanEnough(DiskUsageProbe.DiskUsage usage) {
        return usage.usedFraction() < thresholds.warning() && usage.usableBytes() >= thresholds.reservedBytes();
    }

    private boolean apply(Path file, String policyName, boolean dryRun) {
        if (dryRun) {
            DeletionDecision decision = evaluate(file);
            if (!decision.allowed()) {
                log.info("[dry-run] would keep {} ({} gate: {})", file, decision.gate(), decision.reason());
                return false;
            }
            log.info("[dry-run] would delete {} (policy={})", file, policyName);
            return true;
        }
        return deleteIfSafe(file, policyName);
    }

    private SweepResult finish(SweepResult result, boolean dryRun) {
        if (result.examined() > 0) {
            log.info("{}{} sweep: examined={}, deleted={}, kept={}", dryRun ? "[dry-run] " : "",
                    result.policy(), result.examined(), result.deleted(), result.vetoed());
        }
        return result;
    }

    private static boolean currentIdentityMatches(Path path, RegistryRecord record) {
        try {
            return record.matches(FileIdentity.of(path));
        } catch (IOException e) {
            return false;
        }
    }

    private static void collectFiles(WatchRule rule, FileSink sink) {
        Path root = rule.rootPath();
        if (!Files.isDirectory(root)) {
            return;
        }
        int depth = rule.recursive() ? Integer.MAX_VALUE : 1;
        try {
            Files.walkFileTree(root, EnumSet.noneOf(FileVisitOption.class), depth, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (!dir.equals(root) && WatchRule.isHidden(dir.getFileName().toString())) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isRegularFile() && !WatchRule.isHidden(file.getFileName().toString())) {
                        sink.accept(file, attrs);
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            log.warn("Failed to walk {}: {}", root, e.toString());
        }
    }

    @FunctionalInterface
    private interface FileSink {
        void accept(Path file, BasicFileAttributes attrs);
    }

    private record Candidate(Path path, long modifiedAtMs, long sizeBytes) {
    }
}
