package io.shiplog.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import io.shiplog.schedule.DrainSchedule;
import io.shiplog.schedule.OperationalHours;
import io.shiplog.util.ByteSizes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class ConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final Pattern ENV_REF = Pattern.compile("\\$\\{([A-Za-z_][A-Za-z0-9_]*)}");
    private static final DateTimeFormatter CLOCK_TIME = DateTimeFormatter.ofPattern("H:mm");
    private static final YAMLMapper YAML = new YAMLMapper();

    private final UnaryOperator<String> env;
    private final String userHome;

    public ConfigLoader() {
        this(System::getenv, System.getProperty("user.home"));
    }

    public ConfigLoader(UnaryOperator<String> env, String userHome) {
        this.env = env;
        this.userHome = userHome;
    }

    public ShipLogConfig load(Path file) {
        String text;
        try {
            text = Files.readString(file);
        } catch (NoSuchFileException e) {
            throw new ConfigValidationException("config", "file not found: " + file, e);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read config file: " + file, e);
        }
        ShipLogConfig config = parse(text);
        log.info("Loaded config from {} ({} watch rules)", file, config.watchRules().size());
        return config;
    }

    public ShipLogConfig parse(String yaml) {
        JsonNode root;
        try {
            root = YAML.readTree(yaml);
        } catch (IOException e) {
            throw new ConfigValidationException("config", "invalid YAML: " + e.getMessage(), e);
        }
        if (root == null || root.isMissingNode() || root.isNull() || !root.isObject()) {
            throw new ConfigValidationException("config", "file is empty or not a mapping");
        }
        JsonNode expanded = expand(root);
        return build(expanded);
    }

    private ShipLogConfig build(JsonNode root) {
        String vehicleId = requiredText(root, "vehicle_id", "vehicle_id");
        Path stateDir = path(optionalText(root, "state_dir", "state_dir", ShipLogConfig.DEFAULT_STATE_DIR));
        List<WatchRule> rules = watchRules(root.path("log_directories"));
        RemoteStoreSettings remote = remote(root.has("remote") ? root.path("remote") : root.path("s3"));

        JsonNode upload = section(root, "upload");
        DrainSchedule schedule = drainSchedule(upload.path("schedule"));
        OperationalHours hours = operationalHours(upload.path("operational_hours"));
        UploadSettings uploadSettings = uploadSettings(upload, stateDir);

        DiskThresholds disk = disk(section(root, "disk"));
        DeletionPolicy deletion = deletion(section(root, "deletion"), uploadSettings.registryRetentionDays());
        MonitoringSettings monitoring = monitoring(section(root, "monitoring"), stateDir);
        ZoneId zone = zone(root);
        return new ShipLogConfig(vehicleId, rules, remote, uploadSettings, schedule, hours, disk, deletion, monitoring, zone);
    }

    private List<WatchRule> watchRules(JsonNode node) {
        if (node.isMissingNode() || node.isNull()) {
            throw new ConfigValidationException("log_directories", "is required");
        }
        if (!node.isArray() || node.isEmpty()) {
            throw new ConfigValidationException("log_directories", "must be a non-empty list");
        }
        List<WatchRule> rules = new ArrayList<>();
        Set<Path> seenPaths = new HashSet<>();
        Set<String> seenSources = new HashSet<>();
        for (int i = 0; i < node.size(); i++) {
            JsonNode entry = node.get(i);
            String key = "log_directories[" + i + "]";
            if (!entry.isObject()) {
                throw new ConfigValidationException(key, "must be a mapping with path and source");
            }
            Path root = path(requiredText(entry, "path", key + ".path"));
            String source = requiredText(entry, "source", key + ".source");
            if (source.contains("/")) {
                throw new ConfigValidationException(key + ".source", "must not contain '/': " + source);
            }
            String pattern = optionalText(entry, "pattern", key + ".pattern", null);
            boolean recursive = bool(entry, "recursive", key + ".recursive", true);
            boolean allowDeletion = bool(entry, "allow_deletion", key + ".allow_deletion", true);
            WatchRule rule = new WatchRule(root, source, pattern, recursive, allowDeletion);
            if (!seenPaths.add(rule.rootPath())) {
                throw new ConfigValidationException(key + ".path", "duplicate directory: " + rule.rootPath());
            }
            if (!seenSources.add(source)) {
                throw new ConfigValidationException(key + ".source", "duplicate source: " + source);
            }
            rules.add(rule);
        }
        return rules;
    }

    private RemoteStoreSettings remote(JsonNode node) {
        if (!node.isObject()) {
            throw new ConfigValidationException("remote", "section is required");
        }
        String bucket = requiredText(node, "bucket", "remote.bucket");
        String region = optionalText(node, "region", "remote.region", "us-east-1");
        String endpoint = optionalText(node, "endpoint", "remote.endpoint", null);
        String profile = optionalText(node, "profile", "remote.profile", null);
        return new RemoteStoreSettings(bucket, region, endpoint, profile);
    }

    private DrainSchedule drainSchedule(JsonNode node) {
        if (node.isMissingNode() || node.isNull()) {
            return DrainSchedule.interval(Duration.ofHours(1));
        }
        String mode = optionalText(node, "mode", "upload.schedule.mode", "interval").toLowerCase();
        try {
            switch (mode) {
                case "interval": {
                    long hoursPart = integer(node, "interval_hours", "upload.schedule.interval_hours", 0);
                    long minutesPart = integer(node, "interval_minutes", "upload.schedule.interval_minutes", 0);
                    Duration interval = Duration.ofHours(hoursPart).plusMinutes(minutesPart);
                    if (interval.isZero()) {
                        interval = Duration.ofHours(1);
                    }
                    return DrainSchedule.interval(interval);
                }
                case "daily":
                    return DrainSchedule.daily(clockTime(node, "daily_time", "upload.schedule.daily_time", null));
                default:
                    throw new ConfigValidationException("upload.schedule.mode", "must be 'daily' or 'interval', got " + mode);
            }
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new ConfigValidationException("upload.schedule", e.getMessage(), e);
        }
    }

    private OperationalHours operationalHours(JsonNode node) {
        if (!node.isObject() || !bool(node, "enabled", "upload.operational_hours.enabled", false)) {
            return OperationalHours.always();
        }
        LocalTime start = clockTime(node, "start", "upload.operational_hours.start", null);
        LocalTime end = clockTime(node, "end", "upload.operational_hours.end", null);
        try {
            return new OperationalHours(true, start, end);
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new ConfigValidationException("upload.operational_hours", String.valueOf(e.getMessage()), e);
        }
    }

    private UploadSettings uploadSettings(JsonNode upload, Path stateDir) {
        int stableSeconds = (int) integer(upload, "file_stable_seconds", "upload.file_stable_seconds", ShipLogConfig.DEFAULT_STABLE_SECONDS);
        requireAtLeast(stableSeconds, 1, "upload.file_stable_seconds");

        JsonNode scan = upload.path("scan_existing_files");
        boolean scanEnabled = bool(scan, "enabled", "upload.scan_existing_files.enabled", true);
        int scanMaxAge = (int) integer(scan, "max_age_days", "upload.scan_existing_files.max_age_days", ShipLogConfig.DEFAULT_SCAN_MAX_AGE_DAYS);
        requireAtLeast(scanMaxAge, 0, "upload.scan_existing_files.max_age_days");

        JsonNode registry = upload.path("processed_files_registry");
        Path registryFile = path(optionalText(registry, "registry_file", "upload.processed_files_registry.registry_file",
                stateDir.resolve("registry.json").toString()));
        int retentionDays = (int) integer(registry, "retention_days", "upload.processed_files_registry.retention_days",
                ShipLogConfig.DEFAULT_REGISTRY_RETENTION_DAYS);
        requireAtLeast(retentionDays, 1, "upload.processed_files_registry.retention_days");

        Path queueFile = path(optionalText(upload, "queue_file", "upload.queue_file", stateDir.resolve("queue.json").toString()));
        boolean uploadOnStart = bool(upload, "upload_on_start", "upload.upload_on_start", true);

        int maxAttempts = (int) integer(upload, "max_attempts", "upload.max_attempts", ShipLogConfig.DEFAULT_MAX_ATTEMPTS);
        requireAtLeast(maxAttempts, 1, "upload.max_attempts");
        UploadSettings.RetrySettings retry = new UploadSettings.RetrySettings(
                maxAttempts,
                Duration.ofMillis(ShipLogConfig.DEFAULT_BASE_BACKOFF_MS),
                Duration.ofMillis(ShipLogConfig.DEFAULT_MAX_BACKOFF_MS));

        int batchSize = (int) integer(upload, "batch_size", "upload.batch_size", ShipLogConfig.DEFAULT_BATCH_SIZE);
        requireAtLeast(batchSize, 1, "upload.batch_size");
        int parallelism = (int) integer(upload, "parallelism", "upload.parallelism", ShipLogConfig.DEFAULT_PARALLELISM);
        requireAtLeast(parallelism, 1, "upload.parallelism");
        int timeoutSeconds = (int) integer(upload, "request_timeout_seconds", "upload.request_timeout_seconds",
                ShipLogConfig.DEFAULT_REQUEST_TIMEOUT_SECONDS);
        requireAtLeast(timeoutSeconds, 1, "upload.request_timeout_seconds");
        JsonNode multipart = upload.path("multipart");
        long thresholdMb = integer(multipart, "threshold_mb", "upload.multipart.threshold_mb", ShipLogConfig.DEFAULT_MULTIPART_THRESHOLD_MB);
        requireAtLeast(thresholdMb, 1, "upload.multipart.threshold_mb");
        long partSizeMb = integer(multipart, "part_size_mb", "upload.multipart.part_size_mb", ShipLogConfig.DEFAULT_PART_SIZE_MB);
        requireAtLeast(partSizeMb, 1, "upload.multipart.part_size_mb");
        long maxObjectGb = integer(upload, "max_object_gb", "upload.max_object_gb", ShipLogConfig.DEFAULT_MAX_OBJECT_GB);
        requireAtLeast(maxObjectGb, 1, "upload.max_object_gb");
        UploadSettings.TransferSettings transfer = new UploadSettings.TransferSettings(
                batchSize,
                parallelism,
                Duration.ofSeconds(timeoutSeconds),
                thresholdMb * ByteSizes.MB,
                partSizeMb * ByteSizes.MB,
                maxObjectGb * ByteSizes.GB);

        return new UploadSettings(
                Duration.ofSeconds(stableSeconds),
                new UploadSettings.BacklogScan(scanEnabled, scanMaxAge),
                queueFile,
                registryFile,
                retentionDays,
                uploadOnStart,
                retry,
                transfer);
    }

    private DiskThresholds disk(JsonNode node) {
        double reservedGb = decimal(node, "reserved_gb", "disk.reserved_gb", 0.0d);
        double warning = decimal(node, "warning_threshold", "disk.warning_threshold", 0.90d);
        double critical = decimal(node, "critical_threshold", "disk.critical_threshold", 0.95d);
        return new DiskThresholds(warning, critical, (long) (reservedGb * ByteSizes.GB));
    }

    private DeletionPolicy deletion(JsonNode node, int registryRetentionDays) {
        DeletionPolicy defaults = DeletionPolicy.defaults();
        JsonNode after = node.path("after_upload");
        DeletionPolicy.AfterUpload afterUpload = new DeletionPolicy.AfterUpload(
                bool(after, "enabled", "deletion.after_upload.enabled", defaults.afterUpload().enabled()),
                (int) integer(after, "keep_days", "deletion.after_upload.keep_days", defaults.afterUpload().keepDays()));
        requireAtLeast(afterUpload.keepDays(), 0, "deletion.after_upload.keep_days");
        // after-upload deletion needs the registry record to still exist
        if (afterUpload.enabled() && afterUpload.keepDays() >= registryRetentionDays) {
            throw new ConfigValidationException("deletion.after_upload.keep_days",
                    "must be less than upload.processed_files_registry.retention_days (" + registryRetentionDays + ")");
        }
        JsonNode age = node.path("age_based");
        DeletionPolicy.AgeBased ageBased = new DeletionPolicy.AgeBased(
                bool(age, "enabled", "deletion.age_based.enabled", defaults.ageBased().enabled()),
                (int) integer(age, "max_age_days", "deletion.age_based.max_age_days", defaults.ageBased().maxAgeDays()),
                clockTime(age, "schedule_time", "deletion.age_based.schedule_time", defaults.ageBased().scheduleTime()));
        JsonNode emergency = node.path("emergency");
        DeletionPolicy.Emergency emergencyPolicy = new DeletionPolicy.Emergency(
                bool(emergency, "enabled", "deletion.emergency.enabled", defaults.emergency().enabled()));
        return new DeletionPolicy(afterUpload, ageBased, emergencyPolicy);
    }

    private MonitoringSettings monitoring(JsonNode node, Path stateDir) {
        Path metricsFile = path(optionalText(node, "metrics_file", "monitoring.metrics_file",
                stateDir.resolve("metrics.prom").toString()));
        Path auditFile = path(optionalText(node, "audit_file", "monitoring.audit_file",
                stateDir.resolve("audit.jsonl").toString()));
        long publishSeconds = integer(node, "publish_interval_seconds", "monitoring.publish_interval_seconds",
                ShipLogConfig.DEFAULT_PUBLISH_INTERVAL_SECONDS);
        requireAtLeast(publishSeconds, 1, "monitoring.publish_interval_seconds");
        return new MonitoringSettings(metricsFile, auditFile, Duration.ofSeconds(publishSeconds));
    }

    private ZoneId zone(JsonNode root) {
        String raw = optionalText(root, "time_zone", "time_zone", null);
        if (raw == null) {
            return ZoneId.systemDefault();
        }
        try {
            return ZoneId.of(raw);
        } catch (DateTimeException e) {
            throw new ConfigValidationException("time_zone", "unknown zone: " + raw, e);
        }
    }

    private JsonNode expand(JsonNode node) {
        if (node.isTextual()) {
            return TextNode.valueOf(expandText(node.asText()));
        }
        if (node.isObject()) {
            ObjectNode copy = YAML.createObjectNode();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                copy.set(field.getKey(), expand(field.getValue()));
            }
            return copy;
        }
        if (node.isArray()) {
            ArrayNode copy = YAML.createArrayNode();
            for (JsonNode item : node) {
                copy.add(expand(item));
            }
            return copy;
        }
        return node;
    }

    String expandText(String raw) {
        Matcher matcher = ENV_REF.matcher(raw);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            String value = env.apply(matcher.group(1));
            matcher.appendReplacement(sb, Matcher.quoteReplacement(value == null ? matcher.group() : value));
        }
        matcher.appendTail(sb);
        String value = sb.toString();
        if (userHome != null && (value.equals("~") || value.startsWith("~/"))) {
            value = userHome + value.substring(1);
        }
        return value;
    }

    private static JsonNode section(JsonNode root, String name) {
        JsonNode node = root.path(name);
        if (node.isMissingNode() || node.isNull()) {
            return YAML.createObjectNode();
        }
        if (!node.isObject()) {
            throw new ConfigValidationException(name, "must be a mapping");
        }
        return node;
    }

    private static Path path(String raw) {
        return Paths.get(raw).toAbsolutePath().normalize();
    }

    private static String requiredText(JsonNode node, String field, String key) {
        String value = optionalText(node, field, key, null);
        if (value == null || value.isBlank()) {
            throw new ConfigValidationException(key, "is required");
        }
        return value.trim();
    }

    private static String optionalText(JsonNode node, String field, String key, String fallback) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull()) {
            return fallback;
        }
        if (!value.isValueNode() || value.isBoolean()) {
            throw new ConfigValidationException(key, "must be a string");
        }
        return value.asText();
    }

    private static boolean bool(JsonNode node, String field, String key, boolean fallback) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull()) {
            return fallback;
        }
        if (!value.isBoolean()) {
            throw new ConfigValidationException(key, "must be true or false");
        }
        return value.booleanValue();
    }

    private static long integer(JsonNode node, String field, String key, long fallback) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull()) {
            return fallback;
        }
        if (!value.isIntegralNumber()) {
            throw new ConfigValidationException(key, "must be an integer");
        }
        return value.longValue();
    }

    private static double decimal(JsonNode node, String field, String key, double fallback) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull()) {
            return fallback;
        }
        if (!value.isNumber()) {
            throw new ConfigValidationException(key, "must be a number");
        }
        return value.doubleValue();
    }

    private static LocalTime clockTime(JsonNode node, String field, String key, LocalTime fallback) {
        String raw = optionalText(node, field, key, null);
        if (raw == null) {
            if (fallback == null) {
                throw new ConfigValidationException(key, "is required (HH:MM)");
            }
            return fallback;
        }
        try {
            return LocalTime.parse(raw.trim(), CLOCK_TIME);
        } catch (DateTimeParseException e) {
            throw new ConfigValidationException(key, "must be HH:MM, got " + raw, e);
        }
    }

    private static void requireAtLeast(long value, long min, String key) {
        if (value < min) {
            throw new ConfigValidationException(key, "must be >= " + min + ", got " + value);
        }
    }
}
