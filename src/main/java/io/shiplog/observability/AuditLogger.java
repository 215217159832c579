package io.shiplog.observability;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.shiplog.util.Hashing;
import io.shiplog.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only audit trail of uploads and deletions. Each JSON line carries the hash of
 * the previous line, so truncation or edits break the chain and {@link #verify()} notices.
 */
public final class AuditLogger {
    private static final Logger log = LoggerFactory.getLogger(AuditLogger.class);

    private final Path auditFile;
    private final String vehicleId;
    private final Clock clock;
    private String previousHash;

    public AuditLogger(Path auditFile, String vehicleId, Clock clock) {
        this.auditFile = auditFile;
        this.vehicleId = vehicleId == null ? "" : vehicleId.trim();
        this.clock = clock;
        try {
            Files.createDirectories(auditFile.toAbsolutePath().getParent());
            if (!Files.exists(auditFile)) {
                try {
                    Files.createFile(auditFile);
                } catch (FileAlreadyExistsException ignored) {
                    // created between exists() and createFile()
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize audit log file: " + auditFile, e);
        }
        this.previousHash = loadLastHash();
    }

    public Path file() {
        return auditFile;
    }

    public synchronized void log(AuditEvent event) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", clock.instant().toString());
        row.put("vehicle_id", vehicleId);
        row.put("action", event.action());
        row.put("resource", event.resource());
        row.put("result", event.result());
        row.put("details", event.details() == null ? Map.of() : event.details());
        row.put("prev_hash", previousHash);
        String rowHash = Hashing.sha256Hex(Jsons.toCompactJson(row));
        row.put("hash", rowHash);
        String line = Jsons.toCompactJson(row) + "\n";
        try {
            Files.writeString(auditFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            previousHash = rowHash;
        } catch (IOException e) {
            throw new RuntimeException("Failed to write audit log", e);
        }
    }

    public void logQuietly(AuditEvent event) {
        try {
            log(event);
        } catch (RuntimeException e) {
            log.warn("Audit write failed for {} {}: {}", event.action(), event.resource(), e.toString());
        }
    }

    public synchronized String currentHash() {
        return previousHash;
    }

    public synchronized int verify() {
        List<String> lines;
        try {
            lines = Files.readAllLines(auditFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read audit log: " + auditFile, e);
        }
        String expectedPrev = "";
        int count = 0;
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line.isBlank()) {
                continue;
            }
            ObjectNode node;
            try {
                node = (ObjectNode) Jsons.mapper().readTree(line);
            } catch (IOException | ClassCastException e) {
                throw new IllegalStateException("Audit line " + (i + 1) + " is not a JSON object", e);
            }
            String hash = node.path("hash").asText("");
            if (!expectedPrev.equals(node.path("prev_hash").asText(""))) {
                throw new IllegalStateException("Audit chain broken at line " + (i + 1));
            }
            node.remove("hash");
            String recomputed = Hashing.sha256Hex(Jsons.toCompactJson(node));
            if (!recomputed.equals(hash)) {
                throw new IllegalStateException("Audit row hash mismatch at line " + (i + 1));
            }
            expectedPrev = hash;
            count++;
        }
        return count;
    }

    private String loadLastHash() {
        try {
            String last = "";
            for (String line : Files.readAllLines(auditFile, StandardCharsets.UTF_8)) {
                if (!line.isBlank()) {
                    last = line;
                }
            }
            if (last.isBlank()) {
                return "";
            }
            JsonNode node = Jsons.mapper().readTree(last);
            return node.path("hash").asText("");
        } catch (IOException e) {
            log.warn("Cannot read last audit hash from {}, starting a new chain: {}", auditFile, e.toString());
            return "";
        }
    }

    public record AuditEvent(String action, String resource, String result, Map<String, Object> details) {
        public static AuditEvent of(String action, String resource, String result, Map<String, Object> details) {
            return new AuditEvent(action, resource, result, details == null ? Map.of() : details);
        }
    }
}
