package io.shiplog.observability;

import io.shiplog.support.MutableClock;
import io.shiplog.support.TestFiles;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

final class AuditLoggerTest {

    @Test
    void chainContinuesAcrossInstances() throws Exception {
        Path dir = Files.createTempDirectory("shiplog-audit-");
        try {
            Path file = dir.resolve("audit/audit.jsonl");
            MutableClock clock = new MutableClock(Instant.parse("2024-03-01T10:00:00Z"));
            AuditLogger first = new AuditLogger(file, "truck-07", clock);
            first.log(AuditLogger.AuditEvent.of("upload", "/logs/a.log", "ok", Map.of("key", "k/a")));
            String head = first.currentHash();

            AuditLogger second = new AuditLogger(file, "truck-07", clock);
            Assertions.assertEquals(head, second.currentHash());
            second.log(AuditLogger.AuditEvent.of("delete", "/logs/a.log", "ok", Map.of("policy", "deferred")));

            Assertions.assertEquals(2, second.verify());
            List<String> lines = Files.readAllLines(file);
            Assertions.assertTrue(lines.get(0).contains("\"vehicle_id\":\"truck-07\""));
            Assertions.assertTrue(lines.get(1).contains("\"prev_hash\":\"" + head + "\""));
        } finally {
            TestFiles.deleteRecursively(dir);
        }
    }

    @Test
    void editedRowBreaksVerification() throws Exception {
        Path dir = Files.createTempDirectory("shiplog-audit-");
        try {
            Path file = dir.resolve("audit.jsonl");
            AuditLogger audit = new AuditLogger(file, "truck-07", new MutableClock(Instant.parse("2024-03-01T10:00:00Z")));
            audit.log(AuditLogger.AuditEvent.of("upload", "/logs/a.log", "ok", Map.of()));
            audit.log(AuditLogger.AuditEvent.of("upload", "/logs/b.log", "ok", Map.of()));

            List<String> lines = Files.readAllLines(file);
            Files.write(file, List.of(lines.get(0).replace("a.log", "z.log"), lines.get(1)));

            IllegalStateException e = Assertions.assertThrows(IllegalStateException.class, audit::verify);
            Assertions.assertTrue(e.getMessage().contains("line 1"));
        } finally {
            TestFiles.deleteRecursively(dir);
        }
    }

    @Test
    void removedRowBreaksTheChain() throws Exception {
        Path dir = Files.createTempDirectory("shiplog-audit-");
        try {
            Path file = dir.resolve("audit.jsonl");
            AuditLogger audit = new AuditLogger(file, "truck-07", new MutableClock(Instant.parse("2024-03-01T10:00:00Z")));
            for (String name : List.of("a", "b", "c")) {
                audit.log(AuditLogger.AuditEvent.of("upload", "/logs/" + name, "ok", Map.of()));
            }
            List<String> lines = Files.readAllLines(file);
            Files.write(file, List.of(lines.get(0), lines.get(2)));

            IllegalStateException e = Assertions.assertThrows(IllegalStateException.class, audit::verify);
            Assertions.assertTrue(e.getMessage().contains("line 2"));
        } finally {
            TestFiles.deleteRecursively(dir);
        }
    }
}
