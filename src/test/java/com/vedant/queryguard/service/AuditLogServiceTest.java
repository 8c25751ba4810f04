package com.vedant.queryguard.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vedant.queryguard.model.AuditEntry;
import com.vedant.queryguard.model.AuditStatus;
import com.vedant.queryguard.model.BlockedColumn;
import com.vedant.queryguard.model.SecurityViolationEntry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class AuditLogServiceTest {

    @TempDir
    Path dir;

    private AuditLogService service;

    @BeforeEach
    void setUp() {
        service = new AuditLogService(dir.toString());
    }

    private static AuditEntry entry(String user, Instant at, AuditStatus status, String nl) {
        return new AuditEntry(at, user, user + "@example.com", "admin", "shop", "postgresql", nl,
                "SELECT id FROM users", "SELECT id FROM users", status, List.of(), List.of(),
                null, 12L, 3, null);
    }

    @Test
    void appendsOneJsonLinePerEntryToTheUtcDayPartition() throws IOException {
        // 23:30 UTC is still the 16th even where local time has moved on
        service.record(entry("u1", Instant.parse("2026-10-16T23:30:00Z"), AuditStatus.ALLOWED, "q1"));
        service.record(entry("u1", Instant.parse("2026-10-17T00:10:00Z"), AuditStatus.BLOCKED, "q2"));

        List<String> day16 = Files.readAllLines(dir.resolve("audit-2026-10-16.log"));
        List<String> day17 = Files.readAllLines(dir.resolve("audit-2026-10-17.log"));
        assertEquals(1, day16.size());
        assertEquals(1, day17.size());

        JsonNode json = new ObjectMapper().readTree(day17.get(0));
        assertEquals("blocked", json.get("status").asText());
        assertEquals("u1", json.get("userId").asText());
        assertEquals("2026-10-17T00:10:00Z", json.get("timestamp").asText());
        assertFalse(json.has("error"));
    }

    @Test
    void violationsGoToTheirOwnPartitionWithHighSeverity() throws IOException {
        Instant at = Instant.parse("2026-10-17T08:00:00Z");
        service.recordViolation(SecurityViolationEntry.high(at, "u1", "u1@example.com",
                "SELECT password FROM users", List.of(BlockedColumn.sensitive("password"))));

        List<String> lines = Files.readAllLines(dir.resolve("security-violations-2026-10-17.log"));
        assertEquals(1, lines.size());
        JsonNode json = new ObjectMapper().readTree(lines.get(0));
        assertEquals("HIGH", json.get("severity").asText());
        assertEquals("password", json.get("blockedColumns").get(0).get("column").asText());
        assertFalse(Files.exists(dir.resolve("audit-2026-10-17.log")));
    }

    @Test
    void queryByUserReturnsNewestFirstAndHonoursLimit() {
        service.record(entry("u1", Instant.parse("2026-10-15T10:00:00Z"), AuditStatus.ALLOWED, "oldest"));
        service.record(entry("u2", Instant.parse("2026-10-16T10:00:00Z"), AuditStatus.ALLOWED, "other user"));
        service.record(entry("u1", Instant.parse("2026-10-17T09:00:00Z"), AuditStatus.ALLOWED, "middle"));
        service.record(entry("u1", Instant.parse("2026-10-17T10:00:00Z"), AuditStatus.ERROR, "newest"));

        List<AuditEntry> all = service.queryByUser("u1", 10);
        assertEquals(List.of("newest", "middle", "oldest"),
                all.stream().map(AuditEntry::naturalLanguageQuery).toList());
        assertEquals(AuditStatus.ERROR, all.get(0).status());

        assertEquals(List.of("newest", "middle"),
                service.queryByUser("u1", 2).stream().map(AuditEntry::naturalLanguageQuery).toList());
    }

    @Test
    void queryByUserSkipsMalformedLines() throws IOException {
        service.record(entry("u1", Instant.parse("2026-10-17T10:00:00Z"), AuditStatus.ALLOWED, "good"));
        Files.writeString(dir.resolve("audit-2026-10-17.log"), "not json\n{\"status\":\"weird\"}\n",
                StandardCharsets.UTF_8, java.nio.file.StandardOpenOption.APPEND);

        List<AuditEntry> entries = service.queryByUser("u1", 10);
        assertEquals(1, entries.size());
        assertEquals("good", entries.get(0).naturalLanguageQuery());
    }

    @Test
    void tornMultiByteWriteLosesOnlyItsOwnLine() throws IOException {
        service.record(entry("u1", Instant.parse("2026-10-16T09:00:00Z"), AuditStatus.ALLOWED, "yesterday"));
        service.record(entry("u1", Instant.parse("2026-10-17T09:00:00Z"), AuditStatus.ALLOWED, "today"));
        Files.write(dir.resolve("audit-2026-10-17.log"), new byte[] {'{', '"', (byte) 0xC3, '\n'},
                StandardOpenOption.APPEND);

        List<AuditEntry> history = service.queryByUser("u1", 10);

        assertEquals(List.of("today", "yesterday"),
                history.stream().map(AuditEntry::naturalLanguageQuery).toList());
    }

    @Test
    void queryByUserLooksAtSevenMostRecentPartitionsOnly() {
        for (int day = 1; day <= 9; day++) {
            Instant at = Instant.parse(String.format("2026-10-%02dT12:00:00Z", day));
            service.record(entry("u1", at, AuditStatus.ALLOWED, "day" + day));
        }

        List<String> seen = service.queryByUser("u1", 100).stream()
                .map(AuditEntry::naturalLanguageQuery).toList();
        assertEquals(List.of("day9", "day8", "day7", "day6", "day5", "day4", "day3"), seen);
    }

    @Test
    void missingDirectoryYieldsEmptyHistory() {
        AuditLogService fresh = new AuditLogService(dir.resolve("nope").toString());
        assertTrue(fresh.queryByUser("u1", 5).isEmpty());
    }

    @Test
    void writeFailuresAreAbsorbed() throws IOException {
        Path blocker = dir.resolve("file-not-dir");
        Files.writeString(blocker, "x");
        AuditLogService broken = new AuditLogService(blocker.toString());

        assertDoesNotThrow(() -> broken.record(entry("u1", Instant.now(), AuditStatus.ALLOWED, "q")));
    }

    @Test
    void concurrentAppendsKeepLinesIntact() throws Exception {
        int writers = 8;
        int perWriter = 50;
        Instant at = Instant.parse("2026-10-17T12:00:00Z");
        ExecutorService pool = Executors.newFixedThreadPool(writers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        for (int w = 0; w < writers; w++) {
            String user = "w" + w;
            futures.add(pool.submit(() -> {
                start.await();
                for (int i = 0; i < perWriter; i++) {
                    service.record(entry(user, at, AuditStatus.ALLOWED, "q" + i));
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> f : futures) f.get(30, TimeUnit.SECONDS);
        pool.shutdown();

        List<String> lines = Files.readAllLines(dir.resolve("audit-2026-10-17.log"));
        assertEquals(writers * perWriter, lines.size());
        ObjectMapper mapper = new ObjectMapper();
        for (String line : lines) {
            assertEquals("allowed", mapper.readTree(line).get("status").asText());
        }
    }
}
