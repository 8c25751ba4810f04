package com.vedant.queryguard.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.vedant.queryguard.model.AuditEntry;
import com.vedant.queryguard.model.SecurityViolationEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Append-only audit trail, one newline-delimited JSON file per UTC day:
 * {@code audit-YYYY-MM-DD.log} for every pipeline run and
 * {@code security-violations-YYYY-MM-DD.log} for sensitive-column access attempts.
 *
 * Writing never fails the caller: I/O errors are logged and dropped.
 */
@Service
public class AuditLogService {

    private static final Logger log = LoggerFactory.getLogger(AuditLogService.class);

    static final String AUDIT_PREFIX = "audit-";
    static final String VIOLATION_PREFIX = "security-violations-";
    private static final Pattern AUDIT_FILE = Pattern.compile("audit-\\d{4}-\\d{2}-\\d{2}\\.log");
    private static final int MAX_PARTITIONS_SCANNED = 7;

    private final Path logDir;
    private final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    // serializes appends so concurrent lines never interleave
    private final Object writeLock = new Object();

    public AuditLogService(@Value("${queryguard.audit.dir:logs}") String logDir) {
        this.logDir = Paths.get(logDir);
    }

    public void record(AuditEntry entry) {
        append(AUDIT_PREFIX, entry.timestamp(), entry);
        log.debug("Audit entry recorded: user={} status={}", entry.userId(), entry.status());
    }

    public void recordViolation(SecurityViolationEntry violation) {
        append(VIOLATION_PREFIX, violation.timestamp(), violation);
        log.warn("SECURITY VIOLATION: user={} blocked={} query={}", violation.userId(),
                violation.blockedColumns().size(), violation.attemptedQuery());
    }

    /**
     * Most recent entries for {@code userId}, newest first, read from at most the last 7 daily
     * partitions. Malformed lines are skipped. Older history is not reachable from here.
     */
    public List<AuditEntry> queryByUser(String userId, int limit) {
        List<AuditEntry> result = new ArrayList<>();
        if (limit <= 0 || !Files.isDirectory(logDir)) return result;

        List<Path> partitions;
        try {
            partitions = recentPartitions();
        } catch (IOException e) {
            log.error("Error listing audit logs in {}", logDir, e);
            return result;
        }

        for (Path partition : partitions) {
            List<String> lines;
            try {
                lines = readLines(partition);
            } catch (IOException e) {
                log.error("Error reading audit log {}, skipping it", partition, e);
                continue;
            }
            for (int i = lines.size() - 1; i >= 0; i--) {
                String line = lines.get(i);
                if (line.isBlank()) continue;
                AuditEntry entry = parse(line);
                if (entry != null && userId != null && userId.equals(entry.userId())) {
                    result.add(entry);
                    if (result.size() >= limit) return result;
                }
            }
        }
        return result;
    }

    // torn multi-byte writes decode to U+FFFD and fail JSON parsing on their own line only
    private static List<String> readLines(Path partition) throws IOException {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPLACE)
                .onUnmappableCharacter(CodingErrorAction.REPLACE);
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(Files.newInputStream(partition), decoder))) {
            return reader.lines().collect(Collectors.toList());
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }

    static String partitionName(String prefix, Instant timestamp) {
        LocalDate day = LocalDate.ofInstant(timestamp, ZoneOffset.UTC);
        return prefix + day + ".log";
    }

    private List<Path> recentPartitions() throws IOException {
        try (Stream<Path> files = Files.list(logDir)) {
            return files
                    .filter(p -> AUDIT_FILE.matcher(p.getFileName().toString()).matches())
                    .sorted(Comparator.comparing((Path p) -> p.getFileName().toString()).reversed())
                    .limit(MAX_PARTITIONS_SCANNED)
                    .collect(Collectors.toList());
        }
    }

    private AuditEntry parse(String line) {
        try {
            return mapper.readValue(line, AuditEntry.class);
        } catch (JsonProcessingException e) {
            log.debug("Skipping malformed audit line: {}", e.getOriginalMessage());
            return null;
        }
    }

    private void append(String prefix, Instant timestamp, Object entry) {
        Path file = logDir.resolve(partitionName(prefix, timestamp != null ? timestamp : Instant.now()));
        try {
            byte[] line = (mapper.writeValueAsString(entry) + "\n").getBytes(StandardCharsets.UTF_8);
            synchronized (writeLock) {
                Files.createDirectories(logDir);
                Files.write(file, line, StandardOpenOption.CREATE, StandardOpenOption.APPEND,
                        StandardOpenOption.WRITE);
            }
        } catch (IOException e) {
            log.error("Error writing audit log {}", file, e);
        } catch (RuntimeException e) {
            log.error("Unexpected error writing audit log {}", file, e);
        }
    }
}
