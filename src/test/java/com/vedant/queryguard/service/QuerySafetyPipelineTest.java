package com.vedant.queryguard.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vedant.queryguard.exception.ExecutionFailureException;
import com.vedant.queryguard.exception.ExecutionTimeoutException;
import com.vedant.queryguard.exception.RejectedStatementException;
import com.vedant.queryguard.model.AuditEntry;
import com.vedant.queryguard.model.AuditStatus;
import com.vedant.queryguard.model.PipelineRequest;
import com.vedant.queryguard.model.PipelineResult;
import com.vedant.queryguard.model.SecurityReport;
import com.vedant.queryguard.model.SecurityViolationEntry;
import com.vedant.queryguard.security.SensitiveColumnCatalog;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.InputStream;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class QuerySafetyPipelineTest {

    private static final String SCHEMA = """
            Table: users
              - id (integer) PRIMARY KEY
              - password (varchar)
              - email (varchar)
            """;

    private StatementExecutionService executor;
    private AuditLogService audit;
    private QuerySafetyPipeline pipeline;

    @BeforeEach
    void setUp() throws Exception {
        SensitiveColumnCatalog catalog;
        try (InputStream in = getClass().getResourceAsStream("/sensitive-columns.json")) {
            catalog = SensitiveColumnCatalog.load(in, new ObjectMapper());
        }
        executor = mock(StatementExecutionService.class);
        audit = mock(AuditLogService.class);
        Clock clock = Clock.fixed(Instant.parse("2026-10-17T10:15:00Z"), ZoneOffset.UTC);
        pipeline = new QuerySafetyPipeline(new ColumnSecurityService(catalog), executor, audit, clock, "admin");
    }

    private static PipelineRequest request(String sql, String dbType) {
        return new PipelineRequest("u1", "u1@example.com", "shop", dbType, "show users", sql, SCHEMA);
    }

    private AuditEntry onlyAuditEntry() {
        ArgumentCaptor<AuditEntry> captor = ArgumentCaptor.forClass(AuditEntry.class);
        verify(audit, times(1)).record(captor.capture());
        return captor.getValue();
    }

    @Test
    void sanitizesExecutesAndAuditsAllowed() {
        when(executor.execute("SELECT `id`, `email` FROM users"))
                .thenReturn(List.of(Map.of("id", 1, "email", "a@b.c")));

        PipelineResult result = pipeline.run(request("SELECT id, password, email FROM users", "mysql"));

        assertTrue(result.success());
        assertEquals("SELECT `id`, `email` FROM users", result.executedStatement());
        assertEquals("SELECT id, password, email FROM users", result.originalStatement());
        assertEquals(1, result.rowsReturned());
        assertEquals("password", result.blockedColumns().get(0).column());
        assertEquals(QuerySafetyPipeline.BLOCKED_COLUMNS_WARNING, result.warnings().get(0).message());
        assertEquals(1, result.warnings().get(0).suggestedAlternatives().size());

        AuditEntry entry = onlyAuditEntry();
        assertEquals(AuditStatus.ALLOWED, entry.status());
        assertEquals("SELECT id, password, email FROM users", entry.generatedSql());
        assertEquals("SELECT `id`, `email` FROM users", entry.executedSql());
        assertEquals(1, entry.rowsReturned());
        assertEquals("admin", entry.userRole());
        assertEquals(Instant.parse("2026-10-17T10:15:00Z"), entry.timestamp());

        ArgumentCaptor<SecurityViolationEntry> violation = ArgumentCaptor.forClass(SecurityViolationEntry.class);
        verify(audit).recordViolation(violation.capture());
        assertEquals("HIGH", violation.getValue().severity());
        assertEquals("SELECT id, password, email FROM users", violation.getValue().attemptedQuery());
    }

    @Test
    void postgresTargetsGetDoubleQuotedColumns() {
        when(executor.execute(anyString())).thenReturn(List.of());

        PipelineResult result = pipeline.run(request("SELECT id, password FROM users", "postgresql"));
        assertEquals("SELECT \"id\" FROM users", result.executedStatement());
    }

    @Test
    void rejectedStatementIsNeverExecutedAndAuditedBlocked() {
        RejectedStatementException ex = assertThrows(RejectedStatementException.class,
                () -> pipeline.run(request("SELECT * FROM users; DROP TABLE users", "mysql")));
        assertNotNull(ex.getMatchedPattern());
        assertEquals("SELECT * FROM users; DROP TABLE users", ex.getStatement());

        verifyNoInteractions(executor);
        AuditEntry entry = onlyAuditEntry();
        assertEquals(AuditStatus.BLOCKED, entry.status());
        assertNotNull(entry.reason());
        assertNull(entry.executedSql());
        verify(audit, never()).recordViolation(any());
    }

    @Test
    void cleanStatementRecordsNoViolation() {
        when(executor.execute("SELECT id FROM users")).thenReturn(List.of());

        PipelineResult result = pipeline.run(request("SELECT id FROM users", "mysql"));

        assertEquals("SELECT id FROM users", result.executedStatement());
        assertTrue(result.warnings().isEmpty());
        verify(audit, never()).recordViolation(any());
        assertEquals(AuditStatus.ALLOWED, onlyAuditEntry().status());
    }

    @Test
    void degradedSanitizationStillExecutesWithWarning() {
        when(executor.execute(anyString())).thenReturn(List.of());

        PipelineResult result = pipeline.run(request("SHOW TABLES", "mysql"));

        assertEquals("SHOW TABLES", result.executedStatement());
        assertEquals(ColumnSecurityService.TABLE_UNRESOLVED, result.warnings().get(0).message());
        AuditEntry entry = onlyAuditEntry();
        assertEquals(AuditStatus.ALLOWED, entry.status());
        assertEquals(1, entry.warnings().size());
    }

    @Test
    void timeoutIsAuditedAsError() {
        when(executor.execute(anyString())).thenThrow(new ExecutionTimeoutException("SELECT id FROM users", 100));

        assertThrows(ExecutionTimeoutException.class, () -> pipeline.run(request("SELECT id FROM users", "mysql")));

        AuditEntry entry = onlyAuditEntry();
        assertEquals(AuditStatus.ERROR, entry.status());
        assertTrue(entry.error().contains("timeout"));
        assertEquals("SELECT id FROM users", entry.executedSql());
    }

    @Test
    void backendFailureKeepsErrorTextVerbatim() {
        when(executor.execute(anyString()))
                .thenThrow(new ExecutionFailureException("SELECT id FROM users", "relation \"users\" does not exist", null));

        ExecutionFailureException ex = assertThrows(ExecutionFailureException.class,
                () -> pipeline.run(request("SELECT id FROM users", "mysql")));
        assertEquals("SELECT id FROM users", ex.getStatement());

        assertEquals("relation \"users\" does not exist", onlyAuditEntry().error());
    }

    @Test
    void checkReportsWithoutExecutingOrAuditing() {
        SecurityReport report = pipeline.check("SELECT password FROM users", SCHEMA, "mysql");

        assertFalse(report.allowed());
        assertEquals("SELECT COUNT(*) as users_with_password FROM users", report.sanitizedQuery());
        assertEquals("Query blocked due to 1 sensitive column(s)", report.reason());
        assertEquals("admin", report.userRole());

        SecurityReport ok = pipeline.check("SELECT id FROM users", SCHEMA, "mysql");
        assertTrue(ok.allowed());
        assertEquals(QuerySafetyPipeline.APPROVED, ok.reason());

        SecurityReport rejected = pipeline.check("UPDATE users SET id = 1", SCHEMA, "mysql");
        assertFalse(rejected.allowed());
        assertNull(rejected.sanitizedQuery());

        verifyNoInteractions(executor, audit);
    }
}
