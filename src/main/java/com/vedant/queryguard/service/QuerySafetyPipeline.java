package com.vedant.queryguard.service;

import com.vedant.queryguard.exception.QueryPipelineException;
import com.vedant.queryguard.exception.RejectedStatementException;
import com.vedant.queryguard.model.AuditEntry;
import com.vedant.queryguard.model.AuditStatus;
import com.vedant.queryguard.model.BlockedColumn;
import com.vedant.queryguard.model.IdentifierQuote;
import com.vedant.queryguard.model.PipelineRequest;
import com.vedant.queryguard.model.PipelineResult;
import com.vedant.queryguard.model.SanitizationOutcome;
import com.vedant.queryguard.model.SecurityReport;
import com.vedant.queryguard.model.SecurityViolationEntry;
import com.vedant.queryguard.model.SecurityWarning;
import com.vedant.queryguard.model.ValidationOutcome;
import com.vedant.queryguard.util.SQLValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Statement gate, then column sanitization, then execution, then exactly one audit entry.
 *
 * Every run flows through once; nothing is retried. Rejected statements never reach the
 * database, execution failures keep the statement in the thrown exception.
 */
@Service
public class QuerySafetyPipeline {

    private static final Logger log = LoggerFactory.getLogger(QuerySafetyPipeline.class);

    public static final String BLOCKED_COLUMNS_WARNING =
            "Some columns were blocked for security. Showing safe results instead.";
    public static final String APPROVED = "Query approved";

    private final ColumnSecurityService columnSecurityService;
    private final StatementExecutionService executionService;
    private final AuditLogService auditLogService;
    private final Clock clock;
    private final String userRole;

    public QuerySafetyPipeline(ColumnSecurityService columnSecurityService,
                               StatementExecutionService executionService,
                               AuditLogService auditLogService,
                               Clock clock,
                               @Value("${queryguard.user-role:Admin with access to regular data, sensitive data blocked}") String userRole) {
        this.columnSecurityService = columnSecurityService;
        this.executionService = executionService;
        this.auditLogService = auditLogService;
        this.clock = clock;
        this.userRole = userRole;
    }

    public PipelineResult run(PipelineRequest request) {
        long start = clock.millis();
        String statement = request.statement();
        log.info("=== STATEMENT RECEIVED === user={} db={} sql={}", request.userId(), request.database(), statement);

        ValidationOutcome validation = SQLValidator.validate(statement);
        if (!validation.safe()) {
            log.warn("Statement rejected for user {}: {}", request.userId(), validation.reason());
            audit(request, AuditStatus.BLOCKED, null, List.of(), List.of(), validation.reason(), start, null, null);
            throw new RejectedStatementException(validation.reason(), validation.matchedPattern(), statement);
        }

        String executed = null;
        List<BlockedColumn> blocked = List.of();
        List<SecurityWarning> warnings = List.of();
        List<Map<String, Object>> rows;
        try {
            SanitizationOutcome sanitization = columnSecurityService.sanitize(
                    statement, request.schemaText(), IdentifierQuote.forBackend(request.dbType()));
            executed = sanitization.sanitizedStatement();
            blocked = sanitization.blockedColumns();
            warnings = collectWarnings(sanitization);

            if (sanitization.rewritten()) {
                auditLogService.recordViolation(SecurityViolationEntry.high(
                        Instant.now(clock), request.userId(), request.userEmail(), statement, blocked));
            }

            rows = executionService.execute(executed);
        } catch (QueryPipelineException e) {
            audit(request, AuditStatus.ERROR, executed, blocked, warnings, null, start, null, e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            log.error("Unexpected pipeline failure for statement: {}", statement, e);
            audit(request, AuditStatus.ERROR, executed, blocked, warnings, null, start, null, String.valueOf(e.getMessage()));
            throw e;
        }

        long elapsed = clock.millis() - start;
        log.info("=== QUERY EXECUTED === {} rows returned in {} ms", rows.size(), elapsed);
        audit(request, AuditStatus.ALLOWED, executed, blocked, warnings, null, start, rows.size(), null);

        return new PipelineResult(executed, statement, blocked, warnings, true, rows, rows.size(), elapsed);
    }

    /** Validation and sanitization only; nothing is executed or audited. */
    public SecurityReport check(String statement, String schemaText, String dbType) {
        Instant now = Instant.now(clock);
        ValidationOutcome validation = SQLValidator.validate(statement);
        if (!validation.safe()) {
            return new SecurityReport(now, userRole, statement, null, false, List.of(), List.of(),
                    validation.reason());
        }

        SanitizationOutcome sanitization = columnSecurityService.sanitize(
                statement, schemaText, IdentifierQuote.forBackend(dbType));
        boolean allowed = !sanitization.rewritten();
        String reason = allowed
                ? APPROVED
                : "Query blocked due to " + sanitization.blockedColumns().size() + " sensitive column(s)";
        return new SecurityReport(now, userRole, statement, sanitization.sanitizedStatement(), allowed,
                sanitization.blockedColumns(), collectWarnings(sanitization), reason);
    }

    private List<SecurityWarning> collectWarnings(SanitizationOutcome sanitization) {
        List<SecurityWarning> warnings = new ArrayList<>(sanitization.warnings());
        if (sanitization.rewritten()) {
            warnings.add(new SecurityWarning(BLOCKED_COLUMNS_WARNING, sanitization.blockedColumns(),
                    columnSecurityService.suggestAlternatives(sanitization.blockedColumns())));
        }
        return warnings;
    }

    private void audit(PipelineRequest request, AuditStatus status, String executed,
                       List<BlockedColumn> blocked, List<SecurityWarning> warnings, String reason,
                       long start, Integer rowsReturned, String error) {
        auditLogService.record(new AuditEntry(
                Instant.now(clock),
                request.userId(),
                request.userEmail(),
                userRole,
                request.database(),
                request.dbType(),
                request.naturalLanguageQuery(),
                request.statement(),
                executed,
                status,
                blocked,
                warnings,
                reason,
                clock.millis() - start,
                rowsReturned,
                error));
    }
}
