package com.vedant.queryguard.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;

/**
 * One line of the daily audit log: the outcome of a single pipeline run.
 * Written once, never updated.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record AuditEntry(
        Instant timestamp,
        String userId,
        String userEmail,
        String userRole,
        String database,
        String dbType,
        String naturalLanguageQuery,
        String generatedSql,
        String executedSql,
        AuditStatus status,
        List<BlockedColumn> blockedColumns,
        List<SecurityWarning> warnings,
        String reason,
        Long executionTimeMs,
        Integer rowsReturned,
        String error
) {

    public AuditEntry {
        blockedColumns = blockedColumns == null ? List.of() : List.copyOf(blockedColumns);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
