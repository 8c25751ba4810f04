package com.vedant.queryguard.model;

import java.time.Instant;
import java.util.List;

/** Dry-run verdict for a statement: what would execute and why, without touching the database. */
public record SecurityReport(
        Instant timestamp,
        String userRole,
        String query,
        String sanitizedQuery,
        boolean allowed,
        List<BlockedColumn> blockedColumns,
        List<SecurityWarning> warnings,
        String reason
) {}
