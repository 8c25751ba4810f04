package com.vedant.queryguard.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SecurityViolationEntry(
        Instant timestamp,
        String severity,
        String userId,
        String userEmail,
        String attemptedQuery,
        List<BlockedColumn> blockedColumns,
        String reason
) {

    public static final String HIGH = "HIGH";

    public static SecurityViolationEntry high(Instant timestamp, String userId, String userEmail,
                                              String attemptedQuery, List<BlockedColumn> blockedColumns) {
        return new SecurityViolationEntry(timestamp, HIGH, userId, userEmail, attemptedQuery,
                List.copyOf(blockedColumns),
                "Query blocked due to " + blockedColumns.size() + " sensitive column(s)");
    }
}
