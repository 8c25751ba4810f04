package com.vedant.queryguard.model;

import java.util.List;

/**
 * Statement to execute after column sanitization. {@code blockedColumns} is empty exactly when
 * no rewrite happened, in which case {@code sanitizedStatement} is the input, untouched.
 */
public record SanitizationOutcome(String sanitizedStatement,
                                  List<BlockedColumn> blockedColumns,
                                  List<SecurityWarning> warnings) {

    public SanitizationOutcome {
        blockedColumns = List.copyOf(blockedColumns);
        warnings = List.copyOf(warnings);
    }

    public static SanitizationOutcome unchanged(String statement, List<SecurityWarning> warnings) {
        return new SanitizationOutcome(statement, List.of(), warnings);
    }

    public boolean rewritten() {
        return !blockedColumns.isEmpty();
    }
}
