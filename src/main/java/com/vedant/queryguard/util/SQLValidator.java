package com.vedant.queryguard.util;

import com.vedant.queryguard.model.ValidationOutcome;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Strict statement gate: only read-only, single statements get through.
 * Prevents destructive or injected SQL from NL-generated statements reaching the database.
 *
 * Checks run in a fixed order and stop at the first violation:
 * denylisted patterns (raw text, so comment tricks are caught), then the
 * allowed leading keywords, then the statement separator rule.
 */
public class SQLValidator {

    // Order matters: the first match is the one reported.
    private static final List<Pattern> DANGEROUS_PATTERNS = List.of(
            Pattern.compile("\\bDROP\\s+(TABLE|DATABASE|SCHEMA|INDEX|VIEW)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bTRUNCATE\\s+TABLE", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bALTER\\s+TABLE", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bCREATE\\s+(TABLE|DATABASE|SCHEMA|INDEX)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bGRANT\\s+", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bREVOKE\\s+", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bEXEC(UTE)?\\s+", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bUNION\\s+.*SELECT", Pattern.CASE_INSENSITIVE | Pattern.DOTALL),
            Pattern.compile(";\\s*DROP", Pattern.CASE_INSENSITIVE),
            Pattern.compile(";\\s*DELETE", Pattern.CASE_INSENSITIVE),
            Pattern.compile("--"),
            Pattern.compile("/\\*"),
            Pattern.compile("xp_cmdshell", Pattern.CASE_INSENSITIVE),
            Pattern.compile("sp_executesql", Pattern.CASE_INSENSITIVE)
    );

    private static final Pattern ALLOWED_START = Pattern.compile("^(SELECT|SHOW|DESCRIBE|DESC|EXPLAIN)\\s+");

    public static final String NOT_READ_ONLY =
            "Only SELECT, SHOW, DESCRIBE, and EXPLAIN queries are allowed for safety.";
    public static final String MULTIPLE_STATEMENTS = "Multiple SQL statements are not allowed.";

    private SQLValidator() {
    }

    public static ValidationOutcome validate(String sql) {
        if (sql == null || sql.isBlank()) {
            return ValidationOutcome.rejected("Empty SQL statement.");
        }

        for (Pattern pattern : DANGEROUS_PATTERNS) {
            if (pattern.matcher(sql).find()) {
                return ValidationOutcome.rejected(
                        "Dangerous SQL pattern detected: " + pattern.pattern()
                                + ". Only SELECT queries are allowed for safety.",
                        pattern.pattern());
            }
        }

        // keyword matching only, the raw text was already scanned above
        String normalized = sql.trim().toUpperCase(Locale.ROOT);
        if (!ALLOWED_START.matcher(normalized).find()) {
            return ValidationOutcome.rejected(NOT_READ_ONLY);
        }

        if (sql.indexOf(';') >= 0) {
            return ValidationOutcome.rejected(MULTIPLE_STATEMENTS);
        }

        return ValidationOutcome.ok();
    }
}
