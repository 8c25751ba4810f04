package com.vedant.queryguard.model;

/**
 * Result of checking one raw statement against the read-only rules.
 * {@code reason} and {@code matchedPattern} are null when the statement is safe;
 * {@code matchedPattern} is also null for allow-set and separator violations.
 */
public record ValidationOutcome(boolean safe, String reason, String matchedPattern) {

    public static ValidationOutcome ok() {
        return new ValidationOutcome(true, null, null);
    }

    public static ValidationOutcome rejected(String reason) {
        return new ValidationOutcome(false, reason, null);
    }

    public static ValidationOutcome rejected(String reason, String matchedPattern) {
        return new ValidationOutcome(false, reason, matchedPattern);
    }
}
