package com.vedant.queryguard.model;

import java.util.Locale;

/** How rewritten projections quote column names for a given backend. */
public enum IdentifierQuote {
    BACKTICK("`", "`"),
    DOUBLE_QUOTE("\"", "\""),
    BRACKET("[", "]");

    private final String open;
    private final String close;

    IdentifierQuote(String open, String close) {
        this.open = open;
        this.close = close;
    }

    public String quote(String identifier) {
        return open + identifier + close;
    }

    public static IdentifierQuote forBackend(String dbType) {
        if (dbType == null) return BACKTICK;
        return switch (dbType.trim().toLowerCase(Locale.ROOT)) {
            case "postgres", "postgresql", "supabase" -> DOUBLE_QUOTE;
            case "sqlserver", "mssql" -> BRACKET;
            default -> BACKTICK;
        };
    }
}
