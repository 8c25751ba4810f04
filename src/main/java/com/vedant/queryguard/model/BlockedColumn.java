package com.vedant.queryguard.model;

public record BlockedColumn(String column, String category, String reason) {

    public static final String SENSITIVE = "sensitive";

    public static BlockedColumn sensitive(String column) {
        return new BlockedColumn(column, SENSITIVE, "Access to '" + column + "' is blocked.");
    }
}
