package com.vedant.queryguard.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum AuditStatus {
    ALLOWED, BLOCKED, ERROR;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static AuditStatus fromValue(String value) {
        return valueOf(value.toUpperCase(Locale.ROOT));
    }
}
