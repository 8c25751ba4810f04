package com.vedant.queryguard.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record SecurityWarning(String message,
                              List<BlockedColumn> blockedColumns,
                              List<SafeAlternative> suggestedAlternatives) {

    public static SecurityWarning of(String message) {
        return new SecurityWarning(message, List.of(), List.of());
    }
}
