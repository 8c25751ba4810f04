package com.vedant.queryguard.model;

import java.util.List;
import java.util.Map;

public record PipelineResult(
        String executedStatement,
        String originalStatement,
        List<BlockedColumn> blockedColumns,
        List<SecurityWarning> warnings,
        boolean success,
        List<Map<String, Object>> rows,
        int rowsReturned,
        long executionTimeMs
) {}
