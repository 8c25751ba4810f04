package com.vedant.queryguard.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.vedant.queryguard.model.BlockedColumn;
import com.vedant.queryguard.model.PipelineResult;
import com.vedant.queryguard.model.SecurityWarning;

import java.util.List;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class NLQueryResponseDTO {
    private boolean success;
    private String sql;             // statement actually executed
    private String originalSql;     // statement produced by the translator
    private List<Map<String, Object>> rows;
    private List<BlockedColumn> blockedColumns;
    private List<SecurityWarning> warnings;
    private int rowsReturned;
    private long executionTimeMs;
    private String message;

    public NLQueryResponseDTO() {}

    public static NLQueryResponseDTO from(PipelineResult result) {
        NLQueryResponseDTO dto = new NLQueryResponseDTO();
        dto.setSuccess(result.success());
        dto.setSql(result.executedStatement());
        dto.setOriginalSql(result.originalStatement());
        dto.setRows(result.rows());
        dto.setBlockedColumns(result.blockedColumns());
        dto.setWarnings(result.warnings());
        dto.setRowsReturned(result.rowsReturned());
        dto.setExecutionTimeMs(result.executionTimeMs());
        dto.setMessage("OK");
        return dto;
    }

    public boolean isSuccess() { return success; }
    public void setSuccess(boolean success) { this.success = success; }

    public String getSql() { return sql; }
    public void setSql(String sql) { this.sql = sql; }

    public String getOriginalSql() { return originalSql; }
    public void setOriginalSql(String originalSql) { this.originalSql = originalSql; }

    public List<Map<String, Object>> getRows() { return rows; }
    public void setRows(List<Map<String, Object>> rows) { this.rows = rows; }

    public List<BlockedColumn> getBlockedColumns() { return blockedColumns; }
    public void setBlockedColumns(List<BlockedColumn> blockedColumns) { this.blockedColumns = blockedColumns; }

    public List<SecurityWarning> getWarnings() { return warnings; }
    public void setWarnings(List<SecurityWarning> warnings) { this.warnings = warnings; }

    public int getRowsReturned() { return rowsReturned; }
    public void setRowsReturned(int rowsReturned) { this.rowsReturned = rowsReturned; }

    public long getExecutionTimeMs() { return executionTimeMs; }
    public void setExecutionTimeMs(long executionTimeMs) { this.executionTimeMs = executionTimeMs; }

    public String getMessage() { return message; }
    public void setMessage(String message) { this.message = message; }
}
