package com.vedant.queryguard.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponseDTO {
    private boolean success = false;
    private String code;
    private String message;
    private String statement;   // offending SQL, kept for display

    public ErrorResponseDTO() {}

    public ErrorResponseDTO(String code, String message, String statement) {
        this.code = code;
        this.message = message;
        this.statement = statement;
    }

    public boolean isSuccess() { return success; }
    public void setSuccess(boolean success) { this.success = success; }

    public String getCode() { return code; }
    public void setCode(String code) { this.code = code; }

    public String getMessage() { return message; }
    public void setMessage(String message) { this.message = message; }

    public String getStatement() { return statement; }
    public void setStatement(String statement) { this.statement = statement; }
}
