package com.vedant.queryguard.exception;

/**
 * Terminal failure of one pipeline run. Keeps the offending statement so callers can show it.
 */
public abstract class QueryPipelineException extends RuntimeException {

    private final ErrorKind kind;
    private final String statement;

    protected QueryPipelineException(ErrorKind kind, String message, String statement, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.statement = statement;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public String getStatement() {
        return statement;
    }
}
