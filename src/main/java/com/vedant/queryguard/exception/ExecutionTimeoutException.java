package com.vedant.queryguard.exception;

public class ExecutionTimeoutException extends QueryPipelineException {

    public ExecutionTimeoutException(String statement, long timeoutMs) {
        super(ErrorKind.EXECUTION_TIMEOUT,
                "Query execution timeout. Query took longer than " + timeoutMs + " ms to execute.",
                statement, null);
    }
}
