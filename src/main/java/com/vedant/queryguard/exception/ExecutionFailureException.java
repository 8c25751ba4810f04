package com.vedant.queryguard.exception;

/** Backend reported an error; the message is the backend's text, unmodified. */
public class ExecutionFailureException extends QueryPipelineException {

    public ExecutionFailureException(String statement, String backendMessage, Throwable cause) {
        super(ErrorKind.EXECUTION_FAILURE, backendMessage, statement, cause);
    }
}
