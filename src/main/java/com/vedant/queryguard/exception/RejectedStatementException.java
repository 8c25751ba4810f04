package com.vedant.queryguard.exception;

public class RejectedStatementException extends QueryPipelineException {

    private final String matchedPattern;

    public RejectedStatementException(String reason, String matchedPattern, String statement) {
        super(ErrorKind.REJECTED_STATEMENT, "Query validation failed: " + reason, statement, null);
        this.matchedPattern = matchedPattern;
    }

    public String getMatchedPattern() {
        return matchedPattern;
    }
}
