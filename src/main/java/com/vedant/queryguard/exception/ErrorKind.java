package com.vedant.queryguard.exception;

public enum ErrorKind {
    REJECTED_STATEMENT,
    EXECUTION_TIMEOUT,
    EXECUTION_FAILURE
}
