package com.vedant.queryguard.controller;

import com.vedant.queryguard.dto.ErrorResponseDTO;
import com.vedant.queryguard.exception.ExecutionFailureException;
import com.vedant.queryguard.exception.ExecutionTimeoutException;
import com.vedant.queryguard.exception.RejectedStatementException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(RejectedStatementException.class)
    public ResponseEntity<ErrorResponseDTO> handleRejected(RejectedStatementException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponseDTO(ex.getKind().name(), ex.getMessage(), ex.getStatement()));
    }

    @ExceptionHandler(ExecutionTimeoutException.class)
    public ResponseEntity<ErrorResponseDTO> handleTimeout(ExecutionTimeoutException ex) {
        return ResponseEntity.status(HttpStatus.GATEWAY_TIMEOUT)
                .body(new ErrorResponseDTO(ex.getKind().name(), ex.getMessage(), ex.getStatement()));
    }

    @ExceptionHandler(ExecutionFailureException.class)
    public ResponseEntity<ErrorResponseDTO> handleExecutionFailure(ExecutionFailureException ex) {
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                .body(new ErrorResponseDTO(ex.getKind().name(), "Execution error: " + ex.getMessage(),
                        ex.getStatement()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponseDTO> handleIllegalArgument(IllegalArgumentException ex) {
        return ResponseEntity.badRequest().body(new ErrorResponseDTO("INVALID_ARGUMENT", ex.getMessage(), null));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponseDTO> handleUnreadableBody(HttpMessageNotReadableException ex) {
        log.debug("Unreadable request body: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(new ErrorResponseDTO("INVALID_ARGUMENT",
                "Request body is missing or is not valid JSON.", null));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponseDTO> handleAll(Exception ex) {
        log.error("Unhandled exception occurred", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponseDTO("INTERNAL_SERVER_ERROR",
                        "An error occurred while processing your query.", null));
    }
}
