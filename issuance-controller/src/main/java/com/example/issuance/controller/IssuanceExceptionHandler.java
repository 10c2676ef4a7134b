package com.example.issuance.controller;

import com.example.issuance.error.IssuanceException;
import com.example.issuance.ledger.LedgerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Renders rejected requests as {@code error} / {@code error_description} maps.
 */
@RestControllerAdvice
public class IssuanceExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(IssuanceExceptionHandler.class);

    @ExceptionHandler(IssuanceException.class)
    public ResponseEntity<Map<String, Object>> handleIssuance(IssuanceException e) {
        logger.warn("⚠️Issuance request rejected ({}): {}", e.getError().code(), e.getMessage());
        HttpStatus status = switch (e.getError().category()) {
            case ELIGIBILITY, TIMING -> HttpStatus.CONFLICT;
            case TARGET, ECONOMIC -> HttpStatus.BAD_REQUEST;
        };
        return error(status, e.getError().code(), e.getMessage());
    }

    @ExceptionHandler(LedgerException.class)
    public ResponseEntity<Map<String, Object>> handleLedger(LedgerException e) {
        logger.warn("⚠️Ledger rejected request ({}): {}", e.getCode(), e.getMessage());
        return error(HttpStatus.BAD_REQUEST, e.getCode(), e.getMessage());
    }

    @ExceptionHandler({IllegalArgumentException.class, MissingRequestHeaderException.class,
            HttpMessageNotReadableException.class})
    public ResponseEntity<Map<String, Object>> handleInvalidRequest(Exception e) {
        logger.warn("⚠️Invalid request: {}", e.getMessage());
        return error(HttpStatus.BAD_REQUEST, "invalid_request", e.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnexpected(Exception e) {
        if (e instanceof ErrorResponse response) {
            logger.warn("⚠️Request failed with status {}: {}", response.getStatusCode(), e.getMessage());
            return error(response.getStatusCode(), "invalid_request", e.getMessage());
        }
        logger.error("❌Unexpected error processing request", e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "server_error", "An error occurred while processing the request");
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatusCode status, String code, String description) {
        return ResponseEntity.status(status).body(Map.of(
                "error", code,
                "error_description", String.valueOf(description)
        ));
    }
}
