package com.flagrank.web;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ScoringExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ScoringExceptionHandler.class);

    @ExceptionHandler(ScoringValidationException.class)
    public ResponseEntity<ScoringErrorResponse> handleValidation(ScoringValidationException ex) {
        return ResponseEntity
                .status(ex.getStatus())
                .body(new ScoringErrorResponse(ex.getCode(), ex.getMessage(), false));
    }

    @ExceptionHandler(CapabilityDeniedException.class)
    public ResponseEntity<ScoringErrorResponse> handleCapability(CapabilityDeniedException ex) {
        return ResponseEntity
                .status(ex.getStatus())
                .body(new ScoringErrorResponse(ex.getCode(), ex.getMessage(), false));
    }

    @ExceptionHandler(LedgerUnavailableException.class)
    public ResponseEntity<ScoringErrorResponse> handleLedgerUnavailable(LedgerUnavailableException ex) {
        log.warn("Ledger store unavailable: {}", ex.getMessage(), ex.getCause());
        return ResponseEntity
                .status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(new ScoringErrorResponse("ledger_unavailable", ex.getMessage(), true));
    }

    public record ScoringErrorResponse(
            String code,
            String message,
            boolean retryable
    ) {
    }
}
