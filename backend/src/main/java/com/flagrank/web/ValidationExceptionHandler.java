package com.flagrank.web;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
public class ValidationExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<RequestValidationErrorResponse> handle(MethodArgumentNotValidException ex) {
        Map<String, String> fieldErrors = new LinkedHashMap<>();
        ex.getBindingResult().getFieldErrors().forEach(fieldError ->
                fieldErrors.putIfAbsent(fieldError.getField(), fieldError.getDefaultMessage())
        );

        String message = fieldErrors.isEmpty()
                ? "Request body failed validation"
                : "Request body failed validation: " + String.join("; ", fieldErrors.values());

        return ResponseEntity.badRequest()
                .body(new RequestValidationErrorResponse("invalid_request", message, fieldErrors));
    }

    public record RequestValidationErrorResponse(
            String code,
            String message,
            Map<String, String> fieldErrors
    ) {
    }
}
