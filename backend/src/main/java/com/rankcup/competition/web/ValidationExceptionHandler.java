package com.rankcup.competition.web;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
public class ValidationExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ValidationErrorResponse> handle(MethodArgumentNotValidException ex) {
        Map<String, String> fieldErrors = new LinkedHashMap<>();
        ex.getBindingResult().getFieldErrors().forEach(fe ->
                fieldErrors.putIfAbsent(fe.getField(), fe.getDefaultMessage())
        );

        String detail = fieldErrors.isEmpty()
                ? "Validation failed"
                : "Validation failed: " + String.join("; ", fieldErrors.values());

        return ResponseEntity.badRequest()
                .body(new ValidationErrorResponse(CompetitionErrorCode.VALIDATION_FAILED.code(), detail, fieldErrors));
    }

    @ExceptionHandler(CompetitionValidationException.class)
    public ResponseEntity<ValidationErrorResponse> handle(CompetitionValidationException ex) {
        return ResponseEntity.badRequest()
                .body(new ValidationErrorResponse(
                        ex.getErrorCode().code(),
                        ex.getMessage(),
                        ex.getFieldErrors()
                ));
    }

    public record ValidationErrorResponse(
            String code,
            String detail,
            Map<String, String> fieldErrors
    ) {
    }
}
