package com.rankcup.competition.web;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Input was rejected before anything was written.
 */
@Getter
public class CompetitionValidationException extends RuntimeException {

    private final Map<String, String> fieldErrors;

    public CompetitionValidationException(Map<String, String> fieldErrors) {
        super(fieldErrors.isEmpty()
                ? "Validation failed"
                : "Validation failed: " + String.join("; ", fieldErrors.values()));
        this.fieldErrors = Collections.unmodifiableMap(new LinkedHashMap<>(fieldErrors));
    }

    public static CompetitionValidationException of(String field, String message) {
        return new CompetitionValidationException(Map.of(field, message));
    }

    public CompetitionErrorCode getErrorCode() {
        return CompetitionErrorCode.VALIDATION_FAILED;
    }
}
