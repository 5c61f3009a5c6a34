package com.rankcup.competition.web;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class CompetitionExceptionHandler {

    private static final Logger LOGGER = LoggerFactory.getLogger(CompetitionExceptionHandler.class);

    @ExceptionHandler(CompetitionRuleException.class)
    public ResponseEntity<CompetitionErrorResponse> handle(CompetitionRuleException ex) {
        CompetitionErrorCode errorCode = ex.getErrorCode();
        ResponseEntity.BodyBuilder response = ResponseEntity.status(errorCode.status());
        if (!ex.getRetryAfter().isZero()) {
            // Retry-After is whole seconds, rounded up.
            long seconds = ex.getRetryAfter().plusMillis(999).toSeconds();
            response.header(HttpHeaders.RETRY_AFTER, String.valueOf(seconds));
        }
        return response.body(new CompetitionErrorResponse(errorCode.code(), ex.getMessage()));
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<CompetitionErrorResponse> handleStoreFailure(DataAccessException ex) {
        LOGGER.error("Competition store operation failed", ex);
        CompetitionErrorCode errorCode = CompetitionErrorCode.STORE_UNAVAILABLE;
        return ResponseEntity
                .status(errorCode.status())
                .body(new CompetitionErrorResponse(errorCode.code(), "Competition store is unavailable"));
    }

    public record CompetitionErrorResponse(
            String code,
            String message
    ) {
    }
}
