package com.rankcup.competition.web;

import org.springframework.http.HttpStatus;

/**
 * Every failure the competition core can report, each with a stable machine-readable code.
 */
public enum CompetitionErrorCode {
    VALIDATION_FAILED(HttpStatus.BAD_REQUEST, "validation_failed"),
    COMPETITION_NOT_FOUND(HttpStatus.NOT_FOUND, "competition_not_found"),
    OWNER_LIMIT_REACHED(HttpStatus.CONFLICT, "owner_limit_reached"),
    SERVER_LIMIT_REACHED(HttpStatus.CONFLICT, "server_limit_reached"),
    INACTIVE_COMPETITION(HttpStatus.CONFLICT, "inactive_competition"),
    ALREADY_PARTICIPANT(HttpStatus.CONFLICT, "already_participant"),
    CANNOT_REJOIN(HttpStatus.CONFLICT, "cannot_rejoin"),
    MAXIMUM_PARTICIPANTS_REACHED(HttpStatus.CONFLICT, "maximum_participants_reached"),
    INVITE_REQUIRED(HttpStatus.FORBIDDEN, "invite_required"),
    NOT_COMPETITION_OWNER(HttpStatus.FORBIDDEN, "not_competition_owner"),
    ADMINISTRATOR_REQUIRED(HttpStatus.FORBIDDEN, "administrator_required"),
    PARTICIPANT_NOT_FOUND(HttpStatus.NOT_FOUND, "participant_not_found"),
    ALREADY_LEFT(HttpStatus.CONFLICT, "already_left"),
    MISSING_CREATE_PERMISSION(HttpStatus.FORBIDDEN, "missing_create_permission"),
    CREATION_RATE_LIMITED(HttpStatus.TOO_MANY_REQUESTS, "creation_rate_limited"),
    STORE_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, "store_unavailable");

    private final HttpStatus status;
    private final String code;

    CompetitionErrorCode(HttpStatus status, String code) {
        this.status = status;
        this.code = code;
    }

    public HttpStatus status() {
        return status;
    }

    public String code() {
        return code;
    }
}
