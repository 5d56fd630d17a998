package com.flagrank.web;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Request rejected before anything was written to the ledger.
 */
@Getter
public class ScoringValidationException extends RuntimeException {

    private final HttpStatus status;
    private final String code;

    public ScoringValidationException(HttpStatus status, String code, String message) {
        super(message);
        this.status = status;
        this.code = code;
    }

    public static ScoringValidationException invalidSubmission(String detail) {
        return new ScoringValidationException(HttpStatus.BAD_REQUEST, "invalid_submission", detail);
    }

    public static ScoringValidationException challengeUnavailable(String detail) {
        return new ScoringValidationException(HttpStatus.BAD_REQUEST, "challenge_unavailable", detail);
    }

    public static ScoringValidationException hintUnavailable(String detail) {
        return new ScoringValidationException(HttpStatus.BAD_REQUEST, "hint_unavailable", detail);
    }

    public static ScoringValidationException competitionNotActive(String detail) {
        return new ScoringValidationException(HttpStatus.BAD_REQUEST, "competition_not_active", detail);
    }

    public static ScoringValidationException invalidCompetitionWindow(String detail) {
        return new ScoringValidationException(HttpStatus.BAD_REQUEST, "invalid_competition_window", detail);
    }
}
