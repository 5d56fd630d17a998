package com.flagrank.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public final class ScoringRequests {

    private ScoringRequests() {
    }

    /**
     * Blank and over-long flags are rejected by the submission service with {@code invalid_submission}.
     */
    public record SubmitFlagRequest(
            @NotNull(message = "flag is required")
            String flag
    ) {
    }

    public record ClaimTargetRequest(
            @Size(max = 255, message = "proof must be at most 255 characters")
            String proof
    ) {
    }

    public record RotateCaptureTokenRequest(
            @NotBlank(message = "captureToken is required")
            @Size(max = 255, message = "captureToken must be at most 255 characters")
            String captureToken
    ) {
    }
}
