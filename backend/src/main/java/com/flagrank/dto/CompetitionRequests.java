package com.flagrank.dto;

import jakarta.validation.constraints.AssertTrue;

import java.time.OffsetDateTime;

public final class CompetitionRequests {

    private CompetitionRequests() {
    }

    /**
     * Null bounds leave that side of the window open.
     */
    public record UpdateWindowRequest(
            OffsetDateTime startTime,
            OffsetDateTime endTime,
            OffsetDateTime freezeTime
    ) {
        @AssertTrue(message = "startTime must be before endTime")
        public boolean isStartBeforeEnd() {
            if (startTime == null || endTime == null) {
                return true;
            }
            return startTime.isBefore(endTime);
        }
    }
}
