package com.flagrank.web;

import com.flagrank.model.Capability;
import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public class CapabilityDeniedException extends RuntimeException {

    private final HttpStatus status = HttpStatus.FORBIDDEN;
    private final String code;

    public CapabilityDeniedException(String code, String message) {
        super(message);
        this.code = code;
    }

    public static CapabilityDeniedException missingCapability(Capability capability) {
        return new CapabilityDeniedException(
                "capability_denied",
                "Caller role does not grant " + capability
        );
    }

    public static CapabilityDeniedException teamRequired() {
        return new CapabilityDeniedException(
                "team_required",
                "This operation requires a caller team"
        );
    }

    public static CapabilityDeniedException unknownTeam(Object teamId) {
        return new CapabilityDeniedException(
                "unknown_team",
                "Caller team is not registered: " + teamId
        );
    }
}
