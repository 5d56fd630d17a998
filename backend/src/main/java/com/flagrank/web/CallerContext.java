package com.flagrank.web;

import com.flagrank.model.Role;

import java.util.Objects;
import java.util.UUID;

/**
 * Caller identity as resolved by the authentication layer in front of the service.
 */
public record CallerContext(
        UUID teamId,
        String memberId,
        Role role
) {
    public CallerContext {
        role = Objects.requireNonNullElse(role, Role.PLAYER);
    }

    public static CallerContext team(UUID teamId, String memberId) {
        return new CallerContext(teamId, memberId, Role.PLAYER);
    }

    public static CallerContext staff(Role role) {
        return new CallerContext(null, null, role);
    }
}
