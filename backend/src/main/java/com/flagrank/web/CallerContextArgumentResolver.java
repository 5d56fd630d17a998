package com.flagrank.web;

import com.flagrank.model.Role;
import org.springframework.core.MethodParameter;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

import java.util.Locale;
import java.util.UUID;

/**
 * Builds a {@link CallerContext} from the identity headers set by the upstream auth proxy.
 */
public class CallerContextArgumentResolver implements HandlerMethodArgumentResolver {

    public static final String TEAM_HEADER = "X-Flagrank-Team";
    public static final String MEMBER_HEADER = "X-Flagrank-Member";
    public static final String ROLE_HEADER = "X-Flagrank-Role";

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return CallerContext.class.equals(parameter.getParameterType());
    }

    @Override
    public CallerContext resolveArgument(
            MethodParameter parameter,
            ModelAndViewContainer mavContainer,
            NativeWebRequest webRequest,
            WebDataBinderFactory binderFactory
    ) {
        return new CallerContext(
                parseTeamId(webRequest.getHeader(TEAM_HEADER)),
                trimToNull(webRequest.getHeader(MEMBER_HEADER)),
                parseRole(webRequest.getHeader(ROLE_HEADER))
        );
    }

    private static UUID parseTeamId(String header) {
        String value = trimToNull(header);
        if (value == null) {
            return null;
        }
        try {
            return UUID.fromString(value);
        } catch (IllegalArgumentException ex) {
            throw new CapabilityDeniedException("invalid_team_header", TEAM_HEADER + " is not a valid team id");
        }
    }

    private static Role parseRole(String header) {
        String value = trimToNull(header);
        if (value == null) {
            return Role.PLAYER;
        }
        try {
            return Role.valueOf(value.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new CapabilityDeniedException("invalid_role_header", "Unknown caller role: " + value);
        }
    }

    private static String trimToNull(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }
}
