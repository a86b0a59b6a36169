package com.tokentracker.backend.global.security;

import java.util.Optional;

import org.springframework.http.HttpStatus;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.server.ResponseStatusException;

public final class SecurityUtils {

    private SecurityUtils() {
    }

    public static JwtAuthenticationPrincipal getCurrentPrincipal() {
        return findCurrentPrincipal()
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.UNAUTHORIZED, "UNAUTHORIZED"));
    }

    public static Optional<JwtAuthenticationPrincipal> findCurrentPrincipal() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication == null || !(authentication.getPrincipal() instanceof JwtAuthenticationPrincipal principal)) {
            return Optional.empty();
        }
        return Optional.of(principal);
    }

    public static Long getCurrentAccountId() {
        return getCurrentPrincipal().accountId();
    }

    /**
     * Acting account id for audit entries, or {@code null} outside an authenticated request.
     */
    public static Long findCurrentAccountId() {
        return findCurrentPrincipal().map(JwtAuthenticationPrincipal::accountId).orElse(null);
    }
}
