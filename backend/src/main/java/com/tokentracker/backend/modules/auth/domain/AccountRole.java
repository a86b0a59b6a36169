package com.tokentracker.backend.modules.auth.domain;

import java.util.Arrays;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Closed set of account roles. Stored and serialized by label ("Admin", "User", ...)
 * so rows written by earlier deployments keep reading.
 */
public enum AccountRole {
    ADMIN("Admin"),
    USER("User"),
    AGENT("Agent"),
    EXECUTIVE("Executive");

    private final String label;

    AccountRole(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public static Optional<AccountRole> fromLabel(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String trimmed = raw.trim();
        return Arrays.stream(values())
                .filter(role -> role.label.equalsIgnoreCase(trimmed) || role.name().equalsIgnoreCase(trimmed))
                .findFirst();
    }
}
