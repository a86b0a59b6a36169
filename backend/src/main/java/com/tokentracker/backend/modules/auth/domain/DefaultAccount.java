package com.tokentracker.backend.modules.auth.domain;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Arrays;
import java.util.Optional;

/**
 * Accounts every deployment starts with, together with the default secret each was
 * originally issued. The secrets double as the legacy default table: an account still
 * stored in an old format may upgrade itself when it logs in with its default.
 * Never persisted in plaintext.
 */
public enum DefaultAccount {
    ADMIN("admin", "admin123", AccountRole.ADMIN),
    USER("user", "user123", AccountRole.USER),
    AGENT("agent", "agent123", AccountRole.AGENT),
    EXECUTIVE("executive", "executive123", AccountRole.EXECUTIVE);

    private final String username;
    private final String defaultSecret;
    private final AccountRole role;

    DefaultAccount(String username, String defaultSecret, AccountRole role) {
        this.username = username;
        this.defaultSecret = defaultSecret;
        this.role = role;
    }

    public String getUsername() {
        return username;
    }

    public String getDefaultSecret() {
        return defaultSecret;
    }

    public AccountRole getRole() {
        return role;
    }

    public static Optional<DefaultAccount> forUsername(String username) {
        if (username == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(account -> account.username.equals(username))
                .findFirst();
    }

    /**
     * Case-sensitive username match, constant-time secret comparison.
     */
    public static boolean isDefaultSecret(String username, String plaintext) {
        if (plaintext == null) {
            return false;
        }
        return forUsername(username)
                .map(account -> MessageDigest.isEqual(
                        account.defaultSecret.getBytes(StandardCharsets.UTF_8),
                        plaintext.getBytes(StandardCharsets.UTF_8)))
                .orElse(false);
    }
}
