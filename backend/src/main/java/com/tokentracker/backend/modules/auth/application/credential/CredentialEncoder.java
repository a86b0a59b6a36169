package com.tokentracker.backend.modules.auth.application.credential;

import java.nio.charset.StandardCharsets;

/**
 * Produces the stored form of a new or changed secret. Always uses the strong scheme.
 */
public class CredentialEncoder {

    /** BCrypt ignores everything past this many bytes of input. */
    public static final int MAX_SECRET_BYTES = 72;

    private final BcryptCredentialScheme scheme;

    public CredentialEncoder(BcryptCredentialScheme scheme) {
        this.scheme = scheme;
    }

    public String encode(String plaintext) {
        if (plaintext == null || plaintext.isBlank()) {
            throw new IllegalArgumentException("plaintext must not be blank");
        }
        if (exceedsMaxLength(plaintext)) {
            throw new IllegalArgumentException("plaintext must be at most " + MAX_SECRET_BYTES + " bytes");
        }
        return scheme.encode(plaintext);
    }

    public static boolean exceedsMaxLength(CharSequence plaintext) {
        return plaintext.toString().getBytes(StandardCharsets.UTF_8).length > MAX_SECRET_BYTES;
    }
}
