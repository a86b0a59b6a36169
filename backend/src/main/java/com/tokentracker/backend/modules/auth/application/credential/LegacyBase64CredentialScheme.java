package com.tokentracker.backend.modules.auth.application.credential;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Base64;
import java.util.regex.Pattern;

/**
 * Reversible Base64 encoding written by earlier deployments. Read only: nothing
 * in the service writes this format any more.
 */
public class LegacyBase64CredentialScheme implements CredentialScheme {

    private static final Pattern BASE64_PATTERN = Pattern.compile("^[A-Za-z0-9+/]+={0,2}$");

    @Override
    public boolean supports(String stored) {
        return stored != null && !stored.isEmpty() && BASE64_PATTERN.matcher(stored).matches();
    }

    @Override
    public boolean matches(CharSequence attempt, String stored) {
        if (attempt == null || stored == null) {
            return false;
        }
        byte[] expected = encode(attempt).getBytes(StandardCharsets.US_ASCII);
        byte[] actual = stored.getBytes(StandardCharsets.US_ASCII);
        return MessageDigest.isEqual(expected, actual);
    }

    String encode(CharSequence plaintext) {
        return Base64.getEncoder().encodeToString(plaintext.toString().getBytes(StandardCharsets.UTF_8));
    }
}
