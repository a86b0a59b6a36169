package com.tokentracker.backend.modules.auth.application.credential;

import java.util.regex.Pattern;

import org.springframework.security.crypto.password.PasswordEncoder;

/**
 * Salted adaptive hash. The only scheme used to write credentials.
 */
public class BcryptCredentialScheme implements CredentialScheme {

    private static final Pattern BCRYPT_PATTERN = Pattern.compile("\\A\\$2([ayb])?\\$(\\d\\d)\\$[./0-9A-Za-z]{53}");

    private final PasswordEncoder passwordEncoder;

    public BcryptCredentialScheme(PasswordEncoder passwordEncoder) {
        this.passwordEncoder = passwordEncoder;
    }

    @Override
    public boolean supports(String stored) {
        return stored != null && BCRYPT_PATTERN.matcher(stored).matches();
    }

    @Override
    public boolean matches(CharSequence attempt, String stored) {
        return passwordEncoder.matches(attempt, stored);
    }

    public String encode(CharSequence plaintext) {
        return passwordEncoder.encode(plaintext);
    }
}
