package com.tokentracker.backend.modules.auth.application.credential;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks an attempt against a stored credential written by any supported scheme.
 * Schemes are tried in priority order and the first match wins; the first scheme is
 * the current one.
 */
public class CredentialVerifier {

    private static final Logger log = LoggerFactory.getLogger(CredentialVerifier.class);

    private final List<CredentialScheme> schemes;

    public CredentialVerifier(List<CredentialScheme> schemes) {
        if (schemes == null || schemes.isEmpty()) {
            throw new IllegalArgumentException("at least one credential scheme is required");
        }
        this.schemes = List.copyOf(schemes);
    }

    public boolean verify(String attempt, String stored) {
        if (attempt == null || stored == null || stored.isBlank()) {
            return false;
        }
        if (CredentialEncoder.exceedsMaxLength(attempt)) {
            // a longer attempt could never have been encoded, and BCrypt would truncate it
            return false;
        }
        for (CredentialScheme scheme : schemes) {
            if (!scheme.supports(stored)) {
                continue;
            }
            try {
                if (scheme.matches(attempt, stored)) {
                    return true;
                }
            } catch (RuntimeException ex) {
                // malformed value for this scheme; the next one may still accept it
                log.debug("Credential scheme {} rejected a stored value: {}",
                        scheme.getClass().getSimpleName(), ex.getClass().getSimpleName());
            }
        }
        return false;
    }

    /**
     * True when {@code stored} was written by the current scheme and needs no upgrade.
     */
    public boolean isCurrentFormat(String stored) {
        return schemes.get(0).supports(stored);
    }
}
