package com.tokentracker.backend.modules.auth.application.credential;

/**
 * One way of checking a plaintext attempt against a stored credential.
 * Implementations are pure predicates and must not log or retain their inputs.
 */
public interface CredentialScheme {

    /**
     * Whether {@code stored} is shaped like this scheme's output.
     */
    boolean supports(String stored);

    boolean matches(CharSequence attempt, String stored);
}
