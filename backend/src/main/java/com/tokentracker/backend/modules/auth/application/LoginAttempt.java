package com.tokentracker.backend.modules.auth.application;

import com.tokentracker.backend.modules.auth.domain.UserAccount;

/**
 * Outcome of one pass through the credential migration policy. Failures carry no
 * account and no reason, so wrong password and unknown username look the same.
 */
public record LoginAttempt(Outcome outcome, UserAccount account, boolean migrated) {

    public enum Outcome {
        SUCCESS,
        FAILURE
    }

    public static LoginAttempt success(UserAccount account, boolean migrated) {
        return new LoginAttempt(Outcome.SUCCESS, account, migrated);
    }

    public static LoginAttempt failure() {
        return new LoginAttempt(Outcome.FAILURE, null, false);
    }

    public boolean succeeded() {
        return outcome == Outcome.SUCCESS;
    }
}
