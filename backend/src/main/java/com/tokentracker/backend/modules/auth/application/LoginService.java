package com.tokentracker.backend.modules.auth.application;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import com.tokentracker.backend.global.error.ProblemException;
import com.tokentracker.backend.global.error.RetryableProblemException;
import com.tokentracker.backend.modules.auth.application.JwtTokenService.AccessToken;
import com.tokentracker.backend.modules.auth.domain.UserAccount;
import com.tokentracker.backend.modules.auth.presentation.dto.LoginRequest;
import com.tokentracker.backend.modules.auth.presentation.dto.LoginResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

/**
 * Runs the credential check off the request thread and turns the attempt into a
 * response or a uniform authentication failure.
 */
@Service
public class LoginService {

    private static final Logger log = LoggerFactory.getLogger(LoginService.class);

    static final String MESSAGE_SUCCESS = "Login successful";
    static final String MESSAGE_UPGRADED = "Login successful (credential upgraded)";
    static final String INVALID_CREDENTIALS_MESSAGE = "Invalid username or password";
    private static final int BUSY_RETRY_AFTER_SECONDS = 1;

    private final LegacyCredentialMigrationPolicy migrationPolicy;
    private final JwtTokenService jwtTokenService;
    private final Executor credentialHashExecutor;

    public LoginService(
            LegacyCredentialMigrationPolicy migrationPolicy,
            JwtTokenService jwtTokenService,
            @Qualifier("credentialHashExecutor") Executor credentialHashExecutor
    ) {
        this.migrationPolicy = migrationPolicy;
        this.jwtTokenService = jwtTokenService;
        this.credentialHashExecutor = credentialHashExecutor;
    }

    public CompletableFuture<LoginResponse> login(LoginRequest request) {
        String username = requireText(request.username(), "username is required");
        String password = requireText(request.password(), "password is required");

        try {
            return CompletableFuture.supplyAsync(() -> authenticate(username, password), credentialHashExecutor);
        } catch (RejectedExecutionException e) {
            log.warn("Credential hash pool saturated, rejecting login");
            throw new RetryableProblemException(HttpStatus.SERVICE_UNAVAILABLE, "auth.login_busy",
                    "Login temporarily unavailable, retry shortly", BUSY_RETRY_AFTER_SECONDS);
        }
    }

    private LoginResponse authenticate(String username, String password) {
        LoginAttempt attempt = migrationPolicy.attemptLogin(username, password);
        if (!attempt.succeeded()) {
            log.debug("Login rejected for {}", username);
            throw new ProblemException(HttpStatus.UNAUTHORIZED, "auth.invalid_credentials",
                    INVALID_CREDENTIALS_MESSAGE);
        }

        UserAccount account = attempt.account();
        AccessToken token = jwtTokenService.issueAccessToken(account);
        return new LoginResponse(
                attempt.migrated() ? MESSAGE_UPGRADED : MESSAGE_SUCCESS,
                account.getUsername(),
                account.getRole(),
                token.token(),
                token.tokenType(),
                token.expiresIn()
        );
    }

    private String requireText(String value, String message) {
        if (value == null || value.isBlank()) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "validation_error", message);
        }
        return value;
    }
}
