package com.tokentracker.backend.support;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import com.tokentracker.backend.modules.auth.application.JwtTokenService;
import com.tokentracker.backend.modules.auth.application.credential.CredentialEncoder;
import com.tokentracker.backend.modules.auth.domain.AccountRole;
import com.tokentracker.backend.modules.auth.domain.AccountStatus;
import com.tokentracker.backend.modules.auth.domain.UserAccount;
import com.tokentracker.backend.modules.auth.infrastructure.persistence.UserAccountRepository;

import org.springframework.stereotype.Component;

@Component
public class TestAccountFactory {

    private final UserAccountRepository userAccountRepository;
    private final CredentialEncoder credentialEncoder;
    private final JwtTokenService jwtTokenService;

    public TestAccountFactory(
            UserAccountRepository userAccountRepository,
            CredentialEncoder credentialEncoder,
            JwtTokenService jwtTokenService
    ) {
        this.userAccountRepository = userAccountRepository;
        this.credentialEncoder = credentialEncoder;
        this.jwtTokenService = jwtTokenService;
    }

    public UserAccount createAccount(String username, String rawPassword, AccountRole role) {
        return save(username, credentialEncoder.encode(rawPassword), role);
    }

    /**
     * Stores the credential the way deployments before BCrypt did.
     */
    public UserAccount createLegacyAccount(String username, String rawPassword, AccountRole role) {
        String legacy = Base64.getEncoder().encodeToString(rawPassword.getBytes(StandardCharsets.UTF_8));
        return save(username, legacy, role);
    }

    public UserAccount createAccountWithStoredValue(String username, String storedValue, AccountRole role) {
        return save(username, storedValue, role);
    }

    public String storedCredential(String username) {
        return userAccountRepository.findByUsername(username)
                .map(UserAccount::getCredential)
                .orElseThrow();
    }

    public String bearer(UserAccount account) {
        return "Bearer " + jwtTokenService.issueAccessToken(account).token();
    }

    public String adminBearer() {
        return bearer(createAccount("test-admin", "admin-pass-1", AccountRole.ADMIN));
    }

    public String userBearer() {
        return bearer(createAccount("test-user", "user-pass-1", AccountRole.USER));
    }

    private UserAccount save(String username, String storedValue, AccountRole role) {
        UserAccount account = new UserAccount();
        account.setUsername(username);
        account.setCredential(storedValue);
        account.setRole(role);
        account.setStatus(AccountStatus.ACTIVE);
        return userAccountRepository.saveAndFlush(account);
    }
}
