package com.tokentracker.backend.modules.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import com.tokentracker.backend.modules.auth.application.AccountSeedService;
import com.tokentracker.backend.modules.auth.application.LegacyCredentialMigrationPolicy;
import com.tokentracker.backend.modules.auth.application.LoginAttempt;
import com.tokentracker.backend.modules.auth.application.credential.CredentialVerifier;
import com.tokentracker.backend.modules.auth.domain.AccountRole;
import com.tokentracker.backend.modules.auth.domain.DefaultAccount;
import com.tokentracker.backend.modules.auth.domain.UserAccount;
import com.tokentracker.backend.modules.auth.infrastructure.persistence.UserAccountRepository;
import com.tokentracker.backend.support.AbstractPostgresIntegrationTest;
import com.tokentracker.backend.support.TestAccountFactory;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest
class AccountSeedIntegrationTest extends AbstractPostgresIntegrationTest {

    @Autowired
    private AccountSeedService accountSeedService;

    @Autowired
    private UserAccountRepository userAccountRepository;

    @Autowired
    private LegacyCredentialMigrationPolicy migrationPolicy;

    @Autowired
    private CredentialVerifier credentialVerifier;

    @Autowired
    private TestAccountFactory testAccountFactory;

    @Test
    void seedingEmptyStoreCreatesExactlyTheDefaultAccounts() {
        int created = accountSeedService.seedDefaultAccounts();

        assertThat(created).isEqualTo(DefaultAccount.values().length);
        assertThat(userAccountRepository.findAllByOrderByIdAsc())
                .extracting(UserAccount::getUsername, UserAccount::getRole)
                .containsExactlyInAnyOrder(
                        tuple("admin", AccountRole.ADMIN),
                        tuple("user", AccountRole.USER),
                        tuple("agent", AccountRole.AGENT),
                        tuple("executive", AccountRole.EXECUTIVE)
                );

        for (DefaultAccount account : DefaultAccount.values()) {
            String stored = testAccountFactory.storedCredential(account.getUsername());
            assertThat(credentialVerifier.isCurrentFormat(stored)).isTrue();

            LoginAttempt attempt = migrationPolicy.attemptLogin(account.getUsername(), account.getDefaultSecret());
            assertThat(attempt.succeeded()).isTrue();
            assertThat(attempt.migrated()).isFalse();
        }
    }

    @Test
    void seedingIsIdempotentAndNeverOverwrites() {
        testAccountFactory.createAccount("admin", "rotated-secret", AccountRole.ADMIN);
        String before = testAccountFactory.storedCredential("admin");

        assertThat(accountSeedService.seedDefaultAccounts()).isEqualTo(DefaultAccount.values().length - 1);
        assertThat(accountSeedService.seedDefaultAccounts()).isZero();

        assertThat(testAccountFactory.storedCredential("admin")).isEqualTo(before);
        assertThat(userAccountRepository.count()).isEqualTo(DefaultAccount.values().length);
        assertThat(migrationPolicy.attemptLogin("admin", "admin123").succeeded()).isFalse();
    }
}
