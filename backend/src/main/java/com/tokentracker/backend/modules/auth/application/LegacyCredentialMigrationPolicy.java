package com.tokentracker.backend.modules.auth.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Map;
import java.util.Optional;

import com.tokentracker.backend.modules.audit.application.AuditLogService;
import com.tokentracker.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.tokentracker.backend.modules.auth.application.credential.CredentialEncoder;
import com.tokentracker.backend.modules.auth.application.credential.CredentialVerifier;
import com.tokentracker.backend.modules.auth.domain.DefaultAccount;
import com.tokentracker.backend.modules.auth.domain.UserAccount;
import com.tokentracker.backend.modules.auth.infrastructure.persistence.UserAccountRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Verifies a login and upgrades credentials still stored in a legacy format.
 *
 * <p>Per attempt:
 * <ol>
 *   <li>Verify against the stored credential with every supported scheme.</li>
 *   <li>On a match in the current format: success.</li>
 *   <li>On a match in a legacy format: re-encode, persist, success (migrated).</li>
 *   <li>On no match, when the stored value is not in the current format and the attempt
 *       equals the account's documented default secret: re-encode, persist, success
 *       (migrated).</li>
 *   <li>Anything else, including an unknown username: failure.</li>
 * </ol>
 *
 * <p>Step 4 only applies to stored values that are not in the current format.
 * Once an account holds a BCrypt credential, for example after a password change, its
 * documented default no longer logs in.
 *
 * <p>Persisting is a single update keyed by username. Two concurrent upgrades of the
 * same account both succeed and the last write wins; both writes encode the same
 * plaintext. Once upgraded, an account only ever takes step 2.
 */
@Service
public class LegacyCredentialMigrationPolicy {

    private static final Logger log = LoggerFactory.getLogger(LegacyCredentialMigrationPolicy.class);

    static final String ACTION_CREDENTIAL_MIGRATED = "CREDENTIAL_MIGRATED";
    private static final String UNKNOWN_ACCOUNT_PLACEHOLDER = "unknown-account-placeholder";

    private final UserAccountRepository userAccountRepository;
    private final CredentialVerifier credentialVerifier;
    private final CredentialEncoder credentialEncoder;
    private final AuditLogService auditLogService;
    private final Clock clock;
    private final String unknownAccountCredential;

    public LegacyCredentialMigrationPolicy(
            UserAccountRepository userAccountRepository,
            CredentialVerifier credentialVerifier,
            CredentialEncoder credentialEncoder,
            AuditLogService auditLogService,
            Clock clock
    ) {
        this.userAccountRepository = userAccountRepository;
        this.credentialVerifier = credentialVerifier;
        this.credentialEncoder = credentialEncoder;
        this.auditLogService = auditLogService;
        this.clock = clock;
        this.unknownAccountCredential = credentialEncoder.encode(UNKNOWN_ACCOUNT_PLACEHOLDER);
    }

    public LoginAttempt attemptLogin(String username, String plaintext) {
        Optional<UserAccount> found = userAccountRepository.findByUsername(username);
        if (found.isEmpty()) {
            // same hashing cost as a real account so response time does not reveal usernames
            credentialVerifier.verify(plaintext, unknownAccountCredential);
            return LoginAttempt.failure();
        }

        UserAccount account = found.get();
        String stored = account.getCredential();
        boolean currentFormat = credentialVerifier.isCurrentFormat(stored);

        if (credentialVerifier.verify(plaintext, stored)) {
            if (currentFormat) {
                return LoginAttempt.success(account, false);
            }
            return migrate(account, plaintext, "LEGACY_FORMAT");
        }

        if (!currentFormat && DefaultAccount.isDefaultSecret(username, plaintext)) {
            return migrate(account, plaintext, "LEGACY_DEFAULT");
        }

        return LoginAttempt.failure();
    }

    private LoginAttempt migrate(UserAccount account, String plaintext, String trigger) {
        String upgraded = credentialEncoder.encode(plaintext);
        int updated = userAccountRepository.updateCredential(
                account.getUsername(), upgraded, OffsetDateTime.now(clock));
        if (updated == 0) {
            // deleted between lookup and update
            return LoginAttempt.failure();
        }
        account.setCredential(upgraded);

        auditLogService.record(new AuditLogCommand(
                ACTION_CREDENTIAL_MIGRATED,
                AuditLogService.RESOURCE_USER_ACCOUNT,
                account.getUsername(),
                account.getId(),
                Map.of("trigger", trigger)
        ));
        log.info("Upgraded stored credential for account {}", account.getUsername());
        return LoginAttempt.success(account, true);
    }
}
