package com.tokentracker.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import com.tokentracker.backend.modules.audit.application.AuditLogService;
import com.tokentracker.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.tokentracker.backend.modules.auth.application.credential.BcryptCredentialScheme;
import com.tokentracker.backend.modules.auth.application.credential.CredentialEncoder;
import com.tokentracker.backend.modules.auth.application.credential.CredentialVerifier;
import com.tokentracker.backend.modules.auth.application.credential.LegacyBase64CredentialScheme;
import com.tokentracker.backend.modules.auth.domain.AccountRole;
import com.tokentracker.backend.modules.auth.domain.UserAccount;
import com.tokentracker.backend.modules.auth.infrastructure.persistence.UserAccountRepository;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.test.util.ReflectionTestUtils;

@ExtendWith(MockitoExtension.class)
class LegacyCredentialMigrationPolicyTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2025-03-01T09:00:00Z");

    @Mock
    private UserAccountRepository userAccountRepository;

    @Mock
    private AuditLogService auditLogService;

    private BcryptCredentialScheme bcrypt;
    private CredentialVerifier verifier;
    private LegacyCredentialMigrationPolicy policy;

    @BeforeEach
    void setUp() {
        bcrypt = new BcryptCredentialScheme(new BCryptPasswordEncoder(4));
        verifier = new CredentialVerifier(List.of(bcrypt, new LegacyBase64CredentialScheme()));
        Clock clock = Clock.fixed(NOW.toInstant(), ZoneOffset.UTC);
        policy = new LegacyCredentialMigrationPolicy(
                userAccountRepository,
                verifier,
                new CredentialEncoder(bcrypt),
                auditLogService,
                clock
        );
    }

    @Test
    @DisplayName("current-format credential logs in without touching the store")
    void currentFormatMatch() {
        UserAccount account = account("user", bcrypt.encode("user123"), AccountRole.USER);
        when(userAccountRepository.findByUsername("user")).thenReturn(Optional.of(account));

        LoginAttempt attempt = policy.attemptLogin("user", "user123");

        assertThat(attempt.succeeded()).isTrue();
        assertThat(attempt.migrated()).isFalse();
        assertThat(attempt.account()).isSameAs(account);
        verify(userAccountRepository, never()).updateCredential(anyString(), anyString(), any());
        verify(auditLogService, never()).record(any());
    }

    @Test
    @DisplayName("legacy base64 credential is upgraded to BCrypt on login")
    void legacyFormatMatchMigrates() {
        UserAccount account = account("admin", "YWRtaW4xMjM=", AccountRole.ADMIN);
        when(userAccountRepository.findByUsername("admin")).thenReturn(Optional.of(account));
        when(userAccountRepository.updateCredential(eq("admin"), anyString(), eq(NOW))).thenReturn(1);

        LoginAttempt attempt = policy.attemptLogin("admin", "admin123");

        assertThat(attempt.succeeded()).isTrue();
        assertThat(attempt.migrated()).isTrue();

        ArgumentCaptor<String> written = ArgumentCaptor.forClass(String.class);
        verify(userAccountRepository).updateCredential(eq("admin"), written.capture(), eq(NOW));
        assertThat(verifier.isCurrentFormat(written.getValue())).isTrue();
        assertThat(verifier.verify("admin123", written.getValue())).isTrue();
        assertThat(account.getCredential()).isEqualTo(written.getValue());

        ArgumentCaptor<AuditLogCommand> audit = ArgumentCaptor.forClass(AuditLogCommand.class);
        verify(auditLogService).record(audit.capture());
        assertThat(audit.getValue().actionType()).isEqualTo("CREDENTIAL_MIGRATED");
        assertThat(audit.getValue().resourceKey()).isEqualTo("admin");
        assertThat(audit.getValue().detail().values()).noneMatch(value -> value.toString().contains("admin123"));
    }

    @Test
    @DisplayName("default secret upgrades a credential in an unreadable legacy format")
    void legacyDefaultMigrates() {
        UserAccount account = account("agent", "agent123-plain!", AccountRole.AGENT);
        when(userAccountRepository.findByUsername("agent")).thenReturn(Optional.of(account));
        when(userAccountRepository.updateCredential(eq("agent"), anyString(), eq(NOW))).thenReturn(1);

        LoginAttempt attempt = policy.attemptLogin("agent", "agent123");

        assertThat(attempt.succeeded()).isTrue();
        assertThat(attempt.migrated()).isTrue();
    }

    @Test
    @DisplayName("default secret never overrides a credential the owner already changed")
    void defaultSecretDoesNotOverrideBcrypt() {
        UserAccount account = account("admin", bcrypt.encode("changed-by-owner"), AccountRole.ADMIN);
        when(userAccountRepository.findByUsername("admin")).thenReturn(Optional.of(account));

        LoginAttempt attempt = policy.attemptLogin("admin", "admin123");

        assertThat(attempt.succeeded()).isFalse();
        verify(userAccountRepository, never()).updateCredential(anyString(), anyString(), any());
    }

    @Test
    void wrongPasswordFails() {
        UserAccount account = account("user", "dXNlcjEyMw==", AccountRole.USER);
        when(userAccountRepository.findByUsername("user")).thenReturn(Optional.of(account));

        LoginAttempt attempt = policy.attemptLogin("user", "wrong");

        assertThat(attempt).isEqualTo(LoginAttempt.failure());
        verify(auditLogService, never()).record(any());
    }

    @Test
    @DisplayName("unknown username fails exactly like a wrong password")
    void unknownUserFails() {
        when(userAccountRepository.findByUsername("ghost")).thenReturn(Optional.empty());

        LoginAttempt attempt = policy.attemptLogin("ghost", "admin123");

        assertThat(attempt).isEqualTo(LoginAttempt.failure());
        verify(userAccountRepository, never()).updateCredential(anyString(), anyString(), any());
    }

    @Test
    @DisplayName("account deleted before the upgrade is written fails")
    void vanishedAccountFails() {
        UserAccount account = account("executive", "ZXhlY3V0aXZlMTIz", AccountRole.EXECUTIVE);
        when(userAccountRepository.findByUsername("executive")).thenReturn(Optional.of(account));
        when(userAccountRepository.updateCredential(eq("executive"), anyString(), eq(NOW))).thenReturn(0);

        LoginAttempt attempt = policy.attemptLogin("executive", "executive123");

        assertThat(attempt.succeeded()).isFalse();
        verify(auditLogService, never()).record(any());
    }

    private static UserAccount account(String username, String credential, AccountRole role) {
        UserAccount account = new UserAccount();
        ReflectionTestUtils.setField(account, "id", 7L);
        account.setUsername(username);
        account.setCredential(credential);
        account.setRole(role);
        return account;
    }
}
