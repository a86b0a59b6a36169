package com.tokentracker.backend.modules.auth.application;

import java.util.List;
import java.util.Map;

import com.tokentracker.backend.global.error.ProblemException;
import com.tokentracker.backend.global.security.SecurityUtils;
import com.tokentracker.backend.modules.audit.application.AuditLogService;
import com.tokentracker.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.tokentracker.backend.modules.auth.application.credential.CredentialEncoder;
import com.tokentracker.backend.modules.auth.application.credential.CredentialVerifier;
import com.tokentracker.backend.modules.auth.domain.AccountRole;
import com.tokentracker.backend.modules.auth.domain.AccountStatus;
import com.tokentracker.backend.modules.auth.domain.UserAccount;
import com.tokentracker.backend.modules.auth.infrastructure.persistence.UserAccountRepository;
import com.tokentracker.backend.modules.auth.presentation.dto.AccountResponse;
import com.tokentracker.backend.modules.auth.presentation.dto.ChangePasswordRequest;
import com.tokentracker.backend.modules.auth.presentation.dto.CreateAccountRequest;
import com.tokentracker.backend.modules.auth.presentation.dto.ResetPasswordRequest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class AccountService {

    private static final Logger log = LoggerFactory.getLogger(AccountService.class);

    static final String ACTION_ACCOUNT_CREATED = "ACCOUNT_CREATED";
    static final String ACTION_ACCOUNT_DELETED = "ACCOUNT_DELETED";
    static final String ACTION_PASSWORD_CHANGED = "PASSWORD_CHANGED";
    static final String USERNAME_UNIQUE_CONSTRAINT = "uq_users_username";

    private final UserAccountRepository userAccountRepository;
    private final CredentialEncoder credentialEncoder;
    private final CredentialVerifier credentialVerifier;
    private final AuditLogService auditLogService;

    public AccountService(
            UserAccountRepository userAccountRepository,
            CredentialEncoder credentialEncoder,
            CredentialVerifier credentialVerifier,
            AuditLogService auditLogService
    ) {
        this.userAccountRepository = userAccountRepository;
        this.credentialEncoder = credentialEncoder;
        this.credentialVerifier = credentialVerifier;
        this.auditLogService = auditLogService;
    }

    @Transactional(readOnly = true)
    public List<AccountResponse> listAccounts() {
        return userAccountRepository.findAllByOrderByIdAsc().stream()
                .map(AccountResponse::from)
                .toList();
    }

    /**
     * Not transactional: a unique-key violation raised by the repository's own
     * transaction is translated into a conflict here instead of poisoning an outer one.
     */
    public AccountResponse createAccount(CreateAccountRequest request) {
        String username = request.username().trim();
        AccountRole role = AccountRole.fromLabel(request.role())
                .orElseThrow(() -> new ProblemException(HttpStatus.BAD_REQUEST, "validation_error",
                        "role must be one of Admin, User, Agent, Executive"));

        if (userAccountRepository.existsByUsername(username)) {
            throw usernameConflict();
        }

        UserAccount account = new UserAccount();
        account.setUsername(username);
        account.setCredential(encodeNewSecret(request.password()));
        account.setRole(role);
        account.setStatus(AccountStatus.ACTIVE);

        UserAccount saved;
        try {
            saved = userAccountRepository.saveAndFlush(account);
        } catch (DataIntegrityViolationException ex) {
            // lost a race with a concurrent create of the same username
            if (isUsernameUniqueViolation(ex)) {
                throw usernameConflict();
            }
            throw ex;
        }

        audit(ACTION_ACCOUNT_CREATED, saved, Map.of("role", role.getLabel()));
        log.info("Created account {} with role {}", saved.getUsername(), role.getLabel());
        return AccountResponse.from(saved);
    }

    @Transactional
    public void deleteAccount(Long accountId) {
        UserAccount account = loadAccount(accountId);
        userAccountRepository.delete(account);
        audit(ACTION_ACCOUNT_DELETED, account, Map.of());
        log.info("Deleted account {}", account.getUsername());
    }

    @Transactional
    public AccountResponse resetPassword(Long accountId, ResetPasswordRequest request) {
        UserAccount account = loadAccount(accountId);
        account.setCredential(encodeNewSecret(request.password()));
        userAccountRepository.saveAndFlush(account);
        audit(ACTION_PASSWORD_CHANGED, account, Map.of("mode", "ADMIN_RESET"));
        return AccountResponse.from(account);
    }

    @Transactional
    public void changeOwnPassword(ChangePasswordRequest request) {
        Long accountId = SecurityUtils.getCurrentAccountId();
        UserAccount account = userAccountRepository.findById(accountId)
                .orElseThrow(() -> new ProblemException(HttpStatus.UNAUTHORIZED, "auth.account_missing",
                        "Authentication required"));

        if (!credentialVerifier.verify(request.currentPassword(), account.getCredential())) {
            throw new ProblemException(HttpStatus.UNAUTHORIZED, "auth.invalid_current_password",
                    "Current password is incorrect");
        }

        account.setCredential(encodeNewSecret(request.newPassword()));
        userAccountRepository.saveAndFlush(account);
        audit(ACTION_PASSWORD_CHANGED, account, Map.of("mode", "SELF_SERVICE"));
    }

    private String encodeNewSecret(String password) {
        if (CredentialEncoder.exceedsMaxLength(password)) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "validation_error",
                    "password must be at most " + CredentialEncoder.MAX_SECRET_BYTES + " bytes");
        }
        return credentialEncoder.encode(password);
    }

    private UserAccount loadAccount(Long accountId) {
        return userAccountRepository.findById(accountId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "account.not_found", "User not found"));
    }

    static boolean isUsernameUniqueViolation(DataIntegrityViolationException ex) {
        Throwable root = NestedExceptionUtils.getMostSpecificCause(ex);
        String message = root.getMessage();
        return message != null && message.contains(USERNAME_UNIQUE_CONSTRAINT);
    }

    private ProblemException usernameConflict() {
        return new ProblemException(HttpStatus.CONFLICT, "account.username_taken", "Username already exists");
    }

    private void audit(String action, UserAccount account, Map<String, Object> detail) {
        auditLogService.record(new AuditLogCommand(
                action,
                AuditLogService.RESOURCE_USER_ACCOUNT,
                account.getUsername(),
                SecurityUtils.findCurrentAccountId(),
                detail
        ));
    }
}
