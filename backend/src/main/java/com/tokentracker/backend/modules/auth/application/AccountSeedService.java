package com.tokentracker.backend.modules.auth.application;

import java.time.Clock;
import java.time.OffsetDateTime;

import com.tokentracker.backend.modules.auth.application.credential.CredentialEncoder;
import com.tokentracker.backend.modules.auth.domain.DefaultAccount;
import com.tokentracker.backend.modules.auth.infrastructure.persistence.UserAccountRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Makes sure every {@link DefaultAccount} exists. Accounts already present, under any
 * credential, are left untouched.
 */
@Service
public class AccountSeedService {

    private static final Logger log = LoggerFactory.getLogger(AccountSeedService.class);

    private final UserAccountRepository userAccountRepository;
    private final CredentialEncoder credentialEncoder;
    private final Clock clock;
    private final boolean enabled;

    public AccountSeedService(
            UserAccountRepository userAccountRepository,
            CredentialEncoder credentialEncoder,
            Clock clock,
            @Value("${app.seed.enabled:true}") boolean enabled
    ) {
        this.userAccountRepository = userAccountRepository;
        this.credentialEncoder = credentialEncoder;
        this.clock = clock;
        this.enabled = enabled;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!enabled) {
            log.info("Default account seeding disabled");
            return;
        }
        int created = seedDefaultAccounts();
        log.info("Default account seeding finished, {} account(s) created", created);
    }

    /**
     * @return number of accounts inserted by this call
     */
    public int seedDefaultAccounts() {
        OffsetDateTime now = OffsetDateTime.now(clock);
        int created = 0;
        for (DefaultAccount account : DefaultAccount.values()) {
            created += userAccountRepository.insertIfAbsent(
                    account.getUsername(),
                    credentialEncoder.encode(account.getDefaultSecret()),
                    account.getRole().getLabel(),
                    now
            );
        }
        return created;
    }
}
