package com.tokentracker.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;

import com.tokentracker.backend.modules.auth.domain.AccountRole;
import com.tokentracker.backend.modules.auth.domain.AccountStatus;
import com.tokentracker.backend.modules.auth.domain.UserAccount;

public record AccountResponse(
        Long id,
        String username,
        AccountRole role,
        AccountStatus status,
        OffsetDateTime createdAt
) {

    public static AccountResponse from(UserAccount account) {
        return new AccountResponse(
                account.getId(),
                account.getUsername(),
                account.getRole(),
                account.getStatus(),
                account.getCreatedAt()
        );
    }
}
