package com.tokentracker.backend.modules.auth.presentation.dto;

import com.tokentracker.backend.modules.auth.domain.AccountRole;

public record LoginResponse(
        String message,
        String username,
        AccountRole role,
        String accessToken,
        String tokenType,
        long expiresIn
) {
}
