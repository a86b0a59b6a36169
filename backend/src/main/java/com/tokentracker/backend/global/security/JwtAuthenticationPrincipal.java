package com.tokentracker.backend.global.security;

public record JwtAuthenticationPrincipal(Long accountId, String username, String role) {
}
