package com.tokentracker.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreateAccountRequest(
        @NotBlank(message = "username is required")
        @Size(max = 50, message = "username must be at most 50 characters")
        String username,
        @NotBlank(message = "password is required")
        @Size(max = 72, message = "password must be at most 72 characters")
        String password,
        @NotBlank(message = "role is required") String role
) {
}
