package com.tokentracker.backend.modules.token.presentation.dto;

import java.math.BigDecimal;
import java.time.LocalDate;

import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

/**
 * Create/update payload. {@code amountDue} and {@code margin} are derived server side
 * and therefore not accepted here. Amounts are non-negative so the derived values stay
 * within NUMERIC(10,2).
 */
public record TokenRequest(
        LocalDate date,
        LocalDate completionDate,
        @Size(max = 50) String location,
        @Size(max = 100) String subLocation,
        @NotBlank(message = "token is required") @Size(max = 100) String token,
        @Size(max = 255) String password,
        @Size(max = 255) String clientName,
        @Size(max = 255) String contact,
        @Size(max = 255) String whoWillShip,
        @Size(max = 100) String contactedClient,
        @Size(max = 50) String status,
        @Size(max = 50) String forwarded,
        @PositiveOrZero @Digits(integer = 8, fraction = 2) BigDecimal charges,
        @PositiveOrZero @Digits(integer = 8, fraction = 2) BigDecimal paymentReceived,
        @PositiveOrZero @Digits(integer = 8, fraction = 2) BigDecimal chargesToExecutive,
        @Size(max = 255) String agentName,
        @Size(max = 255) String executiveName,
        @Size(max = 50) String processBy
) {
}
