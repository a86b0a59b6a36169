package com.tokentracker.backend.modules.token.presentation.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.OffsetDateTime;

import com.tokentracker.backend.modules.token.domain.TokenRecord;

public record TokenResponse(
        Long id,
        LocalDate date,
        LocalDate completionDate,
        String location,
        String subLocation,
        String token,
        String password,
        String clientName,
        String contact,
        String whoWillShip,
        String contactedClient,
        String status,
        String forwarded,
        BigDecimal charges,
        BigDecimal paymentReceived,
        BigDecimal amountDue,
        BigDecimal chargesToExecutive,
        String agentName,
        String executiveName,
        BigDecimal margin,
        String processBy,
        boolean agentPaymentApplied,
        boolean executivePaymentApplied,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public static TokenResponse from(TokenRecord record) {
        return new TokenResponse(
                record.getId(),
                record.getDate(),
                record.getCompletionDate(),
                record.getLocation(),
                record.getSubLocation(),
                record.getToken(),
                record.getPassword(),
                record.getClientName(),
                record.getContact(),
                record.getWhoWillShip(),
                record.getContactedClient(),
                record.getStatus(),
                record.getForwarded(),
                record.getCharges(),
                record.getPaymentReceived(),
                record.getAmountDue(),
                record.getChargesToExecutive(),
                record.getAgentName(),
                record.getExecutiveName(),
                record.getMargin(),
                record.getProcessBy(),
                record.isAgentPaymentApplied(),
                record.isExecutivePaymentApplied(),
                record.getCreatedAt(),
                record.getUpdatedAt()
        );
    }
}
