package com.tokentracker.backend.modules.token.infrastructure.persistence;

import java.time.LocalDate;

/**
 * Optional list filters. Blank values and the literal {@code All} disable a filter; the
 * date range only applies when both ends are present.
 */
public record TokenSearchCondition(
        String location,
        String status,
        String keyword,
        String agentName,
        String executiveName,
        LocalDate fromDate,
        LocalDate toDate
) {

    public static final String ALL = "All";

    public static TokenSearchCondition none() {
        return new TokenSearchCondition(null, null, null, null, null, null, null);
    }
}
