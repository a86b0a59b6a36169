package com.tokentracker.backend.global.error;

import org.springframework.http.HttpStatus;

/**
 * Error body shared by every endpoint. {@code error} is the human readable message
 * the web client shows.
 */
public record ProblemResponse(String type, String title, int status, String error, String instance, String code) {

    private static final String DEFAULT_TYPE_PREFIX = "urn:problem:tokentracker:";

    public static ProblemResponse of(HttpStatus httpStatus, String code, String error, String instance) {
        String safeCode = (code != null && !code.isBlank()) ? code : httpStatus.name().toLowerCase();
        String normalized = safeCode.toLowerCase().replaceAll("[^a-z0-9\\-_.]+", "-");
        String safeError = (error != null && !error.isBlank()) ? error : httpStatus.getReasonPhrase();
        return new ProblemResponse(
                DEFAULT_TYPE_PREFIX + normalized,
                httpStatus.getReasonPhrase(),
                httpStatus.value(),
                safeError,
                instance,
                safeCode
        );
    }
}
