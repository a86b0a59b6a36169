package com.tokentracker.backend.global.error;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

/**
 * Failure that is safe to show to the caller: a status, a machine readable code
 * and a message that never contains credential material.
 */
public class ProblemException extends ResponseStatusException {

    private final String code;
    private final String message;

    public ProblemException(HttpStatus status, String code) {
        this(status, code, null);
    }

    public ProblemException(HttpStatus status, String code, String message) {
        super(status, code);
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("ProblemException code must not be blank");
        }
        this.code = code;
        this.message = (message != null && !message.isBlank()) ? message : status.getReasonPhrase();
    }

    public String getCode() {
        return code;
    }

    public String getErrorMessage() {
        return message;
    }
}
