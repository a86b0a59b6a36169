package com.tokentracker.backend.modules.auth.domain;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AccountStatus {
    ACTIVE("Active");

    private final String label;

    AccountStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
