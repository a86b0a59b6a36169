package com.tokentracker.backend.modules.token.domain;

import java.util.Arrays;
import java.util.Optional;

public enum BulkOperation {
    /** Marks the agent as paid: payment received becomes the full charge. */
    APPLY_AGENT_PAYMENT("apply_agent_payment"),
    /** Marks the executive as paid: executive charge becomes the full charge. */
    APPLY_EXECUTIVE_PAYMENT("apply_executive_payment"),
    MARK_COMPLETED("mark_completed");

    private final String wireName;

    BulkOperation(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    public static Optional<BulkOperation> fromWireName(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(op -> op.wireName.equals(raw.trim()))
                .findFirst();
    }
}
