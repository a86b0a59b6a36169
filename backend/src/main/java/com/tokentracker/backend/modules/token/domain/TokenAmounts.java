package com.tokentracker.backend.modules.token.domain;

import java.math.BigDecimal;
import java.math.RoundingMode;

public final class TokenAmounts {

    private static final int SCALE = 2;

    private TokenAmounts() {
    }

    public static BigDecimal orZero(BigDecimal value) {
        return value == null ? BigDecimal.ZERO.setScale(SCALE) : value.setScale(SCALE, RoundingMode.HALF_UP);
    }

    public static BigDecimal amountDue(BigDecimal charges, BigDecimal paymentReceived) {
        return orZero(charges).subtract(orZero(paymentReceived));
    }

    public static BigDecimal margin(BigDecimal charges, BigDecimal chargesToExecutive) {
        return orZero(charges).subtract(orZero(chargesToExecutive));
    }
}
