package com.checkmate.pos_sync.payment;

import java.util.Locale;

public enum PaymentMethod {
    CASH,
    CHECK;

    /**
     * @throws IllegalArgumentException unless the value is "cash" or "check", in any case
     */
    public static PaymentMethod parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Payment type is required");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Payment type must be cash or check: " + value);
        }
    }
}
