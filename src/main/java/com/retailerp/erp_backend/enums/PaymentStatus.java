package com.retailerp.erp_backend.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.math.BigDecimal;

public enum PaymentStatus {
    UNPAID,
    PARTIAL,
    PAID;

    /**
     * Status is never stored independently of the amounts: it is recomputed from them after every change.
     */
    public static PaymentStatus derive(BigDecimal amountPaid, BigDecimal amountDue) {
        if (amountDue.compareTo(BigDecimal.ZERO) <= 0) {
            return PAID;
        }
        if (amountPaid.compareTo(BigDecimal.ZERO) > 0) {
            return PARTIAL;
        }
        return UNPAID;
    }

    @JsonCreator
    public static PaymentStatus fromString(String value) {
        if (value == null) {
            return null;
        }
        try {
            return PaymentStatus.valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    @JsonValue
    public String toValue() {
        return this.name().toLowerCase();
    }
}
