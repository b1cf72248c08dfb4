package com.retailerp.erp_backend.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum PaymentMethod {
    CASH,
    MPESA,
    BANK,
    CARD;

    @JsonCreator
    public static PaymentMethod fromString(String value) {
        if (value == null) {
            return null;
        }
        try {
            // Accept both uppercase and lowercase
            return PaymentMethod.valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    public boolean requiresReference() {
        return this != CASH;
    }

    @JsonValue
    public String toValue() {
        return this.name().toLowerCase();
    }
}
