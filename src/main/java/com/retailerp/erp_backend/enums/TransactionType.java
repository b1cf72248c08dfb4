package com.retailerp.erp_backend.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum TransactionType {
    STOCK_IN("stock_in"),
    STOCK_OUT("stock_out"),
    TRANSFER("transfer"),
    ADJUSTMENT("adjustment");

    private final String value;

    TransactionType(String value) {
        this.value = value;
    }

    @JsonCreator
    public static TransactionType fromString(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase();
        // older clients send the short forms
        if (normalized.equals("in")) {
            return STOCK_IN;
        }
        if (normalized.equals("out")) {
            return STOCK_OUT;
        }
        for (TransactionType type : values()) {
            if (type.value.equals(normalized)) {
                return type;
            }
        }
        return null;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
