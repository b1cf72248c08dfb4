package com.retailerp.erp_backend.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum SaleType {
    INVOICE("invoice", "INV"),
    CREDIT_NOTE("credit_note", "CN");

    private final String value;
    private final String numberPrefix;

    SaleType(String value, String numberPrefix) {
        this.value = value;
        this.numberPrefix = numberPrefix;
    }

    @JsonCreator
    public static SaleType fromString(String value) {
        if (value == null) {
            return null;
        }
        for (SaleType type : values()) {
            if (type.value.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        return null;
    }

    public String getNumberPrefix() {
        return numberPrefix;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
