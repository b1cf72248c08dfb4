package com.retailerp.erp_backend.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ExpenseType {
    STANDARD("standard"),
    SALES("sales");

    private final String value;

    ExpenseType(String value) {
        this.value = value;
    }

    @JsonCreator
    public static ExpenseType fromString(String value) {
        if (value == null) {
            return null;
        }
        for (ExpenseType candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value) || candidate.name().equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        return null;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
