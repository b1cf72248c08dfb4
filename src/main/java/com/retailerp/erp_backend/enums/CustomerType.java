package com.retailerp.erp_backend.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum CustomerType {
    INDIVIDUAL("individual"),
    BUSINESS("business"),
    WALK_IN("walk-in");

    private final String value;

    CustomerType(String value) {
        this.value = value;
    }

    @JsonCreator
    public static CustomerType fromString(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().replace('_', '-');
        for (CustomerType type : values()) {
            if (type.value.equalsIgnoreCase(normalized)) {
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
