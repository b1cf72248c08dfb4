package com.retailerp.erp_backend.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum CustomerStatus {
    ACTIVE("active"),
    INACTIVE("inactive"),
    SUSPENDED("suspended");

    private final String value;

    CustomerStatus(String value) {
        this.value = value;
    }

    @JsonCreator
    public static CustomerStatus fromString(String value) {
        if (value == null) {
            return null;
        }
        for (CustomerStatus candidate : values()) {
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
