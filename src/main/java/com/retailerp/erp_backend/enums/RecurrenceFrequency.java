package com.retailerp.erp_backend.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum RecurrenceFrequency {
    WEEKLY("weekly"),
    MONTHLY("monthly");

    private final String value;

    RecurrenceFrequency(String value) {
        this.value = value;
    }

    @JsonCreator
    public static RecurrenceFrequency fromString(String value) {
        if (value == null) {
            return null;
        }
        for (RecurrenceFrequency candidate : values()) {
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
