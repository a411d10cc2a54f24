package com.counselbooking.scheduling.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ConflictType {
    APPOINTMENT("appointment"),
    BLOCKED("blocked"),
    OUTSIDE_HOURS("outside_hours");

    private final String value;

    ConflictType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
