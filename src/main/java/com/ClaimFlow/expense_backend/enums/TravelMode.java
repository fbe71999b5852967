package com.ClaimFlow.expense_backend.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum TravelMode {
    BUS,
    TRAIN,
    CAB,
    FLIGHT_ECONOMY,
    FLIGHT_BUSINESS,
    OWN_VEHICLE;

    @JsonCreator
    public static TravelMode fromString(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.trim().toUpperCase().replace(' ', '_').replace('-', '_');
        try {
            return TravelMode.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    @JsonValue
    public String getValue() {
        return this.name().toLowerCase();
    }
}
