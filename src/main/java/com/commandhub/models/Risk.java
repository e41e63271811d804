package com.commandhub.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Risk {
    LOW,
    HIGH;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Risk fromWire(String value) {
        if (value == null || value.isBlank()) {
            return LOW;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        if (!"LOW".equals(normalized) && !"HIGH".equals(normalized)) {
            throw new IllegalArgumentException("Unsupported risk level: " + value);
        }
        return Risk.valueOf(normalized);
    }
}
