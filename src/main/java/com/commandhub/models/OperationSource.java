package com.commandhub.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * How an Operation was initiated.
 */
public enum OperationSource {
    API,
    CHAT,
    APPROVAL;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static OperationSource fromWire(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return OperationSource.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
