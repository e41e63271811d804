package com.commandhub.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Lifecycle of an Operation.
 *
 * <pre>
 * queued ──► pending_approval ──► running ──► completed
 *    │                              ▲    └──► failed
 *    └──────────────────────────────┘
 * </pre>
 *
 * A queued row may also go straight to failed, but only when a restart finds
 * it half-created. Terminal states have no outgoing transitions.
 */
public enum OperationStatus {
    QUEUED,
    PENDING_APPROVAL,
    RUNNING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public boolean canTransitionTo(OperationStatus next) {
        return successors().contains(next);
    }

    private Set<OperationStatus> successors() {
        switch (this) {
            case QUEUED:
                return EnumSet.of(PENDING_APPROVAL, RUNNING, FAILED);
            case PENDING_APPROVAL:
                return EnumSet.of(RUNNING);
            case RUNNING:
                return EnumSet.of(COMPLETED, FAILED);
            default:
                return EnumSet.noneOf(OperationStatus.class);
        }
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static OperationStatus fromWire(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return OperationStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown operation status: " + value);
        }
    }
}
