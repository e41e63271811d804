package com.commandhub.models;

/**
 * Filter for recency listings. Null fields do not filter.
 */
public class OperationQuery {

    public static final int DEFAULT_LIMIT = 50;
    public static final int MAX_LIMIT = 200;

    private int limit = DEFAULT_LIMIT;
    private OperationStatus status;
    private Long since;
    private String actor;
    private String sessionId;
    private String command;

    public static OperationQuery latest(int limit) {
        return new OperationQuery().limit(limit);
    }

    public static int clampLimit(int limit) {
        return Math.max(1, Math.min(limit, MAX_LIMIT));
    }

    public OperationQuery limit(int limit) {
        this.limit = clampLimit(limit);
        return this;
    }

    public OperationQuery status(OperationStatus status) {
        this.status = status;
        return this;
    }

    public OperationQuery since(Long since) {
        this.since = since;
        return this;
    }

    public OperationQuery actor(String actor) {
        this.actor = blankToNull(actor);
        return this;
    }

    public OperationQuery sessionId(String sessionId) {
        this.sessionId = blankToNull(sessionId);
        return this;
    }

    public OperationQuery command(String command) {
        this.command = blankToNull(command);
        return this;
    }

    public boolean matches(Operation op) {
        if (status != null && op.getStatus() != status) return false;
        if (since != null && op.getCreatedAt() < since) return false;
        if (actor != null && !actor.equals(op.getActor())) return false;
        if (sessionId != null && !sessionId.equals(op.getSessionId())) return false;
        return command == null || command.equals(op.getCommand());
    }

    public int getLimit() {
        return limit;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
