package com.commandhub;

import com.commandhub.models.Operation;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Result of a gate call: either a completed Operation with the adapter
 * result, or an Operation parked in {@code pending_approval}.
 */
public final class SubmitOutcome {

    private final Operation operation;
    private final boolean pending;
    private final JsonNode result;

    private SubmitOutcome(Operation operation, boolean pending, JsonNode result) {
        this.operation = operation;
        this.pending = pending;
        this.result = result;
    }

    static SubmitOutcome pending(Operation operation) {
        return new SubmitOutcome(operation, true, null);
    }

    static SubmitOutcome completed(Operation operation, JsonNode result) {
        return new SubmitOutcome(operation, false, result);
    }

    public Operation getOperation() {
        return operation;
    }

    public boolean isPending() {
        return pending;
    }

    public JsonNode getResult() {
        return result;
    }

    public String getMessage() {
        if (pending) {
            return "Command " + operation.getCommand() + " requires approval. Approve operation "
                + operation.getId() + " to run it.";
        }
        return "Command " + operation.getCommand() + " completed";
    }
}
