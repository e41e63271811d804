package com.commandhub.controllers;

import com.commandhub.SubmitOutcome;
import com.commandhub.models.Operation;
import io.javalin.http.Context;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Response shapes shared by every endpoint that goes through the approval gate.
 */
final class GateResponses {

    static final int PENDING_STATUS = 202;

    private GateResponses() {
    }

    static Map<String, Object> body(SubmitOutcome outcome) {
        Operation op = outcome.getOperation();
        Map<String, Object> body = new LinkedHashMap<>();
        if (outcome.isPending()) {
            body.put("ok", false);
            body.put("pending_approval", true);
            body.put("operation_id", op.getId());
            body.put("command", op.getCommand());
            body.put("tool", op.getTool());
            body.put("args", op.getArguments());
            body.put("message", outcome.getMessage());
        } else {
            body.put("ok", true);
            body.put("operation_id", op.getId());
            body.put("command", op.getCommand());
            body.put("tool", op.getTool());
            body.put("args", op.getArguments());
            body.put("result", outcome.getResult());
            body.put("status", op.getStatus().wireName());
            body.put("result_excerpt", op.getResultExcerpt());
        }
        if (op.getUndoOf() != null) {
            body.put("undo_of", op.getUndoOf());
        }
        return body;
    }

    static void respond(Context ctx, SubmitOutcome outcome, Map<String, Object> extra) {
        Map<String, Object> body = body(outcome);
        if (extra != null) {
            body.putAll(extra);
        }
        ctx.status(outcome.isPending() ? PENDING_STATUS : 200).json(body);
    }
}
