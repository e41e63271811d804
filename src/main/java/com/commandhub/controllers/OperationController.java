package com.commandhub.controllers;

import com.commandhub.ApprovalGate;
import com.commandhub.AppLogger;
import com.commandhub.ErrorCode;
import com.commandhub.HubException;
import com.commandhub.OperationStore;
import com.commandhub.SubmitOutcome;
import com.commandhub.models.Operation;
import com.commandhub.models.OperationQuery;
import com.commandhub.models.OperationStatus;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.javalin.Javalin;
import io.javalin.http.Context;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Controller for the operation journal: listing, lookup, approval and undo.
 */
public class OperationController implements Controller {

    private final OperationStore store;
    private final ApprovalGate gate;
    private final ObjectMapper objectMapper;
    private final AppLogger.Channel log = AppLogger.channel("OperationController");

    public OperationController(OperationStore store, ApprovalGate gate, ObjectMapper objectMapper) {
        this.store = store;
        this.gate = gate;
        this.objectMapper = objectMapper;
    }

    @Override
    public void registerRoutes(Javalin app) {
        app.get("/operations", this::listOperations);
        app.get("/operations/{id}", this::getOperation);
        app.post("/operations/{id}/approve", this::approveOperation);
        app.post("/operations/{id}/undo", this::undoOperation);
    }

    private void listOperations(Context ctx) {
        try {
            OperationQuery query = new OperationQuery()
                .limit(parseLimit(ctx.queryParam("limit")))
                .status(parseStatus(ctx.queryParam("status")))
                .since(parseSince(ctx.queryParam("since")))
                .actor(ctx.queryParam("actor"))
                .sessionId(ctx.queryParam("session_id"))
                .command(ctx.queryParam("command"));
            List<Operation> operations = store.list(query);
            Map<String, Object> response = new LinkedHashMap<>();
            response.put("ok", true);
            response.put("operations", operations);
            response.put("count", operations.size());
            ctx.json(response);
        } catch (HubException e) {
            Controller.fail(ctx, e);
        } catch (Exception e) {
            log.error("Error listing operations: " + e.getMessage(), e);
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private void getOperation(Context ctx) {
        try {
            long id = requireId(ctx);
            Map<String, Object> response = new LinkedHashMap<>();
            response.put("ok", true);
            response.put("operation", store.get(id));
            ctx.json(response);
        } catch (HubException e) {
            Controller.fail(ctx, e);
        } catch (Exception e) {
            log.error("Error getting operation: " + e.getMessage(), e);
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private void approveOperation(Context ctx) {
        try {
            long id = requireId(ctx);
            ObjectNode body = Controller.readObject(ctx, objectMapper);
            SubmitOutcome outcome = gate.approve(id, Controller.actor(ctx, body), Controller.callerToken(ctx, body));
            GateResponses.respond(ctx, outcome, null);
        } catch (HubException e) {
            Controller.fail(ctx, e);
        } catch (Exception e) {
            log.error("Error approving operation: " + e.getMessage(), e);
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private void undoOperation(Context ctx) {
        try {
            long id = requireId(ctx);
            ObjectNode body = Controller.readObject(ctx, objectMapper);
            SubmitOutcome outcome = gate.undo(id, Controller.actor(ctx, body), Controller.callerToken(ctx, body),
                Controller.text(body, "session_id"), Controller.flag(body, "approved"));
            GateResponses.respond(ctx, outcome, null);
        } catch (HubException e) {
            Controller.fail(ctx, e);
        } catch (Exception e) {
            log.error("Error undoing operation: " + e.getMessage(), e);
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private static long requireId(Context ctx) {
        Long id = Controller.operationId(ctx.pathParam("id"));
        if (id == null) {
            throw new HubException(ErrorCode.VALIDATION_ERROR, "operation id is required");
        }
        return id;
    }

    static int parseLimit(String raw) {
        if (raw == null || raw.isBlank()) {
            return OperationQuery.DEFAULT_LIMIT;
        }
        try {
            return OperationQuery.clampLimit(Integer.parseInt(raw.trim()));
        } catch (NumberFormatException e) {
            throw new HubException(ErrorCode.VALIDATION_ERROR, "limit must be an integer: " + raw);
        }
    }

    static OperationStatus parseStatus(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return OperationStatus.fromWire(raw.trim());
        } catch (IllegalArgumentException e) {
            throw new HubException(ErrorCode.VALIDATION_ERROR, "unknown status: " + raw);
        }
    }

    /**
     * Epoch milliseconds or an ISO-8601 instant.
     */
    static Long parseSince(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String value = raw.trim();
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException ignored) {
            // not epoch millis; try ISO-8601
        }
        try {
            return Instant.parse(value).toEpochMilli();
        } catch (DateTimeParseException e) {
            throw new HubException(ErrorCode.VALIDATION_ERROR, "since must be epoch milliseconds or ISO-8601: " + raw);
        }
    }
}
