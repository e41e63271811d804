package com.commandhub.controllers;

import com.commandhub.ApprovalGate;
import com.commandhub.AppLogger;
import com.commandhub.ErrorCode;
import com.commandhub.HubException;
import com.commandhub.SubmitOutcome;
import com.commandhub.SubmitRequest;
import com.commandhub.commands.CommandCatalog;
import com.commandhub.models.OperationSource;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.javalin.Javalin;
import io.javalin.http.Context;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Controller for direct command submission.
 * Handles /command and its /api/command alias.
 */
public class CommandController implements Controller {

    private final ApprovalGate gate;
    private final CommandCatalog catalog;
    private final ObjectMapper objectMapper;
    private final AppLogger.Channel log = AppLogger.channel("CommandController");

    public CommandController(ApprovalGate gate, CommandCatalog catalog, ObjectMapper objectMapper) {
        this.gate = gate;
        this.catalog = catalog;
        this.objectMapper = objectMapper;
    }

    @Override
    public void registerRoutes(Javalin app) {
        app.post("/command", this::submitCommand);
        app.post("/api/command", this::submitCommand);
    }

    private void submitCommand(Context ctx) {
        try {
            ObjectNode body = Controller.readObject(ctx, objectMapper);
            SubmitRequest request = parseRequest(ctx, body);
            SubmitOutcome outcome = gate.submit(request);
            GateResponses.respond(ctx, outcome, null);
        } catch (HubException e) {
            if (e.getCode() == ErrorCode.UNKNOWN_COMMAND) {
                Map<String, Object> response = Controller.errorBody(e);
                response.put("supported_commands", catalog.commandNames());
                ctx.status(e.getCode().getHttpStatus()).json(response);
                return;
            }
            Controller.fail(ctx, e);
        } catch (Exception e) {
            log.error("Error handling command: " + e.getMessage(), e);
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private SubmitRequest parseRequest(Context ctx, ObjectNode body) {
        Long existingId = parseOperationId(body.get("operation_id"));
        String command = Controller.text(body, "command");
        if (command == null && existingId == null) {
            throw new HubException(ErrorCode.VALIDATION_ERROR, "command is required");
        }
        String projectId = Controller.text(body, "project_id");
        if (projectId == null) {
            projectId = Controller.text(body, "projectId");
        }
        boolean approved = Controller.flag(body, "approved");
        return SubmitRequest.builder(command)
            .arguments(arguments(body))
            .projectId(projectId)
            .callerToken(Controller.callerToken(ctx, body))
            .source(approved && existingId == null ? OperationSource.APPROVAL : OperationSource.API)
            .sessionId(Controller.text(body, "session_id"))
            .actor(Controller.actor(ctx, body))
            .forceApproval(Controller.flag(body, "require_approval"))
            .existingOperationId(existingId)
            .approved(approved)
            .build();
    }

    private Map<String, Object> arguments(JsonNode body) {
        JsonNode args = body.get("arguments");
        if (args == null || args.isNull()) {
            return new LinkedHashMap<>();
        }
        if (!args.isObject()) {
            throw new HubException(ErrorCode.VALIDATION_ERROR, "arguments must be a JSON object");
        }
        @SuppressWarnings("unchecked")
        Map<String, Object> converted = objectMapper.convertValue(args, LinkedHashMap.class);
        return converted;
    }

    private static Long parseOperationId(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isIntegralNumber()) {
            return node.longValue();
        }
        if (node.isTextual()) {
            return Controller.operationId(node.asText());
        }
        throw new HubException(ErrorCode.VALIDATION_ERROR, "operation_id must be an integer");
    }
}
