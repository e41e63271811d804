package com.commandhub.controllers;

import com.commandhub.ApprovalGate;
import com.commandhub.AppLogger;
import com.commandhub.ChatSessionMemory;
import com.commandhub.ErrorCode;
import com.commandhub.HubException;
import com.commandhub.SubmitOutcome;
import com.commandhub.SubmitRequest;
import com.commandhub.commands.CommandCatalog;
import com.commandhub.commands.IntentMatch;
import com.commandhub.commands.IntentParser;
import com.commandhub.models.Operation;
import com.commandhub.models.OperationSource;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.javalin.Javalin;
import io.javalin.http.Context;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Controller for the chat endpoint: free text in, gated command out.
 */
public class ChatController implements Controller {

    private final ApprovalGate gate;
    private final IntentParser intentParser;
    private final ChatSessionMemory sessions;
    private final CommandCatalog catalog;
    private final ObjectMapper objectMapper;
    private final AppLogger.Channel log = AppLogger.channel("ChatController");

    public ChatController(ApprovalGate gate, IntentParser intentParser, ChatSessionMemory sessions,
                          CommandCatalog catalog, ObjectMapper objectMapper) {
        this.gate = gate;
        this.intentParser = intentParser;
        this.sessions = sessions;
        this.catalog = catalog;
        this.objectMapper = objectMapper;
    }

    @Override
    public void registerRoutes(Javalin app) {
        app.post("/chat", this::chat);
    }

    private void chat(Context ctx) {
        IntentMatch match = null;
        String sessionId = null;
        try {
            ObjectNode body = Controller.readObject(ctx, objectMapper);
            String message = Controller.text(body, "message");
            if (message == null) {
                throw new HubException(ErrorCode.VALIDATION_ERROR, "message is required");
            }
            sessionId = Controller.text(body, "session_id");
            if (sessionId == null) {
                sessionId = "chat_" + UUID.randomUUID().toString().replace("-", "").substring(0, 12);
            }
            String hint = Controller.text(body, "project_id");
            if (hint == null) {
                hint = sessions.lastProject(sessionId).orElse(null);
            }

            match = intentParser.parse(message, hint);
            if (!match.isMatched()) {
                Map<String, Object> response = new LinkedHashMap<>();
                response.put("ok", false);
                response.put("assistant_message", "I couldn't match that to a command. Try a slash command such as /"
                    + String.join(", /", catalog.commandNames()) + ".");
                response.put("confidence", 0.0);
                response.put("supported_commands", catalog.commandNames());
                response.put("session_id", sessionId);
                ctx.json(response);
                return;
            }
            sessions.remember(sessionId, match.getProjectId());

            SubmitRequest request = SubmitRequest.builder(match.getCommand())
                .projectId(match.getProjectId())
                .callerToken(Controller.callerToken(ctx, body))
                .source(OperationSource.CHAT)
                .sessionId(sessionId)
                .actor(Controller.actor(ctx, body))
                .approved(Controller.flag(body, "approved"))
                .build();
            SubmitOutcome outcome = gate.submit(request);

            Map<String, Object> extra = new LinkedHashMap<>();
            extra.put("assistant_message", assistantMessage(outcome));
            extra.put("confidence", match.getConfidence());
            extra.put("session_id", sessionId);
            GateResponses.respond(ctx, outcome, extra);
        } catch (HubException e) {
            Map<String, Object> response = Controller.errorBody(e);
            response.put("assistant_message", "That didn't work: " + response.get("error"));
            response.put("confidence", match != null ? match.getConfidence() : 0.0);
            if (sessionId != null) {
                response.put("session_id", sessionId);
            }
            ctx.status(e.getCode().getHttpStatus()).json(response);
        } catch (Exception e) {
            log.error("Error handling chat message: " + e.getMessage(), e);
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private String assistantMessage(SubmitOutcome outcome) {
        Operation op = outcome.getOperation();
        if (outcome.isPending()) {
            return "This will run " + op.getTool() + " and needs approval first. Approve operation "
                + op.getId() + " to continue.";
        }
        String excerpt = op.getResultExcerpt();
        return "Done: " + op.getCommand() + " completed." + (excerpt != null ? " " + excerpt : "");
    }
}
