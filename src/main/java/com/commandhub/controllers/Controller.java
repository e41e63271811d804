package com.commandhub.controllers;

import com.commandhub.ErrorCode;
import com.commandhub.HubException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.javalin.Javalin;
import io.javalin.http.Context;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Interface for API controllers.
 * Each controller registers its routes with the Javalin app.
 */
public interface Controller {

    /**
     * Register this controller's routes with the Javalin app.
     */
    void registerRoutes(Javalin app);

    /**
     * Safe error body helper that handles null exception messages.
     * Use this instead of Map.of("error", e.getMessage()) to prevent NPE.
     */
    static Map<String, Object> errorBody(Exception e) {
        String m = e.getMessage();
        if (m == null || m.isBlank()) {
            m = e.getClass().getSimpleName();
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("ok", false);
        body.put("error", m);
        if (e instanceof HubException) {
            HubException he = (HubException) e;
            body.put("code", he.getCode().name());
            if (he.getOperationId() != null) {
                body.put("operation_id", he.getOperationId());
            }
            if (he.getCurrentStatus() != null) {
                body.put(he.getCode() == ErrorCode.NOT_PENDING_APPROVAL ? "current_status" : "status",
                    he.getCurrentStatus().wireName());
            }
        }
        return body;
    }

    static void fail(Context ctx, HubException e) {
        ctx.status(e.getCode().getHttpStatus()).json(errorBody(e));
    }

    /**
     * Parses the request body as a JSON object. An empty body reads as {}.
     */
    static ObjectNode readObject(Context ctx, ObjectMapper mapper) {
        String raw = ctx.body();
        if (raw == null || raw.isBlank()) {
            return mapper.createObjectNode();
        }
        JsonNode node;
        try {
            node = mapper.readTree(raw);
        } catch (JsonProcessingException e) {
            throw new HubException(ErrorCode.VALIDATION_ERROR, "Request body is not valid JSON");
        }
        if (node == null || !node.isObject()) {
            throw new HubException(ErrorCode.VALIDATION_ERROR, "Request body must be a JSON object");
        }
        return (ObjectNode) node;
    }

    /**
     * Text field; numbers are accepted and rendered as text. Null when absent.
     */
    static String text(JsonNode body, String field) {
        JsonNode node = body.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isTextual() && !node.isNumber()) {
            throw new HubException(ErrorCode.VALIDATION_ERROR, field + " must be a string");
        }
        String value = node.asText().trim();
        return value.isEmpty() ? null : value;
    }

    static boolean flag(JsonNode body, String field) {
        JsonNode node = body.get(field);
        if (node == null || node.isNull()) {
            return false;
        }
        if (!node.isBoolean()) {
            throw new HubException(ErrorCode.VALIDATION_ERROR, field + " must be a boolean");
        }
        return node.booleanValue();
    }

    static Long operationId(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new HubException(ErrorCode.VALIDATION_ERROR, "operation id must be an integer: " + raw);
        }
    }

    /**
     * Actor from {@code X-Actor}, else the body's {@code actor} field.
     */
    static String actor(Context ctx, JsonNode body) {
        String header = ctx.header("X-Actor");
        if (header != null && !header.isBlank()) {
            return header.trim();
        }
        String fromBody = body != null ? text(body, "actor") : null;
        return fromBody != null ? fromBody : "anonymous";
    }

    /**
     * Caller credential from {@code X-Api-Key}, else the body's {@code api_key} field.
     */
    static String callerToken(Context ctx, JsonNode body) {
        String header = ctx.header("X-Api-Key");
        if (header != null && !header.isBlank()) {
            return header.trim();
        }
        return body != null ? text(body, "api_key") : null;
    }
}
