package com.commandhub.controllers;

import com.commandhub.AppLogger;
import com.commandhub.DirectCallReceipts;
import com.commandhub.ErrorCode;
import com.commandhub.HubApplication;
import com.commandhub.HubException;
import com.commandhub.commands.CommandCatalog;
import com.commandhub.commands.CommandEntry;
import com.commandhub.credentials.Credential;
import com.commandhub.credentials.CredentialResolver;
import com.commandhub.tools.BoundedToolInvoker;
import com.commandhub.tools.ToolSchema;
import com.commandhub.tools.ToolSchemaRegistry;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.javalin.Javalin;
import io.javalin.http.Context;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Direct tool invocation: JSON-RPC 2.0 at /mcp plus the REST conveniences
 * /api/tools and /api/mcp-call. These calls do not pass the approval gate
 * and create no Operation; each one leaves a receipt instead.
 */
public class McpController implements Controller {

    static final String PROTOCOL_VERSION = "2024-11-05";

    static final int INVALID_REQUEST = -32600;
    static final int METHOD_NOT_FOUND = -32601;
    static final int INVALID_PARAMS = -32602;
    static final int INTERNAL_ERROR = -32603;
    static final int PARSE_ERROR = -32700;

    private final CommandCatalog catalog;
    private final ToolSchemaRegistry schemas;
    private final CredentialResolver credentials;
    private final BoundedToolInvoker invoker;
    private final DirectCallReceipts receipts;
    private final ObjectMapper objectMapper;
    private final AppLogger.Channel log = AppLogger.channel("McpController");

    public McpController(CommandCatalog catalog, CredentialResolver credentials, BoundedToolInvoker invoker,
                         DirectCallReceipts receipts, ObjectMapper objectMapper) {
        this.catalog = catalog;
        this.schemas = catalog.toolSchemas();
        this.credentials = credentials;
        this.invoker = invoker;
        this.receipts = receipts;
        this.objectMapper = objectMapper;
    }

    @Override
    public void registerRoutes(Javalin app) {
        app.post("/mcp", this::handleRpc);
        app.get("/api/tools", this::listTools);
        app.post("/api/mcp-call", this::directCall);
    }

    private void handleRpc(Context ctx) {
        JsonNode request;
        try {
            request = objectMapper.readTree(ctx.body());
        } catch (JsonProcessingException e) {
            ctx.status(400).json(rpcError(null, PARSE_ERROR, "Parse error: " + e.getOriginalMessage()));
            return;
        }
        JsonNode id = request != null ? request.get("id") : null;
        if (request == null || !request.isObject() || !"2.0".equals(request.path("jsonrpc").asText(null))) {
            ctx.status(400).json(rpcError(id, INVALID_REQUEST, "Invalid Request: jsonrpc must be \"2.0\""));
            return;
        }
        String method = request.path("method").asText("");
        try {
            switch (method) {
                case "initialize":
                    ctx.json(rpcResult(id, initializeResult()));
                    break;
                case "tools/list":
                    ObjectNode listResult = objectMapper.createObjectNode();
                    listResult.set("tools", toolDescriptors());
                    ctx.json(rpcResult(id, listResult));
                    break;
                case "tools/call":
                    handleToolCall(ctx, id, request.path("params"));
                    break;
                default:
                    ctx.status(400).json(rpcError(id, METHOD_NOT_FOUND, "Method not found: " + method));
            }
        } catch (Exception e) {
            log.error("JSON-RPC endpoint error: " + e.getMessage(), e);
            ctx.status(500).json(rpcError(id, INTERNAL_ERROR, "Internal error: " + Controller.errorBody(e).get("error")));
        }
    }

    private void handleToolCall(Context ctx, JsonNode id, JsonNode params) {
        String name = params.path("name").asText("").trim();
        if (name.isEmpty()) {
            ctx.status(400).json(rpcError(id, INVALID_PARAMS, "Invalid params: name is required"));
            return;
        }
        JsonNode args = params.get("arguments");
        String invalid = validate(name, args);
        if (invalid != null) {
            ctx.status(400).json(rpcError(id, INVALID_PARAMS, "Invalid params: " + invalid));
            return;
        }
        try {
            JsonNode result = call(name, args, Controller.callerToken(ctx, null));
            ObjectNode content = objectMapper.createObjectNode();
            ArrayNode parts = content.putArray("content");
            ObjectNode text = parts.addObject();
            text.put("type", "text");
            text.put("text", objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(result));
            ctx.json(rpcResult(id, content));
        } catch (HubException e) {
            boolean clientError = e.getCode().getHttpStatus() < 500;
            ctx.status(clientError ? 400 : 500).json(rpcError(id, clientError ? INVALID_PARAMS : INTERNAL_ERROR,
                (clientError ? "Invalid params: " : "Tool execution error: ") + e.getMessage()));
        } catch (JsonProcessingException e) {
            ctx.status(500).json(rpcError(id, INTERNAL_ERROR, "Tool execution error: " + e.getOriginalMessage()));
        }
    }

    private void listTools(Context ctx) {
        ArrayNode tools = toolDescriptors();
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("tools", tools);
        response.put("count", tools.size());
        ctx.json(response);
    }

    private void directCall(Context ctx) {
        try {
            ObjectNode body = Controller.readObject(ctx, objectMapper);
            String name = Controller.text(body, "name");
            if (name == null) {
                throw new HubException(ErrorCode.VALIDATION_ERROR, "name is required");
            }
            JsonNode args = body.get("arguments");
            String invalid = validate(name, args);
            if (invalid != null) {
                throw new HubException(ErrorCode.VALIDATION_ERROR, invalid);
            }
            JsonNode result = call(name, args, Controller.callerToken(ctx, body));
            Map<String, Object> response = new LinkedHashMap<>();
            response.put("ok", true);
            response.put("name", name);
            response.put("args", args != null && args.isObject() ? args : objectMapper.createObjectNode());
            response.put("result", result);
            ctx.json(response);
        } catch (HubException e) {
            Controller.fail(ctx, e);
        } catch (Exception e) {
            log.error("Error handling direct tool call: " + e.getMessage(), e);
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    /**
     * @return null when the call is acceptable, else a short reason
     */
    private String validate(String tool, JsonNode args) {
        ToolSchema schema = schemas.getSchema(tool);
        if (schema == null) {
            return "unknown tool: " + tool;
        }
        return schema.validate(args);
    }

    private JsonNode call(String tool, JsonNode args, String callerToken) {
        CommandEntry entry = catalog.entryForTool(tool)
            .orElseThrow(() -> new HubException(ErrorCode.UNKNOWN_COMMAND, "unknown tool: " + tool));
        @SuppressWarnings("unchecked")
        Map<String, Object> arguments = args != null && args.isObject()
            ? objectMapper.convertValue(args, LinkedHashMap.class)
            : new LinkedHashMap<>();
        Credential credential = credentials.resolve(callerToken, entry.isRequiresProjectId());
        try {
            JsonNode result = invoker.invoke(tool, arguments, credential);
            receipts.record(tool, arguments, credential, true, null);
            return result;
        } catch (HubException e) {
            receipts.record(tool, arguments, credential, false, e.getMessage());
            throw e;
        }
    }

    private ObjectNode initializeResult() {
        ObjectNode result = objectMapper.createObjectNode();
        result.put("protocolVersion", PROTOCOL_VERSION);
        result.putObject("capabilities").putObject("tools");
        ObjectNode serverInfo = result.putObject("serverInfo");
        serverInfo.put("name", HubApplication.SERVICE_NAME);
        serverInfo.put("version", HubApplication.VERSION);
        return result;
    }

    private ArrayNode toolDescriptors() {
        ArrayNode tools = objectMapper.createArrayNode();
        for (ToolSchema schema : schemas.all()) {
            tools.add(schema.toDescriptor(objectMapper));
        }
        return tools;
    }

    private ObjectNode rpcResult(JsonNode id, JsonNode result) {
        ObjectNode response = objectMapper.createObjectNode();
        response.put("jsonrpc", "2.0");
        response.set("id", id);
        response.set("result", result);
        return response;
    }

    private ObjectNode rpcError(JsonNode id, int code, String message) {
        ObjectNode response = objectMapper.createObjectNode();
        response.put("jsonrpc", "2.0");
        response.set("id", id);
        ObjectNode error = response.putObject("error");
        error.put("code", code);
        error.put("message", message);
        return response;
    }
}
