package com.commandhub.controllers;

import com.commandhub.AppConfig;
import com.commandhub.HubApplication;
import com.commandhub.OperationStore;
import com.commandhub.commands.CommandCatalog;
import com.commandhub.credentials.CredentialResolver;
import com.commandhub.models.OperationStatus;
import io.javalin.Javalin;
import io.javalin.http.Context;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Controller for service metadata: /health, /api/info, /api/status.
 */
public class HealthController implements Controller {

    private final OperationStore store;
    private final CommandCatalog catalog;
    private final CredentialResolver credentials;
    private final AppConfig config;
    private final long startedAt = System.currentTimeMillis();

    public HealthController(OperationStore store, CommandCatalog catalog, CredentialResolver credentials,
                            AppConfig config) {
        this.store = store;
        this.catalog = catalog;
        this.credentials = credentials;
        this.config = config;
    }

    @Override
    public void registerRoutes(Javalin app) {
        app.get("/health", this::health);
        app.get("/api/info", this::info);
        app.get("/api/status", this::status);
    }

    private void health(Context ctx) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "healthy");
        response.put("service", HubApplication.SERVICE_NAME);
        response.put("version", HubApplication.VERSION);
        response.put("timestamp", Instant.now().toString());
        ctx.json(response);
    }

    private void info(Context ctx) {
        Map<String, Object> endpoints = new LinkedHashMap<>();
        endpoints.put("command", "/command");
        endpoints.put("chat", "/chat");
        endpoints.put("operations", "/operations");
        endpoints.put("approve", "/operations/{id}/approve");
        endpoints.put("undo", "/operations/{id}/undo");
        endpoints.put("mcp_call", "/api/mcp-call");
        endpoints.put("health", "/health");
        endpoints.put("status", "/api/status");
        endpoints.put("tools", "/api/tools");
        endpoints.put("mcp", "/mcp");

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("service", HubApplication.SERVICE_NAME);
        response.put("status", "operational");
        response.put("version", HubApplication.VERSION);
        response.put("endpoints", endpoints);
        ctx.json(response);
    }

    private void status(Context ctx) {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (Map.Entry<OperationStatus, Long> entry : store.countByStatus().entrySet()) {
            counts.put(entry.getKey().wireName(), entry.getValue());
        }
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("service", HubApplication.SERVICE_NAME);
        response.put("version", HubApplication.VERSION);
        response.put("uptime_ms", System.currentTimeMillis() - startedAt);
        response.put("operations", counts);
        response.put("operations_total", store.size());
        response.put("durable_store", store.isDurable());
        response.put("catalog_size", catalog.size());
        response.put("default_credential_configured", credentials.hasDefault());
        response.put("shell_token_required", config.isShellTokenRequired());
        ctx.json(response);
    }
}
