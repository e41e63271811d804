package com.commandhub.controllers;

import com.commandhub.AppConfig;
import com.commandhub.HubApplication;
import com.commandhub.models.OperationStatus;
import com.commandhub.tools.StubToolAdapter;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class HubHttpTest {

    @TempDir
    Path dataDir;

    private final ObjectMapper mapper = new ObjectMapper();
    private final HttpClient http = HttpClient.newHttpClient();
    private HubApplication hub;
    private StubToolAdapter adapter;
    private String baseUrl;

    private void start(StubToolAdapter toolAdapter, String shellToken) throws IOException {
        adapter = toolAdapter;
        AppConfig config = new AppConfig.Builder()
            .port(0)
            .dataDir(dataDir)
            .toolServerApiKey("default-key")
            .shellToken(shellToken)
            .build();
        hub = HubApplication.create(config, adapter, Clock.systemUTC(), mapper);
        baseUrl = "http://localhost:" + hub.start().port();
    }

    private void start() throws IOException {
        start(StubToolAdapter.echoingCredential(), null);
    }

    @AfterEach
    void tearDown() {
        if (hub != null) {
            hub.close();
        }
    }

    private HttpResponse<String> post(String path, String json, String... headers) throws Exception {
        HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(baseUrl + path))
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(json));
        if (headers.length > 0) {
            builder.headers(headers);
        }
        return http.send(builder.build(), HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> get(String path) throws Exception {
        return http.send(HttpRequest.newBuilder(URI.create(baseUrl + path)).GET().build(),
            HttpResponse.BodyHandlers.ofString());
    }

    private JsonNode json(HttpResponse<String> response) throws IOException {
        return mapper.readTree(response.body());
    }

    @Test
    void highRiskCommandWaitsForApproval() throws Exception {
        start();

        HttpResponse<String> submitted = post("/command", "{\"command\":\"cleanup\"}", "X-Actor", "alice");
        assertEquals(202, submitted.statusCode());
        JsonNode pending = json(submitted);
        assertTrue(pending.path("pending_approval").asBoolean());
        assertFalse(pending.path("ok").asBoolean());
        long id = pending.path("operation_id").asLong();
        assertEquals("pending_approval", json(get("/operations/" + id)).path("operation").path("status").asText());
        assertEquals(0, adapter.callCount());

        HttpResponse<String> approved = post("/operations/" + id + "/approve", "{}", "X-Actor", "bob");
        assertEquals(200, approved.statusCode());
        JsonNode done = json(approved);
        assertEquals("completed", done.path("status").asText());
        assertEquals("default-key", done.path("result").path("key").asText());
        assertFalse(done.path("result_excerpt").asText().isEmpty());

        JsonNode operation = json(get("/operations/" + id)).path("operation");
        assertEquals("completed", operation.path("status").asText());
        assertEquals("bob", operation.path("approved_by").asText());
        assertEquals("{\"key\":\"default-key\"}", operation.path("result_excerpt").asText());
        assertEquals("alice", operation.path("actor").asText());

        HttpResponse<String> again = post("/operations/" + id + "/approve", "{}");
        assertEquals(409, again.statusCode());
        assertEquals("completed", json(again).path("current_status").asText());
        assertEquals("NOT_PENDING_APPROVAL", json(again).path("code").asText());
    }

    @Test
    void listsNewestFirstWithLimit() throws Exception {
        start();
        for (int i = 0; i < 12; i++) {
            assertEquals(200, post("/api/command", "{\"command\":\"status\"}").statusCode());
        }

        JsonNode page = json(get("/operations?limit=10"));

        assertEquals(10, page.path("count").asInt());
        JsonNode operations = page.path("operations");
        for (int i = 1; i < operations.size(); i++) {
            assertTrue(operations.get(i - 1).path("created_at").asLong() > operations.get(i).path("created_at").asLong());
        }
        assertEquals(12, operations.get(0).path("id").asLong());
        assertEquals(10, json(get("/operations?status=completed&limit=10")).path("count").asInt());
    }

    @Test
    void invalidQueryParametersAreRejected() throws Exception {
        start();

        assertEquals(400, get("/operations?status=finished").statusCode());
        assertEquals(400, get("/operations?limit=lots").statusCode());
        assertEquals(400, get("/operations?since=yesterday").statusCode());
        assertEquals(404, get("/operations/999").statusCode());
    }

    @Test
    void unknownCommandListsSupportedCommands() throws Exception {
        start();

        HttpResponse<String> response = post("/command", "{\"command\":\"launch_rockets\"}");

        assertEquals(400, response.statusCode());
        JsonNode body = json(response);
        assertEquals("UNKNOWN_COMMAND", body.path("code").asText());
        assertEquals(13, body.path("supported_commands").size());
        assertEquals(0, hub.getStore().size());
    }

    @Test
    void projectScopedCommandNeedsProjectId() throws Exception {
        start();

        HttpResponse<String> missing = post("/command", "{\"command\":\"health_project\"}");
        HttpResponse<String> present = post("/command", "{\"command\":\"health_project\",\"projectId\":\"42\"}");

        assertEquals(400, missing.statusCode());
        assertEquals("MISSING_PROJECT_ID", json(missing).path("code").asText());
        assertEquals(200, present.statusCode());
        assertEquals("42", json(present).path("args").path("project_id").asText());
    }

    @Test
    void malformedBodyIsValidationError() throws Exception {
        start();

        HttpResponse<String> response = post("/command", "{not json");

        assertEquals(400, response.statusCode());
        assertEquals("VALIDATION_ERROR", json(response).path("code").asText());
    }

    @Test
    void chatRunsMatchedCommand() throws Exception {
        start();

        HttpResponse<String> response = post("/chat", "{\"message\":\"show me insights\"}");

        assertEquals(200, response.statusCode());
        JsonNode body = json(response);
        assertTrue(body.path("ok").asBoolean());
        assertEquals("insights", body.path("command").asText());
        assertEquals(0.8, body.path("confidence").asDouble(), 1e-9);
        assertTrue(body.path("session_id").asText().startsWith("chat_"));
        assertEquals("chat", json(get("/operations")).path("operations").get(0).path("source").asText());
    }

    @Test
    void chatWithoutMatchCreatesNothing() throws Exception {
        start();

        HttpResponse<String> response = post("/chat", "{\"message\":\"banana\"}");

        assertEquals(200, response.statusCode());
        JsonNode body = json(response);
        assertFalse(body.path("ok").asBoolean());
        assertEquals(0.0, body.path("confidence").asDouble(), 1e-9);
        assertTrue(body.path("assistant_message").asText().length() > 0);
        assertEquals(0, hub.getStore().size());
    }

    @Test
    void chatRemembersProjectPerSession() throws Exception {
        start();

        JsonNode first = json(post("/chat", "{\"message\":\"health of project 42\",\"session_id\":\"s-1\"}"));
        JsonNode second = json(post("/chat", "{\"message\":\"predict completion\",\"session_id\":\"s-1\"}"));
        HttpResponse<String> otherSession = post("/chat", "{\"message\":\"predict completion\",\"session_id\":\"s-2\"}");

        assertEquals("health_project", first.path("command").asText());
        assertEquals("42", first.path("args").path("project_id").asText());
        assertEquals("predict_completion", second.path("command").asText());
        assertEquals("42", second.path("args").path("project_id").asText());
        assertEquals(400, otherSession.statusCode());
        assertEquals("MISSING_PROJECT_ID", json(otherSession).path("code").asText());
    }

    @Test
    void mcpInitializeAndListTools() throws Exception {
        start();

        JsonNode init = json(post("/mcp", "{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"initialize\"}"));
        JsonNode list = json(post("/mcp", "{\"jsonrpc\":\"2.0\",\"id\":2,\"method\":\"tools/list\"}"));

        assertEquals("2024-11-05", init.path("result").path("protocolVersion").asText());
        assertEquals(HubApplication.SERVICE_NAME, init.path("result").path("serverInfo").path("name").asText());
        assertEquals(2, list.path("id").asInt());
        assertEquals(13, list.path("result").path("tools").size());
        assertEquals(13, json(get("/api/tools")).path("count").asInt());
    }

    @Test
    void mcpToolCallBypassesJournalButLeavesReceipt() throws Exception {
        start();

        HttpResponse<String> response = post("/mcp", "{\"jsonrpc\":\"2.0\",\"id\":7,\"method\":\"tools/call\","
            + "\"params\":{\"name\":\"pmos_status\",\"arguments\":{}}}");

        assertEquals(200, response.statusCode());
        JsonNode body = json(response);
        assertEquals(7, body.path("id").asInt());
        JsonNode text = mapper.readTree(body.path("result").path("content").get(0).path("text").asText());
        assertEquals("default-key", text.path("key").asText());
        assertEquals(0, hub.getStore().size());

        Path receiptsFile = dataDir.resolve("receipts").resolve("direct_calls.jsonl");
        List<String> lines = Files.readAllLines(receiptsFile, StandardCharsets.UTF_8);
        assertEquals(1, lines.size());
        JsonNode receipt = mapper.readTree(lines.get(0));
        assertEquals("pmos_status", receipt.path("tool").asText());
        assertTrue(receipt.path("ok").asBoolean());
        assertEquals("default", receipt.path("credential_scope").asText());
        assertFalse(lines.get(0).contains("default-key"));
    }

    @Test
    void mcpProtocolErrors() throws Exception {
        start();

        HttpResponse<String> unknownMethod = post("/mcp", "{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"prompts/list\"}");
        HttpResponse<String> badVersion = post("/mcp", "{\"jsonrpc\":\"1.0\",\"id\":1,\"method\":\"initialize\"}");
        HttpResponse<String> unknownTool = post("/mcp", "{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"tools/call\","
            + "\"params\":{\"name\":\"rm_rf\",\"arguments\":{}}}");
        HttpResponse<String> badArgs = post("/mcp", "{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"tools/call\","
            + "\"params\":{\"name\":\"pmos_health_project\",\"arguments\":{}}}");
        HttpResponse<String> garbage = post("/mcp", "{{{");

        assertEquals(-32601, json(unknownMethod).path("error").path("code").asInt());
        assertEquals(-32600, json(badVersion).path("error").path("code").asInt());
        assertEquals(-32602, json(unknownTool).path("error").path("code").asInt());
        assertEquals(-32602, json(badArgs).path("error").path("code").asInt());
        assertEquals(-32700, json(garbage).path("error").path("code").asInt());
        assertEquals(400, badArgs.statusCode());
        assertEquals(0, adapter.callCount());
    }

    @Test
    void restDirectCall() throws Exception {
        start();

        HttpResponse<String> response = post("/api/mcp-call",
            "{\"name\":\"pmos_insights_list\",\"arguments\":{\"limit\":3}}", "X-Api-Key", "mine");

        assertEquals(200, response.statusCode());
        JsonNode body = json(response);
        assertTrue(body.path("ok").asBoolean());
        assertEquals("mine", body.path("result").path("key").asText());
        assertEquals(3, body.path("args").path("limit").asInt());
        assertEquals(1, hub.getReceipts().readAll().size());
    }

    @Test
    void healthAndStatus() throws Exception {
        start();
        post("/command", "{\"command\":\"cleanup\"}");

        JsonNode health = json(get("/health"));
        JsonNode status = json(get("/api/status"));

        assertEquals("healthy", health.path("status").asText());
        assertEquals(HubApplication.SERVICE_NAME, health.path("service").asText());
        assertEquals(1, status.path("operations").path(OperationStatus.PENDING_APPROVAL.wireName()).asInt());
        assertTrue(status.path("durable_store").asBoolean());
        assertTrue(status.path("default_credential_configured").asBoolean());
        assertEquals(13, status.path("catalog_size").asInt());
    }

    @Test
    void shellTokenGuardsInteractiveEndpoints() throws Exception {
        start(StubToolAdapter.echoingCredential(), "shell-123");

        assertEquals(401, post("/command", "{\"command\":\"status\"}").statusCode());
        assertEquals(401, get("/operations").statusCode());
        assertEquals(401, post("/command", "{\"command\":\"status\"}", "X-Shell-Token", "wrong").statusCode());
        assertEquals(200, post("/command", "{\"command\":\"status\"}", "X-Shell-Token", "shell-123").statusCode());
        assertEquals(200, post("/chat", "{\"message\":\"status\"}", "Authorization", "Bearer shell-123").statusCode());
        assertEquals(200, get("/health").statusCode());
        assertEquals(2, hub.getStore().size());
    }

    @Test
    void callerKeyIsUsedButNeverJournaled() throws Exception {
        start();

        JsonNode body = json(post("/command", "{\"command\":\"status\"}", "X-Api-Key", "caller-secret"));

        assertEquals("caller-secret", body.path("result").path("key").asText());
        String listing = get("/operations").body();
        assertFalse(listing.contains("caller-secret"));
        assertTrue(listing.contains("caller:"));
        String journal = Files.readString(dataDir.resolve("operations.jsonl"), StandardCharsets.UTF_8);
        assertFalse(journal.contains("caller-secret"));
    }

    @Test
    void concurrentCommandsEachEchoTheirOwnKey() throws Exception {
        start();
        int callers = 50;
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        CountDownLatch ready = new CountDownLatch(1);
        try {
            List<Future<HttpResponse<String>>> futures = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                String key = "key-" + i;
                futures.add(pool.submit(() -> {
                    ready.await();
                    return post("/command", "{\"command\":\"status\"}", "X-Api-Key", key);
                }));
            }
            ready.countDown();

            for (int i = 0; i < callers; i++) {
                HttpResponse<String> response = futures.get(i).get(30, TimeUnit.SECONDS);
                assertEquals(200, response.statusCode());
                assertEquals("key-" + i, json(response).path("result").path("key").asText());
            }
        } finally {
            pool.shutdownNow();
        }
        assertEquals(callers, adapter.callCount());
        assertEquals(callers, hub.getStore().size());
    }

    @Test
    void completedCreateFlowCanBeUndoneOverHttp() throws Exception {
        start(StubToolAdapter.returning("{\"id\":\"wf-3\"}"), null);

        long id = json(post("/command", "{\"command\":\"create_flow\",\"arguments\":{\"name\":\"Nightly\"}}"))
            .path("operation_id").asLong();
        HttpResponse<String> undo = post("/operations/" + id + "/undo", "{\"approved\":true}");

        assertEquals(200, undo.statusCode());
        assertEquals(id, json(undo).path("undo_of").asLong());
        JsonNode original = json(get("/operations/" + id)).path("operation");
        assertTrue(original.path("undone_at").isNumber());
        assertEquals(409, post("/operations/" + id + "/undo", "{}").statusCode());
    }
}
