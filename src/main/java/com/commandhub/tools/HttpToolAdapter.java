package com.commandhub.tools;

import com.commandhub.credentials.Credential;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Calls tools on the remote tool server through its JSON-RPC {@code /mcp}
 * endpoint. The API key travels as {@code x-api-key} on each request.
 */
public class HttpToolAdapter implements ToolAdapter {

    private static final String DEFAULT_BASE_URL = "http://localhost:10000";

    private final ObjectMapper mapper;
    private final HttpClient httpClient;
    private final String endpoint;
    private final Duration requestTimeout;
    private final AtomicLong requestIds = new AtomicLong();

    public HttpToolAdapter(ObjectMapper mapper, HttpClient httpClient, String baseUrl, long timeoutMs) {
        this.mapper = mapper;
        this.httpClient = httpClient;
        this.endpoint = normalizeBaseUrl(baseUrl, DEFAULT_BASE_URL) + "/mcp";
        this.requestTimeout = Duration.ofMillis(timeoutMs > 0 ? timeoutMs : 30_000);
    }

    @Override
    public JsonNode invoke(String tool, Map<String, Object> arguments, Credential credential)
        throws IOException, InterruptedException {
        ObjectNode payload = mapper.createObjectNode();
        payload.put("jsonrpc", "2.0");
        payload.put("id", requestIds.incrementAndGet());
        payload.put("method", "tools/call");
        ObjectNode params = payload.putObject("params");
        params.put("name", tool);
        params.set("arguments", mapper.valueToTree(arguments != null ? arguments : Map.of()));

        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(URI.create(endpoint))
            .timeout(requestTimeout)
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(payload)));
        if (credential != null && credential.isPresent()) {
            builder.header("x-api-key", credential.token());
        }

        HttpResponse<String> response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new IOException("Tool server request failed (" + status + "): " + abbreviate(response.body()));
        }

        JsonNode body = mapper.readTree(response.body());
        JsonNode error = body.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            throw new IOException("Tool server error: " + error.path("message").asText(error.toString()));
        }
        return unwrapResult(body.path("result"));
    }

    /**
     * Tool results arrive as {@code content[0].text}; JSON text is parsed,
     * anything else is returned as a string node.
     */
    private JsonNode unwrapResult(JsonNode result) throws IOException {
        if (result.isMissingNode() || result.isNull()) {
            throw new IOException("Tool server response has no result");
        }
        if (result.path("isError").asBoolean(false)) {
            throw new IOException("Tool reported an error: " + result.path("content").path(0).path("text").asText(""));
        }
        JsonNode text = result.path("content").path(0).path("text");
        if (!text.isTextual()) {
            return result;
        }
        try {
            return mapper.readTree(text.asText());
        } catch (JsonProcessingException e) {
            return mapper.getNodeFactory().textNode(text.asText());
        }
    }

    public String getEndpoint() {
        return endpoint;
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() > 300 ? body.substring(0, 300) + "..." : body;
    }

    static String normalizeBaseUrl(String baseUrl, String fallback) {
        String url = (baseUrl == null || baseUrl.isBlank()) ? fallback : baseUrl.trim();
        while (url.endsWith("/")) {
            url = url.substring(0, url.length() - 1);
        }
        return url;
    }
}
