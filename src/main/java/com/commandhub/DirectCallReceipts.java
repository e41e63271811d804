package com.commandhub;

import com.commandhub.credentials.Credential;
import com.commandhub.storage.JsonStorage;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Audit trail for tool calls that bypass the approval gate (JSON-RPC and
 * {@code /api/mcp-call}). One JSON line per call; no Operation is created.
 */
public class DirectCallReceipts {

    private final ObjectMapper objectMapper;
    private final Path receiptsFile;
    private final AppLogger.Channel log = AppLogger.channel("DirectCallReceipts");

    public DirectCallReceipts(Path dataDir, ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.receiptsFile = dataDir != null ? dataDir.resolve("receipts").resolve("direct_calls.jsonl") : null;
    }

    public Path getReceiptsFile() {
        return receiptsFile;
    }

    /**
     * Appends a receipt. Write failures are logged, not thrown.
     */
    public synchronized String record(String tool, Map<String, Object> arguments, Credential credential,
                                      boolean ok, String error) {
        String receiptId = "rcpt_" + UUID.randomUUID().toString().replace("-", "").substring(0, 12);
        if (receiptsFile == null) {
            return receiptId;
        }
        Map<String, Object> receipt = new LinkedHashMap<>();
        receipt.put("receipt_id", receiptId);
        receipt.put("tool", tool);
        receipt.put("arguments", arguments != null ? arguments : Map.of());
        receipt.put("ok", ok);
        receipt.put("error", error);
        receipt.put("credential_scope", credential != null ? credential.scope() : Credential.none().scope());
        receipt.put("at", System.currentTimeMillis());
        try {
            JsonStorage.appendJsonLine(receiptsFile, receipt);
        } catch (IOException e) {
            log.error("Failed to write receipt for direct call to " + tool, e);
        }
        return receiptId;
    }

    public synchronized List<Map<String, Object>> readAll() throws IOException {
        if (receiptsFile == null || !Files.exists(receiptsFile)) {
            return List.of();
        }
        List<Map<String, Object>> receipts = new ArrayList<>();
        for (String line : Files.readAllLines(receiptsFile, StandardCharsets.UTF_8)) {
            if (line == null || line.isBlank()) continue;
            @SuppressWarnings("unchecked")
            Map<String, Object> receipt = objectMapper.readValue(line, Map.class);
            receipts.add(receipt);
        }
        return receipts;
    }
}
