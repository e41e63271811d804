package com.commandhub;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AppConfigTest {

    @Test
    void defaults() {
        AppConfig config = new AppConfig.Builder().fromEnvironment(Map.of()).build();

        assertEquals(AppConfig.DEFAULT_PORT, config.getPort());
        assertNull(config.getHost());
        assertEquals(Paths.get("data").toAbsolutePath().normalize(), config.getDataDir());
        assertEquals(AppConfig.DEFAULT_TOOL_SERVER_URL, config.getToolServerUrl());
        assertEquals("", config.getToolServerApiKey());
        assertEquals(30_000, config.getToolTimeoutMs());
        assertFalse(config.isShellTokenRequired());
        assertEquals(AppConfig.StoreMode.FILE, config.getStoreMode());
        assertNull(config.getCatalogPath());
        assertFalse(config.isDevMode());
    }

    @Test
    void readsEnvironment() {
        Map<String, String> env = new HashMap<>();
        env.put("HUB_PORT", "9100");
        env.put("HUB_HOST", "127.0.0.1");
        env.put("HUB_DATA_DIR", "/tmp/hub-data");
        env.put("TOOL_SERVER_URL", "http://tools:8080");
        env.put("TOOL_SERVER_API_KEY", " secret ");
        env.put("TOOL_TIMEOUT_MS", "2500");
        env.put("HUB_SHELL_TOKEN", "shell-123");
        env.put("HUB_STORE", "memory");

        AppConfig config = new AppConfig.Builder().fromEnvironment(env).build();

        assertEquals(9100, config.getPort());
        assertEquals("127.0.0.1", config.getHost());
        assertEquals(Paths.get("/tmp/hub-data").toAbsolutePath().normalize(), config.getDataDir());
        assertEquals("http://tools:8080", config.getToolServerUrl());
        assertEquals("secret", config.getToolServerApiKey());
        assertEquals(2500, config.getToolTimeoutMs());
        assertEquals("shell-123", config.getShellToken());
        assertTrue(config.isShellTokenRequired());
        assertEquals(AppConfig.StoreMode.MEMORY, config.getStoreMode());
    }

    @Test
    void flagsOverrideEnvironment() {
        AppConfig config = new AppConfig.Builder()
            .fromEnvironment(Map.of("HUB_PORT", "9100", "HUB_DATA_DIR", "/tmp/from-env"))
            .parseArgs(new String[]{"--port", "9200", "--data-dir=/tmp/from-flag", "--dev", "--catalog", "/tmp/c.json"})
            .build();

        assertEquals(9200, config.getPort());
        assertEquals(Paths.get("/tmp/from-flag").toAbsolutePath().normalize(), config.getDataDir());
        assertEquals(Paths.get("/tmp/c.json").toAbsolutePath().normalize(), config.getCatalogPath());
        assertTrue(config.isDevMode());
    }

    @Test
    void derivedPathsLiveUnderDataDir() {
        Path dataDir = Paths.get("/tmp/hub").toAbsolutePath().normalize();
        AppConfig config = new AppConfig.Builder().dataDir(dataDir).build();

        assertEquals(dataDir.resolve("operations.jsonl"), config.getOperationsLog());
        assertEquals(dataDir.resolve("logs").resolve("command-hub.log"), config.getLogPath());
    }

    @Test
    void rejectsInvalidValues() {
        assertThrows(IllegalArgumentException.class,
            () -> new AppConfig.Builder().fromEnvironment(Map.of("HUB_STORE", "redis")));
        assertThrows(IllegalArgumentException.class,
            () -> new AppConfig.Builder().fromEnvironment(Map.of("HUB_PORT", "http")));
        assertThrows(IllegalArgumentException.class,
            () -> new AppConfig.Builder().parseArgs(new String[]{"--port=abc"}));
        assertThrows(IllegalArgumentException.class,
            () -> new AppConfig.Builder().port(70_000).build());
    }

    @Test
    void nonPositiveTimeoutKeepsDefault() {
        AppConfig config = new AppConfig.Builder().fromEnvironment(Map.of("TOOL_TIMEOUT_MS", "0")).build();

        assertEquals(AppConfig.DEFAULT_TOOL_TIMEOUT_MS, config.getToolTimeoutMs());
    }
}
