package com.commandhub;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Map;

/**
 * Application configuration from command-line flags and environment.
 * Flags win over environment variables, which win over defaults.
 */
public class AppConfig {

    public static final int DEFAULT_PORT = 10001;
    public static final String DEFAULT_TOOL_SERVER_URL = "http://localhost:10000";
    public static final long DEFAULT_TOOL_TIMEOUT_MS = 30_000;

    public enum StoreMode {
        FILE,
        MEMORY
    }

    private final String host;
    private final int port;
    private final Path dataDir;
    private final Path logPath;
    private final boolean devMode;
    private final String toolServerUrl;
    private final String toolServerApiKey;
    private final long toolTimeoutMs;
    private final String shellToken;
    private final StoreMode storeMode;
    private final Path catalogPath;

    private AppConfig(Builder b, Path dataDir) {
        this.host = b.host;
        this.port = b.port;
        this.dataDir = dataDir;
        this.logPath = dataDir.resolve("logs").resolve("command-hub.log");
        this.devMode = b.devMode;
        this.toolServerUrl = b.toolServerUrl;
        this.toolServerApiKey = b.toolServerApiKey;
        this.toolTimeoutMs = b.toolTimeoutMs;
        this.shellToken = b.shellToken;
        this.storeMode = b.storeMode;
        this.catalogPath = b.catalogPath;
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    public Path getDataDir() {
        return dataDir;
    }

    public Path getLogPath() {
        return logPath;
    }

    public Path getOperationsLog() {
        return dataDir.resolve("operations.jsonl");
    }

    public boolean isDevMode() {
        return devMode;
    }

    public String getToolServerUrl() {
        return toolServerUrl;
    }

    /**
     * Process default credential; empty when unset.
     */
    public String getToolServerApiKey() {
        return toolServerApiKey;
    }

    public long getToolTimeoutMs() {
        return toolTimeoutMs;
    }

    public String getShellToken() {
        return shellToken;
    }

    public boolean isShellTokenRequired() {
        return shellToken != null && !shellToken.isBlank();
    }

    public StoreMode getStoreMode() {
        return storeMode;
    }

    /**
     * Alternate catalog file, or null for the bundled {@code commands.json}.
     */
    public Path getCatalogPath() {
        return catalogPath;
    }

    /**
     * Builder for AppConfig.
     */
    public static class Builder {
        private String host = null;
        private int port = DEFAULT_PORT;
        private Path dataDir = null;
        private boolean devMode = false;
        private String toolServerUrl = DEFAULT_TOOL_SERVER_URL;
        private String toolServerApiKey = "";
        private long toolTimeoutMs = DEFAULT_TOOL_TIMEOUT_MS;
        private String shellToken = null;
        private StoreMode storeMode = StoreMode.FILE;
        private Path catalogPath = null;

        public Builder host(String host) {
            this.host = host != null && !host.isBlank() ? host.trim() : null;
            return this;
        }

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder dataDir(String path) {
            if (path != null && !path.isEmpty()) {
                this.dataDir = Paths.get(path).toAbsolutePath().normalize();
            }
            return this;
        }

        public Builder dataDir(Path path) {
            if (path != null) {
                this.dataDir = path.toAbsolutePath().normalize();
            }
            return this;
        }

        public Builder devMode(boolean devMode) {
            this.devMode = devMode;
            return this;
        }

        public Builder toolServerUrl(String url) {
            if (url != null && !url.isBlank()) {
                this.toolServerUrl = url.trim();
            }
            return this;
        }

        public Builder toolServerApiKey(String key) {
            this.toolServerApiKey = key != null ? key.trim() : "";
            return this;
        }

        public Builder toolTimeoutMs(long timeoutMs) {
            if (timeoutMs > 0) {
                this.toolTimeoutMs = timeoutMs;
            }
            return this;
        }

        public Builder shellToken(String token) {
            this.shellToken = token != null && !token.isBlank() ? token.trim() : null;
            return this;
        }

        public Builder storeMode(StoreMode mode) {
            if (mode != null) {
                this.storeMode = mode;
            }
            return this;
        }

        public Builder catalogPath(String path) {
            if (path != null && !path.isBlank()) {
                this.catalogPath = Paths.get(path).toAbsolutePath().normalize();
            }
            return this;
        }

        public Builder fromEnvironment() {
            return fromEnvironment(System.getenv());
        }

        public Builder fromEnvironment(Map<String, String> env) {
            String port = env.get("HUB_PORT");
            if (port != null && !port.isBlank()) {
                try {
                    this.port = Integer.parseInt(port.trim());
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("HUB_PORT is not a number: " + port, e);
                }
            }
            host(env.get("HUB_HOST"));
            dataDir(env.get("HUB_DATA_DIR"));
            toolServerUrl(env.get("TOOL_SERVER_URL"));
            if (env.containsKey("TOOL_SERVER_API_KEY")) {
                toolServerApiKey(env.get("TOOL_SERVER_API_KEY"));
            }
            String timeout = env.get("TOOL_TIMEOUT_MS");
            if (timeout != null && !timeout.isBlank()) {
                try {
                    toolTimeoutMs(Long.parseLong(timeout.trim()));
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("TOOL_TIMEOUT_MS is not a number: " + timeout, e);
                }
            }
            shellToken(env.get("HUB_SHELL_TOKEN"));
            String store = env.get("HUB_STORE");
            if (store != null && !store.isBlank()) {
                try {
                    this.storeMode = StoreMode.valueOf(store.trim().toUpperCase(Locale.ROOT));
                } catch (IllegalArgumentException e) {
                    throw new IllegalArgumentException("HUB_STORE must be file or memory: " + store, e);
                }
            }
            return this;
        }

        public Builder parseArgs(String[] args) {
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];

                // --data-dir=value or --data-dir value
                if (arg.startsWith("--data-dir=")) {
                    dataDir(arg.substring("--data-dir=".length()));
                } else if ("--data-dir".equals(arg) && i + 1 < args.length) {
                    dataDir(args[++i]);
                }

                else if (arg.startsWith("--catalog=")) {
                    catalogPath(arg.substring("--catalog=".length()));
                } else if ("--catalog".equals(arg) && i + 1 < args.length) {
                    catalogPath(args[++i]);
                }

                else if (arg.startsWith("--port=")) {
                    this.port = parsePort(arg.substring("--port=".length()));
                } else if ("--port".equals(arg) && i + 1 < args.length) {
                    this.port = parsePort(args[++i]);
                }

                else if ("--dev".equals(arg)) {
                    this.devMode = true;
                }
            }
            return this;
        }

        public AppConfig build() {
            if (port < 0 || port > 65535) {
                throw new IllegalArgumentException("Port out of range: " + port);
            }
            Path data = dataDir != null ? dataDir : Paths.get("data").toAbsolutePath().normalize();
            return new AppConfig(this, data);
        }

        private static int parsePort(String raw) {
            try {
                return Integer.parseInt(raw.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid --port value: " + raw, e);
            }
        }
    }
}
