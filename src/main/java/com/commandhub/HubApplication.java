package com.commandhub;

import com.commandhub.commands.CommandCatalog;
import com.commandhub.commands.IntentParser;
import com.commandhub.controllers.ChatController;
import com.commandhub.controllers.CommandController;
import com.commandhub.controllers.Controller;
import com.commandhub.controllers.HealthController;
import com.commandhub.controllers.McpController;
import com.commandhub.controllers.OperationController;
import com.commandhub.controllers.ShellTokenGuard;
import com.commandhub.credentials.CredentialResolver;
import com.commandhub.tools.BoundedToolInvoker;
import com.commandhub.tools.HttpToolAdapter;
import com.commandhub.tools.ToolAdapter;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.javalin.Javalin;
import io.javalin.json.JavalinJackson;

import java.io.IOException;
import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Wires the hub's components and builds the Javalin server around them.
 */
public class HubApplication implements AutoCloseable {

    public static final String SERVICE_NAME = "command-hub";
    public static final String VERSION = "1.0.0";

    private final AppConfig config;
    private final ObjectMapper objectMapper;
    private final OperationStore store;
    private final CommandCatalog catalog;
    private final CredentialResolver credentials;
    private final BoundedToolInvoker invoker;
    private final ApprovalGate gate;
    private final IntentParser intentParser;
    private final ChatSessionMemory chatSessions;
    private final DirectCallReceipts receipts;
    private final AppLogger.Channel log = AppLogger.channel("HubApplication");
    private Javalin app;

    private HubApplication(AppConfig config, ObjectMapper objectMapper, OperationStore store,
                           CommandCatalog catalog, ToolAdapter adapter) {
        this.config = config;
        this.objectMapper = objectMapper;
        this.store = store;
        this.catalog = catalog;
        this.credentials = new CredentialResolver(config.getToolServerApiKey());
        this.invoker = new BoundedToolInvoker(adapter, config.getToolTimeoutMs());
        this.gate = new ApprovalGate(store, catalog, credentials, invoker, objectMapper);
        this.intentParser = new IntentParser();
        this.chatSessions = new ChatSessionMemory();
        this.receipts = new DirectCallReceipts(config.getDataDir(), objectMapper);
    }

    /**
     * Production wiring: HTTP tool adapter against the configured tool server.
     */
    public static HubApplication fromConfig(AppConfig config) throws IOException {
        ObjectMapper objectMapper = new ObjectMapper();
        HttpClient httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(10))
            .build();
        ToolAdapter adapter = new HttpToolAdapter(objectMapper, httpClient,
            config.getToolServerUrl(), config.getToolTimeoutMs());
        return create(config, adapter, Clock.systemUTC(), objectMapper);
    }

    public static HubApplication create(AppConfig config, ToolAdapter adapter, Clock clock,
                                        ObjectMapper objectMapper) throws IOException {
        ObjectMapper mapper = objectMapper != null ? objectMapper : new ObjectMapper();
        CommandCatalog catalog = config.getCatalogPath() != null
            ? CommandCatalog.loadFile(config.getCatalogPath(), mapper)
            : CommandCatalog.loadDefault(mapper);
        OperationStore store = openStore(config, clock);
        HubApplication application = new HubApplication(config, mapper, store, catalog, adapter);
        application.log.info("Catalog loaded: " + catalog.size() + " commands");
        return application;
    }

    private static OperationStore openStore(AppConfig config, Clock clock) throws IOException {
        AppLogger.Channel log = AppLogger.channel("HubApplication");
        if (config.getStoreMode() == AppConfig.StoreMode.MEMORY) {
            log.warn("Using in-memory operation store: pending approvals and history are lost on restart");
            return OperationStore.inMemory(clock);
        }
        return OperationStore.open(config.getOperationsLog(), clock);
    }

    public Javalin createServer() {
        Javalin javalin = Javalin.create(cfg -> {
            cfg.jsonMapper(new JavalinJackson(objectMapper));
            cfg.http.defaultContentType = "application/json";
        });

        for (Controller controller : controllers()) {
            controller.registerRoutes(javalin);
        }
        registerExceptionHandlers(javalin);
        return javalin;
    }

    /**
     * Starts on the configured host and port (0 picks a free port).
     */
    public Javalin start() {
        app = createServer();
        if (config.getHost() != null) {
            app.start(config.getHost(), config.getPort());
        } else {
            app.start(config.getPort());
        }
        return app;
    }

    private List<Controller> controllers() {
        return List.of(
            new ShellTokenGuard(config.getShellToken()),
            new HealthController(store, catalog, credentials, config),
            new CommandController(gate, catalog, objectMapper),
            new ChatController(gate, intentParser, chatSessions, catalog, objectMapper),
            new OperationController(store, gate, objectMapper),
            new McpController(catalog, credentials, invoker, receipts, objectMapper)
        );
    }

    private void registerExceptionHandlers(Javalin javalin) {
        javalin.exception(HubException.class, (e, ctx) -> {
            log.warn(e.getCode() + ": " + e.getMessage());
            ctx.status(e.getCode().getHttpStatus()).json(Controller.errorBody(e));
        });

        javalin.exception(Exception.class, (e, ctx) -> {
            log.error("Unhandled exception: " + e.getMessage(), e);
            ctx.status(500).json(Controller.errorBody(e));
        });
    }

    public AppConfig getConfig() {
        return config;
    }

    public OperationStore getStore() {
        return store;
    }

    public CommandCatalog getCatalog() {
        return catalog;
    }

    public ApprovalGate getGate() {
        return gate;
    }

    public DirectCallReceipts getReceipts() {
        return receipts;
    }

    @Override
    public void close() {
        if (app != null) {
            app.stop();
            app = null;
        }
        invoker.close();
    }
}
