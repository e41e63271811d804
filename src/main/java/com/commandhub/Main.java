package com.commandhub;

import io.javalin.Javalin;

import java.util.Locale;

public class Main {

    private static AppLogger logger;

    public static void main(String[] args) {
        try {
            // Parse configuration from environment, then flags
            AppConfig config = new AppConfig.Builder()
                    .fromEnvironment()
                    .parseArgs(args)
                    .build();

            // Initialize logging
            AppLogger.initialize(config.getLogPath(), true);
            logger = AppLogger.get();

            printBanner(config);

            HubApplication hub = HubApplication.fromConfig(config);
            Javalin app = hub.start();

            String host = config.getHost() != null ? config.getHost() : "localhost";
            String url = "http://" + host + ":" + app.port() + "/";
            logger.info("Server started on " + url);
            logger.console("");
            logger.console("  Listening on " + url);
            logger.console("  Data dir: " + config.getDataDir());
            logger.console("  Tool server: " + config.getToolServerUrl());
            logger.console("  Store: " + config.getStoreMode().name().toLowerCase(Locale.ROOT));
            logger.console("  Log file: " + config.getLogPath());
            logger.console("");
            logger.console("========================================");
            logger.console("  Press Ctrl+C to stop");
            logger.console("========================================");

            // Add shutdown hook for clean shutdown
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                logger.info("Shutting down...");
                hub.close();
                logger.close();
            }));

        } catch (Exception e) {
            System.err.println("Failed to start Command Hub: " + e.getMessage());
            e.printStackTrace();
            System.exit(1);
        }
    }

    private static void printBanner(AppConfig config) {
        logger.console("");
        logger.console("========================================");
        logger.console("  Command Hub v" + HubApplication.VERSION);
        logger.console("========================================");
        logger.console("  Starting server...");
        if (config.isDevMode()) {
            logger.console("  Mode: Development");
        }
        if (config.isShellTokenRequired()) {
            logger.console("  Shell token: required");
        }
    }
}
