package com.commandhub;

import java.io.FileOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Simple logging utility that writes to both console and file.
 * Components log through {@link #channel(String)} so that messages carry a
 * {@code [Component]} prefix and still reach stdout when the logger was never
 * initialized (unit tests, embedded use).
 */
public class AppLogger {

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final PrintStream fileOutput;
    private final PrintStream consoleOutput;
    private final boolean consoleEnabled;

    private static AppLogger instance;

    private AppLogger(Path logFile, boolean consoleEnabled) throws IOException {
        this.consoleOutput = System.out;
        this.consoleEnabled = consoleEnabled;

        if (logFile != null) {
            Path parent = logFile.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            FileOutputStream fos = new FileOutputStream(logFile.toFile(), true);
            this.fileOutput = new PrintStream(fos, true, "UTF-8");

            String separator = "=".repeat(60);
            fileOutput.println();
            fileOutput.println(separator);
            fileOutput.println("Command Hub started at " + LocalDateTime.now().format(TIME_FORMAT));
            fileOutput.println(separator);
        } else {
            this.fileOutput = null;
        }
    }

    public static synchronized void initialize(Path logFile, boolean consoleEnabled) throws IOException {
        if (instance == null) {
            instance = new AppLogger(logFile, consoleEnabled);
        }
    }

    public static AppLogger get() {
        return instance;
    }

    /**
     * Tagged view over the shared logger. Resolves the instance on every call,
     * so channels created before {@link #initialize} still end up in the file.
     */
    public static Channel channel(String component) {
        return new Channel(component);
    }

    public void info(String message) {
        log("INFO", message);
    }

    public void warn(String message) {
        log("WARN", message);
    }

    public void error(String message) {
        log("ERROR", message);
    }

    public void error(String message, Throwable t) {
        log("ERROR", message);
        if (fileOutput != null) {
            t.printStackTrace(fileOutput);
        }
        if (consoleEnabled) {
            t.printStackTrace(consoleOutput);
        }
    }

    private void log(String level, String message) {
        String timestamp = LocalDateTime.now().format(TIME_FORMAT);
        String line = String.format("[%s] [%s] %s", timestamp, level, message);

        if (fileOutput != null) {
            fileOutput.println(line);
        }

        if (consoleEnabled) {
            consoleOutput.println(line);
        }
    }

    /**
     * Print to console only (for startup banners, etc.)
     */
    public void console(String message) {
        if (consoleEnabled) {
            consoleOutput.println(message);
        }
        if (fileOutput != null) {
            fileOutput.println(message);
        }
    }

    public void close() {
        if (fileOutput != null) {
            fileOutput.close();
        }
    }

    public static final class Channel {
        private final String prefix;

        private Channel(String component) {
            this.prefix = "[" + component + "] ";
        }

        public void info(String message) {
            AppLogger logger = AppLogger.get();
            if (logger != null) {
                logger.info(prefix + message);
            } else {
                System.out.println(prefix + message);
            }
        }

        public void warn(String message) {
            AppLogger logger = AppLogger.get();
            if (logger != null) {
                logger.warn(prefix + message);
            } else {
                System.out.println(prefix + message);
            }
        }

        public void error(String message, Throwable t) {
            AppLogger logger = AppLogger.get();
            if (logger != null) {
                logger.error(prefix + message, t);
            } else {
                System.out.println(prefix + message);
                t.printStackTrace(System.out);
            }
        }
    }
}
