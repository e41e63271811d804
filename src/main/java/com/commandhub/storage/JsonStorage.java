package com.commandhub.storage;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * JSON Lines helpers: one compact JSON document per line.
 */
public class JsonStorage {

    private static final ObjectMapper mapper = new ObjectMapper();

    public static <T> List<T> readJsonLines(Path path, Class<T> clazz) throws IOException {
        if (!Files.exists(path)) {
            return Collections.emptyList();
        }
        List<T> items = new ArrayList<>();
        int lineNo = 0;
        for (String line : Files.readAllLines(path, StandardCharsets.UTF_8)) {
            lineNo++;
            if (line == null || line.isBlank()) {
                continue;
            }
            try {
                items.add(mapper.readValue(line, clazz));
            } catch (IOException e) {
                throw new IOException("Corrupt line " + lineNo + " in " + path + ": " + e.getMessage(), e);
            }
        }
        return items;
    }

    public static void appendJsonLine(Path path, Object value) throws IOException {
        ensureParent(path);
        String json = mapper.writeValueAsString(value);
        try (BufferedWriter writer = Files.newBufferedWriter(
                path,
                StandardCharsets.UTF_8,
                StandardOpenOption.CREATE,
                StandardOpenOption.WRITE,
                StandardOpenOption.APPEND)) {
            writer.write(json);
            writer.newLine();
        }
    }

    /**
     * Atomic rewrite: write to .tmp file, then rename over the target.
     */
    public static void writeJsonLinesAtomic(Path path, List<?> values) throws IOException {
        ensureParent(path);
        Path tmpFile = path.resolveSibling(path.getFileName().toString() + ".tmp");
        try (BufferedWriter writer = Files.newBufferedWriter(tmpFile, StandardCharsets.UTF_8)) {
            for (Object value : values) {
                writer.write(mapper.writeValueAsString(value));
                writer.newLine();
            }
        }
        Files.move(tmpFile, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    private static void ensureParent(Path path) throws IOException {
        Path parent = path.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }
}
