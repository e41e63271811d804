package com.commandhub.commands;

import com.commandhub.ErrorCode;
import com.commandhub.HubException;
import com.commandhub.models.Risk;
import com.commandhub.tools.ToolArgSpec;
import com.commandhub.tools.ToolSchema;
import com.commandhub.tools.ToolSchemaRegistry;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Static mapping from command names to tool invocations. Loaded once at
 * startup and read-only afterwards, so it is shared without locking.
 */
public class CommandCatalog {

    public static final String DEFAULT_RESOURCE = "/commands.json";
    private static final String PROJECT_ID = "project_id";

    private final Map<String, CommandEntry> entries;
    private final Map<String, CommandEntry> byTool;
    private final ObjectMapper mapper;

    private CommandCatalog(List<CommandEntry> entries, ObjectMapper mapper) {
        Map<String, CommandEntry> named = new LinkedHashMap<>();
        Map<String, CommandEntry> tools = new LinkedHashMap<>();
        for (CommandEntry entry : entries) {
            if (named.put(entry.getName(), entry) != null) {
                throw new IllegalArgumentException("Duplicate command in catalog: " + entry.getName());
            }
            tools.putIfAbsent(entry.getTool(), entry);
        }
        for (CommandEntry entry : entries) {
            UndoSpec undo = entry.getUndo();
            if (undo != null && !named.containsKey(undo.getCommand())) {
                throw new IllegalArgumentException("Command " + entry.getName()
                    + " declares unknown inverse: " + undo.getCommand());
            }
        }
        this.entries = Collections.unmodifiableMap(named);
        this.byTool = Collections.unmodifiableMap(tools);
        this.mapper = mapper;
    }

    public static CommandCatalog loadDefault(ObjectMapper mapper) throws IOException {
        try (InputStream in = CommandCatalog.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new FileNotFoundException("Catalog resource not found: " + DEFAULT_RESOURCE);
            }
            return load(in, mapper);
        }
    }

    public static CommandCatalog loadFile(Path path, ObjectMapper mapper) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return load(in, mapper);
        }
    }

    public static CommandCatalog load(InputStream in, ObjectMapper mapper) throws IOException {
        JsonNode root = mapper.readTree(in);
        JsonNode commands = root.path("commands");
        if (!commands.isArray()) {
            throw new IOException("Catalog must contain a \"commands\" array");
        }
        List<CommandEntry> parsed = new ArrayList<>();
        for (JsonNode node : commands) {
            parsed.add(parseEntry(node, mapper));
        }
        return new CommandCatalog(parsed, mapper);
    }

    /**
     * Resolves a request into {tool, effectiveArgs, projectId, risk}.
     * Caller arguments override defaults key by key; nested values are not merged.
     */
    public CommandResolution resolve(String commandName, Map<String, Object> callerArgs, String explicitProjectId) {
        String name = commandName == null ? "" : commandName.trim();
        CommandEntry entry = entries.get(name);
        if (entry == null) {
            throw new HubException(ErrorCode.UNKNOWN_COMMAND, "unsupported command: " + name);
        }
        Map<String, Object> args = callerArgs != null ? callerArgs : Collections.emptyMap();

        String projectId = blankToNull(explicitProjectId);
        if (projectId == null && args.get(PROJECT_ID) != null) {
            projectId = blankToNull(String.valueOf(args.get(PROJECT_ID)));
        }
        if (entry.isRequiresProjectId() && projectId == null) {
            throw new HubException(ErrorCode.MISSING_PROJECT_ID, "command " + name + " requires project_id");
        }

        @SuppressWarnings("unchecked")
        Map<String, Object> effective = mapper.convertValue(entry.getDefaults(), LinkedHashMap.class);
        effective.putAll(args);
        if (entry.isRequiresProjectId()) {
            effective.put(PROJECT_ID, projectId);
        }
        return new CommandResolution(entry, effective, projectId);
    }

    public Optional<CommandEntry> entry(String name) {
        return Optional.ofNullable(name != null ? entries.get(name.trim()) : null);
    }

    public Optional<CommandEntry> entryForTool(String tool) {
        return Optional.ofNullable(tool != null ? byTool.get(tool) : null);
    }

    public List<String> commandNames() {
        return new ArrayList<>(entries.keySet());
    }

    public int size() {
        return entries.size();
    }

    public ToolSchemaRegistry toolSchemas() {
        ToolSchemaRegistry registry = new ToolSchemaRegistry();
        for (CommandEntry entry : byTool.values()) {
            registry.register(entry.getSchema());
        }
        return registry;
    }

    private static CommandEntry parseEntry(JsonNode node, ObjectMapper mapper) throws IOException {
        String name = node.path("name").asText("").trim();
        String tool = node.path("tool").asText("").trim();
        if (name.isEmpty() || tool.isEmpty()) {
            throw new IOException("Catalog entry needs name and tool: " + node);
        }
        String description = node.path("description").asText("");
        JsonNode defaultsNode = node.path("defaults");
        ObjectNode defaults = defaultsNode.isObject() ? (ObjectNode) defaultsNode.deepCopy() : mapper.createObjectNode();
        boolean requiresProjectId = node.path("requires_project_id").asBoolean(false);
        Risk risk;
        try {
            risk = Risk.fromWire(node.path("risk").asText(null));
        } catch (IllegalArgumentException e) {
            throw new IOException("Catalog entry " + name + ": " + e.getMessage(), e);
        }

        ToolSchema schema = new ToolSchema(tool, description);
        for (JsonNode arg : node.path("arguments")) {
            String argName = arg.path("name").asText("").trim();
            if (argName.isEmpty()) {
                throw new IOException("Catalog entry " + name + " has an unnamed argument");
            }
            ToolArgSpec.Type type;
            try {
                type = ToolArgSpec.Type.parse(arg.path("type").asText("string"));
            } catch (IllegalArgumentException e) {
                throw new IOException("Catalog entry " + name + ": " + e.getMessage(), e);
            }
            schema.arg(argName, type, arg.path("required").asBoolean(false), arg.path("description").asText(""));
        }

        UndoSpec undo = null;
        JsonNode undoNode = node.path("undo");
        if (undoNode.isObject()) {
            @SuppressWarnings("unchecked")
            Map<String, Object> undoArgs = undoNode.path("arguments").isObject()
                ? mapper.convertValue(undoNode.path("arguments"), LinkedHashMap.class)
                : new LinkedHashMap<>();
            undo = new UndoSpec(undoNode.path("command").asText("").trim(), undoArgs);
        }
        return new CommandEntry(name, tool, description, defaults, requiresProjectId, risk, schema, undo);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
