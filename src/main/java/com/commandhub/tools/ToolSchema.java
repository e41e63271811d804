package com.commandhub.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Argument contract of one remote tool, as published on {@code tools/list}
 * and enforced on direct {@code tools/call} requests.
 */
public class ToolSchema {
    private final String toolId;
    private final String description;
    private final Map<String, ToolArgSpec> args = new LinkedHashMap<>();

    public ToolSchema(String toolId, String description) {
        this.toolId = toolId;
        this.description = description != null ? description : "";
    }

    public ToolSchema arg(String name, ToolArgSpec.Type type, boolean required, String description) {
        args.put(name, new ToolArgSpec(name, type, required, description));
        return this;
    }

    public String getToolId() {
        return toolId;
    }

    public String getDescription() {
        return description;
    }

    public Map<String, ToolArgSpec> getArgSpecs() {
        return Collections.unmodifiableMap(args);
    }

    public String validate(JsonNode argsNode) {
        if (argsNode == null || argsNode.isNull()) {
            argsNode = JsonNodeFactory.instance.objectNode();
        }
        if (!argsNode.isObject()) {
            return "args-not-object";
        }
        for (ToolArgSpec spec : args.values()) {
            String error = spec.validate(argsNode.get(spec.getName()));
            if (error != null) {
                return error;
            }
        }
        Iterator<String> fields = argsNode.fieldNames();
        while (fields.hasNext()) {
            String field = fields.next();
            if (!args.containsKey(field)) {
                return "unknown-arg:" + field;
            }
        }
        return null;
    }

    /**
     * Renders the MCP tool descriptor: {@code {name, description, inputSchema}}.
     */
    public ObjectNode toDescriptor(ObjectMapper mapper) {
        ObjectNode tool = mapper.createObjectNode();
        tool.put("name", toolId);
        tool.put("description", description);
        ObjectNode schema = tool.putObject("inputSchema");
        schema.put("type", "object");
        ObjectNode properties = schema.putObject("properties");
        ArrayNode required = schema.putArray("required");
        for (ToolArgSpec spec : args.values()) {
            ObjectNode property = properties.putObject(spec.getName());
            property.put("type", spec.getType().jsonType());
            if (spec.getType() == ToolArgSpec.Type.STRING_ARRAY) {
                property.putObject("items").put("type", "string");
            }
            if (spec.getDescription() != null && !spec.getDescription().isBlank()) {
                property.put("description", spec.getDescription());
            }
            if (spec.isRequired()) {
                required.add(spec.getName());
            }
        }
        return tool;
    }
}
