package com.commandhub.commands;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Inverse of a command. Argument values of the form {@code $args.<key>} and
 * {@code $result.<key>} are bound from the completed operation.
 */
public class UndoSpec {

    private static final String ARGS_REF = "$args.";
    private static final String RESULT_REF = "$result.";

    private final String command;
    private final Map<String, Object> arguments;

    public UndoSpec(String command, Map<String, Object> arguments) {
        this.command = command;
        this.arguments = arguments != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(arguments))
            : Collections.emptyMap();
    }

    public String getCommand() {
        return command;
    }

    public Map<String, Object> getArguments() {
        return arguments;
    }

    /**
     * @return bound arguments, or null when a reference cannot be resolved
     */
    public Map<String, Object> bind(Map<String, Object> effectiveArgs, JsonNode result, ObjectMapper mapper) {
        Map<String, Object> bound = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : arguments.entrySet()) {
            Object value = entry.getValue();
            if (value instanceof String && ((String) value).startsWith(ARGS_REF)) {
                Object resolved = effectiveArgs != null
                    ? effectiveArgs.get(((String) value).substring(ARGS_REF.length()))
                    : null;
                if (resolved == null) {
                    return null;
                }
                bound.put(entry.getKey(), resolved);
            } else if (value instanceof String && ((String) value).startsWith(RESULT_REF)) {
                JsonNode node = result != null ? result.path(((String) value).substring(RESULT_REF.length())) : null;
                if (node == null || node.isMissingNode() || node.isNull()) {
                    return null;
                }
                bound.put(entry.getKey(), mapper.convertValue(node, Object.class));
            } else {
                bound.put(entry.getKey(), value);
            }
        }
        return bound;
    }
}
