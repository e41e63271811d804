package com.commandhub.tools;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Locale;

public class ToolArgSpec {
    public enum Type {
        STRING("string"),
        NUMBER("number"),
        INTEGER("integer"),
        BOOLEAN("boolean"),
        OBJECT("object"),
        STRING_ARRAY("array");

        private final String jsonType;

        Type(String jsonType) {
            this.jsonType = jsonType;
        }

        public String jsonType() {
            return jsonType;
        }

        public static Type parse(String raw) {
            String value = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
            switch (value) {
                case "string":
                    return STRING;
                case "number":
                    return NUMBER;
                case "int":
                case "integer":
                    return INTEGER;
                case "boolean":
                    return BOOLEAN;
                case "object":
                    return OBJECT;
                case "string_array":
                case "array":
                    return STRING_ARRAY;
                default:
                    throw new IllegalArgumentException("Unsupported argument type: " + raw);
            }
        }
    }

    private final String name;
    private final Type type;
    private final boolean required;
    private final String description;

    public ToolArgSpec(String name, Type type, boolean required, String description) {
        this.name = name;
        this.type = type;
        this.required = required;
        this.description = description;
    }

    public String getName() {
        return name;
    }

    public Type getType() {
        return type;
    }

    public boolean isRequired() {
        return required;
    }

    public String getDescription() {
        return description;
    }

    public String validate(JsonNode node) {
        if (node == null || node.isNull()) {
            return required ? "missing-required:" + name : null;
        }
        switch (type) {
            case STRING:
                // Ids arrive as numbers from some clients.
                return node.isTextual() || node.isIntegralNumber() ? null : "invalid-type:" + name;
            case NUMBER:
                return node.isNumber() ? null : "invalid-type:" + name;
            case INTEGER:
                return node.isIntegralNumber() ? null : "invalid-type:" + name;
            case BOOLEAN:
                return node.isBoolean() ? null : "invalid-type:" + name;
            case OBJECT:
                return node.isObject() ? null : "invalid-type:" + name;
            case STRING_ARRAY:
                if (!node.isArray()) {
                    return "invalid-type:" + name;
                }
                for (JsonNode child : node) {
                    if (!child.isTextual()) {
                        return "invalid-type:" + name;
                    }
                }
                return null;
            default:
                return "invalid-type:" + name;
        }
    }
}
