package com.commandhub.tools;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

public class ToolSchemaRegistry {
    private final Map<String, ToolSchema> schemas = new LinkedHashMap<>();

    public ToolSchemaRegistry register(ToolSchema schema) {
        if (schema != null && schema.getToolId() != null) {
            schemas.put(schema.getToolId(), schema);
        }
        return this;
    }

    public boolean hasTool(String toolId) {
        return toolId != null && schemas.containsKey(toolId);
    }

    public ToolSchema getSchema(String toolId) {
        return toolId != null ? schemas.get(toolId) : null;
    }

    public Set<String> getToolIds() {
        return Collections.unmodifiableSet(schemas.keySet());
    }

    public Collection<ToolSchema> all() {
        return Collections.unmodifiableCollection(schemas.values());
    }

    public int size() {
        return schemas.size();
    }
}
