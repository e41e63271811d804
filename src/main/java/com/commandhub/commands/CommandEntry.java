package com.commandhub.commands;

import com.commandhub.models.Risk;
import com.commandhub.tools.ToolSchema;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * One catalog row: the tool a command runs, its default arguments, whether
 * it needs a project scope and how risky it is.
 */
public class CommandEntry {
    private final String name;
    private final String tool;
    private final String description;
    private final ObjectNode defaults;
    private final boolean requiresProjectId;
    private final Risk risk;
    private final ToolSchema schema;
    private final UndoSpec undo;

    public CommandEntry(String name, String tool, String description, ObjectNode defaults,
                        boolean requiresProjectId, Risk risk, ToolSchema schema, UndoSpec undo) {
        this.name = name;
        this.tool = tool;
        this.description = description;
        this.defaults = defaults;
        this.requiresProjectId = requiresProjectId;
        this.risk = risk != null ? risk : Risk.LOW;
        this.schema = schema;
        this.undo = undo;
    }

    public String getName() {
        return name;
    }

    public String getTool() {
        return tool;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Returns a fresh copy; callers may not mutate the catalog.
     */
    public ObjectNode getDefaults() {
        return defaults.deepCopy();
    }

    public boolean isRequiresProjectId() {
        return requiresProjectId;
    }

    public Risk getRisk() {
        return risk;
    }

    public ToolSchema getSchema() {
        return schema;
    }

    public UndoSpec getUndo() {
        return undo;
    }
}
