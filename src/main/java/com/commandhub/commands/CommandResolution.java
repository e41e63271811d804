package com.commandhub.commands;

import com.commandhub.models.Risk;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Invocation shape produced by the catalog for one request.
 */
public class CommandResolution {
    private final CommandEntry entry;
    private final Map<String, Object> effectiveArgs;
    private final String projectId;

    public CommandResolution(CommandEntry entry, Map<String, Object> effectiveArgs, String projectId) {
        this.entry = entry;
        this.effectiveArgs = Collections.unmodifiableMap(new LinkedHashMap<>(effectiveArgs));
        this.projectId = projectId;
    }

    public CommandEntry getEntry() {
        return entry;
    }

    public String getCommand() {
        return entry.getName();
    }

    public String getTool() {
        return entry.getTool();
    }

    public Map<String, Object> getEffectiveArgs() {
        return effectiveArgs;
    }

    public String getProjectId() {
        return projectId;
    }

    public Risk getRisk() {
        return entry.getRisk();
    }
}
