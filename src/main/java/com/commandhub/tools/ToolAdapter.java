package com.commandhub.tools;

import com.commandhub.credentials.Credential;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.util.Map;

/**
 * Performs one remote tool call. Implementations must use only the credential
 * passed in; they may not keep per-call state in fields.
 */
public interface ToolAdapter {

    JsonNode invoke(String tool, Map<String, Object> arguments, Credential credential)
        throws IOException, InterruptedException;
}
