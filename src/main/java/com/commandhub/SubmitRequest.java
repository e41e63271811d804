package com.commandhub;

import com.commandhub.models.OperationSource;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Everything a caller hands to {@link ApprovalGate#submit(SubmitRequest)}.
 * The caller token is kept only for the lifetime of the request.
 */
public final class SubmitRequest {

    private final String command;
    private final Map<String, Object> arguments;
    private final String projectId;
    private final String callerToken;
    private final OperationSource source;
    private final String sessionId;
    private final String actor;
    private final boolean forceApproval;
    private final Long existingOperationId;
    private final boolean approved;

    private SubmitRequest(Builder b) {
        this.command = b.command;
        this.arguments = Collections.unmodifiableMap(new LinkedHashMap<>(b.arguments));
        this.projectId = b.projectId;
        this.callerToken = b.callerToken;
        this.source = b.source != null ? b.source : OperationSource.API;
        this.sessionId = b.sessionId;
        this.actor = b.actor != null && !b.actor.isBlank() ? b.actor.trim() : "anonymous";
        this.forceApproval = b.forceApproval;
        this.existingOperationId = b.existingOperationId;
        this.approved = b.approved;
    }

    public static Builder builder(String command) {
        return new Builder().command(command);
    }

    public String getCommand() {
        return command;
    }

    public Map<String, Object> getArguments() {
        return arguments;
    }

    public String getProjectId() {
        return projectId;
    }

    public String getCallerToken() {
        return callerToken;
    }

    public OperationSource getSource() {
        return source;
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getActor() {
        return actor;
    }

    public boolean isForceApproval() {
        return forceApproval;
    }

    public Long getExistingOperationId() {
        return existingOperationId;
    }

    public boolean isApproved() {
        return approved;
    }

    public static class Builder {
        private String command;
        private Map<String, Object> arguments = new LinkedHashMap<>();
        private String projectId;
        private String callerToken;
        private OperationSource source;
        private String sessionId;
        private String actor;
        private boolean forceApproval;
        private Long existingOperationId;
        private boolean approved;

        public Builder command(String command) {
            this.command = command;
            return this;
        }

        public Builder arguments(Map<String, Object> arguments) {
            this.arguments = arguments != null ? new LinkedHashMap<>(arguments) : new LinkedHashMap<>();
            return this;
        }

        public Builder projectId(String projectId) {
            this.projectId = projectId;
            return this;
        }

        public Builder callerToken(String callerToken) {
            this.callerToken = callerToken;
            return this;
        }

        public Builder source(OperationSource source) {
            this.source = source;
            return this;
        }

        public Builder sessionId(String sessionId) {
            this.sessionId = sessionId;
            return this;
        }

        public Builder actor(String actor) {
            this.actor = actor;
            return this;
        }

        public Builder forceApproval(boolean forceApproval) {
            this.forceApproval = forceApproval;
            return this;
        }

        public Builder existingOperationId(Long existingOperationId) {
            this.existingOperationId = existingOperationId;
            return this;
        }

        public Builder approved(boolean approved) {
            this.approved = approved;
            return this;
        }

        public SubmitRequest build() {
            return new SubmitRequest(this);
        }
    }
}
