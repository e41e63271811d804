package com.commandhub.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One journaled request for a mutating action, serialized in snake_case.
 * Instances handed out by the OperationStore are detached copies; changing
 * them has no effect on the journal.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class Operation {

    private long id;
    private OperationSource source;
    private String actor;
    private String sessionId;
    private String command;
    private String tool;
    private Map<String, Object> arguments = new LinkedHashMap<>();
    private String projectId;
    private Risk risk = Risk.LOW;
    private boolean approvalRequired;
    private OperationStatus status = OperationStatus.QUEUED;
    private long createdAt;
    private long updatedAt;
    private Long approvedAt;
    private String approvedBy;
    private String resultExcerpt;
    private String error;
    // Which resolver branch produced the credential; never the secret itself.
    private String credentialScope;

    private String undoCommand;
    private Map<String, Object> undoArguments;
    private Long undoOf;
    private Long undoOperationId;
    private Long undoneAt;
    private String undoneBy;

    public Operation() {
    }

    public Operation copy() {
        Operation c = new Operation();
        c.id = id;
        c.source = source;
        c.actor = actor;
        c.sessionId = sessionId;
        c.command = command;
        c.tool = tool;
        c.arguments = arguments != null ? new LinkedHashMap<>(arguments) : new LinkedHashMap<>();
        c.projectId = projectId;
        c.risk = risk;
        c.approvalRequired = approvalRequired;
        c.status = status;
        c.createdAt = createdAt;
        c.updatedAt = updatedAt;
        c.approvedAt = approvedAt;
        c.approvedBy = approvedBy;
        c.resultExcerpt = resultExcerpt;
        c.error = error;
        c.credentialScope = credentialScope;
        c.undoCommand = undoCommand;
        c.undoArguments = undoArguments != null ? new LinkedHashMap<>(undoArguments) : null;
        c.undoOf = undoOf;
        c.undoOperationId = undoOperationId;
        c.undoneAt = undoneAt;
        c.undoneBy = undoneBy;
        return c;
    }

    public boolean isUndoable() {
        return status == OperationStatus.COMPLETED
            && undoCommand != null
            && undoneAt == null
            && undoOperationId == null;
    }

    public long getId() {
        return id;
    }

    public void setId(long id) {
        this.id = id;
    }

    public OperationSource getSource() {
        return source;
    }

    public void setSource(OperationSource source) {
        this.source = source;
    }

    public String getActor() {
        return actor;
    }

    public void setActor(String actor) {
        this.actor = actor;
    }

    public String getSessionId() {
        return sessionId;
    }

    public void setSessionId(String sessionId) {
        this.sessionId = sessionId;
    }

    public String getCommand() {
        return command;
    }

    public void setCommand(String command) {
        this.command = command;
    }

    public String getTool() {
        return tool;
    }

    public void setTool(String tool) {
        this.tool = tool;
    }

    public Map<String, Object> getArguments() {
        return arguments;
    }

    public void setArguments(Map<String, Object> arguments) {
        this.arguments = arguments;
    }

    public String getProjectId() {
        return projectId;
    }

    public void setProjectId(String projectId) {
        this.projectId = projectId;
    }

    public Risk getRisk() {
        return risk;
    }

    public void setRisk(Risk risk) {
        this.risk = risk;
    }

    public boolean isApprovalRequired() {
        return approvalRequired;
    }

    public void setApprovalRequired(boolean approvalRequired) {
        this.approvalRequired = approvalRequired;
    }

    public OperationStatus getStatus() {
        return status;
    }

    public void setStatus(OperationStatus status) {
        this.status = status;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(long createdAt) {
        this.createdAt = createdAt;
    }

    public long getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(long updatedAt) {
        this.updatedAt = updatedAt;
    }

    public Long getApprovedAt() {
        return approvedAt;
    }

    public void setApprovedAt(Long approvedAt) {
        this.approvedAt = approvedAt;
    }

    public String getApprovedBy() {
        return approvedBy;
    }

    public void setApprovedBy(String approvedBy) {
        this.approvedBy = approvedBy;
    }

    public String getResultExcerpt() {
        return resultExcerpt;
    }

    public void setResultExcerpt(String resultExcerpt) {
        this.resultExcerpt = resultExcerpt;
    }

    public String getError() {
        return error;
    }

    public void setError(String error) {
        this.error = error;
    }

    public String getCredentialScope() {
        return credentialScope;
    }

    public void setCredentialScope(String credentialScope) {
        this.credentialScope = credentialScope;
    }

    public String getUndoCommand() {
        return undoCommand;
    }

    public void setUndoCommand(String undoCommand) {
        this.undoCommand = undoCommand;
    }

    public Map<String, Object> getUndoArguments() {
        return undoArguments;
    }

    public void setUndoArguments(Map<String, Object> undoArguments) {
        this.undoArguments = undoArguments;
    }

    public Long getUndoOf() {
        return undoOf;
    }

    public void setUndoOf(Long undoOf) {
        this.undoOf = undoOf;
    }

    public Long getUndoOperationId() {
        return undoOperationId;
    }

    public void setUndoOperationId(Long undoOperationId) {
        this.undoOperationId = undoOperationId;
    }

    public Long getUndoneAt() {
        return undoneAt;
    }

    public void setUndoneAt(Long undoneAt) {
        this.undoneAt = undoneAt;
    }

    public String getUndoneBy() {
        return undoneBy;
    }

    public void setUndoneBy(String undoneBy) {
        this.undoneBy = undoneBy;
    }

    @Override
    public String toString() {
        return "Operation{" +
            "id=" + id +
            ", command='" + command + '\'' +
            ", tool='" + tool + '\'' +
            ", status=" + status +
            ", risk=" + risk +
            ", source=" + source +
            '}';
    }
}
