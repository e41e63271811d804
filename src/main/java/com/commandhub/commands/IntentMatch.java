package com.commandhub.commands;

import java.util.Objects;

/**
 * Outcome of intent parsing. A null command means "no match": callers must
 * not fall back to a default command.
 */
public final class IntentMatch {

    private final String command;
    private final String projectId;
    private final double confidence;

    public IntentMatch(String command, String projectId, double confidence) {
        this.command = command;
        this.projectId = projectId;
        this.confidence = command == null ? 0.0 : confidence;
    }

    public static IntentMatch none(String projectId) {
        return new IntentMatch(null, projectId, 0.0);
    }

    public String getCommand() {
        return command;
    }

    public String getProjectId() {
        return projectId;
    }

    public double getConfidence() {
        return confidence;
    }

    public boolean isMatched() {
        return command != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IntentMatch)) return false;
        IntentMatch that = (IntentMatch) o;
        return Double.compare(that.confidence, confidence) == 0
            && Objects.equals(command, that.command)
            && Objects.equals(projectId, that.projectId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(command, projectId, confidence);
    }

    @Override
    public String toString() {
        return "IntentMatch{command=" + command + ", projectId=" + projectId + ", confidence=" + confidence + '}';
    }
}
