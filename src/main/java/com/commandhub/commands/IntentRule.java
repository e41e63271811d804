package com.commandhub.commands;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Keyword rule: matches when every needle occurs in the text, ignoring case.
 */
public final class IntentRule {

    private final List<String> needles;
    private final String command;
    private final double confidence;

    public IntentRule(List<String> needles, String command, double confidence) {
        if (needles == null || needles.isEmpty()) {
            throw new IllegalArgumentException("Intent rule for " + command + " needs at least one keyword");
        }
        if (confidence <= 0.0 || confidence >= 1.0) {
            throw new IllegalArgumentException("Intent rule confidence must be in (0, 1): " + confidence);
        }
        this.needles = needles.stream().map(n -> n.toLowerCase(Locale.ROOT)).collect(Collectors.toList());
        this.command = command;
        this.confidence = confidence;
    }

    public static IntentRule of(String command, double confidence, String... needles) {
        return new IntentRule(List.of(needles), command, confidence);
    }

    boolean matches(String lowerText) {
        for (String needle : needles) {
            if (!lowerText.contains(needle)) {
                return false;
            }
        }
        return true;
    }

    public List<String> getNeedles() {
        return needles;
    }

    public String getCommand() {
        return command;
    }

    public double getConfidence() {
        return confidence;
    }
}
