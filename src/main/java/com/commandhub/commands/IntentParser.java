package com.commandhub.commands;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Deterministic free-text classifier for the chat endpoint.
 *
 * A leading {@code /command} token is authoritative. Otherwise the ordered
 * rule table is scanned and the first rule whose keywords all occur wins.
 * No match yields a null command; nothing is guessed.
 */
public class IntentParser {

    private static final Pattern SLASH_COMMAND = Pattern.compile("^\\s*/([A-Za-z][\\w-]*)");
    private static final Pattern PROJECT_TAGGED = Pattern.compile("(?i)\\bproject[:=#-]([A-Za-z0-9_-]+)");
    private static final Pattern PROJECT_NUMERIC = Pattern.compile("(?i)\\bproject\\s*[:=#-]?\\s*(\\d[\\w-]*)");

    public static final List<IntentRule> DEFAULT_RULES = List.of(
        IntentRule.of("cleanup", 0.85, "cleanup"),
        IntentRule.of("cleanup", 0.8, "clean up"),
        IntentRule.of("insights", 0.8, "insight"),
        IntentRule.of("predict_completion", 0.75, "predict"),
        IntentRule.of("predict_completion", 0.75, "completion"),
        IntentRule.of("health_project", 0.7, "health"),
        IntentRule.of("patterns_work", 0.7, "pattern"),
        IntentRule.of("context_analyze", 0.65, "context"),
        IntentRule.of("list_flows", 0.7, "list", "flow"),
        IntentRule.of("status", 0.6, "status"),
        IntentRule.of("status", 0.55, "overview")
    );

    private final List<IntentRule> rules;

    public IntentParser() {
        this(DEFAULT_RULES);
    }

    public IntentParser(List<IntentRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public IntentMatch parse(String text, String projectHint) {
        String input = text != null ? text : "";
        String projectId = extractProjectId(input);
        if (projectId == null) {
            projectId = blankToNull(projectHint);
        }

        Matcher slash = SLASH_COMMAND.matcher(input);
        if (slash.find()) {
            return new IntentMatch(slash.group(1).toLowerCase(Locale.ROOT), projectId, 1.0);
        }

        String lower = input.toLowerCase(Locale.ROOT);
        for (IntentRule rule : rules) {
            if (rule.matches(lower)) {
                return new IntentMatch(rule.getCommand(), projectId, rule.getConfidence());
            }
        }
        return IntentMatch.none(projectId);
    }

    static String extractProjectId(String text) {
        Matcher tagged = PROJECT_TAGGED.matcher(text);
        if (tagged.find()) {
            return tagged.group(1);
        }
        Matcher numeric = PROJECT_NUMERIC.matcher(text);
        if (numeric.find()) {
            return numeric.group(1);
        }
        return null;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
