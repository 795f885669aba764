package vantage.assist.orchestrator;

import java.util.ArrayList;
import java.util.List;

public record AssistantContext(
        String tool,
        String target,
        String summary,
        String timestamp
) {
    public static final AssistantContext EMPTY = new AssistantContext(null, null, null, null);

    public AssistantContext {
        tool = blankToNull(tool);
        target = blankToNull(target);
        summary = blankToNull(summary);
        timestamp = blankToNull(timestamp);
    }

    public static AssistantContext orEmpty(AssistantContext context) {
        return context == null ? EMPTY : context;
    }

    public boolean isEmpty() {
        return tool == null && target == null && summary == null;
    }

    public String contextLine() {
        List<String> parts = new ArrayList<>(3);
        if (tool != null) {
            parts.add("Latest " + tool.replace('_', ' '));
        }
        if (target != null) {
            parts.add("on " + target);
        }
        if (summary != null) {
            parts.add("(" + summary + ")");
        }
        return String.join(" ", parts).trim();
    }

    /** Compact cache-scope key; the timestamp is deliberately excluded. */
    public String fingerprint() {
        if (isEmpty()) {
            return "";
        }
        return nullToEmpty(tool) + "|" + nullToEmpty(target) + "|" + nullToEmpty(summary);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
