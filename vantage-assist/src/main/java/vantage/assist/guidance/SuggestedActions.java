package vantage.assist.guidance;

import java.util.ArrayList;
import java.util.List;

public final class SuggestedActions {
    public static final List<String> DEFAULTS = List.of(
            "Review /api/tool-guidance?tool=whois to learn how the WHOIS lookup works.",
            "Use /api/domain with a `fields` array to combine multiple tools in one request.",
            "Check the FAQ or documentation panels inside the dashboard for more tips."
    );

    private SuggestedActions() {
    }

    public static List<String> forTool(ToolGuidance guidance) {
        List<String> actions = new ArrayList<>(3);
        actions.add("Call `/api/tool-guidance?tool=" + guidance.name() + "` for step-by-step usage.");
        if (!guidance.example().isBlank()) {
            actions.add(guidance.example());
        }
        if ("domain".equals(guidance.name())) {
            actions.add("Include the `fields` payload to filter the diagnostics you need.");
        }
        return List.copyOf(actions);
    }
}
