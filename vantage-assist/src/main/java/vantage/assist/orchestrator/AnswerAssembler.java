package vantage.assist.orchestrator;

import vantage.assist.guidance.GuidanceCatalog;
import vantage.assist.guidance.SuggestedActions;
import vantage.assist.guidance.ToolGuidance;

import java.util.Locale;

public class AnswerAssembler {
    static final String TOOL_CONFIDENCE = "92%";
    static final String GENERAL_CONFIDENCE = "90%";
    static final String UNAVAILABLE_CONFIDENCE = "0%";
    static final int DETERMINISTIC_CONFIDENCE_CAP = 85;
    static final String UNAVAILABLE_TEXT =
            "I'm having trouble reaching the assistant right now. Please try again in a moment.";

    private final GuidanceCatalog catalog;

    public AnswerAssembler(GuidanceCatalog catalog) {
        this.catalog = catalog;
    }

    public Answer generated(ToolGuidance guidance, String text, AssistantContext context, String provider) {
        if (guidance == null) {
            return new Answer(
                    text.trim(),
                    null,
                    null,
                    null,
                    SuggestedActions.DEFAULTS,
                    GENERAL_CONFIDENCE,
                    contextOrNull(context),
                    provider,
                    null
            );
        }
        return new Answer(
                text.trim(),
                guidance.name(),
                guidance.usage(),
                guidance.example(),
                SuggestedActions.forTool(guidance),
                TOOL_CONFIDENCE,
                contextOrNull(context),
                provider,
                null
        );
    }

    public Answer deterministic(ToolGuidance guidance, AssistantContext context) {
        String text = guidance.title() + " helps with " + guidance.description().toLowerCase(Locale.ROOT)
                + " Ask for more details or use " + guidance.example() + ".";
        String contextLine = AssistantContext.orEmpty(context).contextLine();
        if (!contextLine.isEmpty()) {
            text = contextLine + " " + text;
        }
        int confidence = Math.min(DETERMINISTIC_CONFIDENCE_CAP, 50 + guidance.usage().size() * 10);
        return new Answer(
                text,
                guidance.name(),
                guidance.usage(),
                guidance.example(),
                SuggestedActions.forTool(guidance),
                confidence + "%",
                contextOrNull(context),
                Answer.PROVIDER_DETERMINISTIC,
                null
        );
    }

    public Answer unavailable() {
        return new Answer(
                UNAVAILABLE_TEXT,
                null,
                null,
                null,
                SuggestedActions.DEFAULTS,
                UNAVAILABLE_CONFIDENCE,
                null,
                Answer.PROVIDER_DETERMINISTIC,
                catalog.supportedTools()
        );
    }

    private static AssistantContext contextOrNull(AssistantContext context) {
        return context == null || context.isEmpty() ? null : context;
    }
}
