package vantage.assist.api.model;

import vantage.assist.orchestrator.AssistantContext;

public record AssistantRequest(
        String question,
        String tool,
        AssistantContext context
) {
    public String safeQuestion() {
        return question == null ? "" : question;
    }
}
