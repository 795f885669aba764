package vantage.assist.service;

import org.springframework.stereotype.Component;
import vantage.assist.api.model.AssistantRequest;
import vantage.assist.history.RecentHistory;
import vantage.assist.orchestrator.AssistantContext;

@Component
public class AssistantContextResolver {
    private final RecentHistory history;

    public AssistantContextResolver(RecentHistory history) {
        this.history = history;
    }

    public ResolvedContext resolve(String sessionId, AssistantRequest request) {
        AssistantContext supplied = AssistantContext.orEmpty(request.context());
        if (!supplied.isEmpty()) {
            return new ResolvedContext(supplied, false);
        }
        return history.latestContext(sessionId)
                .map(ctx -> new ResolvedContext(ctx, true))
                .orElse(new ResolvedContext(AssistantContext.EMPTY, false));
    }

    public record ResolvedContext(AssistantContext context, boolean fromHistory) {}
}
