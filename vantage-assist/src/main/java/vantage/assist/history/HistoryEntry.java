package vantage.assist.history;

import com.fasterxml.jackson.annotation.JsonInclude;
import vantage.assist.orchestrator.AssistantContext;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record HistoryEntry(
        String requestId,
        String question,
        String answer,
        String tool,
        String provider,
        AssistantContext context,
        Instant askedAt
) {}
