package vantage.assist.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonUnwrapped;
import vantage.assist.orchestrator.Answer;

public record AssistantResponse(
        @JsonProperty("request_id") String requestId,
        @JsonUnwrapped Answer answer,
        @JsonProperty("processing_ms") long processingMs
) {}
