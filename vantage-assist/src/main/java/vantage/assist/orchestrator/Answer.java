package vantage.assist.orchestrator;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record Answer(
        String answer,
        String tool,
        List<String> tips,
        String example,
        @JsonProperty("suggested_actions") List<String> suggestedActions,
        String confidence,
        AssistantContext context,
        String provider,
        @JsonProperty("available_tools") List<String> availableTools
) {
    public static final String PROVIDER_CACHE = "cache";
    public static final String PROVIDER_DETERMINISTIC = "deterministic";

    @JsonIgnore
    public boolean isCached() {
        return PROVIDER_CACHE.equals(provider);
    }

    @JsonIgnore
    public boolean isDeterministic() {
        return PROVIDER_DETERMINISTIC.equals(provider);
    }
}
