package vantage.assist.api.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import vantage.assist.guidance.ToolGuidance;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record GuidanceLookupResponse(
        String tool,
        String title,
        String description,
        List<String> usage,
        String example,
        @JsonProperty("supported_tools") List<String> supportedTools
) {
    public static GuidanceLookupResponse of(ToolGuidance guidance) {
        return new GuidanceLookupResponse(
                guidance.name(),
                guidance.title(),
                guidance.description(),
                guidance.usage(),
                guidance.example(),
                null
        );
    }

    public static GuidanceLookupResponse notFound(List<String> supportedTools) {
        return new GuidanceLookupResponse(
                null,
                "Tool guidance not found",
                "Provide one of the supported tool names.",
                null,
                null,
                supportedTools
        );
    }
}
