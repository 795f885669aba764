package vantage.assist.guidance;

import java.util.List;
import java.util.Locale;

public record ToolGuidance(
        String name,
        String title,
        String description,
        List<String> keywords,
        List<String> usage,
        String example
) {
    public ToolGuidance {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("tool name must not be blank");
        }
        name = name.trim().toLowerCase(Locale.ROOT);
        title = title == null ? name : title;
        description = description == null ? "" : description;
        keywords = keywords == null ? List.of() : keywords.stream().map(k -> k.toLowerCase(Locale.ROOT)).toList();
        usage = usage == null ? List.of() : List.copyOf(usage);
        example = example == null ? "" : example;
    }
}
