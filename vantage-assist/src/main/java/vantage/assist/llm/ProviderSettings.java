package vantage.assist.llm;

import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

public record ProviderSettings(
        String name,
        @DefaultValue("gemini") String type,
        @DefaultValue("true") boolean enabled,
        String apiKey,
        String endpoint,
        @DefaultValue("gemini-2.5-flash") String model,
        @DefaultValue("2") int maxRetries,
        @DefaultValue("1s") Duration retryBackoff,
        @DefaultValue("3") int circuitFailureThreshold,
        @DefaultValue("60s") Duration circuitCooldown,
        @DefaultValue("15s") Duration timeout,
        @DefaultValue("220") int maxOutputTokens,
        @DefaultValue("0.35") double temperature
) {
    public ProviderSettings {
        if (name == null || name.isBlank()) {
            name = type;
        }
        if (apiKey != null) {
            apiKey = apiKey.strip();
            if (apiKey.chars().anyMatch(c -> c < 0x20 || c == 0x7f)) {
                throw new IllegalArgumentException("api-key of provider " + name + " contains control characters");
            }
        }
        maxRetries = Math.max(1, maxRetries);
        retryBackoff = retryBackoff == null || retryBackoff.isNegative() ? Duration.ZERO : retryBackoff;
        circuitFailureThreshold = Math.max(1, circuitFailureThreshold);
        circuitCooldown = circuitCooldown == null || circuitCooldown.isNegative() ? Duration.ZERO : circuitCooldown;
        timeout = timeout == null || timeout.isZero() || timeout.isNegative() ? Duration.ofSeconds(15) : timeout;
    }

    public boolean isUsable() {
        return enabled && apiKey != null && !apiKey.isBlank();
    }

    public String endpointOr(String fallback) {
        return endpoint == null || endpoint.isBlank() ? fallback : endpoint;
    }
}
