package vantage.assist.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import vantage.assist.llm.GeminiProviderClient;
import vantage.assist.llm.OpenAiProviderClient;
import vantage.assist.llm.ProviderClient;
import vantage.assist.llm.ProviderSettings;
import vantage.assist.resilience.CircuitBreaker;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public class ProviderClientFactory {
    private static final Logger log = LoggerFactory.getLogger(ProviderClientFactory.class);

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ProviderClientFactory(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public List<ProviderClient> createAll(List<ProviderSettings> settings) {
        List<ProviderClient> clients = new ArrayList<>();
        for (ProviderSettings s : settings) {
            if (!s.isUsable()) {
                log.info("Provider {} disabled (enabled={}, api key present={})",
                        s.name(), s.enabled(), s.apiKey() != null && !s.apiKey().isBlank());
                continue;
            }
            clients.add(create(s));
            log.info("Provider {} registered at priority {} type={} model={} max_retries={} timeout={}",
                    s.name(), clients.size(), s.type(), s.model(), s.maxRetries(), s.timeout());
        }
        return List.copyOf(clients);
    }

    public ProviderClient create(ProviderSettings settings) {
        CircuitBreaker breaker = new CircuitBreaker(
                settings.name(),
                settings.circuitFailureThreshold(),
                settings.circuitCooldown(),
                clock
        );
        String type = settings.type() == null ? "" : settings.type().trim().toLowerCase(Locale.ROOT);
        return switch (type) {
            case GeminiProviderClient.TYPE -> new GeminiProviderClient(settings, objectMapper, breaker);
            case OpenAiProviderClient.TYPE -> new OpenAiProviderClient(settings, objectMapper, breaker);
            default -> throw new IllegalArgumentException(
                    "Unknown provider type '" + settings.type() + "' for provider " + settings.name());
        };
    }
}
