package vantage.assist.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import vantage.assist.cache.ResponseCache;
import vantage.assist.guidance.GuidanceCatalog;
import vantage.assist.guidance.ToolResolver;
import vantage.assist.history.RecentHistory;
import vantage.assist.llm.ProviderClient;
import vantage.assist.orchestrator.FallbackOrchestrator;

import java.time.Clock;
import java.util.List;

@Configuration
public class AssistantConfiguration {

    @Bean
    public Clock assistantClock() {
        return Clock.systemUTC();
    }

    @Bean
    public GuidanceCatalog guidanceCatalog(
            ObjectMapper objectMapper,
            @Value("${vantage.assist.guidance-location:" + GuidanceCatalog.DEFAULT_LOCATION + "}") String location
    ) {
        return GuidanceCatalog.load(objectMapper, location);
    }

    @Bean
    public ToolResolver toolResolver(GuidanceCatalog catalog) {
        return new ToolResolver(catalog);
    }

    @Bean
    public ResponseCache responseCache(AssistantProperties properties, Clock clock) {
        return new ResponseCache(properties.cache().ttl(), properties.cache().maxEntries(), clock);
    }

    @Bean
    public FallbackOrchestrator fallbackOrchestrator(
            GuidanceCatalog catalog,
            ToolResolver toolResolver,
            ResponseCache cache,
            AssistantProperties properties,
            ObjectMapper objectMapper,
            Clock clock
    ) {
        List<ProviderClient> providers = new ProviderClientFactory(objectMapper, clock)
                .createAll(properties.providers());
        return new FallbackOrchestrator(catalog, toolResolver, cache, providers);
    }

    @Bean
    public RecentHistory recentHistory(AssistantProperties properties) {
        AssistantProperties.History history = properties.history();
        return new RecentHistory(history.maxEntries(), history.maxSessions(), history.idleTimeout());
    }
}
