package vantage.assist.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import vantage.assist.llm.ProviderSettings;

import java.time.Duration;
import java.util.List;

@ConfigurationProperties(prefix = "vantage.assist")
public record AssistantProperties(
        @DefaultValue Cache cache,
        List<ProviderSettings> providers,
        @DefaultValue History history
) {
    public AssistantProperties {
        providers = providers == null ? List.of() : List.copyOf(providers);
    }

    public record Cache(
            @DefaultValue("10m") Duration ttl,
            @DefaultValue("256") int maxEntries
    ) {
        public Cache {
            if (ttl == null || ttl.isZero() || ttl.isNegative()) {
                throw new IllegalArgumentException("vantage.assist.cache.ttl must be > 0");
            }
            if (maxEntries <= 0) {
                throw new IllegalArgumentException("vantage.assist.cache.max-entries must be > 0");
            }
        }
    }

    public record History(
            @DefaultValue("20") int maxEntries,
            @DefaultValue("10000") long maxSessions,
            @DefaultValue("30m") Duration idleTimeout
    ) {
        public History {
            if (maxEntries <= 0) {
                throw new IllegalArgumentException("vantage.assist.history.max-entries must be > 0");
            }
            if (maxSessions <= 0) {
                throw new IllegalArgumentException("vantage.assist.history.max-sessions must be > 0");
            }
            if (idleTimeout == null || idleTimeout.isZero() || idleTimeout.isNegative()) {
                throw new IllegalArgumentException("vantage.assist.history.idle-timeout must be > 0");
            }
        }
    }
}
