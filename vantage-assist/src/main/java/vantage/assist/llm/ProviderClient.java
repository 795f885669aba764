package vantage.assist.llm;

import vantage.assist.resilience.CircuitBreaker;

import java.util.Optional;

public interface ProviderClient {

    String name();

    /**
     * Generates a completion with bounded retries. Returns empty when the
     * provider is unavailable for this prompt; never throws for provider
     * failures.
     */
    Optional<String> complete(String prompt);

    CircuitBreaker circuitBreaker();

    default boolean isAvailable() {
        return !circuitBreaker().isOpen();
    }
}
