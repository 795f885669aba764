package vantage.assist.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import vantage.assist.resilience.CircuitBreaker;
import vantage.assist.resilience.CircuitState;
import vantage.assist.support.MutableClock;
import vantage.assist.support.StubProviderServer;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class GeminiProviderClientTest {
    private final MutableClock clock = MutableClock.startingAt("2024-05-01T10:00:00Z");

    @Test
    void shouldJoinCandidatePartsOnSuccess() throws Exception {
        String body = "{\"candidates\":[{\"content\":{\"parts\":[{\"text\":\"WHOIS shows \"},{\"text\":\"the registrar.\"}]}}]}";
        try (StubProviderServer server = new StubProviderServer(200, body)) {
            GeminiProviderClient client = client(server, 3, 10);

            Optional<String> result = client.complete("What is whois?");

            assertEquals(Optional.of("WHOIS shows the registrar."), result);
            assertEquals(1, server.hits());
            assertTrue(server.bodies().get(0).contains("What is whois?"));
            assertTrue(server.bodies().get(0).contains("\"maxOutputTokens\":220"));
            assertEquals("secret-key", server.credentials().get(0));
        }
    }

    @Test
    void shouldRetryServerErrorsAndCountEachFailure() throws Exception {
        try (StubProviderServer server = new StubProviderServer(503, "overloaded")) {
            GeminiProviderClient client = client(server, 3, 10);

            assertTrue(client.complete("q").isEmpty());

            assertEquals(3, server.hits());
            assertEquals(3, client.circuitBreaker().consecutiveFailures());
            assertEquals(CircuitState.CLOSED, client.circuitBreaker().state());
        }
    }

    @Test
    void shouldNotRetryOrCountClientErrors() throws Exception {
        try (StubProviderServer server = new StubProviderServer(400, "{\"error\":\"bad request\"}")) {
            GeminiProviderClient client = client(server, 3, 1);

            assertTrue(client.complete("q").isEmpty());

            assertEquals(1, server.hits());
            assertEquals(0, client.circuitBreaker().consecutiveFailures());
            assertEquals(CircuitState.CLOSED, client.circuitBreaker().state());
        }
    }

    @Test
    void shouldNotRetryOrCountMalformedBodies() throws Exception {
        try (StubProviderServer server = new StubProviderServer(200, "<html>oops</html>")) {
            GeminiProviderClient client = client(server, 3, 1);

            assertTrue(client.complete("q").isEmpty());
            server.respond(200, "{\"candidates\":[]}");
            assertTrue(client.complete("q").isEmpty());

            assertEquals(2, server.hits());
            assertEquals(0, client.circuitBreaker().consecutiveFailures());
        }
    }

    @Test
    void shouldAbortRetriesOnceCircuitOpens() throws Exception {
        try (StubProviderServer server = new StubProviderServer(500, "")) {
            GeminiProviderClient client = client(server, 5, 2);

            assertTrue(client.complete("q").isEmpty());
            assertEquals(2, server.hits());
            assertEquals(CircuitState.OPEN, client.circuitBreaker().state());

            assertTrue(client.complete("q").isEmpty());
            assertEquals(2, server.hits(), "open circuit must not reach the network");
            assertFalse(client.isAvailable());
        }
    }

    @Test
    void shouldTryOnceAfterCooldownAndClose() throws Exception {
        try (StubProviderServer server = new StubProviderServer(500, "")) {
            GeminiProviderClient client = client(server, 1, 1);
            assertTrue(client.complete("q").isEmpty());
            assertEquals(CircuitState.OPEN, client.circuitBreaker().state());

            server.respond(200, StubProviderServer.geminiReply("recovered"));
            clock.advance(Duration.ofSeconds(61));

            assertEquals(Optional.of("recovered"), client.complete("q"));
            assertEquals(2, server.hits());
            assertEquals(CircuitState.CLOSED, client.circuitBreaker().state());
        }
    }

    @Test
    void shouldResetFailuresAfterSuccess() throws Exception {
        try (StubProviderServer server = new StubProviderServer(200, StubProviderServer.geminiReply("ok"))) {
            GeminiProviderClient client = client(server, 1, 5);
            client.circuitBreaker().recordFailure();
            client.circuitBreaker().recordFailure();

            assertEquals(Optional.of("ok"), client.complete("q"));
            assertEquals(0, client.circuitBreaker().consecutiveFailures());
        }
    }

    @Test
    void shouldTreatConnectionRefusedAsTransient() throws Exception {
        String endpoint;
        try (StubProviderServer server = new StubProviderServer(200, "")) {
            endpoint = server.baseUrl() + "/v1beta/models";
        }
        GeminiProviderClient client = new GeminiProviderClient(
                settings(endpoint, 2, 10), new ObjectMapper(), breaker(10));

        assertTrue(client.complete("q").isEmpty());
        assertEquals(2, client.circuitBreaker().consecutiveFailures());
    }

    @Test
    void shouldSpaceRetriesLinearly() throws Exception {
        try (StubProviderServer server = new StubProviderServer(503, "busy")) {
            GeminiProviderClient client = new GeminiProviderClient(
                    settings(server.baseUrl() + "/v1beta/models", 3, 10, Duration.ofMillis(150)),
                    new ObjectMapper(), breaker(10));

            assertTrue(client.complete("q").isEmpty());

            List<Duration> gaps = server.gapsBetweenHits();
            assertEquals(2, gaps.size());
            assertTrue(gaps.get(0).toMillis() >= 150, "first wait was " + gaps.get(0));
            assertTrue(gaps.get(1).toMillis() >= 300, "second wait was " + gaps.get(1));
        }
    }

    @Test
    void shouldStopWithoutCountingWhenInterruptedDuringCall() throws Exception {
        try (StubProviderServer server = new StubProviderServer(200, StubProviderServer.geminiReply("late"))) {
            server.delay(Duration.ofMillis(500));
            GeminiProviderClient client = client(server, 3, 1);

            Thread.currentThread().interrupt();
            Optional<String> result = client.complete("q");
            boolean interrupted = Thread.interrupted();

            assertTrue(result.isEmpty());
            assertTrue(interrupted, "interrupt flag must survive the call");
            assertTrue(server.hits() <= 1);
            assertEquals(0, client.circuitBreaker().consecutiveFailures());
            assertEquals(CircuitState.CLOSED, client.circuitBreaker().state());
        }
    }

    @Test
    void shouldAbandonBackoffWhenInterrupted() throws Exception {
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
        try (StubProviderServer server = new StubProviderServer(503, "busy")) {
            GeminiProviderClient client = new GeminiProviderClient(
                    settings(server.baseUrl() + "/v1beta/models", 3, 10, Duration.ofSeconds(10)),
                    new ObjectMapper(), breaker(10));
            Thread caller = Thread.currentThread();
            scheduler.schedule(caller::interrupt, 300, TimeUnit.MILLISECONDS);

            long start = System.nanoTime();
            Optional<String> result = client.complete("q");
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
            boolean interrupted = Thread.interrupted();

            assertTrue(result.isEmpty());
            assertTrue(interrupted);
            assertEquals(1, server.hits());
            assertTrue(elapsedMs < 5_000, "backoff kept sleeping for " + elapsedMs + "ms");
        } finally {
            scheduler.shutdownNow();
            Thread.interrupted();
        }
    }

    @Test
    void shouldReleaseTrialWhenCallFailsUnexpectedly() throws Exception {
        try (StubProviderServer server = new StubProviderServer(500, "")) {
            GeminiProviderClient client = new GeminiProviderClient(
                    settings(server.baseUrl() + "/v1beta/models", 1, 1), new ObjectMapper(), breaker(1)) {
                @Override
                protected String extractText(JsonNode root) {
                    throw new IllegalStateException("unexpected body shape");
                }
            };
            assertTrue(client.complete("q").isEmpty());
            assertEquals(CircuitState.OPEN, client.circuitBreaker().state());

            server.respond(200, StubProviderServer.geminiReply("ok"));
            clock.advance(Duration.ofSeconds(61));

            assertTrue(client.complete("q").isEmpty());
            assertEquals(CircuitState.HALF_OPEN, client.circuitBreaker().state());
            assertEquals(1, client.circuitBreaker().consecutiveFailures());
            assertTrue(client.circuitBreaker().tryAcquire(), "trial slot must be free again");
        }
    }

    private GeminiProviderClient client(StubProviderServer server, int maxRetries, int threshold) {
        return new GeminiProviderClient(
                settings(server.baseUrl() + "/v1beta/models", maxRetries, threshold),
                new ObjectMapper(),
                breaker(threshold)
        );
    }

    private CircuitBreaker breaker(int threshold) {
        return new CircuitBreaker("gemini", threshold, Duration.ofSeconds(60), clock);
    }

    static ProviderSettings settings(String endpoint, int maxRetries, int threshold) {
        return settings(endpoint, maxRetries, threshold, Duration.ZERO);
    }

    static ProviderSettings settings(String endpoint, int maxRetries, int threshold, Duration retryBackoff) {
        return new ProviderSettings(
                "gemini",
                "gemini",
                true,
                "secret-key",
                endpoint,
                "gemini-test",
                maxRetries,
                retryBackoff,
                threshold,
                Duration.ofSeconds(60),
                Duration.ofSeconds(2),
                220,
                0.35
        );
    }
}
