package vantage.assist.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import vantage.assist.resilience.CircuitBreaker;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Optional;

/**
 * Transient failures are retried with linear backoff and counted by the
 * circuit breaker. Everything else ends the call without touching the count.
 */
public abstract class AbstractHttpProviderClient implements ProviderClient {
    private static final Logger log = LoggerFactory.getLogger(AbstractHttpProviderClient.class);
    private static final int MAX_LOGGED_BODY = 300;

    protected final ProviderSettings settings;
    protected final ObjectMapper objectMapper;
    private final HttpClient httpClient;
    private final CircuitBreaker circuitBreaker;

    protected AbstractHttpProviderClient(
            ProviderSettings settings,
            ObjectMapper objectMapper,
            HttpClient httpClient,
            CircuitBreaker circuitBreaker
    ) {
        this.settings = settings;
        this.objectMapper = objectMapper;
        this.httpClient = httpClient;
        this.circuitBreaker = circuitBreaker;
    }

    protected static HttpClient defaultHttpClient(ProviderSettings settings) {
        return HttpClient.newBuilder()
                .connectTimeout(settings.timeout())
                .build();
    }

    protected abstract HttpRequest.Builder newRequest();

    protected abstract String buildPayload(String prompt) throws JsonProcessingException;

    /** Returns the completion text, or blank when the body carries none. */
    protected abstract String extractText(JsonNode root);

    @Override
    public String name() {
        return settings.name();
    }

    @Override
    public CircuitBreaker circuitBreaker() {
        return circuitBreaker;
    }

    @Override
    public Optional<String> complete(String prompt) {
        if (!circuitBreaker.tryAcquire()) {
            log.debug("Provider {} skipped, circuit open until {}", name(), circuitBreaker.openUntil());
            return Optional.empty();
        }

        int attempts = settings.maxRetries();
        for (int attempt = 1; attempt <= attempts; attempt++) {
            if (attempt > 1 && circuitBreaker.isOpen()) {
                log.info("Provider {} circuit opened by another caller, abandoning attempt {}", name(), attempt);
                return Optional.empty();
            }
            try {
                String text = callOnce(prompt);
                circuitBreaker.recordSuccess();
                log.debug("Provider {} answered on attempt {}", name(), attempt);
                return Optional.of(text);
            } catch (ProviderCallException e) {
                if (!e.kind().isTransient()) {
                    circuitBreaker.recordIgnored();
                    log.warn("Provider {} gave up on attempt {}: kind={} status={} {}",
                            name(), attempt, e.kind(), e.status(), e.getMessage());
                    return Optional.empty();
                }
                boolean opened = circuitBreaker.recordFailure();
                log.warn("Provider {} attempt {}/{} failed: kind={} status={} {}",
                        name(), attempt, attempts, e.kind(), e.status(), e.getMessage());
                if (opened) {
                    return Optional.empty();
                }
                if (attempt < attempts && !backoff(attempt)) {
                    return Optional.empty();
                }
            } catch (RuntimeException e) {
                circuitBreaker.recordIgnored();
                log.error("Provider {} failed unexpectedly on attempt {}", name(), attempt, e);
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    private String callOnce(String prompt) {
        HttpRequest request;
        try {
            String payload = buildPayload(prompt);
            request = newRequest()
                    .timeout(settings.timeout())
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(payload))
                    .build();
        } catch (JsonProcessingException e) {
            throw new ProviderCallException(ProviderFailureKind.CLIENT_ERROR, "could not encode request", e);
        }

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new ProviderCallException(ProviderFailureKind.TIMEOUT,
                    "no response within " + settings.timeout().toMillis() + "ms", e);
        } catch (IOException e) {
            throw new ProviderCallException(ProviderFailureKind.TRANSPORT, e.toString(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderCallException(ProviderFailureKind.CANCELLED, "interrupted", e);
        }

        int status = response.statusCode();
        if (status >= 500) {
            throw new ProviderCallException(ProviderFailureKind.SERVER_ERROR, status, truncate(response.body()), null);
        }
        if (status < 200 || status >= 300) {
            throw new ProviderCallException(ProviderFailureKind.CLIENT_ERROR, status, truncate(response.body()), null);
        }

        String text;
        try {
            text = extractText(objectMapper.readTree(response.body()));
        } catch (JsonProcessingException e) {
            throw new ProviderCallException(ProviderFailureKind.MALFORMED_RESPONSE, status, "unparseable body", e);
        }
        if (text == null || text.isBlank()) {
            throw new ProviderCallException(ProviderFailureKind.MALFORMED_RESPONSE, status, "no completion text", null);
        }
        return text.trim();
    }

    private boolean backoff(int attempt) {
        Duration delay = settings.retryBackoff().multipliedBy(attempt);
        if (delay.isZero()) {
            return true;
        }
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Provider {} backoff interrupted, abandoning call", name());
            return false;
        }
    }

    private static String truncate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() <= MAX_LOGGED_BODY ? body : body.substring(0, MAX_LOGGED_BODY) + "...";
    }
}
