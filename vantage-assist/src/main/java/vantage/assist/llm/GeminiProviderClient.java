package vantage.assist.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import vantage.assist.resilience.CircuitBreaker;

import java.net.URI;
import java.net.http.HttpRequest;

public class GeminiProviderClient extends AbstractHttpProviderClient {
    public static final String TYPE = "gemini";
    static final String DEFAULT_ENDPOINT = "https://generativelanguage.googleapis.com/v1beta/models";

    private final URI uri;

    public GeminiProviderClient(ProviderSettings settings, ObjectMapper objectMapper, CircuitBreaker circuitBreaker) {
        super(settings, objectMapper, defaultHttpClient(settings), circuitBreaker);
        String base = settings.endpointOr(DEFAULT_ENDPOINT);
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        this.uri = URI.create(base + "/" + settings.model() + ":generateContent");
    }

    @Override
    protected HttpRequest.Builder newRequest() {
        return HttpRequest.newBuilder()
                .uri(uri)
                .header("x-goog-api-key", settings.apiKey());
    }

    @Override
    protected String buildPayload(String prompt) throws JsonProcessingException {
        ObjectNode body = objectMapper.createObjectNode();
        body.putArray("contents")
                .addObject()
                .putArray("parts")
                .addObject()
                .put("text", prompt);
        body.putObject("generationConfig")
                .put("temperature", settings.temperature())
                .put("maxOutputTokens", settings.maxOutputTokens());
        return objectMapper.writeValueAsString(body);
    }

    @Override
    protected String extractText(JsonNode root) {
        JsonNode parts = root.path("candidates").path(0).path("content").path("parts");
        StringBuilder text = new StringBuilder();
        for (JsonNode part : parts) {
            JsonNode value = part.get("text");
            if (value != null && value.isTextual()) {
                text.append(value.asText());
            }
        }
        return text.toString();
    }
}
