package vantage.assist.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import vantage.assist.resilience.CircuitBreaker;

import java.net.URI;
import java.net.http.HttpRequest;

public class OpenAiProviderClient extends AbstractHttpProviderClient {
    public static final String TYPE = "openai";
    static final String DEFAULT_ENDPOINT = "https://api.openai.com/v1/chat/completions";

    private final URI uri;

    public OpenAiProviderClient(ProviderSettings settings, ObjectMapper objectMapper, CircuitBreaker circuitBreaker) {
        super(settings, objectMapper, defaultHttpClient(settings), circuitBreaker);
        this.uri = URI.create(settings.endpointOr(DEFAULT_ENDPOINT));
    }

    @Override
    protected HttpRequest.Builder newRequest() {
        return HttpRequest.newBuilder()
                .uri(uri)
                .header("Authorization", "Bearer " + settings.apiKey());
    }

    @Override
    protected String buildPayload(String prompt) throws JsonProcessingException {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", settings.model());
        body.put("temperature", settings.temperature());
        body.put("max_tokens", settings.maxOutputTokens());
        body.putArray("messages")
                .addObject()
                .put("role", "user")
                .put("content", prompt);
        return objectMapper.writeValueAsString(body);
    }

    @Override
    protected String extractText(JsonNode root) {
        return root.path("choices").path(0).path("message").path("content").asText("");
    }
}
