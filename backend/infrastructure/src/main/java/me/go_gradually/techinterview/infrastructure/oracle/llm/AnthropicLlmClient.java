package me.go_gradually.techinterview.infrastructure.oracle.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.go_gradually.techinterview.application.oracle.port.LlmClient;
import me.go_gradually.techinterview.infrastructure.shared.config.AppProperties;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Messages API adapter. Text blocks of the reply are joined in order.
 */
@Component
public class AnthropicLlmClient implements LlmClient {
    private static final String DEFAULT_MODEL = "claude-3-5-haiku-latest";
    private static final String API_VERSION = "2023-06-01";
    private static final Logger log = Logger.getLogger(AnthropicLlmClient.class.getName());

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final WebClient webClient;
    private final int maxTokens;

    public AnthropicLlmClient(@Qualifier("anthropicWebClient") WebClient webClient, AppProperties properties) {
        this.webClient = webClient;
        this.maxTokens = properties.getIntegrations().getAnthropic().getMaxTokens();
    }

    @Override
    public String provider() {
        return "anthropic";
    }

    @Override
    public String generate(String apiKey, String model, String systemPrompt, String userPrompt) throws Exception {
        String resolvedModel = model == null || model.isBlank() ? DEFAULT_MODEL : model.trim();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", resolvedModel);
        payload.put("max_tokens", maxTokens);
        payload.put("system", systemPrompt == null ? "" : systemPrompt);
        payload.put("messages", List.of(Map.of("role", "user", "content", userPrompt)));
        log.fine(() -> "anthropic.llm.request model=" + resolvedModel + " maxTokens=" + maxTokens);

        String responseBody;
        try {
            responseBody = webClient.post()
                    .uri("/v1/messages")
                    .header("x-api-key", apiKey == null ? "" : apiKey)
                    .header("anthropic-version", API_VERSION)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(payload)
                    .retrieve()
                    .bodyToMono(String.class)
                    .block();
        } catch (WebClientResponseException e) {
            throw new IllegalStateException("Anthropic request failed: status=" + e.getStatusCode().value()
                    + " type=" + errorField(e.getResponseBodyAsString(), "type")
                    + " message=" + errorField(e.getResponseBodyAsString(), "message"), e);
        }
        return joinText(responseBody, resolvedModel);
    }

    private String joinText(String responseBody, String model) throws Exception {
        JsonNode root = objectMapper.readTree(responseBody == null ? "{}" : responseBody);
        StringBuilder text = new StringBuilder();
        for (JsonNode block : root.path("content")) {
            if ("text".equals(block.path("type").asText())) {
                text.append(block.path("text").asText(""));
            }
        }
        if (text.length() == 0) {
            throw new IllegalStateException("Anthropic response missing content");
        }
        if ("max_tokens".equals(root.path("stop_reason").asText())) {
            log.warning(() -> "anthropic.llm.truncated model=" + model + " maxTokens=" + maxTokens);
        }
        return text.toString();
    }

    private String errorField(String body, String field) {
        if (body == null || body.isBlank()) {
            return "unknown";
        }
        try {
            String value = objectMapper.readTree(body).path("error").path(field).asText("");
            return value.isBlank() ? "unknown" : value;
        } catch (Exception e) {
            log.fine(() -> "anthropic.llm.error_body unparsable reason=" + e.getClass().getSimpleName());
            return "unknown";
        }
    }
}
