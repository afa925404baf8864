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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Chat Completions adapter. The JSON response format is requested so the reply is a bare object.
 */
@Component
public class OpenAiLlmClient implements LlmClient {
    private static final String DEFAULT_CHAT_MODEL = "gpt-4o-mini";
    private static final Logger log = Logger.getLogger(OpenAiLlmClient.class.getName());

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final OpenAiLlmLogFormatter logFormatter;
    private final WebClient webClient;
    private final Double temperature;

    public OpenAiLlmClient(@Qualifier("openAiWebClient") WebClient webClient, AppProperties properties) {
        this.webClient = webClient;
        this.logFormatter = OpenAiLlmLogFormatter.from(properties);
        this.temperature = properties.getIntegrations().getOpenai().getTemperature();
    }

    @Override
    public String provider() {
        return "openai";
    }

    @Override
    public String generate(String apiKey, String model, String systemPrompt, String userPrompt) throws Exception {
        String resolvedModel = resolveChatModel(model);
        Map<String, Object> payload = requestPayload(resolvedModel, systemPrompt, userPrompt);
        log.fine(() -> "openai.llm.request model=" + resolvedModel + " promptChars=" + userPrompt.length());
        String responseBody;
        try {
            responseBody = webClient.post()
                    .uri("/v1/chat/completions")
                    .headers(headers -> headers.setBearerAuth(apiKey == null ? "" : apiKey))
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(payload)
                    .retrieve()
                    .bodyToMono(String.class)
                    .block();
        } catch (WebClientResponseException e) {
            throw new IllegalStateException("OpenAI request failed: status=" + e.getStatusCode().value()
                    + " message=" + resolveErrorMessage(e.getResponseBodyAsString()), e);
        }
        String content = extractContent(responseBody);
        logSuccess(resolvedModel, content);
        return content;
    }

    private Map<String, Object> requestPayload(String model, String systemPrompt, String userPrompt) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("model", model);
        List<Map<String, Object>> messages = new ArrayList<>();
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            messages.add(Map.of("role", "system", "content", systemPrompt));
        }
        messages.add(Map.of("role", "user", "content", userPrompt));
        payload.put("messages", messages);
        payload.put("response_format", Map.of("type", "json_object"));
        if (temperature != null) {
            payload.put("temperature", temperature);
        }
        return payload;
    }

    private String extractContent(String responseBody) throws Exception {
        JsonNode root = objectMapper.readTree(responseBody == null ? "{}" : responseBody);
        JsonNode content = root.path("choices").path(0).path("message").path("content");
        if (!content.isTextual() || content.asText().isBlank()) {
            throw new IllegalStateException("OpenAI response missing content");
        }
        return content.asText();
    }

    private void logSuccess(String model, String content) {
        if (!logFormatter.shouldLogSuccessAtFine() || !log.isLoggable(Level.FINE)) {
            return;
        }
        log.fine(() -> "openai.llm.response success model=" + model + " bodyPreview=" + logFormatter.preview(content));
    }

    private String resolveErrorMessage(String body) {
        if (body == null || body.isBlank()) {
            return "unknown";
        }
        try {
            String message = objectMapper.readTree(body).path("error").path("message").asText("");
            return message.isBlank() ? logFormatter.preview(body) : message;
        } catch (Exception e) {
            log.fine(() -> "openai.llm.error_body unparsable reason=" + e.getClass().getSimpleName());
            return logFormatter.preview(body);
        }
    }

    private String resolveChatModel(String model) {
        String candidate = model == null ? "" : model.trim();
        return candidate.isBlank() ? DEFAULT_CHAT_MODEL : candidate;
    }
}
