package me.go_gradually.techinterview.infrastructure.oracle.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.go_gradually.techinterview.infrastructure.shared.config.AppProperties;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OpenAiLlmClientTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private MockWebServer server;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
    }

    private OpenAiLlmClient client() {
        return new OpenAiLlmClient(WebClient.builder().baseUrl(server.url("/").toString()).build(), new AppProperties());
    }

    @Test
    void provider_returnsOpenAi() {
        assertEquals("openai", client().provider());
    }

    @Test
    void generate_postsChatCompletionAndReturnsContent() throws Exception {
        server.enqueue(new MockResponse()
                .setHeader("Content-Type", "application/json")
                .setBody("{\"id\":\"chatcmpl-1\",\"choices\":[{\"message\":{\"role\":\"assistant\",\"content\":\"{\\\"next_question\\\":\\\"Why?\\\"}\"}}]}"));

        String result = client().generate("api-key", "gpt-4o", "system rules", "context json");

        assertEquals("{\"next_question\":\"Why?\"}", result);
        RecordedRequest request = server.takeRequest();
        assertEquals("POST", request.getMethod());
        assertEquals("/v1/chat/completions", request.getPath());
        assertEquals("Bearer api-key", request.getHeader("Authorization"));
        JsonNode payload = objectMapper.readTree(request.getBody().readUtf8());
        assertEquals("gpt-4o", payload.path("model").asText());
        assertEquals("system", payload.path("messages").path(0).path("role").asText());
        assertEquals("system rules", payload.path("messages").path(0).path("content").asText());
        assertEquals("context json", payload.path("messages").path(1).path("content").asText());
        assertEquals("json_object", payload.path("response_format").path("type").asText());
        assertEquals(0.3, payload.path("temperature").asDouble(), 1e-9);
    }

    @Test
    void generate_blankModel_usesDefaultModel() throws Exception {
        server.enqueue(new MockResponse()
                .setHeader("Content-Type", "application/json")
                .setBody("{\"choices\":[{\"message\":{\"content\":\"{}\"}}]}"));

        client().generate("api-key", " ", "sys", "user");

        JsonNode payload = objectMapper.readTree(server.takeRequest().getBody().readUtf8());
        assertEquals("gpt-4o-mini", payload.path("model").asText());
    }

    @Test
    void generate_errorStatus_surfacesApiMessage() {
        server.enqueue(new MockResponse()
                .setResponseCode(401)
                .setHeader("Content-Type", "application/json")
                .setBody("{\"error\":{\"message\":\"Incorrect API key provided\"}}"));

        IllegalStateException error = assertThrows(IllegalStateException.class,
                () -> client().generate("bad-key", "gpt-4o-mini", "sys", "user"));

        assertTrue(error.getMessage().contains("status=401"));
        assertTrue(error.getMessage().contains("Incorrect API key provided"));
    }

    @Test
    void generate_missingContent_throws() {
        server.enqueue(new MockResponse()
                .setHeader("Content-Type", "application/json")
                .setBody("{\"choices\":[]}"));

        assertThrows(IllegalStateException.class, () -> client().generate("api-key", "gpt-4o-mini", "sys", "user"));
    }
}
