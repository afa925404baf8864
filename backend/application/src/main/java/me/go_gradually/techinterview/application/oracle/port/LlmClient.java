package me.go_gradually.techinterview.application.oracle.port;

public interface LlmClient {
    String provider();

    String generate(String apiKey, String model, String systemPrompt, String userPrompt) throws Exception;
}
