package me.go_gradually.techinterview.infrastructure.oracle.llm;

import me.go_gradually.techinterview.infrastructure.shared.config.AppProperties;

final class OpenAiLlmLogFormatter {
    private static final int DEFAULT_RESPONSE_PREVIEW_CHARS = 1024;

    private final int responsePreviewChars;
    private final boolean fullBody;
    private final boolean logSuccessAtFine;

    OpenAiLlmLogFormatter(int responsePreviewChars, boolean fullBody, boolean logSuccessAtFine) {
        this.responsePreviewChars = Math.max(0, responsePreviewChars);
        this.fullBody = fullBody;
        this.logSuccessAtFine = logSuccessAtFine;
    }

    static OpenAiLlmLogFormatter from(AppProperties properties) {
        if (properties == null || properties.getIntegrations() == null || properties.getIntegrations().getOpenai() == null) {
            return defaults();
        }
        AppProperties.OpenAi.Logging logging = properties.getIntegrations().getOpenai().getLogging();
        if (logging == null) {
            return defaults();
        }
        return new OpenAiLlmLogFormatter(logging.getResponsePreviewChars(), logging.isFullBody(), logging.isLogSuccessAtFine());
    }

    static OpenAiLlmLogFormatter defaults() {
        return new OpenAiLlmLogFormatter(DEFAULT_RESPONSE_PREVIEW_CHARS, false, true);
    }

    boolean shouldLogSuccessAtFine() {
        return logSuccessAtFine;
    }

    /**
     * Single-line preview; newlines are escaped and the text is cut unless full bodies are enabled.
     */
    String preview(String body) {
        if (body == null || body.isBlank()) {
            return "";
        }
        String singleLine = body.replace("\r", "\\r").replace("\n", "\\n");
        if (fullBody || responsePreviewChars == 0 || singleLine.length() <= responsePreviewChars) {
            return singleLine;
        }
        return singleLine.substring(0, responsePreviewChars) + "...(truncated)";
    }
}
