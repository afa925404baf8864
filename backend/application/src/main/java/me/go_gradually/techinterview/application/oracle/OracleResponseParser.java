package me.go_gradually.techinterview.application.oracle;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.go_gradually.techinterview.domain.interview.Difficulty;
import me.go_gradually.techinterview.domain.interview.TopicArea;
import me.go_gradually.techinterview.domain.oracle.AdaptationNeed;
import me.go_gradually.techinterview.domain.oracle.AnswerAnalysis;
import me.go_gradually.techinterview.domain.oracle.InterviewStatus;
import me.go_gradually.techinterview.domain.oracle.OracleDecision;
import me.go_gradually.techinterview.domain.oracle.TimeManagement;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decodes the oracle's free-text reply into an {@link OracleDecision}. A fenced JSON block
 * wins over a bare object; missing optional fields are defaulted.
 */
public class OracleResponseParser {
    private static final Pattern FENCED = Pattern.compile("```(?:json)?\\s*(\\{.*?})\\s*```", Pattern.DOTALL);

    private final ObjectMapper objectMapper;

    public OracleResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Optional<OracleDecision> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        for (String candidate : candidates(raw)) {
            Optional<JsonNode> root = readObject(candidate);
            if (root.isPresent()) {
                return Optional.of(toDecision(root.get()));
            }
        }
        return Optional.empty();
    }

    private List<String> candidates(String raw) {
        List<String> candidates = new ArrayList<>();
        Matcher fenced = FENCED.matcher(raw);
        if (fenced.find()) {
            candidates.add(fenced.group(1));
        }
        int start = raw.indexOf('{');
        while (start >= 0) {
            String balanced = balancedObject(raw, start);
            if (balanced == null) {
                break;
            }
            candidates.add(balanced);
            start = raw.indexOf('{', start + balanced.length());
        }
        int first = raw.indexOf('{');
        int last = raw.lastIndexOf('}');
        if (first >= 0 && last > first) {
            candidates.add(raw.substring(first, last + 1));
        }
        return candidates;
    }

    static String balancedObject(String raw, int start) {
        int depth = 0;
        boolean inString = false;
        boolean escaped = false;
        for (int i = start; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            if (c == '"') {
                inString = true;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return raw.substring(start, i + 1);
                }
            }
        }
        return null;
    }

    private Optional<JsonNode> readObject(String json) {
        try {
            JsonNode node = objectMapper.readTree(json);
            return node != null && node.isObject() ? Optional.of(node) : Optional.empty();
        } catch (Exception e) {
            return Optional.empty();
        }
    }

    private OracleDecision toDecision(JsonNode root) {
        return new OracleDecision(
                InterviewStatus.fromCode(root.path("interview_status").asText("")),
                root.path("current_phase").asText(""),
                root.path("next_question").asText(""),
                TopicArea.ofOrGeneral(root.path("question_area").asText("")),
                Difficulty.fromCode(root.path("question_difficulty").asText("")).orElse(null),
                toAnalysis(root.path("previous_answer_analysis")),
                TimeManagement.fromCode(root.path("time_management").asText("")),
                AdaptationNeed.fromCode(root.path("adaptation_needed").asText("")),
                texts(root.path("interview_plan")),
                root.path("current_area").asText(""),
                root.path("interviewer_notes").asText(""));
    }

    private AnswerAnalysis toAnalysis(JsonNode node) {
        if (!node.isObject()) {
            return AnswerAnalysis.empty();
        }
        String notes = node.has("analysis_notes")
                ? node.path("analysis_notes").asText("")
                : node.path("notes").asText("");
        return new AnswerAnalysis(
                node.path("technical_score").asDouble(0),
                node.path("communication_score").asDouble(0),
                node.path("confidence_score").asDouble(0),
                node.path("depth_score").asDouble(0),
                node.path("practical_experience").asDouble(0),
                texts(node.path("red_flags")),
                texts(node.path("strengths_shown")),
                notes);
    }

    private List<String> texts(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node.isArray()) {
            for (JsonNode item : node) {
                if (item.isTextual() || item.isNumber()) {
                    values.add(item.asText());
                }
            }
        } else if (node.isTextual()) {
            values.add(node.asText());
        }
        return values;
    }
}
