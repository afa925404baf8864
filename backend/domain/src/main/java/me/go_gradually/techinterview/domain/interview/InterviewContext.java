package me.go_gradually.techinterview.domain.interview;

import me.go_gradually.techinterview.domain.profile.ProfileSummary;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything the oracle sees for one decision. Answers in {@code recentExchanges}
 * are already cut to the configured char cap.
 */
public record InterviewContext(String phase,
                               boolean opening,
                               ProfileSummary profile,
                               TimeView time,
                               String vacancyType,
                               List<String> interviewPlan,
                               List<String> coveredAreas,
                               List<ExchangeView> recentExchanges,
                               RepetitionView repetition,
                               StrategyView strategy,
                               int questionsCount,
                               String lastQuestion,
                               String lastAnswer) {
    public InterviewContext {
        phase = normalize(phase);
        vacancyType = normalize(vacancyType);
        interviewPlan = interviewPlan == null ? List.of() : List.copyOf(interviewPlan);
        coveredAreas = coveredAreas == null ? List.of() : List.copyOf(coveredAreas);
        recentExchanges = recentExchanges == null ? List.of() : List.copyOf(recentExchanges);
        lastQuestion = normalize(lastQuestion);
        lastAnswer = normalize(lastAnswer);
    }

    public record TimeView(double elapsedMinutes,
                           double remainingMinutes,
                           double maxMinutes,
                           String status,
                           String phaseStrategy,
                           String phaseStrategyGuidance) {
    }

    public record ExchangeView(String phase, String topic, String question, String answer) {
        public ExchangeView {
            phase = normalize(phase);
            topic = normalize(topic);
            question = normalize(question);
            answer = normalize(answer);
        }
    }

    public record RepetitionView(Map<String, Integer> topicFrequency,
                                 List<String> avoidTopics,
                                 List<String> recentQuestions) {
        public RepetitionView {
            topicFrequency = Collections.unmodifiableMap(new LinkedHashMap<>(topicFrequency));
            avoidTopics = List.copyOf(avoidTopics);
            recentQuestions = List.copyOf(recentQuestions);
        }
    }

    public record StrategyView(String currentDifficulty,
                               String strategy,
                               String approach,
                               String questionStyle,
                               String targetDifficulty) {
    }

    private static String normalize(String value) {
        return value == null ? "" : value.trim();
    }
}
