package me.go_gradually.techinterview.domain.repetition;

import me.go_gradually.techinterview.domain.interview.Difficulty;
import me.go_gradually.techinterview.domain.interview.InterviewPhase;
import me.go_gradually.techinterview.domain.interview.TopicArea;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Append-only log of the questions asked in one interview, used to keep the next
 * question from circling back to the same topic or wording.
 */
public class RepetitionGuard {
    private final RepetitionSettings settings;
    private final KeywordExtractor keywordExtractor;
    private final List<QuestionRecord> log = new ArrayList<>();
    private final Map<TopicArea, Integer> topicFrequency = new LinkedHashMap<>();
    private final Set<TopicArea> failedTopics = new LinkedHashSet<>();

    public RepetitionGuard(RepetitionSettings settings) {
        if (settings == null) {
            throw new IllegalArgumentException("Repetition settings are required");
        }
        this.settings = settings;
        this.keywordExtractor = new KeywordExtractor(settings);
    }

    public QuestionRecord record(String questionText,
                                 TopicArea topic,
                                 InterviewPhase phase,
                                 Difficulty difficulty,
                                 Instant askedAt) {
        TopicArea area = topic == null ? TopicArea.GENERAL : topic;
        QuestionRecord record = new QuestionRecord(questionText, area, keywordExtractor.extract(questionText),
                phase, difficulty, askedAt);
        log.add(record);
        topicFrequency.merge(area, 1, Integer::sum);
        return record;
    }

    public boolean isRepetitive(String proposedText, TopicArea proposedTopic) {
        TopicArea area = proposedTopic == null ? TopicArea.GENERAL : proposedTopic;
        if (frequency(area) >= settings.topicLimit()) {
            return true;
        }
        Set<String> proposed = keywordExtractor.extract(proposedText);
        if (proposed.isEmpty()) {
            return false;
        }
        for (QuestionRecord recent : recentRecords()) {
            int shared = countShared(proposed, recent.keywords());
            double ratio = (double) shared / proposed.size();
            if (shared >= settings.minSharedKeywords() && ratio > settings.overlapRatio()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Candidate topics worth switching to, least asked first. Ties keep candidate order.
     */
    public List<TopicArea> alternatives(TopicArea currentTopic, Collection<TopicArea> candidateTopics) {
        if (candidateTopics == null) {
            return List.of();
        }
        return candidateTopics.stream()
                .filter(topic -> topic != null && !topic.equals(currentTopic))
                .distinct()
                .filter(topic -> !failedTopics.contains(topic))
                .filter(topic -> frequency(topic) < settings.alternativeCeiling())
                .sorted(Comparator.comparingInt(this::frequency))
                .toList();
    }

    public void markFailed(TopicArea topic) {
        if (topic != null) {
            failedTopics.add(topic);
        }
    }

    public int frequency(TopicArea topic) {
        return topicFrequency.getOrDefault(topic, 0);
    }

    public List<QuestionRecord> getLog() {
        return Collections.unmodifiableList(log);
    }

    public Map<TopicArea, Integer> getTopicFrequency() {
        return Collections.unmodifiableMap(topicFrequency);
    }

    public Set<TopicArea> getFailedTopics() {
        return Collections.unmodifiableSet(failedTopics);
    }

    public List<QuestionRecord> recentRecords() {
        int from = Math.max(0, log.size() - settings.recentWindow());
        return Collections.unmodifiableList(log.subList(from, log.size()));
    }

    public Set<String> keywordsOf(String text) {
        return keywordExtractor.extract(text);
    }

    private static int countShared(Set<String> proposed, Set<String> recorded) {
        int shared = 0;
        for (String keyword : proposed) {
            if (recorded.contains(keyword)) {
                shared += 1;
            }
        }
        return shared;
    }
}
