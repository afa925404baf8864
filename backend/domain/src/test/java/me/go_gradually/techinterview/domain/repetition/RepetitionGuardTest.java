package me.go_gradually.techinterview.domain.repetition;

import me.go_gradually.techinterview.domain.interview.Difficulty;
import me.go_gradually.techinterview.domain.interview.InterviewPhase;
import me.go_gradually.techinterview.domain.interview.TopicArea;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RepetitionGuardTest {
    private static final Instant NOW = Instant.parse("2026-01-05T10:00:00Z");
    private static final TopicArea ALGORITHMS = TopicArea.of("algorithms");

    private final RepetitionGuard guard = new RepetitionGuard(RepetitionSettings.defaults());

    private void ask(String text, TopicArea topic) {
        guard.record(text, topic, InterviewPhase.VALIDATION, Difficulty.MEDIUM, NOW);
    }

    @Test
    void record_extractsKeywordsAndCountsTopic() {
        QuestionRecord record = guard.record("How would you index a large PostgreSQL table?",
                TopicArea.TECHNICAL_BASICS, InterviewPhase.EXPLORATION, Difficulty.EASY, NOW);

        assertEquals(Set.of("index", "large", "postgresql", "table"), record.keywords());
        assertEquals(1, guard.frequency(TopicArea.TECHNICAL_BASICS));
        assertEquals(1, guard.getLog().size());
    }

    @Test
    void isRepetitive_topicAskedThreeTimes_regardlessOfWording() {
        ask("Explain quicksort", ALGORITHMS);
        ask("Binary heaps?", ALGORITHMS);
        assertFalse(guard.isRepetitive("Completely unrelated wording", ALGORITHMS));

        ask("Graph traversal", ALGORITHMS);

        assertTrue(guard.isRepetitive("Completely unrelated wording", ALGORITHMS));
        assertTrue(guard.isRepetitive("", ALGORITHMS));
    }

    @Test
    void isRepetitive_keywordOverlapWithRecentQuestion() {
        ask("Describe database indexing strategies for large tables", TopicArea.TECHNICAL_BASICS);

        assertTrue(guard.isRepetitive("Database indexing strategies?", TopicArea.SYSTEM_DESIGN));
        assertFalse(guard.isRepetitive("Database replication lag and failover handling", TopicArea.SYSTEM_DESIGN));
    }

    @Test
    void isRepetitive_onlyComparesRecentWindow() {
        ask("Database indexing strategies", TopicArea.TECHNICAL_BASICS);
        ask("Kafka consumer groups", TopicArea.SYSTEM_DESIGN);
        ask("Team conflicts", TopicArea.SOFT_SKILLS);
        ask("Tell me about a recent project", TopicArea.PRACTICAL_EXPERIENCE);

        assertFalse(guard.isRepetitive("Database indexing strategies", TopicArea.SYSTEM_DESIGN));
    }

    @Test
    void isRepetitive_questionWithoutKeywordsNeverOverlaps() {
        ask("Why? How? What for?", TopicArea.GENERAL);

        assertFalse(guard.isRepetitive("Why? How? What for?", TopicArea.SOFT_SKILLS));
    }

    @Test
    void keywords_areRestrictedToConfiguredScript() {
        KeywordExtractor extractor = new KeywordExtractor(RepetitionSettings.defaults());

        assertEquals(Set.of("caching", "layer"), extractor.extract("Кэширование caching layer 2024 ok"));
    }

    @Test
    void alternatives_skipFailedAndFrequentTopicsLeastAskedFirst() {
        ask("Quicksort basics", ALGORITHMS);
        ask("Merge sort stability", ALGORITHMS);
        ask("Recent project overview", TopicArea.PRACTICAL_EXPERIENCE);
        guard.markFailed(TopicArea.SOFT_SKILLS);

        List<TopicArea> alternatives = guard.alternatives(TopicArea.TECHNICAL_BASICS, List.of(
                TopicArea.TECHNICAL_BASICS, ALGORITHMS, TopicArea.PRACTICAL_EXPERIENCE,
                TopicArea.SOFT_SKILLS, TopicArea.SYSTEM_DESIGN));

        assertEquals(List.of(TopicArea.SYSTEM_DESIGN, TopicArea.PRACTICAL_EXPERIENCE), alternatives);
    }

    @Test
    void alternatives_excludeTopicMarkedFailed() {
        ask("Explain quicksort", ALGORITHMS);
        guard.markFailed(ALGORITHMS);

        List<TopicArea> alternatives = guard.alternatives(TopicArea.GENERAL, List.of(ALGORITHMS, TopicArea.SYSTEM_DESIGN));

        assertEquals(List.of(TopicArea.SYSTEM_DESIGN), alternatives);
    }
}
