package me.go_gradually.techinterview.domain.repetition;

import me.go_gradually.techinterview.domain.interview.Difficulty;
import me.go_gradually.techinterview.domain.interview.InterviewPhase;
import me.go_gradually.techinterview.domain.interview.TopicArea;

import java.time.Instant;
import java.util.Set;

public record QuestionRecord(String text,
                             TopicArea topic,
                             Set<String> keywords,
                             InterviewPhase phase,
                             Difficulty difficulty,
                             Instant askedAt) {
    public QuestionRecord {
        if (topic == null || phase == null || askedAt == null) {
            throw new IllegalArgumentException("Question topic, phase and timestamp are required");
        }
        text = text == null ? "" : text.trim();
        keywords = keywords == null ? Set.of() : Set.copyOf(keywords);
        difficulty = difficulty == null ? Difficulty.MEDIUM : difficulty;
    }
}
