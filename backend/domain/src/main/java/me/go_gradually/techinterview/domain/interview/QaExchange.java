package me.go_gradually.techinterview.domain.interview;

import java.time.Instant;

public record QaExchange(String question, String answer, InterviewPhase phase, TopicArea topic, Instant answeredAt) {
    public QaExchange {
        question = question == null ? "" : question.trim();
        answer = answer == null ? "" : answer.trim();
    }
}
