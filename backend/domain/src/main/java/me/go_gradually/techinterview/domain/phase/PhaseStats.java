package me.go_gradually.techinterview.domain.phase;

import me.go_gradually.techinterview.domain.interview.Difficulty;
import me.go_gradually.techinterview.domain.interview.InterviewPhase;
import me.go_gradually.techinterview.domain.profile.RunningAverage;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Counters for one phase. Only mutated while the phase is current.
 */
public class PhaseStats {
    private final InterviewPhase phase;
    private int questionsAsked;
    private final RunningAverage technicalScore = new RunningAverage();
    private final List<Difficulty> difficultiesUsed = new ArrayList<>();
    private Instant startedAt;

    public PhaseStats(InterviewPhase phase) {
        if (phase == null) {
            throw new IllegalArgumentException("Phase is required");
        }
        this.phase = phase;
    }

    void start(Instant instant) {
        this.startedAt = instant;
    }

    void recordAnswer(double technical, Difficulty difficulty) {
        technicalScore.add(technical);
        recordUnscoredAnswer(difficulty);
    }

    void recordUnscoredAnswer(Difficulty difficulty) {
        questionsAsked += 1;
        if (difficulty != null && !difficultiesUsed.contains(difficulty)) {
            difficultiesUsed.add(difficulty);
        }
    }

    public InterviewPhase getPhase() {
        return phase;
    }

    public int getQuestionsAsked() {
        return questionsAsked;
    }

    public double getAvgTechnicalScore() {
        return technicalScore.value();
    }

    public List<Difficulty> getDifficultiesUsed() {
        return Collections.unmodifiableList(difficultiesUsed);
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public boolean isStarted() {
        return startedAt != null;
    }
}
