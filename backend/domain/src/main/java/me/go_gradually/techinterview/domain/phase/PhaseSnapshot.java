package me.go_gradually.techinterview.domain.phase;

import me.go_gradually.techinterview.domain.interview.InterviewPhase;

import java.time.Duration;

/**
 * Entry of the phase history, written once when {@code phase} is left.
 */
public record PhaseSnapshot(InterviewPhase phase,
                            InterviewPhase next,
                            Duration duration,
                            int questionsAsked,
                            TransitionReason reason) {
}
