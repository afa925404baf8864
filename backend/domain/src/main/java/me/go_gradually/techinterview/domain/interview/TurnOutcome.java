package me.go_gradually.techinterview.domain.interview;

import me.go_gradually.techinterview.domain.phase.PhaseSnapshot;
import me.go_gradually.techinterview.domain.strategy.AnswerStrategy;
import me.go_gradually.techinterview.domain.time.PhaseTimeStrategy;
import me.go_gradually.techinterview.domain.time.TimeStatus;

import java.util.Optional;

/**
 * Result of one processed answer (or of the opening turn): the next question plus bookkeeping.
 *
 * @param fallbackUsed         the question is a canned phase question
 * @param repetitionDetected   the oracle's proposed question was judged repetitive
 * @param questionSubstituted  a repetitive proposal was replaced by a bridge question
 */
public record TurnOutcome(String nextQuestion,
                          TopicArea questionArea,
                          Difficulty questionDifficulty,
                          InterviewPhase phase,
                          PhaseSnapshot transition,
                          boolean fallbackUsed,
                          boolean repetitionDetected,
                          boolean questionSubstituted,
                          AnswerStrategy strategy,
                          TimeStatus timeStatus,
                          PhaseTimeStrategy phaseTimeStrategy,
                          int totalAnswers,
                          boolean shouldEnd) {
    public Optional<PhaseSnapshot> phaseTransition() {
        return Optional.ofNullable(transition);
    }

    public boolean isFinished() {
        return phase.isTerminal();
    }
}
