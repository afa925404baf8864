package me.go_gradually.techinterview.domain.phase;

import me.go_gradually.techinterview.domain.interview.Difficulty;
import me.go_gradually.techinterview.domain.interview.InterviewPhase;
import me.go_gradually.techinterview.domain.oracle.InterviewStatus;
import me.go_gradually.techinterview.domain.oracle.OracleDecision;
import me.go_gradually.techinterview.domain.oracle.TimeManagement;
import me.go_gradually.techinterview.domain.profile.TechnicalLevel;
import me.go_gradually.techinterview.domain.time.TimeStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Decides whether the interview stays in its current phase after each answer.
 *
 * <p>Signals are checked in a fixed order: critical time, the recommended phase,
 * the oracle's adaptation veto, the oracle's finished status and finally the oracle's
 * own pacing request. The first one that applies wins.
 */
public class PhaseStateMachine {
    private final PhaseTransitionRules rules;
    private final Map<InterviewPhase, PhaseStats> stats = new EnumMap<>(InterviewPhase.class);
    private final List<PhaseSnapshot> history = new ArrayList<>();
    private InterviewPhase current = InterviewPhase.EXPLORATION;

    public PhaseStateMachine(PhaseTransitionRules rules, Instant startedAt) {
        if (rules == null || startedAt == null) {
            throw new IllegalArgumentException("Phase rules and start instant are required");
        }
        this.rules = rules;
        for (InterviewPhase phase : InterviewPhase.values()) {
            stats.put(phase, new PhaseStats(phase));
        }
        stats.get(current).start(startedAt);
    }

    public void recordAnswer(double technicalScore, Difficulty difficulty) {
        stats.get(current).recordAnswer(technicalScore, difficulty);
    }

    /**
     * Counts an answer that came without any analysis; the phase average is left as is.
     */
    public void recordUnscoredAnswer(Difficulty difficulty) {
        stats.get(current).recordUnscoredAnswer(difficulty);
    }

    public InterviewPhase recommendedPhase(TechnicalLevel level, double averageTechnical) {
        return rules.recommend(current, stats.get(current).getQuestionsAsked(), level, averageTechnical);
    }

    public PhaseDecision decide(TimeStatus timeStatus,
                                TechnicalLevel level,
                                double averageTechnical,
                                OracleDecision decision) {
        if (current.isTerminal()) {
            return PhaseDecision.stay(current);
        }
        OracleDecision oracle = decision == null ? OracleDecision.neutral() : decision;
        if (timeStatus == TimeStatus.CRITICAL && !current.isClosing()) {
            return PhaseDecision.moveTo(InterviewPhase.WRAP_UP, TransitionReason.TIME_CRITICAL);
        }
        InterviewPhase recommended = recommendedPhase(level, averageTechnical);
        if (recommended != current) {
            return PhaseDecision.moveTo(recommended, TransitionReason.RECOMMENDED);
        }
        if (oracle.adaptationNeeded().isRequested()) {
            return PhaseDecision.hold(current);
        }
        if (oracle.interviewStatus() == InterviewStatus.FINISHED || oracle.timeManagement() == TimeManagement.FINISH) {
            return PhaseDecision.moveTo(InterviewPhase.FINISHED, TransitionReason.ORACLE_FINISHED);
        }
        if (oracle.timeManagement().requestsWrapUp() && current != InterviewPhase.WRAP_UP) {
            return PhaseDecision.moveTo(InterviewPhase.WRAP_UP, TransitionReason.ORACLE_TIME_REQUEST);
        }
        return PhaseDecision.stay(current);
    }

    /**
     * Moves to the decided phase, writing the left phase into the history.
     * A decision for the current phase changes nothing.
     */
    public Optional<PhaseSnapshot> apply(PhaseDecision decision, Instant now) {
        if (decision == null || decision.target() == current || current.isTerminal()) {
            return Optional.empty();
        }
        PhaseStats leaving = stats.get(current);
        Instant since = leaving.getStartedAt() == null ? now : leaving.getStartedAt();
        Duration spent = Duration.between(since, now);
        PhaseSnapshot snapshot = new PhaseSnapshot(current, decision.target(),
                spent.isNegative() ? Duration.ZERO : spent, leaving.getQuestionsAsked(), decision.reason());
        history.add(snapshot);
        current = decision.target();
        stats.get(current).start(now);
        return Optional.of(snapshot);
    }

    public InterviewPhase getCurrent() {
        return current;
    }

    public PhaseStats getStats(InterviewPhase phase) {
        return stats.get(phase);
    }

    public PhaseStats getCurrentStats() {
        return stats.get(current);
    }

    public Map<InterviewPhase, PhaseStats> getAllStats() {
        return Collections.unmodifiableMap(stats);
    }

    public List<PhaseSnapshot> getHistory() {
        return Collections.unmodifiableList(history);
    }

    public List<InterviewPhase> completedPhases() {
        return history.stream().map(PhaseSnapshot::phase).toList();
    }
}
