package me.go_gradually.techinterview.domain.phase;

import me.go_gradually.techinterview.domain.interview.Difficulty;
import me.go_gradually.techinterview.domain.interview.InterviewPhase;
import me.go_gradually.techinterview.domain.interview.TopicArea;
import me.go_gradually.techinterview.domain.oracle.AdaptationNeed;
import me.go_gradually.techinterview.domain.oracle.AnswerAnalysis;
import me.go_gradually.techinterview.domain.oracle.InterviewStatus;
import me.go_gradually.techinterview.domain.oracle.OracleDecision;
import me.go_gradually.techinterview.domain.oracle.TimeManagement;
import me.go_gradually.techinterview.domain.profile.TechnicalLevel;
import me.go_gradually.techinterview.domain.time.TimeStatus;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PhaseStateMachineTest {
    private static final Instant START = Instant.parse("2026-01-05T10:00:00Z");

    private final PhaseStateMachine machine = new PhaseStateMachine(PhaseTransitionRules.defaults(), START);

    private static OracleDecision decision(InterviewStatus status, TimeManagement time, AdaptationNeed adaptation) {
        return new OracleDecision(status, "", "Next?", TopicArea.GENERAL, Difficulty.MEDIUM,
                AnswerAnalysis.empty(), time, adaptation, List.of(), "", "");
    }

    private static OracleDecision plain() {
        return decision(InterviewStatus.CONTINUING, TimeManagement.CONTINUE, AdaptationNeed.NONE);
    }

    private void answer(int times) {
        for (int i = 0; i < times; i++) {
            machine.recordAnswer(6, Difficulty.MEDIUM);
        }
    }

    @Test
    void decide_criticalTime_forcesWrapUpOverEverySignal() {
        answer(4);
        OracleDecision finished = decision(InterviewStatus.FINISHED, TimeManagement.FINISH, AdaptationNeed.CLARIFY);

        PhaseDecision result = machine.decide(TimeStatus.CRITICAL, TechnicalLevel.MIDDLE, 6, finished);

        assertEquals(InterviewPhase.WRAP_UP, result.target());
        assertEquals(TransitionReason.TIME_CRITICAL, result.reason());
    }

    @Test
    void decide_criticalTime_inWrapUp_followsRecommendation() {
        machine.apply(PhaseDecision.moveTo(InterviewPhase.WRAP_UP, TransitionReason.TIME_CRITICAL), START);

        PhaseDecision result = machine.decide(TimeStatus.CRITICAL, TechnicalLevel.MIDDLE, 6, plain());

        assertEquals(InterviewPhase.FINISHED, result.target());
    }

    @Test
    void decide_recommendedPhaseWinsOverAdaptationVeto() {
        answer(2);
        OracleDecision clarify = decision(InterviewStatus.CONTINUING, TimeManagement.CONTINUE, AdaptationNeed.CLARIFY);

        PhaseDecision result = machine.decide(TimeStatus.ON_TRACK, TechnicalLevel.MIDDLE, 6, clarify);

        assertEquals(InterviewPhase.VALIDATION, result.target());
        assertEquals(TransitionReason.RECOMMENDED, result.reason());
    }

    @Test
    void decide_adaptationVetoHoldsAgainstOracleFinish() {
        answer(1);
        OracleDecision vetoed = decision(InterviewStatus.FINISHED, TimeManagement.WRAP_UP, AdaptationNeed.CLARIFY);

        PhaseDecision result = machine.decide(TimeStatus.NEEDS_WRAP_UP, TechnicalLevel.UNKNOWN, 6, vetoed);

        assertTrue(result.isHeld());
        assertEquals(InterviewPhase.EXPLORATION, result.target());
    }

    @Test
    void decide_oracleFinished_thenOracleWrapUpRequest() {
        answer(1);

        PhaseDecision finished = machine.decide(TimeStatus.ON_TRACK, TechnicalLevel.UNKNOWN, 6,
                decision(InterviewStatus.FINISHED, TimeManagement.CONTINUE, AdaptationNeed.NONE));
        PhaseDecision finish = machine.decide(TimeStatus.ON_TRACK, TechnicalLevel.UNKNOWN, 6,
                decision(InterviewStatus.CONTINUING, TimeManagement.FINISH, AdaptationNeed.NONE));
        PhaseDecision wrapUp = machine.decide(TimeStatus.ON_TRACK, TechnicalLevel.UNKNOWN, 6,
                decision(InterviewStatus.CONTINUING, TimeManagement.CRITICAL, AdaptationNeed.NONE));
        PhaseDecision stay = machine.decide(TimeStatus.NEEDS_WRAP_UP, TechnicalLevel.UNKNOWN, 6, plain());

        assertEquals(InterviewPhase.FINISHED, finished.target());
        assertEquals(InterviewPhase.FINISHED, finish.target());
        assertEquals(InterviewPhase.WRAP_UP, wrapUp.target());
        assertEquals(TransitionReason.ORACLE_TIME_REQUEST, wrapUp.reason());
        assertEquals(InterviewPhase.EXPLORATION, stay.target());
        assertEquals(TransitionReason.NONE, stay.reason());
    }

    @Test
    void apply_appendsSnapshotAndRestartsPhaseClock() {
        answer(2);
        Instant later = START.plus(Duration.ofMinutes(4));

        PhaseSnapshot snapshot = machine.apply(
                machine.decide(TimeStatus.ON_TRACK, TechnicalLevel.JUNIOR, 3, plain()), later).orElseThrow();

        assertEquals(InterviewPhase.EXPLORATION, snapshot.phase());
        assertEquals(InterviewPhase.VALIDATION, snapshot.next());
        assertEquals(Duration.ofMinutes(4), snapshot.duration());
        assertEquals(2, snapshot.questionsAsked());
        assertEquals(InterviewPhase.VALIDATION, machine.getCurrent());
        assertEquals(later, machine.getCurrentStats().getStartedAt());
        assertEquals(List.of(snapshot), machine.getHistory());
    }

    @Test
    void apply_sameOrTerminalPhase_changesNothing() {
        assertTrue(machine.apply(PhaseDecision.stay(InterviewPhase.EXPLORATION), START).isEmpty());

        machine.apply(PhaseDecision.moveTo(InterviewPhase.FINISHED, TransitionReason.ORACLE_FINISHED), START);

        assertTrue(machine.apply(PhaseDecision.moveTo(InterviewPhase.WRAP_UP, TransitionReason.TIME_CRITICAL), START).isEmpty());
        assertEquals(TransitionReason.NONE,
                machine.decide(TimeStatus.CRITICAL, TechnicalLevel.MIDDLE, 5, plain()).reason());
        assertEquals(1, machine.getHistory().size());
    }

    @Test
    void recordAnswer_tracksStatsOfCurrentPhaseOnly() {
        machine.recordAnswer(8, Difficulty.MEDIUM);
        machine.recordAnswer(0, Difficulty.HARD);
        machine.recordAnswer(6, Difficulty.MEDIUM);

        PhaseStats stats = machine.getStats(InterviewPhase.EXPLORATION);
        assertEquals(3, stats.getQuestionsAsked());
        assertEquals(14.0 / 3, stats.getAvgTechnicalScore(), 1e-9);
        assertEquals(List.of(Difficulty.MEDIUM, Difficulty.HARD), stats.getDifficultiesUsed());
        assertEquals(0, machine.getStats(InterviewPhase.VALIDATION).getQuestionsAsked());
    }

    @Test
    void recordUnscoredAnswer_countsQuestionWithoutMovingAverage() {
        machine.recordAnswer(8, Difficulty.MEDIUM);
        machine.recordUnscoredAnswer(Difficulty.EASY);

        PhaseStats stats = machine.getStats(InterviewPhase.EXPLORATION);
        assertEquals(2, stats.getQuestionsAsked());
        assertEquals(8.0, stats.getAvgTechnicalScore(), 1e-9);
        assertEquals(List.of(Difficulty.MEDIUM, Difficulty.EASY), stats.getDifficultiesUsed());
    }
}
