package me.go_gradually.techinterview.domain.report;

import me.go_gradually.techinterview.domain.interview.Difficulty;
import me.go_gradually.techinterview.domain.interview.InterviewPhase;
import me.go_gradually.techinterview.domain.interview.TopicArea;
import me.go_gradually.techinterview.domain.oracle.AnswerAnalysis;
import me.go_gradually.techinterview.domain.phase.PhaseDecision;
import me.go_gradually.techinterview.domain.phase.PhaseStateMachine;
import me.go_gradually.techinterview.domain.phase.PhaseTransitionRules;
import me.go_gradually.techinterview.domain.phase.TransitionReason;
import me.go_gradually.techinterview.domain.profile.CandidateProfile;
import me.go_gradually.techinterview.domain.profile.HrAnalysis;
import me.go_gradually.techinterview.domain.profile.ProfileThresholds;
import me.go_gradually.techinterview.domain.strategy.AnswerStrategy;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

class ReportSynthesizerTest {
    private static final Instant START = Instant.parse("2026-01-05T10:00:00Z");

    private final ReportSynthesizer synthesizer = new ReportSynthesizer(RecommendationThresholds.defaults());

    @Test
    void overallScore_rescalesPairAverageToHundred() {
        assertEquals(82, ReportSynthesizer.overallScore(8.5, 7.9));
        assertEquals(0, ReportSynthesizer.overallScore(0, 0));
        assertEquals(100, ReportSynthesizer.overallScore(10, 10));
    }

    @Test
    void recommend_highScoreWithoutRedFlags_isStrongHireWithHighConfidence() {
        FinalRecommendation recommendation = synthesizer.recommend(82, 0);

        assertEquals(HiringRecommendation.STRONG_HIRE, recommendation.decision());
        assertEquals(ConfidenceLevel.HIGH, recommendation.confidenceLevel());
        assertEquals("Strongly recommended for hire", recommendation.decisionText());
    }

    @Test
    void recommend_threeRedFlags_fallsToNoHireRegardlessOfScore() {
        FinalRecommendation recommendation = synthesizer.recommend(82, 3);

        assertEquals(HiringRecommendation.NO_HIRE, recommendation.decision());
        assertEquals(ConfidenceLevel.LOW, recommendation.confidenceLevel());
    }

    @Test
    void recommend_walksTiersInOrder() {
        assertEquals(HiringRecommendation.HIRE, synthesizer.recommend(82, 1).decision());
        assertEquals(HiringRecommendation.CONDITIONAL_HIRE, synthesizer.recommend(82, 2).decision());
        assertEquals(HiringRecommendation.HIRE, synthesizer.recommend(65, 0).decision());
        assertEquals(HiringRecommendation.CONDITIONAL_HIRE, synthesizer.recommend(64, 0).decision());
        assertEquals(HiringRecommendation.NO_HIRE, synthesizer.recommend(49, 0).decision());
        assertEquals(ConfidenceLevel.MEDIUM, synthesizer.recommend(49, 2).confidenceLevel());
    }

    @Test
    void synthesize_combinesProfilePhasesAndInsights() {
        HrAnalysis hr = new HrAnalysis(List.of("Java"), List.of("algorithms"), 75);
        CandidateProfile profile = new CandidateProfile("Alex", "Backend Engineer", "fintech", hr, ProfileThresholds.defaults());
        PhaseStateMachine phases = new PhaseStateMachine(PhaseTransitionRules.defaults(), START);

        profile.recordAnswer(TopicArea.of("algorithms"), AnswerAnalysis.scores(2, 6, 5));
        phases.recordAnswer(2, Difficulty.MEDIUM);
        profile.recordAnswer(TopicArea.TECHNICAL_BASICS, AnswerAnalysis.scores(8, 8, 8).withStrengths(List.of("Java internals")));
        phases.recordAnswer(8, Difficulty.EASY);
        phases.apply(PhaseDecision.moveTo(InterviewPhase.VALIDATION, TransitionReason.RECOMMENDED), START.plus(Duration.ofMinutes(6)));

        InterviewReport report = synthesizer.synthesize("s-1", profile, phases, Difficulty.EASY, AnswerStrategy.DEEPEN,
                List.of("technical_basics"), 9.04, START.plus(Duration.ofMinutes(9)));

        assertEquals("s-1", report.sessionId());
        assertEquals(60, report.overallScore());
        assertEquals(HiringRecommendation.CONDITIONAL_HIRE, report.finalRecommendation().decision());
        PhaseBreakdown exploration = report.phaseBreakdown().get("exploration");
        assertEquals(2, exploration.questionsAsked());
        assertEquals(5.0, exploration.avgScore());
        assertEquals(List.of("medium", "easy"), exploration.difficultiesUsed());
        assertEquals(6.0, exploration.durationMinutes());
        assertFalse(report.phaseBreakdown().containsKey("validation"));
        assertEquals(1, report.interviewFlow().size());
        assertEquals("validation", report.interviewFlow().get(0).next());
        assertEquals(List.of("Java"), report.hrValidation().validatedStrengths());
        assertEquals(List.of("algorithms"), report.hrValidation().confirmedConcerns());
        assertEquals("middle", report.hrValidation().preliminaryLevel());
        assertEquals(1, report.adaptiveInsights().phaseTransitions());
        assertFalse(report.adaptiveInsights().hrConcernsAddressed());
        assertEquals(9.0, report.adaptiveInsights().totalInterviewMinutes());
        assertEquals("deepen", report.adaptiveInsights().finalStrategy());
        assertEquals(8.0, report.profile().performanceByArea().get("technical_basics"), 1e-9);
    }
}
