package me.go_gradually.techinterview.domain.oracle;

import me.go_gradually.techinterview.domain.interview.InterviewPhase;
import me.go_gradually.techinterview.domain.interview.TopicArea;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OracleDecisionTest {

    @Test
    void constructor_defaultsMissingFields() {
        OracleDecision decision = new OracleDecision(null, null, null, null, null, null, null, null, null, null, null);

        assertEquals(InterviewStatus.CONTINUING, decision.interviewStatus());
        assertEquals(TopicArea.GENERAL, decision.questionArea());
        assertTrue(decision.previousAnswerAnalysis().isEmpty());
        assertEquals(TimeManagement.CONTINUE, decision.timeManagement());
        assertEquals(AdaptationNeed.NONE, decision.adaptationNeeded());
        assertFalse(decision.hasNextQuestion());
        assertTrue(decision.reportedPhase().isEmpty());
        assertTrue(decision.difficulty().isEmpty());
    }

    @Test
    void reportedPhase_ignoresUnknownNames() {
        OracleDecision known = OracleDecision.neutral().withNextQuestion("Q", TopicArea.GENERAL);
        OracleDecision unknown = new OracleDecision(InterviewStatus.CONTINUING, "deep_dive", "Q", TopicArea.GENERAL,
                null, AnswerAnalysis.empty(), TimeManagement.CONTINUE, AdaptationNeed.NONE, List.of(), "", "");
        OracleDecision stressTest = new OracleDecision(InterviewStatus.CONTINUING, " Stress_Test ", "Q", TopicArea.GENERAL,
                null, AnswerAnalysis.empty(), TimeManagement.CONTINUE, AdaptationNeed.NONE, List.of(), "", "");

        assertTrue(known.hasNextQuestion());
        assertTrue(unknown.reportedPhase().isEmpty());
        assertEquals(InterviewPhase.STRESS_TEST, stressTest.reportedPhase().orElseThrow());
    }

    @Test
    void answerAnalysis_clampsScoresAndCleansLists() {
        AnswerAnalysis analysis = new AnswerAnalysis(12, -1, Double.NaN, 5, 5,
                Arrays.asList("late", null, " late "), List.of("focus"), null);

        assertEquals(10.0, analysis.technicalScore());
        assertEquals(0.0, analysis.communicationScore());
        assertEquals(0.0, analysis.confidenceScore());
        assertEquals(List.of("late"), analysis.redFlags());
        assertEquals("", analysis.notes());
    }

    @Test
    void adaptationNeed_parsesNegativeWordsAsNone() {
        assertEquals(AdaptationNeed.NONE, AdaptationNeed.fromCode("none"));
        assertEquals(AdaptationNeed.NONE, AdaptationNeed.fromCode("false"));
        assertEquals(AdaptationNeed.NONE, AdaptationNeed.fromCode(" "));
        assertEquals(AdaptationNeed.CLARIFY, AdaptationNeed.fromCode("clarify"));
        assertEquals(AdaptationNeed.OTHER, AdaptationNeed.fromCode("rephrase"));
        assertTrue(AdaptationNeed.OTHER.isRequested());
    }
}
