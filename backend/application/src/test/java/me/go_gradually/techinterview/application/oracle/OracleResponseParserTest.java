package me.go_gradually.techinterview.application.oracle;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.go_gradually.techinterview.domain.interview.Difficulty;
import me.go_gradually.techinterview.domain.interview.InterviewPhase;
import me.go_gradually.techinterview.domain.interview.TopicArea;
import me.go_gradually.techinterview.domain.oracle.AdaptationNeed;
import me.go_gradually.techinterview.domain.oracle.InterviewStatus;
import me.go_gradually.techinterview.domain.oracle.OracleDecision;
import me.go_gradually.techinterview.domain.oracle.TimeManagement;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class OracleResponseParserTest {
    private static final String PAYLOAD = """
            {
              "interview_status": "continuing",
              "current_phase": "validation",
              "next_question": "How does a B-tree index speed up range queries?",
              "question_area": "Technical Basics",
              "question_difficulty": "hard",
              "previous_answer_analysis": {
                "technical_score": 7.5,
                "communication_score": 8,
                "confidence_score": "6",
                "depth_score": 5,
                "practical_experience": 4,
                "red_flags": ["vague about ownership"],
                "strengths_shown": ["clear structure"],
                "analysis_notes": "step by step reasoning"
              },
              "time_management": "accelerate",
              "adaptation_needed": "deepen",
              "interview_plan": ["technical_basics", "system_design"],
              "current_area": "technical_basics",
              "interviewer_notes": "push on indexing"
            }
            """;

    private final OracleResponseParser parser = new OracleResponseParser(new ObjectMapper());

    @Test
    void parse_fencedAndBarePayload_yieldSameDecision() {
        Optional<OracleDecision> bare = parser.parse(PAYLOAD);
        Optional<OracleDecision> fenced = parser.parse("Here is my decision:\n```json\n" + PAYLOAD + "```\nGood luck!");

        assertTrue(bare.isPresent());
        assertEquals(bare, fenced);
    }

    @Test
    void parse_readsAllFields() {
        OracleDecision decision = parser.parse(PAYLOAD).orElseThrow();

        assertEquals(InterviewStatus.CONTINUING, decision.interviewStatus());
        assertEquals(Optional.of(InterviewPhase.VALIDATION), decision.reportedPhase());
        assertEquals("How does a B-tree index speed up range queries?", decision.nextQuestion());
        assertEquals(TopicArea.TECHNICAL_BASICS, decision.questionArea());
        assertEquals(Optional.of(Difficulty.HARD), decision.difficulty());
        assertEquals(7.5, decision.previousAnswerAnalysis().technicalScore(), 1e-9);
        assertEquals(6.0, decision.previousAnswerAnalysis().confidenceScore(), 1e-9);
        assertEquals(List.of("vague about ownership"), decision.previousAnswerAnalysis().redFlags());
        assertEquals(List.of("clear structure"), decision.previousAnswerAnalysis().strengthsShown());
        assertEquals("step by step reasoning", decision.previousAnswerAnalysis().notes());
        assertEquals(TimeManagement.ACCELERATE, decision.timeManagement());
        assertEquals(AdaptationNeed.DEEPEN, decision.adaptationNeeded());
        assertEquals(List.of("technical_basics", "system_design"), decision.interviewPlan());
        assertEquals("push on indexing", decision.interviewerNotes());
    }

    @Test
    void parse_textAroundObject_usesBalancedBraces() {
        String raw = "Sure. {\"next_question\": \"Why use {braces} here?\", \"question_area\": \"soft_skills\"} "
                + "and a trailing note with a stray } brace";

        OracleDecision decision = parser.parse(raw).orElseThrow();

        assertEquals("Why use {braces} here?", decision.nextQuestion());
        assertEquals(TopicArea.SOFT_SKILLS, decision.questionArea());
    }

    @Test
    void parse_missingOptionalFields_areDefaulted() {
        OracleDecision decision = parser.parse("{\"next_question\": \"Tell me about caching.\"}").orElseThrow();

        assertEquals(InterviewStatus.CONTINUING, decision.interviewStatus());
        assertEquals(TopicArea.GENERAL, decision.questionArea());
        assertTrue(decision.difficulty().isEmpty());
        assertTrue(decision.previousAnswerAnalysis().isEmpty());
        assertEquals(TimeManagement.CONTINUE, decision.timeManagement());
        assertEquals(AdaptationNeed.NONE, decision.adaptationNeeded());
        assertTrue(decision.interviewPlan().isEmpty());
    }

    @Test
    void parse_nullListItems_areSkipped() {
        String raw = "{\"next_question\": \"q\", \"previous_answer_analysis\": {\"technical_score\": 7, "
                + "\"red_flags\": [null, \"blames the team\", {\"text\": \"nested\"}], \"strengths_shown\": [null]}}";

        OracleDecision decision = parser.parse(raw).orElseThrow();

        assertEquals(List.of("blames the team"), decision.previousAnswerAnalysis().redFlags());
        assertTrue(decision.previousAnswerAnalysis().strengthsShown().isEmpty());
    }

    @Test
    void parse_undecodableText_returnsEmpty() {
        assertTrue(parser.parse("I cannot answer that.").isEmpty());
        assertTrue(parser.parse("{ not json at all").isEmpty());
        assertTrue(parser.parse("```json\n[1, 2, 3]\n```").isEmpty());
        assertTrue(parser.parse("").isEmpty());
        assertTrue(parser.parse(null).isEmpty());
    }

    @Test
    void parse_brokenFence_fallsBackToBraceScan() {
        String raw = "```json\n{\"next_question\": \"broken\",}\n```\n{\"next_question\": \"Recovered?\"}";

        OracleDecision decision = parser.parse(raw).orElseThrow();

        assertEquals("Recovered?", decision.nextQuestion());
    }
}
