package me.go_gradually.techinterview.domain.phase;

import me.go_gradually.techinterview.domain.interview.InterviewPhase;
import me.go_gradually.techinterview.domain.profile.TechnicalLevel;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class PhaseTransitionRulesTest {
    private final PhaseTransitionRules rules = PhaseTransitionRules.defaults();

    @Test
    void recommend_exploration_needsKnownLevelOrFallbackCount() {
        assertEquals(InterviewPhase.EXPLORATION, rules.recommend(InterviewPhase.EXPLORATION, 2, TechnicalLevel.UNKNOWN, 9));
        assertEquals(InterviewPhase.VALIDATION, rules.recommend(InterviewPhase.EXPLORATION, 2, TechnicalLevel.JUNIOR, 1));
        assertEquals(InterviewPhase.VALIDATION, rules.recommend(InterviewPhase.EXPLORATION, 4, TechnicalLevel.UNKNOWN, 0));
    }

    @Test
    void recommend_validation_prefersStressTestWhenAverageClearsBar() {
        assertEquals(InterviewPhase.STRESS_TEST, rules.recommend(InterviewPhase.VALIDATION, 2, TechnicalLevel.SENIOR, 6.0));
        assertEquals(InterviewPhase.VALIDATION, rules.recommend(InterviewPhase.VALIDATION, 2, TechnicalLevel.MIDDLE, 5.9));
        assertEquals(InterviewPhase.SOFT_SKILLS, rules.recommend(InterviewPhase.VALIDATION, 3, TechnicalLevel.MIDDLE, 5.9));
    }

    @Test
    void recommend_laterPhases() {
        assertEquals(InterviewPhase.SOFT_SKILLS, rules.recommend(InterviewPhase.STRESS_TEST, 1, TechnicalLevel.SENIOR, 9));
        assertEquals(InterviewPhase.SOFT_SKILLS, rules.recommend(InterviewPhase.SOFT_SKILLS, 1, TechnicalLevel.SENIOR, 9));
        assertEquals(InterviewPhase.WRAP_UP, rules.recommend(InterviewPhase.SOFT_SKILLS, 2, TechnicalLevel.SENIOR, 9));
        assertEquals(InterviewPhase.FINISHED, rules.recommend(InterviewPhase.WRAP_UP, 0, TechnicalLevel.SENIOR, 9));
        assertEquals(InterviewPhase.FINISHED, rules.recommend(InterviewPhase.FINISHED, 5, TechnicalLevel.SENIOR, 9));
    }

    @Test
    void constructor_rejectsFallbackBelowMinimum() {
        assertThrows(IllegalArgumentException.class, () -> new PhaseTransitionRules(3, 2, 6.0, 2, 3, 1, 2));
    }
}
