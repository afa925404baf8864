package me.go_gradually.techinterview.domain.phase;

import me.go_gradually.techinterview.domain.interview.InterviewPhase;
import me.go_gradually.techinterview.domain.profile.TechnicalLevel;

/**
 * Question-count policy behind the recommended next phase.
 *
 * @param explorationMinQuestions      answers in exploration before validation, once a level is known
 * @param explorationFallbackQuestions answers in exploration before validation regardless of level
 * @param stressTestMinAverage         running technical average that qualifies for stress test
 * @param stressTestMinQuestions       answers in validation before stress test can be recommended
 * @param validationMinQuestions       answers in validation before soft skills is recommended instead
 * @param stressTestQuestions          answers in stress test before soft skills
 * @param softSkillsQuestions          answers in soft skills before wrap-up
 */
public record PhaseTransitionRules(int explorationMinQuestions,
                                   int explorationFallbackQuestions,
                                   double stressTestMinAverage,
                                   int stressTestMinQuestions,
                                   int validationMinQuestions,
                                   int stressTestQuestions,
                                   int softSkillsQuestions) {
    public PhaseTransitionRules {
        if (explorationMinQuestions < 1 || explorationFallbackQuestions < explorationMinQuestions) {
            throw new IllegalArgumentException("Exploration fallback must be at least the exploration minimum");
        }
        if (stressTestMinQuestions < 1 || validationMinQuestions < 1
                || stressTestQuestions < 1 || softSkillsQuestions < 1) {
            throw new IllegalArgumentException("Phase question counts must be positive");
        }
        if (stressTestMinAverage < 0 || stressTestMinAverage > 10) {
            throw new IllegalArgumentException("stressTestMinAverage must be within 0-10");
        }
    }

    public static PhaseTransitionRules defaults() {
        return new PhaseTransitionRules(2, 4, 6.0, 2, 3, 1, 2);
    }

    /**
     * Advisory next phase. Returns {@code current} when no rule fires.
     */
    public InterviewPhase recommend(InterviewPhase current,
                                    int questionsInPhase,
                                    TechnicalLevel level,
                                    double averageTechnical) {
        return switch (current) {
            case EXPLORATION -> {
                boolean levelKnown = level != null && level != TechnicalLevel.UNKNOWN;
                if ((questionsInPhase >= explorationMinQuestions && levelKnown)
                        || questionsInPhase >= explorationFallbackQuestions) {
                    yield InterviewPhase.VALIDATION;
                }
                yield current;
            }
            case VALIDATION -> {
                if (averageTechnical >= stressTestMinAverage && questionsInPhase >= stressTestMinQuestions) {
                    yield InterviewPhase.STRESS_TEST;
                }
                if (questionsInPhase >= validationMinQuestions) {
                    yield InterviewPhase.SOFT_SKILLS;
                }
                yield current;
            }
            case STRESS_TEST -> questionsInPhase >= stressTestQuestions ? InterviewPhase.SOFT_SKILLS : current;
            case SOFT_SKILLS -> questionsInPhase >= softSkillsQuestions ? InterviewPhase.WRAP_UP : current;
            case WRAP_UP -> InterviewPhase.FINISHED;
            case FINISHED -> current;
        };
    }
}
