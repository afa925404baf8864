package me.go_gradually.techinterview.domain.interview;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Ordered stages of a technical interview. {@link #FINISHED} is terminal.
 */
public enum InterviewPhase {
    EXPLORATION("exploration"),
    VALIDATION("validation"),
    STRESS_TEST("stress_test"),
    SOFT_SKILLS("soft_skills"),
    WRAP_UP("wrap_up"),
    FINISHED("finished");

    private final String code;

    InterviewPhase(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public boolean isTerminal() {
        return this == FINISHED;
    }

    public boolean isClosing() {
        return this == WRAP_UP || this == FINISHED;
    }

    /**
     * This phase and every phase after it in canonical order, excluding {@link #FINISHED}.
     */
    public List<InterviewPhase> remainingIncludingSelf() {
        return Arrays.stream(values())
                .filter(phase -> phase.ordinal() >= ordinal())
                .filter(phase -> !phase.isTerminal())
                .toList();
    }

    public static Optional<InterviewPhase> fromCode(String code) {
        if (code == null || code.isBlank()) {
            return Optional.empty();
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(phase -> phase.code.equals(normalized))
                .findFirst();
    }

    public static InterviewPhase requireCode(String code) {
        return fromCode(code)
                .orElseThrow(() -> new IllegalArgumentException("Unknown interview phase: " + code));
    }
}
