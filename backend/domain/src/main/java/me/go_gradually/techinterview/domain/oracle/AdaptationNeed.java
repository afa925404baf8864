package me.go_gradually.techinterview.domain.oracle;

import java.util.Locale;

/**
 * The oracle's {@code adaptation_needed} field. Anything other than {@link #NONE}
 * asks the interview to stay where it is for a follow-up.
 */
public enum AdaptationNeed {
    NONE,
    CLARIFY,
    SIMPLIFY,
    DEEPEN,
    OTHER;

    public static AdaptationNeed fromCode(String code) {
        if (code == null || code.isBlank()) {
            return NONE;
        }
        return switch (code.trim().toLowerCase(Locale.ROOT)) {
            case "none", "no", "false", "null" -> NONE;
            case "clarify", "clarification", "follow_up", "followup" -> CLARIFY;
            case "simplify", "easier" -> SIMPLIFY;
            case "deepen", "harder" -> DEEPEN;
            default -> OTHER;
        };
    }

    public boolean isRequested() {
        return this != NONE;
    }
}
