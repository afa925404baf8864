package me.go_gradually.techinterview.domain.oracle;

import java.util.Locale;

/**
 * Pacing request carried in the oracle's {@code time_management} field.
 */
public enum TimeManagement {
    CONTINUE,
    ACCELERATE,
    WRAP_UP,
    CRITICAL,
    FINISH;

    public static TimeManagement fromCode(String code) {
        if (code == null || code.isBlank()) {
            return CONTINUE;
        }
        return switch (code.trim().toLowerCase(Locale.ROOT)) {
            case "accelerate", "speed_up" -> ACCELERATE;
            case "wrap_up", "wrapup" -> WRAP_UP;
            case "critical" -> CRITICAL;
            case "finish", "finished" -> FINISH;
            default -> CONTINUE;
        };
    }

    public boolean requestsWrapUp() {
        return this == WRAP_UP || this == CRITICAL;
    }
}
