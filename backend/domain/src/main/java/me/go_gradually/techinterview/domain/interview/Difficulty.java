package me.go_gradually.techinterview.domain.interview;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum Difficulty {
    EASY("easy"),
    MEDIUM("medium"),
    HARD("hard");

    private final String code;

    Difficulty(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static Optional<Difficulty> fromCode(String code) {
        if (code == null || code.isBlank()) {
            return Optional.empty();
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(difficulty -> difficulty.code.equals(normalized))
                .findFirst();
    }
}
