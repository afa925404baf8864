package me.go_gradually.techinterview.domain.interview;

/**
 * @param maxQuestions     answers after which the interview should end
 * @param criticalRedFlags distinct red flags after which the interview should end
 */
public record SessionLimits(int maxQuestions, int criticalRedFlags) {
    public SessionLimits {
        if (maxQuestions < 1 || criticalRedFlags < 1) {
            throw new IllegalArgumentException("Session limits must be positive");
        }
    }

    public static SessionLimits defaults() {
        return new SessionLimits(12, 8);
    }
}
