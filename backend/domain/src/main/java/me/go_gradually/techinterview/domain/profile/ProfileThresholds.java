package me.go_gradually.techinterview.domain.profile;

/**
 * Score bars used by {@link CandidateProfile}.
 *
 * @param failureThreshold   technical score at or below which an answer counts against its topic
 * @param successThreshold   technical score at or above which a topic is marked strong
 * @param minAnswersForLevel answers required before the technical level is classified
 * @param middleLevelMin     running technical average needed for {@code middle}
 * @param seniorLevelMin     running technical average needed for {@code senior}
 * @param maxPriorityConcerns cap on the HR concerns reported as still open
 */
public record ProfileThresholds(double failureThreshold,
                                double successThreshold,
                                int minAnswersForLevel,
                                double middleLevelMin,
                                double seniorLevelMin,
                                int maxPriorityConcerns) {
    public ProfileThresholds {
        if (failureThreshold < 0 || successThreshold > 10 || failureThreshold >= successThreshold) {
            throw new IllegalArgumentException("Profile failure threshold must be below success threshold within 0-10");
        }
        if (minAnswersForLevel < 1) {
            throw new IllegalArgumentException("minAnswersForLevel must be positive");
        }
        if (middleLevelMin > seniorLevelMin) {
            throw new IllegalArgumentException("middle level bar must not exceed senior level bar");
        }
        if (maxPriorityConcerns < 0) {
            throw new IllegalArgumentException("maxPriorityConcerns must not be negative");
        }
    }

    public static ProfileThresholds defaults() {
        return new ProfileThresholds(3.0, 8.0, 3, 4.0, 7.0, 3);
    }
}
