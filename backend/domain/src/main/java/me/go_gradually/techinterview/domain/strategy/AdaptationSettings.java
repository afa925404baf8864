package me.go_gradually.techinterview.domain.strategy;

/**
 * Score bars and hysteresis counts for {@link StrategyAdaptor} and {@link DifficultyAdaptor}.
 */
public record AdaptationSettings(double weakScore,
                                 double veryWeakScore,
                                 double strongScore,
                                 int consecutiveWeak,
                                 int consecutiveStrong) {
    public AdaptationSettings {
        if (veryWeakScore > weakScore || weakScore >= strongScore) {
            throw new IllegalArgumentException("Adaptation scores must satisfy very-weak <= weak < strong");
        }
        if (consecutiveWeak < 1 || consecutiveStrong < 1) {
            throw new IllegalArgumentException("Consecutive answer counts must be positive");
        }
    }

    public static AdaptationSettings defaults() {
        return new AdaptationSettings(4.0, 2.0, 8.0, 2, 2);
    }
}
