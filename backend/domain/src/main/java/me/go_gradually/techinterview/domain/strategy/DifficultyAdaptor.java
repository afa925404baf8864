package me.go_gradually.techinterview.domain.strategy;

import me.go_gradually.techinterview.domain.interview.Difficulty;

/**
 * Hysteresis on answer quality. A run of weak or strong answers forces the difficulty;
 * otherwise the running technical average decides.
 */
public class DifficultyAdaptor {
    private final AdaptationSettings settings;
    private int consecutiveWeak;
    private int consecutiveStrong;
    private Difficulty current = Difficulty.MEDIUM;

    public DifficultyAdaptor(AdaptationSettings settings) {
        if (settings == null) {
            throw new IllegalArgumentException("Adaptation settings are required");
        }
        this.settings = settings;
    }

    public Difficulty onAnswer(double technicalScore, double averageTechnicalScore) {
        if (technicalScore <= settings.weakScore()) {
            consecutiveWeak += 1;
            consecutiveStrong = 0;
        } else if (technicalScore >= settings.strongScore()) {
            consecutiveStrong += 1;
            consecutiveWeak = 0;
        } else {
            consecutiveWeak = 0;
            consecutiveStrong = 0;
        }
        current = recommend(averageTechnicalScore);
        return current;
    }

    Difficulty recommend(double averageTechnicalScore) {
        if (consecutiveWeak >= settings.consecutiveWeak()) {
            return Difficulty.EASY;
        }
        if (consecutiveStrong >= settings.consecutiveStrong()) {
            return Difficulty.HARD;
        }
        if (averageTechnicalScore < settings.weakScore()) {
            return Difficulty.EASY;
        }
        if (averageTechnicalScore > settings.strongScore()) {
            return Difficulty.HARD;
        }
        return Difficulty.MEDIUM;
    }

    public Difficulty getCurrent() {
        return current;
    }

    public int getConsecutiveWeak() {
        return consecutiveWeak;
    }

    public int getConsecutiveStrong() {
        return consecutiveStrong;
    }
}
