package me.go_gradually.techinterview.domain.report;

/**
 * Overall-score bars (0-100) and red-flag caps of each recommendation tier.
 */
public record RecommendationThresholds(int strongHireScore,
                                       int hireScore,
                                       int conditionalHireScore,
                                       int strongHireMaxRedFlags,
                                       int hireMaxRedFlags,
                                       int conditionalHireMaxRedFlags) {
    public RecommendationThresholds {
        if (conditionalHireScore < 0 || conditionalHireScore > hireScore || hireScore > strongHireScore
                || strongHireScore > 100) {
            throw new IllegalArgumentException("Recommendation bars must satisfy 0 <= conditional <= hire <= strong-hire <= 100");
        }
        if (strongHireMaxRedFlags < 0 || hireMaxRedFlags < 0 || conditionalHireMaxRedFlags < 0) {
            throw new IllegalArgumentException("Red flag caps must not be negative");
        }
    }

    public static RecommendationThresholds defaults() {
        return new RecommendationThresholds(80, 65, 50, 0, 1, 2);
    }

    public HiringRecommendation recommend(int overallScore, int redFlags) {
        if (overallScore >= strongHireScore && redFlags <= strongHireMaxRedFlags) {
            return HiringRecommendation.STRONG_HIRE;
        } else if (overallScore >= hireScore && redFlags <= hireMaxRedFlags) {
            return HiringRecommendation.HIRE;
        } else if (overallScore >= conditionalHireScore && redFlags <= conditionalHireMaxRedFlags) {
            return HiringRecommendation.CONDITIONAL_HIRE;
        } else {
            return HiringRecommendation.NO_HIRE;
        }
    }
}
