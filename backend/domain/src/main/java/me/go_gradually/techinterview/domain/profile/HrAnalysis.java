package me.go_gradually.techinterview.domain.profile;

import me.go_gradually.techinterview.domain.util.TextUtils;

import java.util.List;

/**
 * Recruiter screening produced before the interview. All parts are optional.
 */
public record HrAnalysis(List<String> keyStrengths, List<String> criticalConcerns, Integer overallScore) {
    public HrAnalysis {
        keyStrengths = TextUtils.cleanList(keyStrengths);
        criticalConcerns = TextUtils.cleanList(criticalConcerns);
    }

    public static HrAnalysis none() {
        return new HrAnalysis(List.of(), List.of(), null);
    }

    /**
     * Level suggested by the screening score. It is a hint for question framing only.
     */
    public TechnicalLevel preliminaryLevel() {
        if (overallScore == null) {
            return TechnicalLevel.UNKNOWN;
        }
        if (overallScore >= 85) {
            return TechnicalLevel.SENIOR;
        }
        if (overallScore >= 70) {
            return TechnicalLevel.MIDDLE;
        }
        if (overallScore >= 50) {
            return TechnicalLevel.JUNIOR;
        }
        return TechnicalLevel.UNKNOWN;
    }
}
