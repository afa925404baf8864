package me.go_gradually.techinterview.domain.interview;

import me.go_gradually.techinterview.domain.phase.PhaseTransitionRules;
import me.go_gradually.techinterview.domain.profile.ProfileThresholds;
import me.go_gradually.techinterview.domain.repetition.RepetitionSettings;
import me.go_gradually.techinterview.domain.report.RecommendationThresholds;
import me.go_gradually.techinterview.domain.strategy.AdaptationSettings;
import me.go_gradually.techinterview.domain.time.TimeBudgetSettings;

public record InterviewSettings(SessionLimits limits,
                                TranscriptWindow transcript,
                                ProfileThresholds profile,
                                TimeBudgetSettings time,
                                AdaptationSettings adaptation,
                                RepetitionSettings repetition,
                                PhaseTransitionRules phases,
                                RecommendationThresholds report) {
    public InterviewSettings {
        if (limits == null || transcript == null || profile == null || time == null
                || adaptation == null || repetition == null || phases == null || report == null) {
            throw new IllegalArgumentException("Every interview settings group is required");
        }
    }

    public static InterviewSettings defaults() {
        return new InterviewSettings(
                SessionLimits.defaults(),
                TranscriptWindow.defaults(),
                ProfileThresholds.defaults(),
                TimeBudgetSettings.defaults(),
                AdaptationSettings.defaults(),
                RepetitionSettings.defaults(),
                PhaseTransitionRules.defaults(),
                RecommendationThresholds.defaults());
    }
}
