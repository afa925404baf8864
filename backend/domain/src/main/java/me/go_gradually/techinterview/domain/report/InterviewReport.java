package me.go_gradually.techinterview.domain.report;

import me.go_gradually.techinterview.domain.profile.ProfileSummary;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only export of a finished (or previewed) interview.
 */
public record InterviewReport(String sessionId,
                              Instant generatedAt,
                              int overallScore,
                              ProfileSummary profile,
                              Map<String, PhaseBreakdown> phaseBreakdown,
                              List<PhaseFlowEntry> interviewFlow,
                              HrValidation hrValidation,
                              AdaptiveInsights adaptiveInsights,
                              FinalRecommendation finalRecommendation) {
    public InterviewReport {
        phaseBreakdown = Collections.unmodifiableMap(new LinkedHashMap<>(phaseBreakdown));
        interviewFlow = List.copyOf(interviewFlow);
    }
}
