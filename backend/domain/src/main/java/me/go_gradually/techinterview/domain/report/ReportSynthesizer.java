package me.go_gradually.techinterview.domain.report;

import me.go_gradually.techinterview.domain.interview.Difficulty;
import me.go_gradually.techinterview.domain.interview.InterviewPhase;
import me.go_gradually.techinterview.domain.phase.PhaseSnapshot;
import me.go_gradually.techinterview.domain.phase.PhaseStateMachine;
import me.go_gradually.techinterview.domain.phase.PhaseStats;
import me.go_gradually.techinterview.domain.profile.CandidateProfile;
import me.go_gradually.techinterview.domain.profile.ProfileSummary;
import me.go_gradually.techinterview.domain.strategy.AnswerStrategy;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reduces a profile and its phase history to a score out of 100 and a hiring recommendation.
 */
public class ReportSynthesizer {
    private final RecommendationThresholds thresholds;

    public ReportSynthesizer(RecommendationThresholds thresholds) {
        if (thresholds == null) {
            throw new IllegalArgumentException("Recommendation thresholds are required");
        }
        this.thresholds = thresholds;
    }

    public static int overallScore(double avgTechnical, double avgCommunication) {
        return (int) Math.round(((avgTechnical + avgCommunication) / 2) * 10);
    }

    public FinalRecommendation recommend(int overallScore, int redFlagCount) {
        HiringRecommendation decision = thresholds.recommend(overallScore, redFlagCount);
        return new FinalRecommendation(decision, decision.decisionText(), ConfidenceLevel.fromRedFlagCount(redFlagCount));
    }

    public InterviewReport synthesize(String sessionId,
                                      CandidateProfile profile,
                                      PhaseStateMachine phases,
                                      Difficulty finalDifficulty,
                                      AnswerStrategy finalStrategy,
                                      List<String> coveredAreas,
                                      double totalInterviewMinutes,
                                      Instant now) {
        ProfileSummary summary = profile.summary();
        int overall = overallScore(summary.avgTechnical(), summary.avgCommunication());
        FinalRecommendation recommendation = recommend(overall, summary.redFlags().size());

        HrValidation hrValidation = new HrValidation(
                summary.preliminaryLevel().code(),
                profile.validatedHrStrengths(),
                profile.confirmedHrConcerns(),
                summary.priorityConcerns());
        AdaptiveInsights insights = new AdaptiveInsights(
                finalDifficulty.code(),
                finalStrategy.code(),
                phases.getHistory().size(),
                summary.priorityConcerns().isEmpty(),
                round1(totalInterviewMinutes),
                coveredAreas);

        return new InterviewReport(
                sessionId,
                now,
                overall,
                summary,
                phaseBreakdown(phases, now),
                phases.getHistory().stream().map(ReportSynthesizer::toFlowEntry).toList(),
                hrValidation,
                insights,
                recommendation);
    }

    private Map<String, PhaseBreakdown> phaseBreakdown(PhaseStateMachine phases, Instant now) {
        Map<String, PhaseBreakdown> breakdown = new LinkedHashMap<>();
        for (InterviewPhase phase : InterviewPhase.values()) {
            PhaseStats stats = phases.getStats(phase);
            if (stats.getQuestionsAsked() == 0) {
                continue;
            }
            Duration spent = phases.getHistory().stream()
                    .filter(snapshot -> snapshot.phase() == phase)
                    .map(PhaseSnapshot::duration)
                    .reduce(Duration.ZERO, Duration::plus);
            if (phase == phases.getCurrent() && stats.getStartedAt() != null) {
                Duration open = Duration.between(stats.getStartedAt(), now);
                spent = spent.plus(open.isNegative() ? Duration.ZERO : open);
            }
            breakdown.put(phase.code(), new PhaseBreakdown(
                    stats.getQuestionsAsked(),
                    round1(stats.getAvgTechnicalScore()),
                    stats.getDifficultiesUsed().stream().map(Difficulty::code).toList(),
                    round1(toMinutes(spent))));
        }
        return breakdown;
    }

    private static PhaseFlowEntry toFlowEntry(PhaseSnapshot snapshot) {
        return new PhaseFlowEntry(
                snapshot.phase().code(),
                snapshot.next().code(),
                round1(toMinutes(snapshot.duration())),
                snapshot.questionsAsked(),
                snapshot.reason().name());
    }

    private static double toMinutes(Duration duration) {
        return duration.toMillis() / 60000.0;
    }

    private static double round1(double value) {
        return Math.round(value * 10) / 10.0;
    }
}
