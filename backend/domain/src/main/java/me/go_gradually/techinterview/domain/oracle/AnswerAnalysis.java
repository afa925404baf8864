package me.go_gradually.techinterview.domain.oracle;

import me.go_gradually.techinterview.domain.util.TextUtils;

import java.util.List;

/**
 * Oracle scores for one answer. Every score is conventionally on a 0-10 scale and
 * 0 means the oracle supplied nothing for that signal.
 */
public record AnswerAnalysis(double technicalScore,
                             double communicationScore,
                             double confidenceScore,
                             double depthScore,
                             double practicalExperience,
                             List<String> redFlags,
                             List<String> strengthsShown,
                             String notes) {
    public AnswerAnalysis {
        technicalScore = clamp(technicalScore);
        communicationScore = clamp(communicationScore);
        confidenceScore = clamp(confidenceScore);
        depthScore = clamp(depthScore);
        practicalExperience = clamp(practicalExperience);
        redFlags = TextUtils.cleanList(redFlags);
        strengthsShown = TextUtils.cleanList(strengthsShown);
        notes = TextUtils.normalize(notes);
    }

    public static AnswerAnalysis empty() {
        return new AnswerAnalysis(0, 0, 0, 0, 0, List.of(), List.of(), "");
    }

    public static AnswerAnalysis scores(double technical, double communication, double confidence) {
        return new AnswerAnalysis(technical, communication, confidence, 0, 0, List.of(), List.of(), "");
    }

    public AnswerAnalysis withRedFlags(List<String> flags) {
        return new AnswerAnalysis(technicalScore, communicationScore, confidenceScore, depthScore,
                practicalExperience, flags, strengthsShown, notes);
    }

    public AnswerAnalysis withStrengths(List<String> strengths) {
        return new AnswerAnalysis(technicalScore, communicationScore, confidenceScore, depthScore,
                practicalExperience, redFlags, strengths, notes);
    }

    public AnswerAnalysis withNotes(String value) {
        return new AnswerAnalysis(technicalScore, communicationScore, confidenceScore, depthScore,
                practicalExperience, redFlags, strengthsShown, value);
    }

    public boolean isEmpty() {
        return technicalScore == 0
                && communicationScore == 0
                && confidenceScore == 0
                && depthScore == 0
                && practicalExperience == 0
                && redFlags.isEmpty()
                && strengthsShown.isEmpty()
                && notes.isEmpty();
    }

    private static double clamp(double score) {
        if (Double.isNaN(score)) {
            return 0;
        }
        return Math.min(10.0, Math.max(0.0, score));
    }
}
