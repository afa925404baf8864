package me.go_gradually.techinterview.domain.interview;

import me.go_gradually.techinterview.domain.profile.HrAnalysis;

/**
 * What is known about the candidate before the first question.
 */
public record CandidateIntake(String candidateName, String vacancyTitle, String industry, HrAnalysis hrAnalysis) {
    public CandidateIntake {
        candidateName = candidateName == null ? "" : candidateName.trim();
        vacancyTitle = vacancyTitle == null ? "" : vacancyTitle.trim();
        industry = industry == null ? "" : industry.trim();
        hrAnalysis = hrAnalysis == null ? HrAnalysis.none() : hrAnalysis;
    }
}
