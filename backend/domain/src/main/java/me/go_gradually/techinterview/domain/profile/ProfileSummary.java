package me.go_gradually.techinterview.domain.profile;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only view of a {@link CandidateProfile} at one instant.
 */
public record ProfileSummary(String name,
                             String vacancyTitle,
                             String industry,
                             TechnicalLevel technicalLevel,
                             TechnicalLevel preliminaryLevel,
                             CommunicationStyle communicationStyle,
                             int totalAnswers,
                             double avgTechnical,
                             double avgCommunication,
                             double avgConfidence,
                             List<String> confirmedStrengths,
                             List<String> confirmedWeaknesses,
                             List<String> redFlags,
                             List<String> learningIndicators,
                             List<String> hrStrengths,
                             List<String> priorityConcerns,
                             List<String> failedTopics,
                             List<String> strongTopics,
                             Map<String, Double> performanceByArea) {
    public ProfileSummary {
        confirmedStrengths = List.copyOf(confirmedStrengths);
        confirmedWeaknesses = List.copyOf(confirmedWeaknesses);
        redFlags = List.copyOf(redFlags);
        learningIndicators = List.copyOf(learningIndicators);
        hrStrengths = List.copyOf(hrStrengths);
        priorityConcerns = List.copyOf(priorityConcerns);
        failedTopics = List.copyOf(failedTopics);
        strongTopics = List.copyOf(strongTopics);
        performanceByArea = Collections.unmodifiableMap(new LinkedHashMap<>(performanceByArea));
    }
}
