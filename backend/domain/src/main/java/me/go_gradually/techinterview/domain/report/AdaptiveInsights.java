package me.go_gradually.techinterview.domain.report;

import java.util.List;

public record AdaptiveInsights(String finalDifficulty,
                               String finalStrategy,
                               int phaseTransitions,
                               boolean hrConcernsAddressed,
                               double totalInterviewMinutes,
                               List<String> coveredAreas) {
    public AdaptiveInsights {
        coveredAreas = List.copyOf(coveredAreas);
    }
}
