package me.go_gradually.techinterview.domain.report;

import java.util.List;

public record PhaseBreakdown(int questionsAsked,
                             double avgScore,
                             List<String> difficultiesUsed,
                             double durationMinutes) {
    public PhaseBreakdown {
        difficultiesUsed = List.copyOf(difficultiesUsed);
    }
}
