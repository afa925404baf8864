package me.go_gradually.techinterview.domain.report;

public record PhaseFlowEntry(String phase, String next, double durationMinutes, int questionsAsked, String reason) {
}
