package me.go_gradually.techinterview.domain.report;

public record FinalRecommendation(HiringRecommendation decision, String decisionText, ConfidenceLevel confidenceLevel) {
}
