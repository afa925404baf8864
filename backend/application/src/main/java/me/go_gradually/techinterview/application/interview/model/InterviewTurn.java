package me.go_gradually.techinterview.application.interview.model;

import me.go_gradually.techinterview.domain.interview.TurnOutcome;

public record InterviewTurn(String sessionId, TurnOutcome outcome) {
}
