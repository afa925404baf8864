package me.go_gradually.techinterview.application.interview.port;

import me.go_gradually.techinterview.application.interview.usecase.InterviewOrchestrator;
import me.go_gradually.techinterview.domain.session.SessionId;

import java.util.Optional;

public interface InterviewSessionStorePort {
    void save(InterviewOrchestrator orchestrator);

    Optional<InterviewOrchestrator> find(SessionId sessionId);
}
