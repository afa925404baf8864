package me.go_gradually.techinterview.infrastructure.interview.store;

import me.go_gradually.techinterview.application.interview.port.InterviewSessionStorePort;
import me.go_gradually.techinterview.application.interview.usecase.InterviewOrchestrator;
import me.go_gradually.techinterview.domain.session.SessionId;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class InMemoryInterviewSessionStore implements InterviewSessionStorePort {
    private final Map<SessionId, InterviewOrchestrator> sessions = new ConcurrentHashMap<>();

    @Override
    public void save(InterviewOrchestrator orchestrator) {
        sessions.put(orchestrator.getSession().getSessionId(), orchestrator);
    }

    @Override
    public Optional<InterviewOrchestrator> find(SessionId sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }
}
