package me.go_gradually.techinterview.infrastructure.interview.store;

import me.go_gradually.techinterview.application.interview.model.OracleFailure;
import me.go_gradually.techinterview.application.interview.model.OracleResult;
import me.go_gradually.techinterview.application.interview.usecase.InterviewOrchestrator;
import me.go_gradually.techinterview.application.shared.port.MetricsPort;
import me.go_gradually.techinterview.domain.interview.CandidateIntake;
import me.go_gradually.techinterview.domain.interview.InterviewSession;
import me.go_gradually.techinterview.domain.interview.InterviewSettings;
import me.go_gradually.techinterview.domain.session.SessionId;
import org.junit.jupiter.api.Test;

import java.time.Clock;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class InMemoryInterviewSessionStoreTest {

    @Test
    void save_thenFind_returnsSameOrchestrator() {
        InMemoryInterviewSessionStore store = new InMemoryInterviewSessionStore();
        InterviewSession session = new InterviewSession(SessionId.of("s-1"),
                new CandidateIntake("Mina", "QA Engineer", "games", null),
                InterviewSettings.defaults(), Clock.systemUTC());
        InterviewOrchestrator orchestrator = new InterviewOrchestrator(session,
                context -> OracleResult.failure(OracleFailure.CALL_FAILED, "offline"), mock(MetricsPort.class));

        store.save(orchestrator);

        assertSame(orchestrator, store.find(SessionId.of("s-1")).orElseThrow());
        assertTrue(store.find(SessionId.of("s-2")).isEmpty());
    }
}
