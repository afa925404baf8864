package me.go_gradually.techinterview.application.interview.usecase;

import me.go_gradually.techinterview.application.interview.model.InterviewStatusView;
import me.go_gradually.techinterview.application.interview.model.InterviewTurn;
import me.go_gradually.techinterview.application.interview.model.StartInterviewCommand;
import me.go_gradually.techinterview.application.interview.port.InterviewOracle;
import me.go_gradually.techinterview.application.interview.port.InterviewReportPort;
import me.go_gradually.techinterview.application.interview.port.InterviewSessionStorePort;
import me.go_gradually.techinterview.application.shared.port.MetricsPort;
import me.go_gradually.techinterview.domain.interview.CandidateIntake;
import me.go_gradually.techinterview.domain.interview.InterviewSession;
import me.go_gradually.techinterview.domain.interview.InterviewSettings;
import me.go_gradually.techinterview.domain.interview.TurnOutcome;
import me.go_gradually.techinterview.domain.profile.HrAnalysis;
import me.go_gradually.techinterview.domain.report.InterviewReport;
import me.go_gradually.techinterview.domain.session.SessionId;
import me.go_gradually.techinterview.domain.time.TimeBudgetManager;

import java.io.IOException;
import java.time.Clock;
import java.util.NoSuchElementException;
import java.util.logging.Logger;

public class InterviewUseCase {
    private static final Logger log = Logger.getLogger(InterviewUseCase.class.getName());

    private final InterviewSessionStorePort sessionStore;
    private final InterviewReportPort reportStore;
    private final InterviewOracle oracle;
    private final MetricsPort metrics;
    private final InterviewSettings settings;
    private final Clock clock;

    public InterviewUseCase(InterviewSessionStorePort sessionStore,
                            InterviewReportPort reportStore,
                            InterviewOracle oracle,
                            MetricsPort metrics,
                            InterviewSettings settings,
                            Clock clock) {
        this.sessionStore = sessionStore;
        this.reportStore = reportStore;
        this.oracle = oracle;
        this.metrics = metrics;
        this.settings = settings;
        this.clock = clock;
    }

    public InterviewTurn start(StartInterviewCommand command) {
        if (command == null || command.getCandidateName() == null || command.getCandidateName().isBlank()) {
            throw new IllegalArgumentException("candidateName is required");
        }
        HrAnalysis hrAnalysis = new HrAnalysis(command.getHrStrengths(), command.getHrConcerns(), command.getHrOverallScore());
        CandidateIntake intake = new CandidateIntake(command.getCandidateName(), command.getVacancyTitle(),
                command.getIndustry(), hrAnalysis);
        InterviewSession session = new InterviewSession(SessionId.generate(), intake, settings, clock);
        InterviewOrchestrator orchestrator = new InterviewOrchestrator(session, oracle, metrics);
        TurnOutcome outcome = orchestrator.start(intake.candidateName());
        sessionStore.save(orchestrator);
        return new InterviewTurn(session.getSessionId().value(), outcome);
    }

    public InterviewTurn answer(String sessionId, String answer) {
        if (answer == null || answer.isBlank()) {
            throw new IllegalArgumentException("answer is required");
        }
        InterviewOrchestrator orchestrator = require(sessionId);
        synchronized (orchestrator) {
            TurnOutcome outcome = orchestrator.processAnswer(answer.trim());
            return new InterviewTurn(sessionId, outcome);
        }
    }

    public InterviewStatusView status(String sessionId) {
        InterviewOrchestrator orchestrator = require(sessionId);
        synchronized (orchestrator) {
            InterviewSession session = orchestrator.getSession();
            TimeBudgetManager time = session.getTimeBudget();
            return new InterviewStatusView(
                    session.getSessionId().value(),
                    session.getProfile().getName(),
                    session.getCurrentPhase().code(),
                    session.getCurrentQuestion(),
                    session.getCurrentTopic().value(),
                    session.getCurrentDifficulty().code(),
                    session.getTotalAnswers(),
                    time.elapsedMinutes(),
                    time.remainingMinutes(),
                    time.status().code(),
                    session.getProfile().getTechnicalLevel().code(),
                    session.isCompleted(),
                    orchestrator.shouldEnd());
        }
    }

    public InterviewReport report(String sessionId) {
        InterviewOrchestrator orchestrator = require(sessionId);
        synchronized (orchestrator) {
            return orchestrator.report();
        }
    }

    /**
     * Closes the interview and hands the final report to the report store.
     */
    public InterviewReport complete(String sessionId) throws IOException {
        InterviewOrchestrator orchestrator = require(sessionId);
        InterviewReport report;
        synchronized (orchestrator) {
            report = orchestrator.complete();
        }
        String location = reportStore.save(report);
        log.info(() -> "interview.report.saved sessionId=" + sessionId + " location=" + location);
        return report;
    }

    private InterviewOrchestrator require(String sessionId) {
        SessionId id = SessionId.of(sessionId);
        return sessionStore.find(id)
                .orElseThrow(() -> new NoSuchElementException("Interview not found: " + id.value()));
    }
}
