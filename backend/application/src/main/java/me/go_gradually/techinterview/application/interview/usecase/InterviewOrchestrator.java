package me.go_gradually.techinterview.application.interview.usecase;

import me.go_gradually.techinterview.application.interview.model.OracleResult;
import me.go_gradually.techinterview.application.interview.port.InterviewOracle;
import me.go_gradually.techinterview.application.shared.port.MetricsPort;
import me.go_gradually.techinterview.domain.interview.InterviewSession;
import me.go_gradually.techinterview.domain.interview.TurnOutcome;
import me.go_gradually.techinterview.domain.oracle.OracleDecision;
import me.go_gradually.techinterview.domain.phase.PhaseSnapshot;
import me.go_gradually.techinterview.domain.report.InterviewReport;

import java.time.Duration;
import java.time.Instant;
import java.util.logging.Logger;

/**
 * Drives one {@link InterviewSession}: asks the oracle, hands its decision to the session
 * and reports what happened. One instance per session; calls must not overlap.
 */
public class InterviewOrchestrator {
    private static final Logger log = Logger.getLogger(InterviewOrchestrator.class.getName());

    private final InterviewSession session;
    private final InterviewOracle oracle;
    private final MetricsPort metrics;

    public InterviewOrchestrator(InterviewSession session, InterviewOracle oracle, MetricsPort metrics) {
        this.session = session;
        this.oracle = oracle;
        this.metrics = metrics;
    }

    public TurnOutcome start(String candidateName) {
        if (session.isOpened()) {
            throw new IllegalStateException("Interview has already been started");
        }
        OracleResult result = oracle.decide(session.openingContext());
        TurnOutcome outcome = session.open(candidateName, result.decisionOrNull());
        if (outcome.fallbackUsed()) {
            recordFallback(result);
        }
        metrics.incrementSessionStarted();
        log.info(() -> "interview.session.started sessionId=" + session.getSessionId().value()
                + " vacancyType=" + session.getVacancyType().code()
                + " plan=" + session.getPlan().names());
        return outcome;
    }

    public TurnOutcome processAnswer(String answer) {
        if (!session.isAcceptingAnswers()) {
            throw new IllegalStateException(session.isOpened()
                    ? "Interview is already finished"
                    : "Interview has not been started yet");
        }
        Instant start = Instant.now();
        OracleResult result = oracle.decide(session.answerContext(answer));
        OracleDecision decision = result.decisionOrNull();
        if (decision != null && !decision.reportedPhaseCode().isEmpty() && decision.reportedPhase().isEmpty()) {
            log.warning(() -> "interview.oracle.unknownPhase sessionId=" + session.getSessionId().value()
                    + " phase=" + decision.reportedPhaseCode());
        }
        TurnOutcome outcome = session.applyAnswer(answer, decision);
        outcome.phaseTransition().ifPresent(this::recordTransition);
        if (outcome.fallbackUsed()) {
            recordFallback(result);
        }
        if (outcome.repetitionDetected()) {
            metrics.incrementRepetitionDetected();
            log.fine(() -> "interview.repetition.detected sessionId=" + session.getSessionId().value()
                    + " substituted=" + outcome.questionSubstituted()
                    + " area=" + outcome.questionArea().value());
        }
        metrics.recordTurnLatency(Duration.between(start, Instant.now()));
        return outcome;
    }

    public boolean shouldEnd() {
        return session.shouldEnd();
    }

    public boolean shouldEnd(double maxMinutes, int maxQuestions) {
        return session.shouldEnd(maxMinutes, maxQuestions);
    }

    public InterviewReport report() {
        return session.report();
    }

    public InterviewReport complete() {
        boolean alreadyCompleted = session.isCompleted();
        InterviewReport report = session.complete();
        if (!alreadyCompleted) {
            metrics.incrementSessionCompleted();
            log.info(() -> "interview.session.completed sessionId=" + report.sessionId()
                    + " answers=" + session.getTotalAnswers()
                    + " score=" + report.overallScore()
                    + " decision=" + report.finalRecommendation().decision().code());
        }
        return report;
    }

    public InterviewSession getSession() {
        return session;
    }

    private void recordTransition(PhaseSnapshot snapshot) {
        metrics.incrementPhaseTransition(snapshot.phase().code(), snapshot.next().code());
        log.info(() -> "interview.phase.transition sessionId=" + session.getSessionId().value()
                + " from=" + snapshot.phase().code()
                + " to=" + snapshot.next().code()
                + " reason=" + snapshot.reason());
    }

    private void recordFallback(OracleResult result) {
        metrics.incrementOracleFallback();
        String cause = result.isSuccess() ? "MISSING_QUESTION" : result.failure().name();
        log.warning(() -> "interview.oracle.fallback sessionId=" + session.getSessionId().value()
                + " phase=" + session.getCurrentPhase().code()
                + " cause=" + cause);
    }
}
