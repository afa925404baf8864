package me.go_gradually.techinterview.application.shared.port;

import java.time.Duration;

public interface MetricsPort {
    void recordOracleLatency(Duration duration);

    void recordTurnLatency(Duration duration);

    void incrementOracleError();

    void incrementOracleFallback();

    void incrementPhaseTransition(String from, String to);

    void incrementRepetitionDetected();

    void incrementSessionStarted();

    void incrementSessionCompleted();
}
