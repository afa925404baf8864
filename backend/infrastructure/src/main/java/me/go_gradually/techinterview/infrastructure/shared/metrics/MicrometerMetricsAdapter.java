package me.go_gradually.techinterview.infrastructure.shared.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import me.go_gradually.techinterview.application.shared.port.MetricsPort;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
public class MicrometerMetricsAdapter implements MetricsPort {
    private final MeterRegistry meterRegistry;

    public MicrometerMetricsAdapter(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @Override
    public void recordOracleLatency(Duration duration) {
        record("oracle.latency", duration);
    }

    @Override
    public void recordTurnLatency(Duration duration) {
        record("interview.turn.latency", duration);
    }

    @Override
    public void incrementOracleError() {
        meterRegistry.counter("oracle.errors").increment();
    }

    @Override
    public void incrementOracleFallback() {
        meterRegistry.counter("oracle.fallbacks").increment();
    }

    @Override
    public void incrementPhaseTransition(String from, String to) {
        meterRegistry.counter("interview.phase.transitions", "from", from, "to", to).increment();
    }

    @Override
    public void incrementRepetitionDetected() {
        meterRegistry.counter("interview.repetition.detected").increment();
    }

    @Override
    public void incrementSessionStarted() {
        meterRegistry.counter("interview.sessions.started").increment();
    }

    @Override
    public void incrementSessionCompleted() {
        meterRegistry.counter("interview.sessions.completed").increment();
    }

    private void record(String name, Duration duration) {
        Timer.builder(name)
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry)
                .record(duration);
    }
}
