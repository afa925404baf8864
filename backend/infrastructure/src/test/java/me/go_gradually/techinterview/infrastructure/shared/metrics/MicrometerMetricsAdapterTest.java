package me.go_gradually.techinterview.infrastructure.shared.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

class MicrometerMetricsAdapterTest {

    @Test
    void recordsTimersAndCounters() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        MicrometerMetricsAdapter adapter = new MicrometerMetricsAdapter(registry);

        adapter.recordOracleLatency(Duration.ofMillis(120));
        adapter.recordTurnLatency(Duration.ofMillis(150));
        adapter.incrementOracleError();
        adapter.incrementOracleFallback();
        adapter.incrementOracleFallback();
        adapter.incrementRepetitionDetected();
        adapter.incrementSessionStarted();
        adapter.incrementSessionCompleted();

        assertNotNull(registry.find("oracle.latency").timer());
        assertEquals(1, registry.find("oracle.latency").timer().count());
        assertEquals(1, registry.find("interview.turn.latency").timer().count());
        assertEquals(1.0, registry.find("oracle.errors").counter().count());
        assertEquals(2.0, registry.find("oracle.fallbacks").counter().count());
        assertEquals(1.0, registry.find("interview.repetition.detected").counter().count());
        assertEquals(1.0, registry.find("interview.sessions.started").counter().count());
        assertEquals(1.0, registry.find("interview.sessions.completed").counter().count());
    }

    @Test
    void phaseTransitionsAreTaggedByPhases() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        MicrometerMetricsAdapter adapter = new MicrometerMetricsAdapter(registry);

        adapter.incrementPhaseTransition("exploration", "validation");
        adapter.incrementPhaseTransition("exploration", "validation");
        adapter.incrementPhaseTransition("validation", "wrap_up");

        assertEquals(2.0, registry.find("interview.phase.transitions")
                .tags("from", "exploration", "to", "validation").counter().count());
        assertEquals(1.0, registry.find("interview.phase.transitions")
                .tags("from", "validation", "to", "wrap_up").counter().count());
    }
}
