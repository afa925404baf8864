package me.go_gradually.techinterview.domain.time;

import me.go_gradually.techinterview.domain.interview.InterviewPhase;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Set;

/**
 * Wall-clock budget of one interview. Every reading goes through the injected
 * {@link Clock}; nothing here runs on a timer.
 */
public class TimeBudgetManager {
    private static final double SECONDS_PER_MINUTE = 60.0;

    private final Clock clock;
    private final TimeBudgetSettings settings;
    private final Instant startedAt;

    public TimeBudgetManager(Clock clock, TimeBudgetSettings settings) {
        if (clock == null || settings == null) {
            throw new IllegalArgumentException("Clock and time budget settings are required");
        }
        this.clock = clock;
        this.settings = settings;
        this.startedAt = clock.instant();
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant now() {
        return clock.instant();
    }

    public Duration elapsed() {
        Duration elapsed = Duration.between(startedAt, clock.instant());
        return elapsed.isNegative() ? Duration.ZERO : elapsed;
    }

    public Duration remaining() {
        Duration max = Duration.ofMillis(Math.round(settings.maxSessionMinutes() * SECONDS_PER_MINUTE * 1000));
        Duration remaining = max.minus(elapsed());
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    public double elapsedMinutes() {
        return toMinutes(elapsed());
    }

    public double remainingMinutes() {
        return toMinutes(remaining());
    }

    public TimeStatus status() {
        double remaining = remainingMinutes();
        if (remaining < settings.criticalMinutes()) {
            return TimeStatus.CRITICAL;
        }
        if (remaining < settings.wrapUpMinutes()) {
            return TimeStatus.NEEDS_WRAP_UP;
        }
        if (remaining < settings.accelerationMinutes()) {
            return TimeStatus.NEEDS_ACCELERATION;
        }
        return TimeStatus.ON_TRACK;
    }

    /**
     * Sum of target minutes for {@code current} and every later phase not already completed.
     */
    public double remainingTargetMinutes(InterviewPhase current, Collection<InterviewPhase> completedPhases) {
        Set<InterviewPhase> completed = completedPhases == null ? Set.of() : Set.copyOf(completedPhases);
        return current.remainingIncludingSelf().stream()
                .filter(phase -> phase == current || !completed.contains(phase))
                .mapToDouble(settings::targetMinutes)
                .sum();
    }

    public double strategyRatio(InterviewPhase current, Collection<InterviewPhase> completedPhases) {
        double targets = remainingTargetMinutes(current, completedPhases);
        double remaining = remainingMinutes();
        if (targets <= 0) {
            return remaining > 0 ? Double.POSITIVE_INFINITY : 0.0;
        }
        return remaining / targets;
    }

    public PhaseTimeStrategy phaseStrategy(InterviewPhase current, Collection<InterviewPhase> completedPhases) {
        double ratio = strategyRatio(current, completedPhases);
        if (ratio < settings.criticalShortageRatio()) {
            return PhaseTimeStrategy.CRITICAL_SHORTAGE;
        }
        if (ratio < settings.accelerateRatio()) {
            return PhaseTimeStrategy.ACCELERATE;
        }
        if (ratio < settings.onTrackRatio()) {
            return PhaseTimeStrategy.ON_TRACK;
        }
        return PhaseTimeStrategy.AMPLE_TIME;
    }

    public boolean exceeds(double maxMinutes) {
        return elapsedMinutes() > maxMinutes;
    }

    public Duration since(Instant instant) {
        Duration duration = Duration.between(instant, clock.instant());
        return duration.isNegative() ? Duration.ZERO : duration;
    }

    private static double toMinutes(Duration duration) {
        return duration.toMillis() / (SECONDS_PER_MINUTE * 1000);
    }
}
