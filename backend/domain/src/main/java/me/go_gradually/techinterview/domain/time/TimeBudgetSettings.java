package me.go_gradually.techinterview.domain.time;

import me.go_gradually.techinterview.domain.interview.InterviewPhase;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Time budget configuration. Minute thresholds bucket the remaining time into a
 * {@link TimeStatus}; ratio breakpoints bucket remaining time over remaining phase
 * targets into a {@link PhaseTimeStrategy}.
 */
public record TimeBudgetSettings(double maxSessionMinutes,
                                 double criticalMinutes,
                                 double wrapUpMinutes,
                                 double accelerationMinutes,
                                 Map<InterviewPhase, Double> phaseTargetMinutes,
                                 double criticalShortageRatio,
                                 double accelerateRatio,
                                 double onTrackRatio) {
    public TimeBudgetSettings {
        if (maxSessionMinutes <= 0) {
            throw new IllegalArgumentException("maxSessionMinutes must be positive");
        }
        if (criticalMinutes < 0 || criticalMinutes > wrapUpMinutes || wrapUpMinutes > accelerationMinutes) {
            throw new IllegalArgumentException("Time thresholds must satisfy 0 <= critical <= wrap-up <= acceleration");
        }
        if (criticalShortageRatio < 0 || criticalShortageRatio > accelerateRatio || accelerateRatio > onTrackRatio) {
            throw new IllegalArgumentException("Strategy ratios must satisfy 0 <= critical-shortage <= accelerate <= on-track");
        }
        EnumMap<InterviewPhase, Double> targets = new EnumMap<>(InterviewPhase.class);
        if (phaseTargetMinutes != null) {
            for (Map.Entry<InterviewPhase, Double> entry : phaseTargetMinutes.entrySet()) {
                if (entry.getKey() == null || entry.getValue() == null || entry.getValue() < 0) {
                    throw new IllegalArgumentException("Phase target minutes must be non-negative: " + entry);
                }
                targets.put(entry.getKey(), entry.getValue());
            }
        }
        phaseTargetMinutes = Collections.unmodifiableMap(targets);
    }

    public static TimeBudgetSettings defaults() {
        Map<InterviewPhase, Double> targets = new EnumMap<>(InterviewPhase.class);
        targets.put(InterviewPhase.EXPLORATION, 5.0);
        targets.put(InterviewPhase.VALIDATION, 8.0);
        targets.put(InterviewPhase.STRESS_TEST, 6.0);
        targets.put(InterviewPhase.SOFT_SKILLS, 5.0);
        targets.put(InterviewPhase.WRAP_UP, 1.0);
        return new TimeBudgetSettings(15, 3, 7, 12, targets, 0.5, 0.8, 1.2);
    }

    public double targetMinutes(InterviewPhase phase) {
        return phaseTargetMinutes.getOrDefault(phase, 0.0);
    }
}
