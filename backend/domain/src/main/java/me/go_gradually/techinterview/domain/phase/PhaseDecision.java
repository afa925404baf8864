package me.go_gradually.techinterview.domain.phase;

import me.go_gradually.techinterview.domain.interview.InterviewPhase;

public record PhaseDecision(InterviewPhase target, TransitionReason reason) {
    public static PhaseDecision stay(InterviewPhase current) {
        return new PhaseDecision(current, TransitionReason.NONE);
    }

    public static PhaseDecision hold(InterviewPhase current) {
        return new PhaseDecision(current, TransitionReason.ADAPTATION_HOLD);
    }

    public static PhaseDecision moveTo(InterviewPhase target, TransitionReason reason) {
        return new PhaseDecision(target, reason);
    }

    public boolean isHeld() {
        return reason == TransitionReason.ADAPTATION_HOLD;
    }
}
