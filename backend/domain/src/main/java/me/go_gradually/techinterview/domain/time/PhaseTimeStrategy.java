package me.go_gradually.techinterview.domain.time;

/**
 * Advisory pacing hint derived from remaining time versus the remaining phase schedule.
 */
public enum PhaseTimeStrategy {
    CRITICAL_SHORTAGE("critical_shortage", "one short, decisive question per remaining phase"),
    ACCELERATE("accelerate", "prefer focused questions and skip follow-ups"),
    ON_TRACK("on_track", "keep the planned depth"),
    AMPLE_TIME("ample_time", "room for follow-ups and deeper probing");

    private final String code;
    private final String guidance;

    PhaseTimeStrategy(String code, String guidance) {
        this.code = code;
        this.guidance = guidance;
    }

    public String code() {
        return code;
    }

    public String guidance() {
        return guidance;
    }
}
