package me.go_gradually.techinterview.domain.time;

/**
 * Absolute time pressure, ordered from least to most severe.
 */
public enum TimeStatus {
    ON_TRACK("on_track"),
    NEEDS_ACCELERATION("needs_acceleration"),
    NEEDS_WRAP_UP("needs_wrap_up"),
    CRITICAL("critical");

    private final String code;

    TimeStatus(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public boolean isAtLeast(TimeStatus other) {
        return ordinal() >= other.ordinal();
    }
}
