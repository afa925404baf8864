package me.go_gradually.techinterview.domain.report;

public enum ConfidenceLevel {
    HIGH("high"),
    MEDIUM("medium"),
    LOW("low");

    private final String code;

    ConfidenceLevel(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static ConfidenceLevel fromRedFlagCount(int redFlags) {
        if (redFlags <= 0) {
            return HIGH;
        }
        if (redFlags <= 2) {
            return MEDIUM;
        }
        return LOW;
    }
}
