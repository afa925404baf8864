package me.go_gradually.techinterview.domain.profile;

public enum TechnicalLevel {
    UNKNOWN("unknown"),
    JUNIOR("junior"),
    MIDDLE("middle"),
    SENIOR("senior");

    private final String code;

    TechnicalLevel(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
