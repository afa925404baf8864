package me.go_gradually.techinterview.domain.profile;

public enum CommunicationStyle {
    UNKNOWN("unknown"),
    CONFIDENT("confident"),
    UNCERTAIN("uncertain"),
    CONCISE("concise"),
    DEVELOPING("developing");

    private final String code;

    CommunicationStyle(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    static CommunicationStyle classify(double communicationScore, double confidenceScore) {
        if (confidenceScore >= 8 && communicationScore >= 7) {
            return CONFIDENT;
        }
        if (confidenceScore <= 4) {
            return UNCERTAIN;
        }
        if (communicationScore >= 8) {
            return CONCISE;
        }
        return DEVELOPING;
    }
}
