package me.go_gradually.techinterview.domain.report;

public enum HiringRecommendation {
    STRONG_HIRE("strong_hire", "Strongly recommended for hire"),
    HIRE("hire", "Recommended for hire"),
    CONDITIONAL_HIRE("conditional_hire", "Conditionally recommended, needs an additional assessment"),
    NO_HIRE("no_hire", "Not recommended for hire");

    private final String code;
    private final String decisionText;

    HiringRecommendation(String code, String decisionText) {
        this.code = code;
        this.decisionText = decisionText;
    }

    public String code() {
        return code;
    }

    public String decisionText() {
        return decisionText;
    }
}
