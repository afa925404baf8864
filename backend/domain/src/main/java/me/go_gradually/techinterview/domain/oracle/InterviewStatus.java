package me.go_gradually.techinterview.domain.oracle;

import java.util.Locale;

public enum InterviewStatus {
    CONTINUING,
    FINISHED;

    public static InterviewStatus fromCode(String code) {
        if (code == null) {
            return CONTINUING;
        }
        return "finished".equals(code.trim().toLowerCase(Locale.ROOT)) ? FINISHED : CONTINUING;
    }
}
