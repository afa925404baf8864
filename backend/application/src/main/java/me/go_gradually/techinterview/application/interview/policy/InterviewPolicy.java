package me.go_gradually.techinterview.application.interview.policy;

import me.go_gradually.techinterview.domain.interview.InterviewSettings;

public interface InterviewPolicy {
    String getOracleProvider();

    String getOracleModel();

    String getOracleApiKey();

    /**
     * Builds the domain settings; invalid values fail here with {@link IllegalArgumentException}.
     */
    InterviewSettings toInterviewSettings();
}
