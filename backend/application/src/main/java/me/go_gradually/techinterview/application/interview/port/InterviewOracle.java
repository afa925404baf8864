package me.go_gradually.techinterview.application.interview.port;

import me.go_gradually.techinterview.application.interview.model.OracleResult;
import me.go_gradually.techinterview.domain.interview.InterviewContext;

/**
 * External decision provider. Implementations never throw; failures come back as
 * {@link OracleResult#failure}.
 */
public interface InterviewOracle {
    OracleResult decide(InterviewContext context);
}
