package me.go_gradually.techinterview.application.interview.model;

import me.go_gradually.techinterview.domain.oracle.OracleDecision;

/**
 * Either a decoded decision or the reason there is none.
 */
public record OracleResult(OracleDecision decision, OracleFailure failure, String detail) {
    public OracleResult {
        detail = detail == null ? "" : detail.trim();
        if ((decision == null) == (failure == null)) {
            throw new IllegalArgumentException("OracleResult needs exactly one of decision or failure");
        }
    }

    public static OracleResult success(OracleDecision decision) {
        return new OracleResult(decision, null, "");
    }

    public static OracleResult failure(OracleFailure failure, String detail) {
        return new OracleResult(null, failure, detail);
    }

    public boolean isSuccess() {
        return decision != null;
    }

    public OracleDecision decisionOrNull() {
        return decision;
    }
}
