package me.go_gradually.techinterview.application.interview.model;

public enum OracleFailure {
    CALL_FAILED,
    MALFORMED_RESPONSE
}
