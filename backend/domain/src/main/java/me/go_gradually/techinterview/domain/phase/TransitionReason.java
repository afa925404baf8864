package me.go_gradually.techinterview.domain.phase;

public enum TransitionReason {
    TIME_CRITICAL,
    RECOMMENDED,
    ADAPTATION_HOLD,
    ORACLE_FINISHED,
    ORACLE_TIME_REQUEST,
    NONE
}
