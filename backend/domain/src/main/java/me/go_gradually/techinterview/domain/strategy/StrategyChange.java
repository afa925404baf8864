package me.go_gradually.techinterview.domain.strategy;

public record StrategyChange(AnswerStrategy from, AnswerStrategy to) {
    public static StrategyChange none(AnswerStrategy current) {
        return new StrategyChange(current, current);
    }

    public boolean changed() {
        return from != to;
    }
}
