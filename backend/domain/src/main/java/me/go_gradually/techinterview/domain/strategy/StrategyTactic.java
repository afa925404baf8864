package me.go_gradually.techinterview.domain.strategy;

import me.go_gradually.techinterview.domain.interview.Difficulty;

/**
 * How the next question should be framed under a given {@link AnswerStrategy}.
 */
public record StrategyTactic(Difficulty targetDifficulty, String approach, String questionStyle) {
}
