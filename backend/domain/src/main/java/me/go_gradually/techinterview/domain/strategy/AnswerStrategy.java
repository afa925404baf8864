package me.go_gradually.techinterview.domain.strategy;

import me.go_gradually.techinterview.domain.interview.Difficulty;

public enum AnswerStrategy {
    STANDARD("standard", new StrategyTactic(Difficulty.MEDIUM,
            "follow the interview plan",
            "open question on the current area")),
    SIMPLIFY("simplify", new StrategyTactic(Difficulty.EASY,
            "step back to fundamentals",
            "short concrete question with one expected idea")),
    ALTERNATIVE_ANGLE("alternative_angle", new StrategyTactic(Difficulty.MEDIUM,
            "approach the same area from practical experience",
            "scenario question based on a real situation")),
    DEEPEN("deepen", new StrategyTactic(Difficulty.HARD,
            "probe trade-offs and edge cases",
            "follow-up that asks why and what if")),
    SWITCH_TOPIC("switch_topic", new StrategyTactic(Difficulty.MEDIUM,
            "move to an area that has not been covered",
            "fresh question on a different plan area"));

    private final String code;
    private final StrategyTactic tactic;

    AnswerStrategy(String code, StrategyTactic tactic) {
        this.code = code;
        this.tactic = tactic;
    }

    public String code() {
        return code;
    }

    public StrategyTactic tactic() {
        return tactic;
    }
}
