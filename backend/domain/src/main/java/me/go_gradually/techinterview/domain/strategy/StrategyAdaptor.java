package me.go_gradually.techinterview.domain.strategy;

import me.go_gradually.techinterview.domain.interview.TopicArea;

import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Keeps one current answer strategy and reacts to answer quality. Re-entering the
 * strategy already in place is not a change.
 */
public class StrategyAdaptor {
    private final AdaptationSettings settings;
    private AnswerStrategy current = AnswerStrategy.STANDARD;
    private final Set<AnswerStrategy> failedStrategies = EnumSet.noneOf(AnswerStrategy.class);
    private final Set<AnswerStrategy> successfulStrategies = EnumSet.noneOf(AnswerStrategy.class);
    private final Set<TopicArea> successfulTopics = new LinkedHashSet<>();

    public StrategyAdaptor(AdaptationSettings settings) {
        if (settings == null) {
            throw new IllegalArgumentException("Adaptation settings are required");
        }
        this.settings = settings;
    }

    public StrategyChange onAnswer(TopicArea topic, double technicalScore) {
        if (technicalScore <= settings.weakScore()) {
            failedStrategies.add(current);
            AnswerStrategy target = technicalScore <= settings.veryWeakScore()
                    ? AnswerStrategy.SIMPLIFY
                    : AnswerStrategy.ALTERNATIVE_ANGLE;
            return switchTo(target);
        }
        if (technicalScore >= settings.strongScore()) {
            successfulStrategies.add(current);
            if (topic != null) {
                successfulTopics.add(topic);
            }
            return switchTo(AnswerStrategy.DEEPEN);
        }
        return StrategyChange.none(current);
    }

    public StrategyChange onTopicFailed() {
        return switchTo(AnswerStrategy.SWITCH_TOPIC);
    }

    public StrategyTactic tactic() {
        return tactic(current);
    }

    public StrategyTactic tactic(AnswerStrategy strategy) {
        return strategy.tactic();
    }

    public AnswerStrategy getCurrent() {
        return current;
    }

    public Set<AnswerStrategy> getFailedStrategies() {
        return Collections.unmodifiableSet(failedStrategies);
    }

    public Set<AnswerStrategy> getSuccessfulStrategies() {
        return Collections.unmodifiableSet(successfulStrategies);
    }

    public Set<TopicArea> getSuccessfulTopics() {
        return Collections.unmodifiableSet(successfulTopics);
    }

    private StrategyChange switchTo(AnswerStrategy target) {
        if (target == current) {
            return StrategyChange.none(current);
        }
        StrategyChange change = new StrategyChange(current, target);
        current = target;
        return change;
    }
}
