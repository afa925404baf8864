package me.go_gradually.techinterview.domain.repetition;

import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Knobs of the {@link RepetitionGuard}.
 *
 * @param topicLimit          questions per topic after which any further one is repetitive
 * @param alternativeCeiling  questions per topic at which it stops being offered as an alternative
 * @param recentWindow        how many of the latest questions are compared by keywords
 * @param minSharedKeywords   shared keywords needed before the overlap ratio is considered
 * @param overlapRatio        shared / proposed keywords ratio that must be exceeded
 * @param minKeywordLength    shorter tokens are discarded
 * @param script              the only Unicode script whose letters form keywords
 * @param stopWords           tokens never treated as keywords
 */
public record RepetitionSettings(int topicLimit,
                                 int alternativeCeiling,
                                 int recentWindow,
                                 int minSharedKeywords,
                                 double overlapRatio,
                                 int minKeywordLength,
                                 Character.UnicodeScript script,
                                 Set<String> stopWords) {
    public static final Set<String> DEFAULT_STOP_WORDS = Set.of(
            "what", "when", "where", "which", "while", "with", "would", "could", "should",
            "your", "yours", "about", "there", "their", "them", "they", "this", "that", "these",
            "those", "have", "from", "into", "been", "were", "will", "does", "tell", "describe",
            "explain", "please", "some", "more", "most", "than", "then", "also", "just", "like",
            "used", "using", "very", "each", "other", "such", "only", "over", "because"
    );

    public RepetitionSettings {
        if (topicLimit < 1 || alternativeCeiling < 1 || recentWindow < 1 || minSharedKeywords < 1) {
            throw new IllegalArgumentException("Repetition limits must be positive");
        }
        if (overlapRatio < 0 || overlapRatio > 1) {
            throw new IllegalArgumentException("overlapRatio must be within 0-1");
        }
        if (minKeywordLength < 1) {
            throw new IllegalArgumentException("minKeywordLength must be positive");
        }
        script = script == null ? Character.UnicodeScript.LATIN : script;
        stopWords = stopWords == null ? Set.of() : stopWords.stream()
                .filter(word -> word != null && !word.isBlank())
                .map(word -> word.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    public static RepetitionSettings defaults() {
        return new RepetitionSettings(3, 2, 3, 2, 0.6, 4, Character.UnicodeScript.LATIN, DEFAULT_STOP_WORDS);
    }
}
