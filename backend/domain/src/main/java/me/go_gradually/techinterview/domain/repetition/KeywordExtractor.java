package me.go_gradually.techinterview.domain.repetition;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits a question into its significant words: letters of one script only,
 * lower-cased, long enough and not a stop word.
 */
public class KeywordExtractor {
    private final Pattern wordPattern;
    private final int minLength;
    private final Set<String> stopWords;

    public KeywordExtractor(RepetitionSettings settings) {
        this.wordPattern = Pattern.compile("[\\p{L}&&\\p{Is" + settings.script().name() + "}]+");
        this.minLength = settings.minKeywordLength();
        this.stopWords = settings.stopWords();
    }

    public Set<String> extract(String text) {
        if (text == null || text.isBlank()) {
            return Set.of();
        }
        Set<String> keywords = new LinkedHashSet<>();
        Matcher matcher = wordPattern.matcher(text.toLowerCase(Locale.ROOT));
        while (matcher.find()) {
            String token = matcher.group();
            if (token.length() >= minLength && !stopWords.contains(token)) {
                keywords.add(token);
            }
        }
        return Collections.unmodifiableSet(keywords);
    }
}
