package me.go_gradually.techinterview.domain.interview;

import java.util.Locale;

/**
 * Subject of questioning such as {@code system_design}. Topics come from the
 * interview plan and from the oracle, so the set is open; names are normalized
 * to lower-case snake form.
 */
public record TopicArea(String value) {
    public static final TopicArea GENERAL = new TopicArea("general");
    public static final TopicArea GENERAL_BACKGROUND = new TopicArea("general_background");
    public static final TopicArea TECHNICAL_BASICS = new TopicArea("technical_basics");
    public static final TopicArea PRACTICAL_EXPERIENCE = new TopicArea("practical_experience");
    public static final TopicArea PROBLEM_SOLVING = new TopicArea("problem_solving");
    public static final TopicArea SYSTEM_DESIGN = new TopicArea("system_design");
    public static final TopicArea SOFT_SKILLS = new TopicArea("soft_skills");

    public TopicArea {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Topic area is required");
        }
        value = value.trim().toLowerCase(Locale.ROOT).replaceAll("[\\s-]+", "_");
    }

    public static TopicArea of(String value) {
        return new TopicArea(value);
    }

    public static TopicArea ofOrGeneral(String value) {
        if (value == null || value.isBlank()) {
            return GENERAL;
        }
        return new TopicArea(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
