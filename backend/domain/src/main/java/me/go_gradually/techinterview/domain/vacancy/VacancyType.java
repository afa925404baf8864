package me.go_gradually.techinterview.domain.vacancy;

import me.go_gradually.techinterview.domain.interview.TopicArea;

import java.util.List;
import java.util.Locale;

/**
 * Vacancy families, checked in declaration order; the first keyword hit wins.
 */
public enum VacancyType {
    FRONTEND("frontend",
            List.of("frontend", "front-end", "react", "vue", "angular", "javascript", "js", "css", "html"),
            List.of(TopicArea.TECHNICAL_BASICS, TopicArea.PRACTICAL_EXPERIENCE, TopicArea.PROBLEM_SOLVING, TopicArea.SOFT_SKILLS)),
    BACKEND("backend",
            List.of("backend", "back-end", "python", "java", "node", "api", "database", "server"),
            List.of(TopicArea.TECHNICAL_BASICS, TopicArea.SYSTEM_DESIGN, TopicArea.PROBLEM_SOLVING, TopicArea.PRACTICAL_EXPERIENCE)),
    FULLSTACK("fullstack",
            List.of("fullstack", "full-stack", "full stack"),
            List.of(TopicArea.TECHNICAL_BASICS, TopicArea.PRACTICAL_EXPERIENCE, TopicArea.SYSTEM_DESIGN, TopicArea.SOFT_SKILLS)),
    MOBILE("mobile",
            List.of("mobile", "ios", "android", "react native", "flutter"),
            List.of(TopicArea.TECHNICAL_BASICS, TopicArea.PRACTICAL_EXPERIENCE, TopicArea.PROBLEM_SOLVING, TopicArea.SOFT_SKILLS)),
    DEVOPS("devops",
            List.of("devops", "docker", "kubernetes", "aws", "ci/cd", "infrastructure", "sre"),
            List.of(TopicArea.SYSTEM_DESIGN, TopicArea.TECHNICAL_BASICS, TopicArea.PROBLEM_SOLVING, TopicArea.SOFT_SKILLS)),
    QA("qa",
            List.of("qa", "test", "quality assurance"),
            List.of(TopicArea.TECHNICAL_BASICS, TopicArea.PROBLEM_SOLVING, TopicArea.PRACTICAL_EXPERIENCE, TopicArea.SOFT_SKILLS));

    private final String code;
    private final List<String> keywords;
    private final List<TopicArea> focusAreas;

    VacancyType(String code, List<String> keywords, List<TopicArea> focusAreas) {
        this.code = code;
        this.keywords = keywords;
        this.focusAreas = focusAreas;
    }

    public String code() {
        return code;
    }

    public List<TopicArea> focusAreas() {
        return focusAreas;
    }

    public static VacancyType classify(String vacancyTitle, String industry) {
        String text = ((vacancyTitle == null ? "" : vacancyTitle) + " " + (industry == null ? "" : industry))
                .toLowerCase(Locale.ROOT);
        for (VacancyType type : values()) {
            if (type.keywords.stream().anyMatch(text::contains)) {
                return type;
            }
        }
        return FULLSTACK;
    }
}
