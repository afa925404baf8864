package me.go_gradually.techinterview.domain.vacancy;

import me.go_gradually.techinterview.domain.interview.TopicArea;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Ordered topic areas the interview intends to cover. Built once from the vacancy
 * and recruiter concerns; the oracle may later replace it wholesale.
 */
public record InterviewPlan(List<TopicArea> areas) {
    public static final int MAX_AREAS = 4;
    public static final int MAX_CONCERNS = 3;

    private static final Map<TopicArea, List<String>> CONCERN_KEYWORDS = Map.of(
            TopicArea.PROBLEM_SOLVING, List.of("algorithm", "data structure", "problem"),
            TopicArea.SYSTEM_DESIGN, List.of("architecture", "design", "system"),
            TopicArea.SOFT_SKILLS, List.of("team", "lead", "manag"),
            TopicArea.TECHNICAL_BASICS, List.of("technolog", "framework", "language")
    );
    private static final List<TopicArea> CONCERN_ORDER = List.of(
            TopicArea.PROBLEM_SOLVING, TopicArea.SYSTEM_DESIGN, TopicArea.SOFT_SKILLS, TopicArea.TECHNICAL_BASICS);

    public InterviewPlan {
        areas = areas == null ? List.of() : List.copyOf(areas);
    }

    public static InterviewPlan create(VacancyType vacancyType, List<String> hrConcerns) {
        Set<TopicArea> ordered = new LinkedHashSet<>();
        if (hrConcerns != null) {
            hrConcerns.stream()
                    .limit(MAX_CONCERNS)
                    .map(InterviewPlan::areaForConcern)
                    .flatMap(Optional::stream)
                    .forEach(ordered::add);
        }
        ordered.addAll(vacancyType.focusAreas());
        return new InterviewPlan(new ArrayList<>(ordered).subList(0, Math.min(MAX_AREAS, ordered.size())));
    }

    public static InterviewPlan fromNames(List<String> names) {
        List<TopicArea> parsed = new ArrayList<>();
        if (names != null) {
            for (String name : names) {
                if (name != null && !name.isBlank()) {
                    parsed.add(TopicArea.of(name));
                }
            }
        }
        return new InterviewPlan(parsed);
    }

    static Optional<TopicArea> areaForConcern(String concern) {
        if (concern == null) {
            return Optional.empty();
        }
        String lowered = concern.toLowerCase(Locale.ROOT);
        return CONCERN_ORDER.stream()
                .filter(area -> CONCERN_KEYWORDS.get(area).stream().anyMatch(lowered::contains))
                .findFirst();
    }

    public boolean isEmpty() {
        return areas.isEmpty();
    }

    public List<String> names() {
        return areas.stream().map(TopicArea::value).toList();
    }
}
