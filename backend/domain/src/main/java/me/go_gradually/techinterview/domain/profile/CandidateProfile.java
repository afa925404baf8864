package me.go_gradually.techinterview.domain.profile;

import me.go_gradually.techinterview.domain.interview.TopicArea;
import me.go_gradually.techinterview.domain.oracle.AnswerAnalysis;
import me.go_gradually.techinterview.domain.util.TextUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Running picture of one candidate during one interview.
 *
 * <p>Averages are plain arithmetic means over every recorded answer. Per-topic history
 * only keeps technical scores above zero, because zero means the oracle did not score
 * the answer; the overall technical average still counts it.
 */
public class CandidateProfile {
    private static final int FAILURES_TO_BLACKLIST = 2;
    private static final Map<String, List<String>> LEARNING_KEYWORDS = learningKeywords();

    private final ProfileThresholds thresholds;
    private final String vacancyTitle;
    private final String industry;
    private final List<String> hrStrengths;
    private final List<String> hrConcerns;
    private final TechnicalLevel preliminaryLevel;

    private String name = "";
    private TechnicalLevel technicalLevel = TechnicalLevel.UNKNOWN;
    private CommunicationStyle communicationStyle = CommunicationStyle.UNKNOWN;
    private int totalAnswers;
    private final RunningAverage technical = new RunningAverage();
    private final RunningAverage communication = new RunningAverage();
    private final RunningAverage confidence = new RunningAverage();
    private final List<String> confirmedStrengths = new ArrayList<>();
    private final List<String> confirmedWeaknesses = new ArrayList<>();
    private final List<String> redFlags = new ArrayList<>();
    private final List<String> learningIndicators = new ArrayList<>();
    private final Map<TopicArea, List<Double>> topicScores = new LinkedHashMap<>();
    private final Map<TopicArea, Integer> topicQuestionCounts = new LinkedHashMap<>();
    private final Map<TopicArea, Integer> failureCounters = new HashMap<>();
    private final Set<TopicArea> failedTopics = new LinkedHashSet<>();
    private final Set<TopicArea> strongTopics = new LinkedHashSet<>();

    public CandidateProfile(String name,
                            String vacancyTitle,
                            String industry,
                            HrAnalysis hrAnalysis,
                            ProfileThresholds thresholds) {
        if (thresholds == null) {
            throw new IllegalArgumentException("Profile thresholds are required");
        }
        HrAnalysis hr = hrAnalysis == null ? HrAnalysis.none() : hrAnalysis;
        this.thresholds = thresholds;
        this.name = TextUtils.normalize(name);
        this.vacancyTitle = TextUtils.normalize(vacancyTitle);
        this.industry = TextUtils.normalize(industry);
        this.hrStrengths = hr.keyStrengths();
        this.hrConcerns = hr.criticalConcerns();
        this.preliminaryLevel = hr.preliminaryLevel();
    }

    public void rename(String candidateName) {
        if (!TextUtils.isBlank(candidateName)) {
            this.name = candidateName.trim();
        }
    }

    public ProfileUpdate recordAnswer(TopicArea topic, AnswerAnalysis analysis) {
        if (analysis == null || analysis.isEmpty()) {
            return ProfileUpdate.skipped();
        }
        TopicArea area = topic == null ? TopicArea.GENERAL : topic;
        totalAnswers += 1;
        technical.add(analysis.technicalScore());
        communication.add(analysis.communicationScore());
        confidence.add(analysis.confidenceScore());
        topicQuestionCounts.merge(area, 1, Integer::sum);

        double score = analysis.technicalScore();
        if (score > 0) {
            topicScores.computeIfAbsent(area, ignored -> new ArrayList<>()).add(score);
        }
        boolean newlyFailed = trackFailure(area, score);
        boolean newlyStrong = trackSuccess(area, score);
        recordWeakness(area, score);

        updateTechnicalLevel();
        communicationStyle = CommunicationStyle.classify(analysis.communicationScore(), analysis.confidenceScore());
        TextUtils.appendDistinct(confirmedStrengths, analysis.strengthsShown());
        TextUtils.appendDistinct(redFlags, analysis.redFlags());
        updateLearningIndicators(analysis.notes());
        return new ProfileUpdate(true, newlyFailed, newlyStrong);
    }

    private boolean trackFailure(TopicArea area, double score) {
        int current = failureCounters.getOrDefault(area, 0);
        int next;
        if (score <= thresholds.failureThreshold()) {
            next = current + 1;
        } else if (score >= thresholds.successThreshold()) {
            next = 0;
        } else {
            next = Math.max(0, current - 1);
        }
        failureCounters.put(area, next);
        if (next >= FAILURES_TO_BLACKLIST) {
            return failedTopics.add(area);
        }
        return false;
    }

    private boolean trackSuccess(TopicArea area, double score) {
        if (score >= thresholds.successThreshold()) {
            return strongTopics.add(area);
        }
        return false;
    }

    private void recordWeakness(TopicArea area, double score) {
        if (score > thresholds.failureThreshold()) {
            return;
        }
        String weakness = String.format(Locale.ROOT, "weak knowledge in %s (score %s/10)", area.value(), formatScore(score));
        TextUtils.appendDistinct(confirmedWeaknesses, List.of(weakness));
    }

    private void updateTechnicalLevel() {
        if (totalAnswers < thresholds.minAnswersForLevel()) {
            return;
        }
        double average = technical.value();
        if (average >= thresholds.seniorLevelMin()) {
            technicalLevel = TechnicalLevel.SENIOR;
        } else if (average >= thresholds.middleLevelMin()) {
            technicalLevel = TechnicalLevel.MIDDLE;
        } else {
            technicalLevel = TechnicalLevel.JUNIOR;
        }
    }

    private void updateLearningIndicators(String notes) {
        if (TextUtils.isBlank(notes)) {
            return;
        }
        String lowered = notes.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, List<String>> entry : LEARNING_KEYWORDS.entrySet()) {
            boolean matched = entry.getValue().stream().anyMatch(lowered::contains);
            if (matched && !learningIndicators.contains(entry.getKey())) {
                learningIndicators.add(entry.getKey());
            }
        }
    }

    /**
     * HR concerns that no confirmed strength has echoed yet, capped by configuration.
     */
    public List<String> priorityConcerns() {
        List<String> open = new ArrayList<>();
        for (String concern : hrConcerns) {
            boolean addressed = confirmedStrengths.stream()
                    .anyMatch(strength -> TextUtils.containsIgnoreCase(strength, concern));
            if (!addressed) {
                open.add(concern);
            }
        }
        return open.subList(0, Math.min(open.size(), thresholds.maxPriorityConcerns()));
    }

    public List<String> validatedHrStrengths() {
        return hrStrengths.stream()
                .filter(strength -> confirmedStrengths.stream()
                        .anyMatch(confirmed -> TextUtils.containsIgnoreCase(confirmed, strength)))
                .toList();
    }

    public List<String> confirmedHrConcerns() {
        return hrConcerns.stream()
                .filter(concern -> confirmedWeaknesses.stream()
                        .anyMatch(weakness -> TextUtils.containsIgnoreCase(weakness, concern)))
                .toList();
    }

    public Map<String, Double> performanceByArea() {
        Map<String, Double> performance = new LinkedHashMap<>();
        for (Map.Entry<TopicArea, List<Double>> entry : topicScores.entrySet()) {
            List<Double> scores = entry.getValue();
            if (scores.isEmpty()) {
                continue;
            }
            double average = scores.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
            performance.put(entry.getKey().value(), average);
        }
        return performance;
    }

    public ProfileSummary summary() {
        return new ProfileSummary(
                name,
                vacancyTitle,
                industry,
                technicalLevel,
                preliminaryLevel,
                communicationStyle,
                totalAnswers,
                technical.value(),
                communication.value(),
                confidence.value(),
                confirmedStrengths,
                confirmedWeaknesses,
                redFlags,
                learningIndicators,
                hrStrengths,
                priorityConcerns(),
                failedTopics.stream().map(TopicArea::value).toList(),
                strongTopics.stream().map(TopicArea::value).toList(),
                performanceByArea()
        );
    }

    private static String formatScore(double score) {
        if (score == Math.rint(score)) {
            return String.valueOf((long) score);
        }
        return String.format(Locale.ROOT, "%.1f", score);
    }

    private static Map<String, List<String>> learningKeywords() {
        Map<String, List<String>> keywords = new LinkedHashMap<>();
        keywords.put("curious", List.of("curious", "asks questions", "wants to know"));
        keywords.put("adaptive", List.of("tries to apply", "thinks about applying", "relates to experience"));
        keywords.put("systematic", List.of("structured approach", "methodical", "step by step"));
        keywords.put("growth_mindset", List.of("willing to learn", "wants to grow", "admits gaps"));
        return Collections.unmodifiableMap(keywords);
    }

    public String getName() {
        return name;
    }

    public String getVacancyTitle() {
        return vacancyTitle;
    }

    public String getIndustry() {
        return industry;
    }

    public TechnicalLevel getTechnicalLevel() {
        return technicalLevel;
    }

    public TechnicalLevel getPreliminaryLevel() {
        return preliminaryLevel;
    }

    public CommunicationStyle getCommunicationStyle() {
        return communicationStyle;
    }

    public int getTotalAnswers() {
        return totalAnswers;
    }

    public double getAvgTechnicalScore() {
        return technical.value();
    }

    public double getAvgCommunicationScore() {
        return communication.value();
    }

    public double getAvgConfidenceScore() {
        return confidence.value();
    }

    public List<String> getConfirmedStrengths() {
        return Collections.unmodifiableList(confirmedStrengths);
    }

    public List<String> getConfirmedWeaknesses() {
        return Collections.unmodifiableList(confirmedWeaknesses);
    }

    public List<String> getRedFlags() {
        return Collections.unmodifiableList(redFlags);
    }

    public List<String> getLearningIndicators() {
        return Collections.unmodifiableList(learningIndicators);
    }

    public List<String> getHrStrengths() {
        return hrStrengths;
    }

    public List<String> getHrConcerns() {
        return hrConcerns;
    }

    public List<Double> getTopicScores(TopicArea topic) {
        return Collections.unmodifiableList(topicScores.getOrDefault(topic, List.of()));
    }

    public int getTopicQuestionCount(TopicArea topic) {
        return topicQuestionCounts.getOrDefault(topic, 0);
    }

    public Set<TopicArea> getFailedTopics() {
        return Collections.unmodifiableSet(failedTopics);
    }

    public Set<TopicArea> getStrongTopics() {
        return Collections.unmodifiableSet(strongTopics);
    }

    public boolean isTopicFailed(TopicArea topic) {
        return failedTopics.contains(topic);
    }
}
