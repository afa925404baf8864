package me.go_gradually.techinterview.infrastructure.shared.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import me.go_gradually.techinterview.application.interview.policy.InterviewPolicy;
import me.go_gradually.techinterview.application.shared.policy.DataDirProvider;
import me.go_gradually.techinterview.domain.interview.InterviewPhase;
import me.go_gradually.techinterview.domain.interview.InterviewSettings;
import me.go_gradually.techinterview.domain.interview.SessionLimits;
import me.go_gradually.techinterview.domain.interview.TranscriptWindow;
import me.go_gradually.techinterview.domain.phase.PhaseTransitionRules;
import me.go_gradually.techinterview.domain.profile.ProfileThresholds;
import me.go_gradually.techinterview.domain.repetition.RepetitionSettings;
import me.go_gradually.techinterview.domain.report.RecommendationThresholds;
import me.go_gradually.techinterview.domain.strategy.AdaptationSettings;
import me.go_gradually.techinterview.domain.time.TimeBudgetSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Binds {@code techinterview.*}. Threshold keys have no Java defaults: a key missing from
 * the configuration fails validation when the context starts.
 */
@Validated
@ConfigurationProperties(prefix = "techinterview")
public class AppProperties implements DataDirProvider, InterviewPolicy {
    @NotBlank
    private String dataDir;
    @Valid
    private Oracle oracle = new Oracle();
    @Valid
    private Session session = new Session();
    @Valid
    private Profile profile = new Profile();
    @Valid
    private Time time = new Time();
    @Valid
    private Adaptation adaptation = new Adaptation();
    @Valid
    private Repetition repetition = new Repetition();
    @Valid
    private Phases phases = new Phases();
    @Valid
    private Report report = new Report();
    private Integrations integrations = new Integrations();

    public String getDataDir() {
        return dataDir;
    }

    public void setDataDir(String dataDir) {
        this.dataDir = dataDir;
    }

    public Oracle getOracle() {
        return oracle;
    }

    public void setOracle(Oracle oracle) {
        this.oracle = oracle;
    }

    public Session getSession() {
        return session;
    }

    public void setSession(Session session) {
        this.session = session;
    }

    public Profile getProfile() {
        return profile;
    }

    public void setProfile(Profile profile) {
        this.profile = profile;
    }

    public Time getTime() {
        return time;
    }

    public void setTime(Time time) {
        this.time = time;
    }

    public Adaptation getAdaptation() {
        return adaptation;
    }

    public void setAdaptation(Adaptation adaptation) {
        this.adaptation = adaptation;
    }

    public Repetition getRepetition() {
        return repetition;
    }

    public void setRepetition(Repetition repetition) {
        this.repetition = repetition;
    }

    public Phases getPhases() {
        return phases;
    }

    public void setPhases(Phases phases) {
        this.phases = phases;
    }

    public Report getReport() {
        return report;
    }

    public void setReport(Report report) {
        this.report = report;
    }

    public Integrations getIntegrations() {
        return integrations;
    }

    public void setIntegrations(Integrations integrations) {
        this.integrations = integrations;
    }

    @Override
    public String getOracleProvider() {
        return oracle.getProvider();
    }

    @Override
    public String getOracleModel() {
        return oracle.getModel();
    }

    @Override
    public String getOracleApiKey() {
        return oracle.getApiKey();
    }

    @Override
    public InterviewSettings toInterviewSettings() {
        return new InterviewSettings(
                new SessionLimits(session.getMaxQuestions(), session.getCriticalRedFlags()),
                new TranscriptWindow(oracle.getRecentExchanges(), oracle.getAnswerCharCap()),
                new ProfileThresholds(
                        profile.getFailureThreshold(),
                        profile.getSuccessThreshold(),
                        profile.getMinAnswersForLevel(),
                        profile.getMiddleLevelMin(),
                        profile.getSeniorLevelMin(),
                        profile.getMaxPriorityConcerns()),
                new TimeBudgetSettings(
                        session.getMaxMinutes(),
                        time.getCriticalMinutes(),
                        time.getWrapUpMinutes(),
                        time.getAccelerationMinutes(),
                        phaseTargets(time.getPhaseTargetMinutes()),
                        time.getCriticalShortageRatio(),
                        time.getAccelerateRatio(),
                        time.getOnTrackRatio()),
                new AdaptationSettings(
                        adaptation.getWeakScore(),
                        adaptation.getVeryWeakScore(),
                        adaptation.getStrongScore(),
                        adaptation.getConsecutiveWeak(),
                        adaptation.getConsecutiveStrong()),
                new RepetitionSettings(
                        repetition.getTopicLimit(),
                        repetition.getAlternativeCeiling(),
                        repetition.getRecentWindow(),
                        repetition.getMinSharedKeywords(),
                        repetition.getOverlapRatio(),
                        repetition.getMinKeywordLength(),
                        Character.UnicodeScript.forName(repetition.getScript().trim().toUpperCase(Locale.ROOT)),
                        repetition.getStopWords() == null
                                ? RepetitionSettings.DEFAULT_STOP_WORDS
                                : Set.copyOf(repetition.getStopWords())),
                new PhaseTransitionRules(
                        phases.getExplorationMinQuestions(),
                        phases.getExplorationFallbackQuestions(),
                        phases.getStressTestMinAverage(),
                        phases.getStressTestMinQuestions(),
                        phases.getValidationMinQuestions(),
                        phases.getStressTestQuestions(),
                        phases.getSoftSkillsQuestions()),
                new RecommendationThresholds(
                        report.getStrongHireScore(),
                        report.getHireScore(),
                        report.getConditionalHireScore(),
                        report.getStrongHireMaxRedFlags(),
                        report.getHireMaxRedFlags(),
                        report.getConditionalHireMaxRedFlags()));
    }

    private static Map<InterviewPhase, Double> phaseTargets(Map<String, Double> configured) {
        Map<InterviewPhase, Double> targets = new EnumMap<>(InterviewPhase.class);
        configured.forEach((key, minutes) -> targets.put(InterviewPhase.requireCode(key), minutes));
        return targets;
    }

    public static class Oracle {
        @NotBlank
        private String provider;
        @NotBlank
        private String model;
        private String apiKey;
        @NotNull
        private Integer recentExchanges;
        @NotNull
        private Integer answerCharCap;

        public String getProvider() {
            return provider;
        }

        public void setProvider(String provider) {
            this.provider = provider;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public Integer getRecentExchanges() {
            return recentExchanges;
        }

        public void setRecentExchanges(Integer recentExchanges) {
            this.recentExchanges = recentExchanges;
        }

        public Integer getAnswerCharCap() {
            return answerCharCap;
        }

        public void setAnswerCharCap(Integer answerCharCap) {
            this.answerCharCap = answerCharCap;
        }
    }

    public static class Session {
        @NotNull
        private Double maxMinutes;
        @NotNull
        private Integer maxQuestions;
        @NotNull
        private Integer criticalRedFlags;

        public Double getMaxMinutes() {
            return maxMinutes;
        }

        public void setMaxMinutes(Double maxMinutes) {
            this.maxMinutes = maxMinutes;
        }

        public Integer getMaxQuestions() {
            return maxQuestions;
        }

        public void setMaxQuestions(Integer maxQuestions) {
            this.maxQuestions = maxQuestions;
        }

        public Integer getCriticalRedFlags() {
            return criticalRedFlags;
        }

        public void setCriticalRedFlags(Integer criticalRedFlags) {
            this.criticalRedFlags = criticalRedFlags;
        }
    }

    public static class Profile {
        @NotNull
        private Double failureThreshold;
        @NotNull
        private Double successThreshold;
        @NotNull
        private Integer minAnswersForLevel;
        @NotNull
        private Double middleLevelMin;
        @NotNull
        private Double seniorLevelMin;
        @NotNull
        private Integer maxPriorityConcerns;

        public Double getFailureThreshold() {
            return failureThreshold;
        }

        public void setFailureThreshold(Double failureThreshold) {
            this.failureThreshold = failureThreshold;
        }

        public Double getSuccessThreshold() {
            return successThreshold;
        }

        public void setSuccessThreshold(Double successThreshold) {
            this.successThreshold = successThreshold;
        }

        public Integer getMinAnswersForLevel() {
            return minAnswersForLevel;
        }

        public void setMinAnswersForLevel(Integer minAnswersForLevel) {
            this.minAnswersForLevel = minAnswersForLevel;
        }

        public Double getMiddleLevelMin() {
            return middleLevelMin;
        }

        public void setMiddleLevelMin(Double middleLevelMin) {
            this.middleLevelMin = middleLevelMin;
        }

        public Double getSeniorLevelMin() {
            return seniorLevelMin;
        }

        public void setSeniorLevelMin(Double seniorLevelMin) {
            this.seniorLevelMin = seniorLevelMin;
        }

        public Integer getMaxPriorityConcerns() {
            return maxPriorityConcerns;
        }

        public void setMaxPriorityConcerns(Integer maxPriorityConcerns) {
            this.maxPriorityConcerns = maxPriorityConcerns;
        }
    }

    public static class Time {
        @NotNull
        private Double criticalMinutes;
        @NotNull
        private Double wrapUpMinutes;
        @NotNull
        private Double accelerationMinutes;
        @NotEmpty
        private Map<String, Double> phaseTargetMinutes = new LinkedHashMap<>();
        @NotNull
        private Double criticalShortageRatio;
        @NotNull
        private Double accelerateRatio;
        @NotNull
        private Double onTrackRatio;

        public Double getCriticalMinutes() {
            return criticalMinutes;
        }

        public void setCriticalMinutes(Double criticalMinutes) {
            this.criticalMinutes = criticalMinutes;
        }

        public Double getWrapUpMinutes() {
            return wrapUpMinutes;
        }

        public void setWrapUpMinutes(Double wrapUpMinutes) {
            this.wrapUpMinutes = wrapUpMinutes;
        }

        public Double getAccelerationMinutes() {
            return accelerationMinutes;
        }

        public void setAccelerationMinutes(Double accelerationMinutes) {
            this.accelerationMinutes = accelerationMinutes;
        }

        public Map<String, Double> getPhaseTargetMinutes() {
            return phaseTargetMinutes;
        }

        public void setPhaseTargetMinutes(Map<String, Double> phaseTargetMinutes) {
            this.phaseTargetMinutes = phaseTargetMinutes;
        }

        public Double getCriticalShortageRatio() {
            return criticalShortageRatio;
        }

        public void setCriticalShortageRatio(Double criticalShortageRatio) {
            this.criticalShortageRatio = criticalShortageRatio;
        }

        public Double getAccelerateRatio() {
            return accelerateRatio;
        }

        public void setAccelerateRatio(Double accelerateRatio) {
            this.accelerateRatio = accelerateRatio;
        }

        public Double getOnTrackRatio() {
            return onTrackRatio;
        }

        public void setOnTrackRatio(Double onTrackRatio) {
            this.onTrackRatio = onTrackRatio;
        }
    }

    public static class Adaptation {
        @NotNull
        private Double weakScore;
        @NotNull
        private Double veryWeakScore;
        @NotNull
        private Double strongScore;
        @NotNull
        private Integer consecutiveWeak;
        @NotNull
        private Integer consecutiveStrong;

        public Double getWeakScore() {
            return weakScore;
        }

        public void setWeakScore(Double weakScore) {
            this.weakScore = weakScore;
        }

        public Double getVeryWeakScore() {
            return veryWeakScore;
        }

        public void setVeryWeakScore(Double veryWeakScore) {
            this.veryWeakScore = veryWeakScore;
        }

        public Double getStrongScore() {
            return strongScore;
        }

        public void setStrongScore(Double strongScore) {
            this.strongScore = strongScore;
        }

        public Integer getConsecutiveWeak() {
            return consecutiveWeak;
        }

        public void setConsecutiveWeak(Integer consecutiveWeak) {
            this.consecutiveWeak = consecutiveWeak;
        }

        public Integer getConsecutiveStrong() {
            return consecutiveStrong;
        }

        public void setConsecutiveStrong(Integer consecutiveStrong) {
            this.consecutiveStrong = consecutiveStrong;
        }
    }

    public static class Repetition {
        @NotNull
        private Integer topicLimit;
        @NotNull
        private Integer alternativeCeiling;
        @NotNull
        private Integer recentWindow;
        @NotNull
        private Integer minSharedKeywords;
        @NotNull
        private Double overlapRatio;
        @NotNull
        private Integer minKeywordLength;
        @NotBlank
        private String script;
        private List<String> stopWords;

        public Integer getTopicLimit() {
            return topicLimit;
        }

        public void setTopicLimit(Integer topicLimit) {
            this.topicLimit = topicLimit;
        }

        public Integer getAlternativeCeiling() {
            return alternativeCeiling;
        }

        public void setAlternativeCeiling(Integer alternativeCeiling) {
            this.alternativeCeiling = alternativeCeiling;
        }

        public Integer getRecentWindow() {
            return recentWindow;
        }

        public void setRecentWindow(Integer recentWindow) {
            this.recentWindow = recentWindow;
        }

        public Integer getMinSharedKeywords() {
            return minSharedKeywords;
        }

        public void setMinSharedKeywords(Integer minSharedKeywords) {
            this.minSharedKeywords = minSharedKeywords;
        }

        public Double getOverlapRatio() {
            return overlapRatio;
        }

        public void setOverlapRatio(Double overlapRatio) {
            this.overlapRatio = overlapRatio;
        }

        public Integer getMinKeywordLength() {
            return minKeywordLength;
        }

        public void setMinKeywordLength(Integer minKeywordLength) {
            this.minKeywordLength = minKeywordLength;
        }

        public String getScript() {
            return script;
        }

        public void setScript(String script) {
            this.script = script;
        }

        public List<String> getStopWords() {
            return stopWords;
        }

        public void setStopWords(List<String> stopWords) {
            this.stopWords = stopWords;
        }
    }

    public static class Phases {
        @NotNull
        private Integer explorationMinQuestions;
        @NotNull
        private Integer explorationFallbackQuestions;
        @NotNull
        private Double stressTestMinAverage;
        @NotNull
        private Integer stressTestMinQuestions;
        @NotNull
        private Integer validationMinQuestions;
        @NotNull
        private Integer stressTestQuestions;
        @NotNull
        private Integer softSkillsQuestions;

        public Integer getExplorationMinQuestions() {
            return explorationMinQuestions;
        }

        public void setExplorationMinQuestions(Integer explorationMinQuestions) {
            this.explorationMinQuestions = explorationMinQuestions;
        }

        public Integer getExplorationFallbackQuestions() {
            return explorationFallbackQuestions;
        }

        public void setExplorationFallbackQuestions(Integer explorationFallbackQuestions) {
            this.explorationFallbackQuestions = explorationFallbackQuestions;
        }

        public Double getStressTestMinAverage() {
            return stressTestMinAverage;
        }

        public void setStressTestMinAverage(Double stressTestMinAverage) {
            this.stressTestMinAverage = stressTestMinAverage;
        }

        public Integer getStressTestMinQuestions() {
            return stressTestMinQuestions;
        }

        public void setStressTestMinQuestions(Integer stressTestMinQuestions) {
            this.stressTestMinQuestions = stressTestMinQuestions;
        }

        public Integer getValidationMinQuestions() {
            return validationMinQuestions;
        }

        public void setValidationMinQuestions(Integer validationMinQuestions) {
            this.validationMinQuestions = validationMinQuestions;
        }

        public Integer getStressTestQuestions() {
            return stressTestQuestions;
        }

        public void setStressTestQuestions(Integer stressTestQuestions) {
            this.stressTestQuestions = stressTestQuestions;
        }

        public Integer getSoftSkillsQuestions() {
            return softSkillsQuestions;
        }

        public void setSoftSkillsQuestions(Integer softSkillsQuestions) {
            this.softSkillsQuestions = softSkillsQuestions;
        }
    }

    public static class Report {
        @NotNull
        private Integer strongHireScore;
        @NotNull
        private Integer hireScore;
        @NotNull
        private Integer conditionalHireScore;
        @NotNull
        private Integer strongHireMaxRedFlags;
        @NotNull
        private Integer hireMaxRedFlags;
        @NotNull
        private Integer conditionalHireMaxRedFlags;

        public Integer getStrongHireScore() {
            return strongHireScore;
        }

        public void setStrongHireScore(Integer strongHireScore) {
            this.strongHireScore = strongHireScore;
        }

        public Integer getHireScore() {
            return hireScore;
        }

        public void setHireScore(Integer hireScore) {
            this.hireScore = hireScore;
        }

        public Integer getConditionalHireScore() {
            return conditionalHireScore;
        }

        public void setConditionalHireScore(Integer conditionalHireScore) {
            this.conditionalHireScore = conditionalHireScore;
        }

        public Integer getStrongHireMaxRedFlags() {
            return strongHireMaxRedFlags;
        }

        public void setStrongHireMaxRedFlags(Integer strongHireMaxRedFlags) {
            this.strongHireMaxRedFlags = strongHireMaxRedFlags;
        }

        public Integer getHireMaxRedFlags() {
            return hireMaxRedFlags;
        }

        public void setHireMaxRedFlags(Integer hireMaxRedFlags) {
            this.hireMaxRedFlags = hireMaxRedFlags;
        }

        public Integer getConditionalHireMaxRedFlags() {
            return conditionalHireMaxRedFlags;
        }

        public void setConditionalHireMaxRedFlags(Integer conditionalHireMaxRedFlags) {
            this.conditionalHireMaxRedFlags = conditionalHireMaxRedFlags;
        }
    }

    public static class Integrations {
        private OpenAi openai = new OpenAi();
        private Anthropic anthropic = new Anthropic();

        public OpenAi getOpenai() {
            return openai;
        }

        public void setOpenai(OpenAi openai) {
            this.openai = openai;
        }

        public Anthropic getAnthropic() {
            return anthropic;
        }

        public void setAnthropic(Anthropic anthropic) {
            this.anthropic = anthropic;
        }
    }

    public static class OpenAi {
        private String baseUrl = "https://api.openai.com";
        private Double temperature = 0.3;
        private Logging logging = new Logging();

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public Double getTemperature() {
            return temperature;
        }

        public void setTemperature(Double temperature) {
            this.temperature = temperature;
        }

        public Logging getLogging() {
            return logging;
        }

        public void setLogging(Logging logging) {
            this.logging = logging;
        }

        public static class Logging {
            private int responsePreviewChars = 1024;
            private boolean fullBody = false;
            private boolean logSuccessAtFine = true;

            public int getResponsePreviewChars() {
                return responsePreviewChars;
            }

            public void setResponsePreviewChars(int responsePreviewChars) {
                this.responsePreviewChars = responsePreviewChars;
            }

            public boolean isFullBody() {
                return fullBody;
            }

            public void setFullBody(boolean fullBody) {
                this.fullBody = fullBody;
            }

            public boolean isLogSuccessAtFine() {
                return logSuccessAtFine;
            }

            public void setLogSuccessAtFine(boolean logSuccessAtFine) {
                this.logSuccessAtFine = logSuccessAtFine;
            }
        }
    }

    public static class Anthropic {
        private String baseUrl = "https://api.anthropic.com";
        private int maxTokens = 1024;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public int getMaxTokens() {
            return maxTokens;
        }

        public void setMaxTokens(int maxTokens) {
            this.maxTokens = maxTokens;
        }
    }
}
