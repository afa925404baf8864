package me.go_gradually.techinterview.domain.interview;

import me.go_gradually.techinterview.domain.oracle.AnswerAnalysis;
import me.go_gradually.techinterview.domain.oracle.OracleDecision;
import me.go_gradually.techinterview.domain.phase.PhaseDecision;
import me.go_gradually.techinterview.domain.phase.PhaseSnapshot;
import me.go_gradually.techinterview.domain.phase.PhaseStateMachine;
import me.go_gradually.techinterview.domain.profile.CandidateProfile;
import me.go_gradually.techinterview.domain.profile.ProfileUpdate;
import me.go_gradually.techinterview.domain.repetition.QuestionRecord;
import me.go_gradually.techinterview.domain.repetition.RepetitionGuard;
import me.go_gradually.techinterview.domain.report.InterviewReport;
import me.go_gradually.techinterview.domain.report.ReportSynthesizer;
import me.go_gradually.techinterview.domain.session.SessionId;
import me.go_gradually.techinterview.domain.strategy.DifficultyAdaptor;
import me.go_gradually.techinterview.domain.strategy.StrategyAdaptor;
import me.go_gradually.techinterview.domain.strategy.StrategyTactic;
import me.go_gradually.techinterview.domain.time.PhaseTimeStrategy;
import me.go_gradually.techinterview.domain.time.TimeBudgetManager;
import me.go_gradually.techinterview.domain.util.TextUtils;
import me.go_gradually.techinterview.domain.vacancy.InterviewPlan;
import me.go_gradually.techinterview.domain.vacancy.VacancyType;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One interview in progress. Owns the candidate profile, the time budget, the
 * repetition guard, both adaptors and the phase state machine, and applies one
 * oracle decision per answer.
 *
 * <p>Not thread-safe; callers serialize access per session.
 */
public class InterviewSession {
    private final SessionId sessionId;
    private final InterviewSettings settings;
    private final CandidateIntake intake;
    private final CandidateProfile profile;
    private final TimeBudgetManager timeBudget;
    private final RepetitionGuard repetitionGuard;
    private final StrategyAdaptor strategyAdaptor;
    private final DifficultyAdaptor difficultyAdaptor;
    private final PhaseStateMachine phaseMachine;
    private final ReportSynthesizer reportSynthesizer;
    private final VacancyType vacancyType;
    private final List<QaExchange> transcript = new ArrayList<>();
    private final List<TopicArea> coveredAreas = new ArrayList<>();
    private InterviewPlan plan;
    private String currentQuestion = "";
    private TopicArea currentTopic = TopicArea.GENERAL_BACKGROUND;
    private Difficulty currentDifficulty = Difficulty.MEDIUM;
    private OracleDecision lastDecision = OracleDecision.neutral();
    private int totalAnswers;
    private int redFlagDeferralTurn = -1;
    private int fallbackTurns;
    private int repetitionsDetected;
    private boolean opened;
    private boolean completed;

    public InterviewSession(SessionId sessionId, CandidateIntake intake, InterviewSettings settings, Clock clock) {
        if (sessionId == null || intake == null || settings == null || clock == null) {
            throw new IllegalArgumentException("Session id, intake, settings and clock are required");
        }
        this.sessionId = sessionId;
        this.intake = intake;
        this.settings = settings;
        this.profile = new CandidateProfile(intake.candidateName(), intake.vacancyTitle(), intake.industry(),
                intake.hrAnalysis(), settings.profile());
        this.timeBudget = new TimeBudgetManager(clock, settings.time());
        this.repetitionGuard = new RepetitionGuard(settings.repetition());
        this.strategyAdaptor = new StrategyAdaptor(settings.adaptation());
        this.difficultyAdaptor = new DifficultyAdaptor(settings.adaptation());
        this.phaseMachine = new PhaseStateMachine(settings.phases(), timeBudget.getStartedAt());
        this.reportSynthesizer = new ReportSynthesizer(settings.report());
        this.vacancyType = VacancyType.classify(intake.vacancyTitle(), intake.industry());
        this.plan = InterviewPlan.create(vacancyType, profile.getHrConcerns());
    }

    /**
     * Context for the opening question, before any answer exists.
     */
    public InterviewContext openingContext() {
        return buildContext(true, "", "");
    }

    /**
     * Context for the decision that follows {@code answer} to the current question.
     */
    public InterviewContext answerContext(String answer) {
        return buildContext(false, currentQuestion, answer);
    }

    /**
     * Sets the first question. A {@code null} decision means the oracle gave nothing usable.
     */
    public TurnOutcome open(String candidateName, OracleDecision decision) {
        if (opened) {
            throw new IllegalStateException("Interview has already been opened");
        }
        profile.rename(candidateName);
        opened = true;
        boolean fallback = decision == null || !decision.hasNextQuestion();
        if (decision != null) {
            replacePlan(decision.interviewPlan());
        }
        String question;
        TopicArea topic;
        if (fallback) {
            fallbackTurns += 1;
            question = fallbackQuestion(InterviewPhase.EXPLORATION);
            topic = FallbackQuestions.topicForPhase(InterviewPhase.EXPLORATION);
        } else {
            question = decision.nextQuestion();
            topic = decision.questionArea();
            currentDifficulty = decision.difficulty().orElse(difficultyAdaptor.getCurrent());
        }
        ask(question, topic);
        return outcome(null, fallback, false, false);
    }

    /**
     * Applies the oracle's decision for {@code answer}. A {@code null} decision means the
     * oracle failed or its response could not be decoded: the profile is left untouched
     * and a canned question for the phase is asked.
     */
    public TurnOutcome applyAnswer(String answer, OracleDecision decision) {
        if (!opened) {
            throw new IllegalStateException("Interview has not been opened yet");
        }
        if (!isAcceptingAnswers()) {
            throw new IllegalStateException("Interview is already finished");
        }
        Instant now = timeBudget.now();
        transcript.add(new QaExchange(currentQuestion, answer, phaseMachine.getCurrent(), currentTopic, now));
        totalAnswers += 1;

        OracleDecision effective = decision == null ? OracleDecision.neutral() : decision;
        AnswerAnalysis analysis = effective.previousAnswerAnalysis();
        if (decision != null) {
            updateProfile(analysis);
            adjustPlan(effective);
        }
        if (decision != null && !analysis.isEmpty()) {
            phaseMachine.recordAnswer(analysis.technicalScore(), currentDifficulty);
        } else {
            phaseMachine.recordUnscoredAnswer(currentDifficulty);
        }
        lastDecision = effective;
        deferRedFlagEndIfRequested(effective);

        PhaseDecision phaseDecision = phaseMachine.decide(timeBudget.status(), profile.getTechnicalLevel(),
                profile.getAvgTechnicalScore(), effective);
        PhaseSnapshot transition = phaseMachine.apply(phaseDecision, now).orElse(null);

        InterviewPhase phase = phaseMachine.getCurrent();
        if (phase.isTerminal()) {
            currentQuestion = FallbackQuestions.closing(profile.getName());
            currentTopic = TopicArea.GENERAL;
            return outcome(transition, false, false, false);
        }
        if (decision == null || !effective.hasNextQuestion()) {
            fallbackTurns += 1;
            currentDifficulty = difficultyAdaptor.getCurrent();
            ask(fallbackQuestion(phase), FallbackQuestions.topicForPhase(phase));
            return outcome(transition, true, false, false);
        }

        currentDifficulty = effective.difficulty().orElse(difficultyAdaptor.getCurrent());
        String proposed = effective.nextQuestion();
        TopicArea proposedTopic = effective.questionArea();
        if (!repetitionGuard.isRepetitive(proposed, proposedTopic)) {
            ask(proposed, proposedTopic);
            return outcome(transition, false, false, false);
        }
        repetitionsDetected += 1;
        List<TopicArea> alternatives = repetitionGuard.alternatives(proposedTopic, plan.areas());
        if (alternatives.isEmpty()) {
            ask(proposed, proposedTopic);
            return outcome(transition, false, true, false);
        }
        TopicArea bridgeTopic = alternatives.get(0);
        ask(FallbackQuestions.bridgeTo(bridgeTopic), bridgeTopic);
        return outcome(transition, false, true, true);
    }

    private void updateProfile(AnswerAnalysis analysis) {
        ProfileUpdate update = profile.recordAnswer(currentTopic, analysis);
        if (!update.applied()) {
            return;
        }
        double technical = analysis.technicalScore();
        strategyAdaptor.onAnswer(currentTopic, technical);
        difficultyAdaptor.onAnswer(technical, profile.getAvgTechnicalScore());
        if (update.topicNewlyFailed()) {
            repetitionGuard.markFailed(currentTopic);
            strategyAdaptor.onTopicFailed();
        }
    }

    private void adjustPlan(OracleDecision decision) {
        if (!TextUtils.isBlank(decision.currentArea())) {
            TopicArea area = TopicArea.of(decision.currentArea());
            if (!coveredAreas.contains(area)) {
                coveredAreas.add(area);
            }
        }
        replacePlan(decision.interviewPlan());
    }

    private void replacePlan(List<String> proposedPlan) {
        InterviewPlan proposed = InterviewPlan.fromNames(proposedPlan);
        if (!proposed.isEmpty() && !proposed.equals(plan)) {
            plan = proposed;
        }
    }

    private void deferRedFlagEndIfRequested(OracleDecision decision) {
        boolean overLimit = profile.getRedFlags().size() >= settings.limits().criticalRedFlags();
        if (overLimit && decision.adaptationNeeded().isRequested() && redFlagDeferralTurn < 0) {
            redFlagDeferralTurn = totalAnswers;
        }
    }

    private void ask(String question, TopicArea topic) {
        currentQuestion = question;
        currentTopic = topic;
        repetitionGuard.record(question, topic, phaseMachine.getCurrent(), currentDifficulty, timeBudget.now());
    }

    private String fallbackQuestion(InterviewPhase phase) {
        return FallbackQuestions.forPhase(phase, profile.getName(), intake.industry());
    }

    private TurnOutcome outcome(PhaseSnapshot transition,
                                boolean fallbackUsed,
                                boolean repetitionDetected,
                                boolean substituted) {
        InterviewPhase phase = phaseMachine.getCurrent();
        return new TurnOutcome(
                currentQuestion,
                currentTopic,
                currentDifficulty,
                phase,
                transition,
                fallbackUsed,
                repetitionDetected,
                substituted,
                strategyAdaptor.getCurrent(),
                timeBudget.status(),
                timeBudget.phaseStrategy(phase, phaseMachine.completedPhases()),
                totalAnswers,
                shouldEnd());
    }

    /**
     * Uses the configured session ceiling and question cap.
     */
    public boolean shouldEnd() {
        return shouldEnd(settings.time().maxSessionMinutes(), settings.limits().maxQuestions());
    }

    public boolean shouldEnd(double maxMinutes, int maxQuestions) {
        if (completed) {
            return true;
        }
        if (timeBudget.exceeds(maxMinutes)
                || totalAnswers >= maxQuestions
                || phaseMachine.getCurrent().isTerminal()) {
            return true;
        }
        boolean redFlagLimit = profile.getRedFlags().size() >= settings.limits().criticalRedFlags();
        return redFlagLimit && redFlagDeferralTurn != totalAnswers;
    }

    public InterviewReport report() {
        return reportSynthesizer.synthesize(
                sessionId.value(),
                profile,
                phaseMachine,
                difficultyAdaptor.getCurrent(),
                strategyAdaptor.getCurrent(),
                coveredAreas.stream().map(TopicArea::value).toList(),
                timeBudget.elapsedMinutes(),
                timeBudget.now());
    }

    /**
     * Closes the session for further answers and returns its final report.
     */
    public InterviewReport complete() {
        completed = true;
        return report();
    }

    private InterviewContext buildContext(boolean opening, String lastQuestion, String lastAnswer) {
        InterviewPhase phase = phaseMachine.getCurrent();
        PhaseTimeStrategy phaseTimeStrategy = timeBudget.phaseStrategy(phase, phaseMachine.completedPhases());
        InterviewContext.TimeView time = new InterviewContext.TimeView(
                timeBudget.elapsedMinutes(),
                timeBudget.remainingMinutes(),
                settings.time().maxSessionMinutes(),
                timeBudget.status().code(),
                phaseTimeStrategy.code(),
                phaseTimeStrategy.guidance());
        StrategyTactic tactic = strategyAdaptor.tactic();
        InterviewContext.StrategyView strategy = new InterviewContext.StrategyView(
                difficultyAdaptor.getCurrent().code(),
                strategyAdaptor.getCurrent().code(),
                tactic.approach(),
                tactic.questionStyle(),
                tactic.targetDifficulty().code());
        return new InterviewContext(
                phase.code(),
                opening,
                profile.summary(),
                time,
                vacancyType.code(),
                plan.names(),
                coveredAreas.stream().map(TopicArea::value).toList(),
                recentExchanges(),
                repetitionView(),
                strategy,
                totalAnswers,
                lastQuestion,
                TextUtils.truncateWithEllipsis(lastAnswer, settings.transcript().answerCharCap()));
    }

    private List<InterviewContext.ExchangeView> recentExchanges() {
        int window = settings.transcript().recentExchanges();
        int from = Math.max(0, transcript.size() - window);
        int cap = settings.transcript().answerCharCap();
        return transcript.subList(from, transcript.size()).stream()
                .map(exchange -> new InterviewContext.ExchangeView(
                        exchange.phase().code(),
                        exchange.topic().value(),
                        exchange.question(),
                        TextUtils.truncateWithEllipsis(exchange.answer(), cap)))
                .toList();
    }

    private InterviewContext.RepetitionView repetitionView() {
        Map<String, Integer> frequency = new LinkedHashMap<>();
        repetitionGuard.getTopicFrequency().forEach((topic, count) -> frequency.put(topic.value(), count));
        return new InterviewContext.RepetitionView(
                frequency,
                repetitionGuard.getFailedTopics().stream().map(TopicArea::value).toList(),
                repetitionGuard.recentRecords().stream().map(QuestionRecord::text).toList());
    }

    public SessionId getSessionId() {
        return sessionId;
    }

    public CandidateIntake getIntake() {
        return intake;
    }

    public CandidateProfile getProfile() {
        return profile;
    }

    public TimeBudgetManager getTimeBudget() {
        return timeBudget;
    }

    public RepetitionGuard getRepetitionGuard() {
        return repetitionGuard;
    }

    public StrategyAdaptor getStrategyAdaptor() {
        return strategyAdaptor;
    }

    public DifficultyAdaptor getDifficultyAdaptor() {
        return difficultyAdaptor;
    }

    public PhaseStateMachine getPhaseMachine() {
        return phaseMachine;
    }

    public InterviewPhase getCurrentPhase() {
        return phaseMachine.getCurrent();
    }

    public VacancyType getVacancyType() {
        return vacancyType;
    }

    public InterviewPlan getPlan() {
        return plan;
    }

    public List<TopicArea> getCoveredAreas() {
        return Collections.unmodifiableList(coveredAreas);
    }

    public List<QaExchange> getTranscript() {
        return Collections.unmodifiableList(transcript);
    }

    public String getCurrentQuestion() {
        return currentQuestion;
    }

    public TopicArea getCurrentTopic() {
        return currentTopic;
    }

    public Difficulty getCurrentDifficulty() {
        return currentDifficulty;
    }

    public OracleDecision getLastDecision() {
        return lastDecision;
    }

    public int getTotalAnswers() {
        return totalAnswers;
    }

    public int getFallbackTurns() {
        return fallbackTurns;
    }

    public int getRepetitionsDetected() {
        return repetitionsDetected;
    }

    public boolean isOpened() {
        return opened;
    }

    public boolean isCompleted() {
        return completed;
    }

    public boolean isAcceptingAnswers() {
        return opened && !completed && !phaseMachine.getCurrent().isTerminal();
    }
}
