package me.go_gradually.techinterview.presentation.interview.dto;

public class TurnResponse {
    private String sessionId;
    private String question;
    private String questionArea;
    private String questionDifficulty;
    private String phase;
    private PhaseTransitionResponse phaseTransition;
    private boolean fallbackUsed;
    private boolean repetitionDetected;
    private boolean questionSubstituted;
    private String strategy;
    private String timeStatus;
    private String phaseTimeStrategy;
    private int totalAnswers;
    private boolean shouldEnd;
    private boolean finished;

    public String getSessionId() {
        return sessionId;
    }

    public void setSessionId(String sessionId) {
        this.sessionId = sessionId;
    }

    public String getQuestion() {
        return question;
    }

    public void setQuestion(String question) {
        this.question = question;
    }

    public String getQuestionArea() {
        return questionArea;
    }

    public void setQuestionArea(String questionArea) {
        this.questionArea = questionArea;
    }

    public String getQuestionDifficulty() {
        return questionDifficulty;
    }

    public void setQuestionDifficulty(String questionDifficulty) {
        this.questionDifficulty = questionDifficulty;
    }

    public String getPhase() {
        return phase;
    }

    public void setPhase(String phase) {
        this.phase = phase;
    }

    public PhaseTransitionResponse getPhaseTransition() {
        return phaseTransition;
    }

    public void setPhaseTransition(PhaseTransitionResponse phaseTransition) {
        this.phaseTransition = phaseTransition;
    }

    public boolean isFallbackUsed() {
        return fallbackUsed;
    }

    public void setFallbackUsed(boolean fallbackUsed) {
        this.fallbackUsed = fallbackUsed;
    }

    public boolean isRepetitionDetected() {
        return repetitionDetected;
    }

    public void setRepetitionDetected(boolean repetitionDetected) {
        this.repetitionDetected = repetitionDetected;
    }

    public boolean isQuestionSubstituted() {
        return questionSubstituted;
    }

    public void setQuestionSubstituted(boolean questionSubstituted) {
        this.questionSubstituted = questionSubstituted;
    }

    public String getStrategy() {
        return strategy;
    }

    public void setStrategy(String strategy) {
        this.strategy = strategy;
    }

    public String getTimeStatus() {
        return timeStatus;
    }

    public void setTimeStatus(String timeStatus) {
        this.timeStatus = timeStatus;
    }

    public String getPhaseTimeStrategy() {
        return phaseTimeStrategy;
    }

    public void setPhaseTimeStrategy(String phaseTimeStrategy) {
        this.phaseTimeStrategy = phaseTimeStrategy;
    }

    public int getTotalAnswers() {
        return totalAnswers;
    }

    public void setTotalAnswers(int totalAnswers) {
        this.totalAnswers = totalAnswers;
    }

    public boolean isShouldEnd() {
        return shouldEnd;
    }

    public void setShouldEnd(boolean shouldEnd) {
        this.shouldEnd = shouldEnd;
    }

    public boolean isFinished() {
        return finished;
    }

    public void setFinished(boolean finished) {
        this.finished = finished;
    }
}
