package me.go_gradually.techinterview.domain.oracle;

import me.go_gradually.techinterview.domain.interview.Difficulty;
import me.go_gradually.techinterview.domain.interview.InterviewPhase;
import me.go_gradually.techinterview.domain.interview.TopicArea;
import me.go_gradually.techinterview.domain.util.TextUtils;

import java.util.List;
import java.util.Optional;

/**
 * Structured decision returned by the oracle for one turn. Optional fields are
 * already defaulted; {@code reportedPhaseCode} is kept raw so an unknown name can be
 * detected and ignored.
 */
public record OracleDecision(InterviewStatus interviewStatus,
                             String reportedPhaseCode,
                             String nextQuestion,
                             TopicArea questionArea,
                             Difficulty questionDifficulty,
                             AnswerAnalysis previousAnswerAnalysis,
                             TimeManagement timeManagement,
                             AdaptationNeed adaptationNeeded,
                             List<String> interviewPlan,
                             String currentArea,
                             String interviewerNotes) {
    public OracleDecision {
        interviewStatus = interviewStatus == null ? InterviewStatus.CONTINUING : interviewStatus;
        reportedPhaseCode = TextUtils.normalize(reportedPhaseCode);
        nextQuestion = TextUtils.normalize(nextQuestion);
        questionArea = questionArea == null ? TopicArea.GENERAL : questionArea;
        previousAnswerAnalysis = previousAnswerAnalysis == null ? AnswerAnalysis.empty() : previousAnswerAnalysis;
        timeManagement = timeManagement == null ? TimeManagement.CONTINUE : timeManagement;
        adaptationNeeded = adaptationNeeded == null ? AdaptationNeed.NONE : adaptationNeeded;
        interviewPlan = TextUtils.cleanList(interviewPlan);
        currentArea = TextUtils.normalize(currentArea);
        interviewerNotes = TextUtils.normalize(interviewerNotes);
    }

    /**
     * Decision with no oracle signal at all, used when the oracle could not be consulted.
     */
    public static OracleDecision neutral() {
        return new OracleDecision(InterviewStatus.CONTINUING, "", "", TopicArea.GENERAL, null,
                AnswerAnalysis.empty(), TimeManagement.CONTINUE, AdaptationNeed.NONE, List.of(), "", "");
    }

    public Optional<InterviewPhase> reportedPhase() {
        return InterviewPhase.fromCode(reportedPhaseCode);
    }

    public Optional<Difficulty> difficulty() {
        return Optional.ofNullable(questionDifficulty);
    }

    public boolean hasNextQuestion() {
        return !nextQuestion.isEmpty();
    }

    public OracleDecision withNextQuestion(String question, TopicArea area) {
        return new OracleDecision(interviewStatus, reportedPhaseCode, question, area, questionDifficulty,
                previousAnswerAnalysis, timeManagement, adaptationNeeded, interviewPlan, currentArea, interviewerNotes);
    }
}
