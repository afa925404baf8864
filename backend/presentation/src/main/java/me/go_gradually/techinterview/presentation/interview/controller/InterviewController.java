package me.go_gradually.techinterview.presentation.interview.controller;

import jakarta.validation.Valid;
import me.go_gradually.techinterview.application.interview.model.InterviewStatusView;
import me.go_gradually.techinterview.application.interview.model.InterviewTurn;
import me.go_gradually.techinterview.application.interview.model.StartInterviewCommand;
import me.go_gradually.techinterview.application.interview.usecase.InterviewUseCase;
import me.go_gradually.techinterview.domain.interview.TurnOutcome;
import me.go_gradually.techinterview.domain.phase.PhaseSnapshot;
import me.go_gradually.techinterview.domain.report.InterviewReport;
import me.go_gradually.techinterview.presentation.interview.dto.AnswerRequest;
import me.go_gradually.techinterview.presentation.interview.dto.HrAnalysisRequest;
import me.go_gradually.techinterview.presentation.interview.dto.PhaseTransitionResponse;
import me.go_gradually.techinterview.presentation.interview.dto.StartInterviewRequest;
import me.go_gradually.techinterview.presentation.interview.dto.TurnResponse;
import org.springframework.web.bind.annotation.*;

import java.io.IOException;
import java.util.Locale;

@RestController
@RequestMapping("/api/interviews")
public class InterviewController {
    private final InterviewUseCase interviewUseCase;

    public InterviewController(InterviewUseCase interviewUseCase) {
        this.interviewUseCase = interviewUseCase;
    }

    @PostMapping
    public TurnResponse start(@Valid @RequestBody StartInterviewRequest request) {
        return toResponse(interviewUseCase.start(toCommand(request)));
    }

    @PostMapping("/{sessionId}/answers")
    public TurnResponse answer(@PathVariable String sessionId, @Valid @RequestBody AnswerRequest request) {
        return toResponse(interviewUseCase.answer(sessionId, request.getAnswer()));
    }

    @GetMapping("/{sessionId}")
    public InterviewStatusView status(@PathVariable String sessionId) {
        return interviewUseCase.status(sessionId);
    }

    @PostMapping("/{sessionId}/complete")
    public InterviewReport complete(@PathVariable String sessionId) throws IOException {
        return interviewUseCase.complete(sessionId);
    }

    @GetMapping("/{sessionId}/report")
    public InterviewReport report(@PathVariable String sessionId) {
        return interviewUseCase.report(sessionId);
    }

    private StartInterviewCommand toCommand(StartInterviewRequest request) {
        StartInterviewCommand command = new StartInterviewCommand();
        command.setCandidateName(request.getCandidateName());
        command.setVacancyTitle(request.getVacancyTitle());
        command.setIndustry(request.getIndustry());
        HrAnalysisRequest hr = request.getHrAnalysis();
        if (hr != null) {
            command.setHrStrengths(hr.getKeyStrengths());
            command.setHrConcerns(hr.getCriticalConcerns());
            command.setHrOverallScore(hr.getOverallScore());
        }
        return command;
    }

    private TurnResponse toResponse(InterviewTurn turn) {
        TurnOutcome outcome = turn.outcome();
        TurnResponse response = new TurnResponse();
        response.setSessionId(turn.sessionId());
        response.setQuestion(outcome.nextQuestion());
        response.setQuestionArea(outcome.questionArea().value());
        response.setQuestionDifficulty(outcome.questionDifficulty().code());
        response.setPhase(outcome.phase().code());
        response.setPhaseTransition(outcome.phaseTransition().map(this::toTransition).orElse(null));
        response.setFallbackUsed(outcome.fallbackUsed());
        response.setRepetitionDetected(outcome.repetitionDetected());
        response.setQuestionSubstituted(outcome.questionSubstituted());
        response.setStrategy(outcome.strategy().code());
        response.setTimeStatus(outcome.timeStatus().code());
        response.setPhaseTimeStrategy(outcome.phaseTimeStrategy().code());
        response.setTotalAnswers(outcome.totalAnswers());
        response.setShouldEnd(outcome.shouldEnd());
        response.setFinished(outcome.isFinished());
        return response;
    }

    private PhaseTransitionResponse toTransition(PhaseSnapshot snapshot) {
        PhaseTransitionResponse response = new PhaseTransitionResponse();
        response.setFrom(snapshot.phase().code());
        response.setTo(snapshot.next().code());
        response.setReason(snapshot.reason().name().toLowerCase(Locale.ROOT));
        response.setDurationMinutes(snapshot.duration().toMillis() / 60000.0);
        response.setQuestionsAsked(snapshot.questionsAsked());
        return response;
    }
}
