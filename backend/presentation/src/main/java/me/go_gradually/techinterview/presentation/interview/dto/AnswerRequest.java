package me.go_gradually.techinterview.presentation.interview.dto;

import jakarta.validation.constraints.NotBlank;

public class AnswerRequest {
    @NotBlank
    private String answer;

    public String getAnswer() {
        return answer;
    }

    public void setAnswer(String answer) {
        this.answer = answer;
    }
}
