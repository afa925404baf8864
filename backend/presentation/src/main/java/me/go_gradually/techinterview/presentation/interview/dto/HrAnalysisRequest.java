package me.go_gradually.techinterview.presentation.interview.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

import java.util.List;

public class HrAnalysisRequest {
    private List<String> keyStrengths;
    private List<String> criticalConcerns;
    @Min(0)
    @Max(100)
    private Integer overallScore;

    public List<String> getKeyStrengths() {
        return keyStrengths;
    }

    public void setKeyStrengths(List<String> keyStrengths) {
        this.keyStrengths = keyStrengths;
    }

    public List<String> getCriticalConcerns() {
        return criticalConcerns;
    }

    public void setCriticalConcerns(List<String> criticalConcerns) {
        this.criticalConcerns = criticalConcerns;
    }

    public Integer getOverallScore() {
        return overallScore;
    }

    public void setOverallScore(Integer overallScore) {
        this.overallScore = overallScore;
    }
}
