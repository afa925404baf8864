package me.go_gradually.techinterview.presentation.interview.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;

public class StartInterviewRequest {
    @NotBlank
    private String candidateName;
    private String vacancyTitle;
    private String industry;
    @Valid
    private HrAnalysisRequest hrAnalysis;

    public String getCandidateName() {
        return candidateName;
    }

    public void setCandidateName(String candidateName) {
        this.candidateName = candidateName;
    }

    public String getVacancyTitle() {
        return vacancyTitle;
    }

    public void setVacancyTitle(String vacancyTitle) {
        this.vacancyTitle = vacancyTitle;
    }

    public String getIndustry() {
        return industry;
    }

    public void setIndustry(String industry) {
        this.industry = industry;
    }

    public HrAnalysisRequest getHrAnalysis() {
        return hrAnalysis;
    }

    public void setHrAnalysis(HrAnalysisRequest hrAnalysis) {
        this.hrAnalysis = hrAnalysis;
    }
}
