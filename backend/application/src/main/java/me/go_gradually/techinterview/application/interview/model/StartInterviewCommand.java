package me.go_gradually.techinterview.application.interview.model;

import java.util.List;

public class StartInterviewCommand {
    private String candidateName;
    private String vacancyTitle;
    private String industry;
    private List<String> hrStrengths;
    private List<String> hrConcerns;
    private Integer hrOverallScore;

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

    public List<String> getHrStrengths() {
        return hrStrengths;
    }

    public void setHrStrengths(List<String> hrStrengths) {
        this.hrStrengths = hrStrengths;
    }

    public List<String> getHrConcerns() {
        return hrConcerns;
    }

    public void setHrConcerns(List<String> hrConcerns) {
        this.hrConcerns = hrConcerns;
    }

    public Integer getHrOverallScore() {
        return hrOverallScore;
    }

    public void setHrOverallScore(Integer hrOverallScore) {
        this.hrOverallScore = hrOverallScore;
    }
}
