package me.go_gradually.techinterview.domain.report;

import java.util.List;

/**
 * How the interview compares with the recruiter screening.
 */
public record HrValidation(String preliminaryLevel,
                           List<String> validatedStrengths,
                           List<String> confirmedConcerns,
                           List<String> openConcerns) {
    public HrValidation {
        validatedStrengths = List.copyOf(validatedStrengths);
        confirmedConcerns = List.copyOf(confirmedConcerns);
        openConcerns = List.copyOf(openConcerns);
    }
}
