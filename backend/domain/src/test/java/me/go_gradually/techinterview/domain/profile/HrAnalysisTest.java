package me.go_gradually.techinterview.domain.profile;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class HrAnalysisTest {

    @Test
    void preliminaryLevel_mapsScoreBands() {
        assertEquals(TechnicalLevel.SENIOR, new HrAnalysis(List.of(), List.of(), 85).preliminaryLevel());
        assertEquals(TechnicalLevel.MIDDLE, new HrAnalysis(List.of(), List.of(), 70).preliminaryLevel());
        assertEquals(TechnicalLevel.JUNIOR, new HrAnalysis(List.of(), List.of(), 50).preliminaryLevel());
        assertEquals(TechnicalLevel.UNKNOWN, new HrAnalysis(List.of(), List.of(), 49).preliminaryLevel());
        assertEquals(TechnicalLevel.UNKNOWN, HrAnalysis.none().preliminaryLevel());
    }

    @Test
    void constructor_dropsBlankAndDuplicateEntries() {
        HrAnalysis analysis = new HrAnalysis(List.of(" Java ", "", "Java"), null, null);

        assertEquals(List.of("Java"), analysis.keyStrengths());
        assertEquals(List.of(), analysis.criticalConcerns());
    }
}
