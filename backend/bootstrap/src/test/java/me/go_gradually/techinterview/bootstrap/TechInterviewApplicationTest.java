package me.go_gradually.techinterview.bootstrap;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.go_gradually.techinterview.application.interview.port.InterviewOracle;
import me.go_gradually.techinterview.application.interview.usecase.InterviewUseCase;
import me.go_gradually.techinterview.domain.interview.InterviewPhase;
import me.go_gradually.techinterview.domain.interview.InterviewSettings;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

@SpringBootTest(properties = {
        "techinterview.data-dir=${java.io.tmpdir}/techinterview-test",
        "techinterview.oracle.api-key=sk-test"
})
class TechInterviewApplicationTest {

    @Autowired
    private InterviewSettings interviewSettings;

    @Autowired
    private InterviewUseCase interviewUseCase;

    @Autowired
    private InterviewOracle interviewOracle;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    void bindsConfiguredThresholdsToDomainDefaults() {
        assertEquals(InterviewSettings.defaults(), interviewSettings);
        assertNotNull(interviewUseCase);
        assertNotNull(interviewOracle);
    }

    @Test
    void objectMapperWritesDomainCodes() throws Exception {
        assertEquals("\"stress_test\"", objectMapper.writeValueAsString(InterviewPhase.STRESS_TEST));
    }
}
