package me.go_gradually.techinterview.application.oracle;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.go_gradually.techinterview.application.interview.model.OracleFailure;
import me.go_gradually.techinterview.application.interview.model.OracleResult;
import me.go_gradually.techinterview.application.interview.policy.InterviewPolicy;
import me.go_gradually.techinterview.application.oracle.port.LlmClient;
import me.go_gradually.techinterview.application.shared.port.MetricsPort;
import me.go_gradually.techinterview.domain.interview.CandidateIntake;
import me.go_gradually.techinterview.domain.interview.InterviewContext;
import me.go_gradually.techinterview.domain.interview.InterviewSession;
import me.go_gradually.techinterview.domain.interview.InterviewSettings;
import me.go_gradually.techinterview.domain.profile.HrAnalysis;
import me.go_gradually.techinterview.domain.session.SessionId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class LlmInterviewOracleTest {

    @Mock
    private LlmClient openAiClient;
    @Mock
    private InterviewPolicy policy;
    @Mock
    private MetricsPort metrics;

    private LlmInterviewOracle oracle;
    private InterviewContext context;

    @BeforeEach
    void setUp() {
        when(openAiClient.provider()).thenReturn("openai");
        when(policy.getOracleProvider()).thenReturn("OpenAI");
        lenient().when(policy.getOracleModel()).thenReturn("gpt-4o-mini");
        lenient().when(policy.getOracleApiKey()).thenReturn("sk-test");
        ObjectMapper objectMapper = new ObjectMapper();
        oracle = new LlmInterviewOracle(List.of(openAiClient), policy,
                new InterviewPromptBuilder(objectMapper), new OracleResponseParser(objectMapper), metrics);
        CandidateIntake intake = new CandidateIntake("Mina", "Backend Developer", "fintech",
                new HrAnalysis(List.of("Java"), List.of("system design depth"), 72));
        InterviewSession session = new InterviewSession(SessionId.of("s-1"), intake, InterviewSettings.defaults(),
                Clock.fixed(Instant.parse("2026-01-05T10:00:00Z"), ZoneOffset.UTC));
        context = session.openingContext();
    }

    @Test
    void decide_validResponse_returnsDecision() throws Exception {
        when(openAiClient.generate(eq("sk-test"), eq("gpt-4o-mini"), anyString(), anyString()))
                .thenReturn("```json\n{\"next_question\": \"What brought you to backend work?\", \"question_area\": \"general_background\"}\n```");

        OracleResult result = oracle.decide(context);

        assertTrue(result.isSuccess());
        assertEquals("What brought you to backend work?", result.decision().nextQuestion());
        verify(metrics).recordOracleLatency(any());
        verify(metrics, never()).incrementOracleError();
    }

    @Test
    void decide_userPromptCarriesContext() throws Exception {
        when(openAiClient.generate(anyString(), anyString(), anyString(), anyString())).thenReturn("{}");

        oracle.decide(context);

        ArgumentCaptor<String> system = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<String> user = ArgumentCaptor.forClass(String.class);
        verify(openAiClient).generate(anyString(), anyString(), system.capture(), user.capture());
        assertTrue(system.getValue().contains("next_question"));
        assertTrue(user.getValue().contains("\"phase\" : \"exploration\""));
        assertTrue(user.getValue().contains("\"preliminary_level\" : \"middle\""));
        assertTrue(user.getValue().contains("system design depth"));
    }

    @Test
    void decide_clientThrows_returnsCallFailed() throws Exception {
        when(openAiClient.generate(anyString(), anyString(), anyString(), anyString()))
                .thenThrow(new IOException("connection reset"));

        OracleResult result = oracle.decide(context);

        assertFalse(result.isSuccess());
        assertEquals(OracleFailure.CALL_FAILED, result.failure());
        assertEquals("connection reset", result.detail());
        verify(metrics).incrementOracleError();
        verify(metrics).recordOracleLatency(any());
    }

    @Test
    void decide_malformedResponse_returnsMalformed() throws Exception {
        when(openAiClient.generate(anyString(), anyString(), anyString(), anyString()))
                .thenReturn("Sorry, I can only answer in prose today.");

        OracleResult result = oracle.decide(context);

        assertEquals(OracleFailure.MALFORMED_RESPONSE, result.failure());
        assertNull(result.decisionOrNull());
        verify(metrics).incrementOracleError();
    }

    @Test
    void constructor_unknownProvider_fails() {
        when(policy.getOracleProvider()).thenReturn("gemini");
        ObjectMapper objectMapper = new ObjectMapper();

        assertThrows(IllegalStateException.class, () -> new LlmInterviewOracle(List.of(openAiClient), policy,
                new InterviewPromptBuilder(objectMapper), new OracleResponseParser(objectMapper), metrics));
    }
}
