package me.go_gradually.techinterview.bootstrap;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.go_gradually.techinterview.application.interview.policy.InterviewPolicy;
import me.go_gradually.techinterview.application.interview.port.InterviewOracle;
import me.go_gradually.techinterview.application.interview.port.InterviewReportPort;
import me.go_gradually.techinterview.application.interview.port.InterviewSessionStorePort;
import me.go_gradually.techinterview.application.interview.usecase.InterviewUseCase;
import me.go_gradually.techinterview.application.oracle.InterviewPromptBuilder;
import me.go_gradually.techinterview.application.oracle.LlmInterviewOracle;
import me.go_gradually.techinterview.application.oracle.OracleResponseParser;
import me.go_gradually.techinterview.application.oracle.port.LlmClient;
import me.go_gradually.techinterview.application.shared.port.MetricsPort;
import me.go_gradually.techinterview.domain.interview.InterviewSettings;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;

@Configuration
public class UseCaseConfig {
    @Bean
    public OracleResponseParser oracleResponseParser(ObjectMapper objectMapper) {
        return new OracleResponseParser(objectMapper);
    }

    @Bean
    public InterviewPromptBuilder interviewPromptBuilder(ObjectMapper objectMapper) {
        return new InterviewPromptBuilder(objectMapper);
    }

    @Bean
    public InterviewOracle interviewOracle(List<LlmClient> llmClients,
                                           InterviewPolicy interviewPolicy,
                                           InterviewPromptBuilder promptBuilder,
                                           OracleResponseParser responseParser,
                                           MetricsPort metricsPort) {
        return new LlmInterviewOracle(llmClients, interviewPolicy, promptBuilder, responseParser, metricsPort);
    }

    @Bean
    public InterviewUseCase interviewUseCase(InterviewSessionStorePort sessionStore,
                                             InterviewReportPort reportStore,
                                             InterviewOracle interviewOracle,
                                             MetricsPort metricsPort,
                                             InterviewSettings interviewSettings,
                                             Clock clock) {
        return new InterviewUseCase(sessionStore, reportStore, interviewOracle, metricsPort, interviewSettings, clock);
    }
}
