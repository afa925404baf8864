package me.go_gradually.techinterview.application.oracle;

import me.go_gradually.techinterview.application.interview.model.OracleFailure;
import me.go_gradually.techinterview.application.interview.model.OracleResult;
import me.go_gradually.techinterview.application.interview.policy.InterviewPolicy;
import me.go_gradually.techinterview.application.interview.port.InterviewOracle;
import me.go_gradually.techinterview.application.oracle.port.LlmClient;
import me.go_gradually.techinterview.application.shared.port.MetricsPort;
import me.go_gradually.techinterview.domain.interview.InterviewContext;
import me.go_gradually.techinterview.domain.oracle.OracleDecision;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;
import java.util.stream.Collectors;

public class LlmInterviewOracle implements InterviewOracle {
    private static final Logger log = Logger.getLogger(LlmInterviewOracle.class.getName());

    private final LlmClient client;
    private final InterviewPolicy policy;
    private final InterviewPromptBuilder promptBuilder;
    private final OracleResponseParser parser;
    private final MetricsPort metrics;

    public LlmInterviewOracle(List<LlmClient> clientList,
                              InterviewPolicy policy,
                              InterviewPromptBuilder promptBuilder,
                              OracleResponseParser parser,
                              MetricsPort metrics) {
        Map<String, LlmClient> clients = clientList.stream().collect(Collectors.toMap(LlmClient::provider, c -> c));
        String provider = policy.getOracleProvider() == null ? "" : policy.getOracleProvider().toLowerCase(Locale.ROOT);
        this.client = Optional.ofNullable(clients.get(provider))
                .orElseThrow(() -> new IllegalStateException("Unknown oracle provider: " + provider));
        this.policy = policy;
        this.promptBuilder = promptBuilder;
        this.parser = parser;
        this.metrics = metrics;
    }

    @Override
    public OracleResult decide(InterviewContext context) {
        Instant start = Instant.now();
        String raw;
        try {
            raw = client.generate(policy.getOracleApiKey(), policy.getOracleModel(),
                    promptBuilder.buildSystemPrompt(), promptBuilder.buildUserPrompt(context));
        } catch (Exception e) {
            metrics.incrementOracleError();
            log.warning(() -> "oracle.call.failed provider=" + client.provider()
                    + " phase=" + context.phase() + " error=" + e.getClass().getSimpleName());
            return OracleResult.failure(OracleFailure.CALL_FAILED, e.getMessage());
        } finally {
            metrics.recordOracleLatency(Duration.between(start, Instant.now()));
        }
        Optional<OracleDecision> decision = parser.parse(raw);
        if (decision.isEmpty()) {
            int chars = raw == null ? 0 : raw.length();
            metrics.incrementOracleError();
            log.warning(() -> "oracle.response.malformed provider=" + client.provider()
                    + " phase=" + context.phase() + " chars=" + chars);
            return OracleResult.failure(OracleFailure.MALFORMED_RESPONSE, "Response contained no decodable JSON object");
        }
        return OracleResult.success(decision.get());
    }
}
