package me.go_gradually.techinterview.infrastructure.shared.json;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import me.go_gradually.techinterview.domain.interview.Difficulty;
import me.go_gradually.techinterview.domain.interview.InterviewPhase;
import me.go_gradually.techinterview.domain.interview.TopicArea;
import me.go_gradually.techinterview.domain.profile.CommunicationStyle;
import me.go_gradually.techinterview.domain.profile.TechnicalLevel;
import me.go_gradually.techinterview.domain.report.ConfidenceLevel;
import me.go_gradually.techinterview.domain.report.HiringRecommendation;

import java.io.IOException;
import java.util.function.Function;

/**
 * Writes domain value types by their wire codes ({@code "strong_hire"}, not {@code "STRONG_HIRE"}).
 */
public class InterviewJsonModule extends SimpleModule {
    public InterviewJsonModule() {
        super("techinterview-domain");
        addCoded(TechnicalLevel.class, TechnicalLevel::code);
        addCoded(CommunicationStyle.class, CommunicationStyle::code);
        addCoded(HiringRecommendation.class, HiringRecommendation::code);
        addCoded(ConfidenceLevel.class, ConfidenceLevel::code);
        addCoded(InterviewPhase.class, InterviewPhase::code);
        addCoded(Difficulty.class, Difficulty::code);
        addCoded(TopicArea.class, TopicArea::value);
    }

    private <T> void addCoded(Class<T> type, Function<T, String> code) {
        addSerializer(type, new CodeSerializer<>(type, code));
    }

    private static final class CodeSerializer<T> extends StdSerializer<T> {
        private final transient Function<T, String> code;

        private CodeSerializer(Class<T> type, Function<T, String> code) {
            super(type);
            this.code = code;
        }

        @Override
        public void serialize(T value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            gen.writeString(code.apply(value));
        }
    }
}
