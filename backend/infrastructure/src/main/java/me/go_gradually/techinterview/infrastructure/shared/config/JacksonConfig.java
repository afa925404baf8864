package me.go_gradually.techinterview.infrastructure.shared.config;

import com.fasterxml.jackson.databind.Module;
import me.go_gradually.techinterview.infrastructure.shared.json.InterviewJsonModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class JacksonConfig {
    @Bean
    public Module interviewJsonModule() {
        return new InterviewJsonModule();
    }
}
