package me.go_gradually.techinterview.bootstrap;

import me.go_gradually.techinterview.domain.interview.InterviewSettings;
import me.go_gradually.techinterview.infrastructure.shared.config.AppProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(AppProperties.class)
public class AppConfig {
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Validates every threshold group at startup; an inconsistent configuration fails the context.
     */
    @Bean
    public InterviewSettings interviewSettings(AppProperties properties) {
        return properties.toInterviewSettings();
    }
}
