package me.go_gradually.techinterview.bootstrap;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "me.go_gradually.techinterview")
public class TechInterviewApplication {
    public static void main(String[] args) {
        SpringApplication.run(TechInterviewApplication.class, args);
    }
}
