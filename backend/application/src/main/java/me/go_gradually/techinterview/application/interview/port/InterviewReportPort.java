package me.go_gradually.techinterview.application.interview.port;

import me.go_gradually.techinterview.domain.report.InterviewReport;

import java.io.IOException;

public interface InterviewReportPort {
    String save(InterviewReport report) throws IOException;
}
