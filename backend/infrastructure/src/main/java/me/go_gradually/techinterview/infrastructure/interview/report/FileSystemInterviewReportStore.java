package me.go_gradually.techinterview.infrastructure.interview.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.go_gradually.techinterview.application.interview.port.InterviewReportPort;
import me.go_gradually.techinterview.application.shared.policy.DataDirProvider;
import me.go_gradually.techinterview.domain.report.InterviewReport;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes each report to {@code <data-dir>/reports/<sessionId>.json}, replacing an earlier export.
 */
@Component
public class FileSystemInterviewReportStore implements InterviewReportPort {
    private final DataDirProvider dataDirProvider;
    private final ObjectMapper objectMapper;

    public FileSystemInterviewReportStore(DataDirProvider dataDirProvider, ObjectMapper objectMapper) {
        this.dataDirProvider = dataDirProvider;
        this.objectMapper = objectMapper;
    }

    @Override
    public String save(InterviewReport report) throws IOException {
        Path reportDir = Path.of(dataDirProvider.getDataDir(), "reports");
        Files.createDirectories(reportDir);
        Path target = reportDir.resolve(fileName(report.sessionId()));
        if (!target.normalize().startsWith(reportDir.normalize())) {
            throw new IllegalArgumentException("Invalid session id for report: " + report.sessionId());
        }
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(target.toFile(), report);
        return target.toString();
    }

    private String fileName(String sessionId) {
        return sessionId.replaceAll("[^A-Za-z0-9._-]", "_") + ".json";
    }
}
