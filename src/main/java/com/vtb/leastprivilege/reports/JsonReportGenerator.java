package com.vtb.leastprivilege.reports;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.vtb.leastprivilege.models.AnalysisReport;
import com.vtb.leastprivilege.models.ApplicationReport;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Objects;

/**
 * Генератор отчетов в формате JSON
 */
@Slf4j
public class JsonReportGenerator implements ReportGenerator {

    private final ObjectMapper objectMapper;

    public JsonReportGenerator() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public void generate(AnalysisReport report, Path outputPath) throws IOException {
        log.info("Генерация JSON отчета: {}", outputPath);

        if (report == null) {
            throw new IllegalArgumentException("AnalysisReport не может быть null");
        }

        String json = objectMapper.writeValueAsString(sanitize(report));
        if (outputPath.getParent() != null) {
            Files.createDirectories(outputPath.getParent());
        }
        Files.writeString(outputPath, json);

        log.info("JSON отчет сохранен: {} ({} байт)", outputPath, Files.size(outputPath));
    }

    @Override
    public String getFileExtension() {
        return "json";
    }

    private AnalysisReport sanitize(AnalysisReport report) {
        if (report.getApplications() == null) {
            report.setApplications(new ArrayList<>());
        }
        report.getApplications().removeIf(Objects::isNull);
        for (ApplicationReport application : report.getApplications()) {
            if (application.getOptimalPermissions() == null) {
                application.setOptimalPermissions(new ArrayList<>());
            }
            if (application.getUnmatchedActivities() == null) {
                application.setUnmatchedActivities(new ArrayList<>());
            }
        }
        if (report.getPermissionMaps() == null) {
            report.setPermissionMaps(new ArrayList<>());
        }
        return report;
    }
}
