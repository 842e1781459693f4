package com.ili.analysis.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes {@link AnalysisReport} as indented JSON with snake_case field names.
 */
public class AnalysisReportWriter {
    private static final Logger log = LoggerFactory.getLogger(AnalysisReportWriter.class);

    private final ObjectMapper objectMapper;

    public AnalysisReportWriter() {
        this.objectMapper = new ObjectMapper()
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public String toJson(AnalysisReport report) {
        try {
            return objectMapper.writeValueAsString(report);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize analysis report", e);
        }
    }

    /**
     * Writes the report, creating parent directories as needed.
     */
    public void write(AnalysisReport report, Path path) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(path.toFile(), report);
        } catch (IOException e) {
            log.error("report.write.failed path={} error={}", path, e.getMessage());
            throw new UncheckedIOException("Failed to write analysis report to " + path, e);
        }
        log.info("report.written path={}", path);
    }

    ObjectMapper getObjectMapper() {
        return objectMapper;
    }
}
