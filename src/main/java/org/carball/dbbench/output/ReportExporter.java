package org.carball.dbbench.output;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.carball.dbbench.baseline.ComparisonResult;
import org.carball.dbbench.model.advisor.AdvisorReport;
import org.carball.dbbench.stats.IterationResult;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes reports as JSON.
 */
@Slf4j
public class ReportExporter {

    private final ObjectMapper objectMapper = JsonMappers.create();

    public String toJson(AdvisorReport report) {
        return write(report.toMap());
    }

    public String toJson(ComparisonResult comparison) {
        return write(comparison.toMap());
    }

    public String toJson(IterationResult result) {
        return write(result);
    }

    public void export(AdvisorReport report, Path file) throws IOException {
        writeFile(toJson(report), file);
    }

    public void export(ComparisonResult comparison, Path file) throws IOException {
        writeFile(toJson(comparison), file);
    }

    public void export(IterationResult result, Path file) throws IOException {
        writeFile(toJson(result), file);
    }

    private String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.error("Error generating JSON report", e);
            throw new IllegalStateException("Failed to generate JSON report", e);
        }
    }

    private void writeFile(String json, Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(file, json);
        log.info("Report exported to {}", file);
    }
}
