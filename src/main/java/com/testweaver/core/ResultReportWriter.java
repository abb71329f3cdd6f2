package com.testweaver.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.testweaver.model.ScenarioResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes scenario results to {@code <report dir>/results.json}.
 *
 * <pre>
 * {
 *   "generatedAt": "2024-05-01T10:15:30Z",
 *   "total": 2, "passed": 1, "failed": 1,
 *   "scenarios": [ { "name": "...", "finalState": "COMPLETED", "results": [ ... ] } ]
 * }
 * </pre>
 *
 * The file is written to a temp file first and moved into place atomically; the
 * temp file is removed if either step fails.
 */
public class ResultReportWriter {

    private static final Logger log = LoggerFactory.getLogger(ResultReportWriter.class);
    public static final String FILE_NAME = "results.json";

    private final Path reportDir;
    private final ObjectMapper mapper;

    public ResultReportWriter(Path reportDir) {
        this.reportDir = reportDir;
        this.mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * @return the path of the written report
     * @throws ConfigurationException if the report directory cannot be written
     */
    public Path write(List<ScenarioResult> results) {
        long passed = results.stream().filter(ScenarioResult::isSuccessful).count();
        Map<String, Object> report = new LinkedHashMap<>();
        report.put("generatedAt", Instant.now());
        report.put("total", results.size());
        report.put("passed", passed);
        report.put("failed", results.size() - passed);
        report.put("scenarios", results);

        Path target = reportDir.resolve(FILE_NAME);
        Path tmp = null;
        try {
            Files.createDirectories(reportDir);
            tmp = Files.createTempFile(reportDir, "results", ".json.tmp");
            mapper.writeValue(tmp.toFile(), report);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.info("ResultReportWriter: {} scenario result(s) written to {}", results.size(), target);
            return target;
        } catch (IOException e) {
            discard(tmp, e);
            throw new ConfigurationException("Could not write report to " + target + ": " + e.getMessage(), e);
        }
    }

    private static void discard(Path tmp, IOException failure) {
        if (tmp == null) return;
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException cleanup) {
            failure.addSuppressed(cleanup);
        }
    }
}
