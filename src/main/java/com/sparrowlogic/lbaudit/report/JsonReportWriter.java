package com.sparrowlogic.lbaudit.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.sparrowlogic.lbaudit.model.AuditResult;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.List;

@Component
public class JsonReportWriter {

    static final String FILE_NAME = "load_balancer_analysis.json";

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public JsonReportWriter(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper.copy()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.clock = clock;
    }

    public Path write(List<AuditResult> results, Path directory) {
        var file = directory.resolve(FILE_NAME);
        var report = new Report(clock.instant(), AuditSummary.of(results), results);
        try {
            Files.createDirectories(directory);
            objectMapper.writeValue(file.toFile(), report);
            return file;
        } catch (IOException e) {
            throw new UncheckedIOException("Could not write " + file, e);
        }
    }

    record Report(
        @JsonProperty("audit_timestamp") Instant auditTimestamp,
        AuditSummary summary,
        @JsonProperty("load_balancers") List<AuditResult> loadBalancers
    ) {}
}
