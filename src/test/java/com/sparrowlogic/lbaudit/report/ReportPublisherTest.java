package com.sparrowlogic.lbaudit.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sparrowlogic.lbaudit.config.AuditProperties;
import com.sparrowlogic.lbaudit.model.AuditResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static com.sparrowlogic.lbaudit.TestFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class ReportPublisherTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldWriteBothReportFiles() {
        var properties = new AuditProperties("us-east-1", null, false, false, 14, 7, 4, tempDir.resolve("out").toString());
        var publisher = new ReportPublisher(
            new JsonReportWriter(new ObjectMapper().findAndRegisterModules(), Clock.fixed(NOW, ZoneOffset.UTC)),
            new CsvCostReportWriter(),
            new MarkdownReportService(),
            properties);
        var result = new AuditResult("prod-alb", ALB_ARN, "application", 100.0, List.of(), Map.of(), Map.of(), 22.50);

        var files = publisher.publish(List.of(result));

        assertEquals(2, files.size());
        files.forEach(file -> assertTrue(Files.exists(file), file + " missing"));
    }
}
