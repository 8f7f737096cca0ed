package com.sparrowlogic.lbaudit.report;

import com.sparrowlogic.lbaudit.config.AuditProperties;
import com.sparrowlogic.lbaudit.model.AuditResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;

@Service
public class ReportPublisher {

    private static final Logger logger = LoggerFactory.getLogger(ReportPublisher.class);

    private final JsonReportWriter jsonWriter;
    private final CsvCostReportWriter csvWriter;
    private final MarkdownReportService markdownService;
    private final AuditProperties properties;

    public ReportPublisher(JsonReportWriter jsonWriter, CsvCostReportWriter csvWriter,
                           MarkdownReportService markdownService, AuditProperties properties) {
        this.jsonWriter = jsonWriter;
        this.csvWriter = csvWriter;
        this.markdownService = markdownService;
        this.properties = properties;
    }

    public List<Path> publish(List<AuditResult> results) {
        var directory = Path.of(properties.reportDir());
        var json = jsonWriter.write(results, directory);
        var csv = csvWriter.write(results, directory);
        logger.info("Audit summary\n{}", markdownService.generateMarkdown(results));
        logger.info("Reports written to {} and {}", json, csv);
        return List.of(json, csv);
    }
}
