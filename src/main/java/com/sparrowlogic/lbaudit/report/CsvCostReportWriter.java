package com.sparrowlogic.lbaudit.report;

import com.sparrowlogic.lbaudit.model.AuditResult;
import com.sparrowlogic.lbaudit.model.Category;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Writes one row per cost issue, the plan operators work through to cut spend.
 */
@Component
public class CsvCostReportWriter {

    static final String FILE_NAME = "cost_optimization_plan.csv";
    static final List<String> HEADER = List.of(
        "lb_name", "lb_arn", "issue_type", "severity", "description", "estimated_monthly_cost", "recommendation");

    public Path write(List<AuditResult> results, Path directory) {
        var file = directory.resolve(FILE_NAME);
        try {
            Files.createDirectories(directory);
            try (var writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
                writer.write(String.join(",", HEADER));
                writer.newLine();
                for (var result : results) {
                    for (var issue : result.issues()) {
                        if (issue.category() != Category.COST) {
                            continue;
                        }
                        writer.write(row(
                            result.name(),
                            result.arn(),
                            issue.issueType(),
                            issue.severity().name(),
                            issue.description(),
                            String.format(Locale.ROOT, "%.2f", result.estimatedMonthlyCost()),
                            Recommendations.forIssueType(issue.issueType())
                        ));
                        writer.newLine();
                    }
                }
            }
            return file;
        } catch (IOException e) {
            throw new UncheckedIOException("Could not write " + file, e);
        }
    }

    private static String row(String... values) {
        var escaped = new String[values.length];
        for (int i = 0; i < values.length; i++) {
            escaped[i] = escape(values[i]);
        }
        return String.join(",", escaped);
    }

    static String escape(String value) {
        if (value == null) {
            return "";
        }
        if (value.contains(",") || value.contains("\"") || value.contains("\n")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }
}
