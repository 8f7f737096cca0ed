package com.sparrowlogic.lbaudit.report;

import com.sparrowlogic.lbaudit.model.AuditResult;
import com.sparrowlogic.lbaudit.model.Severity;
import org.commonmark.ext.gfm.tables.TablesExtension;
import org.commonmark.parser.Parser;
import org.commonmark.renderer.html.HtmlRenderer;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Human-readable audit summary. The Markdown goes to the log in batch mode and is rendered
 * to HTML for the report page.
 */
@Service
public class MarkdownReportService {

    private final Parser parser;
    private final HtmlRenderer renderer;

    public MarkdownReportService() {
        var extensions = List.of(TablesExtension.create());
        this.parser = Parser.builder().extensions(extensions).build();
        this.renderer = HtmlRenderer.builder().extensions(extensions).escapeHtml(true).build();
    }

    public String generateMarkdown(List<AuditResult> results) {
        var summary = AuditSummary.of(results);
        var md = new StringBuilder("# Load Balancer Audit\n\n");

        md.append("## EXECUTIVE SUMMARY\n\n");
        if (results.isEmpty()) {
            md.append("No load balancers qualified for the audit.\n");
            return md.toString();
        }
        md.append("- Load balancers audited: ").append(summary.totalLoadBalancers()).append('\n');
        md.append("- Average health score: ").append(summary.averageHealthScore()).append('\n');
        md.append("- Estimated monthly cost: $").append(String.format(Locale.ROOT, "%.2f", summary.totalMonthlyCost())).append('\n');
        for (var severity : Severity.values()) {
            md.append("- ").append(severity).append(" issues: ").append(summary.issuesBySeverity().get(severity)).append('\n');
        }

        md.append("\n## HEALTH SCORE\n\n");
        md.append("| Load balancer | Type | Score | Issues | Monthly cost |\n");
        md.append("|---|---|---|---|---|\n");
        results.stream()
            .sorted(Comparator.comparingDouble(AuditResult::healthScore))
            .forEach(result -> md.append("| ").append(result.name())
                .append(" | ").append(result.type())
                .append(" | ").append(String.format(Locale.ROOT, "%.1f", result.healthScore()))
                .append(" | ").append(result.issues().size())
                .append(" | $").append(String.format(Locale.ROOT, "%.2f", result.estimatedMonthlyCost()))
                .append(" |\n"));

        for (var result : results) {
            if (result.issues().isEmpty()) {
                continue;
            }
            md.append("\n### ").append(result.name()).append("\n\n");
            md.append("| Severity | Category | Issue | Description | Recommendation |\n");
            md.append("|---|---|---|---|---|\n");
            result.issues().stream()
                .sorted(Comparator.comparing(issue -> issue.severity().ordinal()))
                .forEach(issue -> md.append("| ").append(issue.severity())
                    .append(" | ").append(issue.category())
                    .append(" | ").append(issue.issueType())
                    .append(" | ").append(cell(issue.description()))
                    .append(" | ").append(Recommendations.forIssueType(issue.issueType()))
                    .append(" |\n"));
        }
        return md.toString();
    }

    public String toHtml(String markdown) {
        return renderer.render(parser.parse(markdown));
    }

    private static String cell(String text) {
        return text == null ? "" : text.replace("|", "\\|").replace("\n", " ");
    }
}
