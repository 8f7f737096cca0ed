package com.sparrowlogic.lbaudit.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.sparrowlogic.lbaudit.model.AuditResult;
import com.sparrowlogic.lbaudit.model.Category;
import com.sparrowlogic.lbaudit.model.Severity;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

public record AuditSummary(
    @JsonProperty("total_load_balancers") int totalLoadBalancers,
    @JsonProperty("average_health_score") double averageHealthScore,
    @JsonProperty("issues_by_severity") Map<Severity, Long> issuesBySeverity,
    @JsonProperty("issues_by_category") Map<Category, Long> issuesByCategory,
    @JsonProperty("total_monthly_cost") double totalMonthlyCost
) {
    public static AuditSummary of(List<AuditResult> results) {
        var bySeverity = new EnumMap<Severity, Long>(Severity.class);
        var byCategory = new EnumMap<Category, Long>(Category.class);
        for (var severity : Severity.values()) {
            bySeverity.put(severity, 0L);
        }
        for (var category : Category.values()) {
            byCategory.put(category, 0L);
        }
        results.stream().flatMap(result -> result.issues().stream()).forEach(issue -> {
            bySeverity.merge(issue.severity(), 1L, Long::sum);
            byCategory.merge(issue.category(), 1L, Long::sum);
        });

        var average = results.stream().mapToDouble(AuditResult::healthScore).average().orElse(0.0);
        var totalCost = results.stream().mapToDouble(AuditResult::estimatedMonthlyCost).sum();
        return new AuditSummary(
            results.size(),
            Math.round(average * 10.0) / 10.0,
            bySeverity,
            byCategory,
            Math.round(totalCost * 100.0) / 100.0
        );
    }
}
