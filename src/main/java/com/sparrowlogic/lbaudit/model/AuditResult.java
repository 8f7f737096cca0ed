package com.sparrowlogic.lbaudit.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

public record AuditResult(
    @JsonProperty("lb_name") String name,
    @JsonProperty("lb_arn") String arn,
    @JsonProperty("lb_type") String type,
    @JsonProperty("health_score") double healthScore,
    List<Issue> issues,
    Map<String, Double> metrics,
    @JsonProperty("certificate_expiry") Map<String, CertificateInfo> certificateExpiry,
    @JsonProperty("estimated_monthly_cost") double estimatedMonthlyCost
) {
    public AuditResult {
        issues = List.copyOf(issues);
        metrics = Map.copyOf(metrics);
        certificateExpiry = Map.copyOf(certificateExpiry);
    }
}
