package com.sparrowlogic.lbaudit.report;

import java.util.Map;

public final class Recommendations {

    private static final Map<String, String> BY_ISSUE_TYPE = Map.ofEntries(
        Map.entry("weak_tls_policy", "Switch the listener to ELBSecurityPolicy-TLS13-1-2-2021-06 or newer"),
        Map.entry("no_https_redirect", "Add a default redirect action from HTTP to HTTPS (301)"),
        Map.entry("missing_waf", "Associate a WAF Web ACL with the load balancer"),
        Map.entry("ssl_expiration_risk", "Renew the certificate or verify ACM automatic renewal"),
        Map.entry("no_deletion_protection", "Enable deletion protection"),
        Map.entry("overly_broad_ingress", "Restrict 0.0.0.0/0 ingress to ports 80 and 443"),
        Map.entry("unhealthy_targets", "Investigate failing targets and replace unhealthy instances"),
        Map.entry("high_5xx_rate", "Review backend errors and scale or fix the failing service"),
        Map.entry("inefficient_health_checks", "Use an interval of 30s or less and a timeout of 10s or less"),
        Map.entry("single_az_risk", "Enable at least two availability zones"),
        Map.entry("nlb_skew", "Enable cross-zone load balancing"),
        Map.entry("stateful_session_issues", "Enable stickiness on the target group or externalize session state"),
        Map.entry("idle_assets", "Delete the load balancer if it is no longer needed"),
        Map.entry("unused_target_groups", "Remove the target group or register healthy targets"),
        Map.entry("missing_observability", "Enable access logs to S3"),
        Map.entry("no_monitoring_alarms", "Create CloudWatch alarms for the missing metrics"),
        Map.entry("maintenance_rules", "Remove the maintenance rule or decommission the load balancer"),
        Map.entry("inefficient_target_type", "Consider Lambda targets for this workload")
    );

    private Recommendations() {
    }

    public static String forIssueType(String issueType) {
        return BY_ISSUE_TYPE.getOrDefault(issueType, "Review the configuration");
    }
}
