package com.sparrowlogic.lbaudit.check;

import com.sparrowlogic.lbaudit.model.AuditTarget;
import com.sparrowlogic.lbaudit.model.Category;
import com.sparrowlogic.lbaudit.model.Issue;
import com.sparrowlogic.lbaudit.model.Severity;
import com.sparrowlogic.lbaudit.service.MetricStatistic;
import com.sparrowlogic.lbaudit.service.MetricsAggregator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;

import java.util.ArrayList;
import java.util.Map;

/**
 * Flags target groups with at least a fifth of their targets unhealthy, but only while the
 * load balancer is receiving traffic.
 */
public class UnhealthyTargetsCheck implements LoadBalancerCheck {

    private static final Logger logger = LoggerFactory.getLogger(UnhealthyTargetsCheck.class);

    static final double UNHEALTHY_RATIO_THRESHOLD = 0.20;

    private final TargetHealthLookup targetHealth;
    private final MetricsAggregator metrics;
    private final int windowDays;

    public UnhealthyTargetsCheck(TargetHealthLookup targetHealth, MetricsAggregator metrics, int windowDays) {
        this.targetHealth = targetHealth;
        this.metrics = metrics;
        this.windowDays = windowDays;
    }

    @Override
    public String name() {
        return "unhealthy_targets";
    }

    @Override
    public CheckResult run(AuditTarget target) {
        var lb = target.loadBalancer();
        if (target.targetGroups().isEmpty()) {
            return CheckResult.empty();
        }
        var traffic = metrics.getMetric(lb, lb.kind().trafficMetric(), MetricStatistic.SUM, windowDays);
        if (traffic <= 0) {
            return CheckResult.empty();
        }

        var issues = new ArrayList<Issue>();
        for (var targetGroup : target.targetGroups()) {
            try {
                var health = targetHealth.targetHealth(targetGroup.arn());
                if (health.isEmpty()) {
                    continue;
                }
                var unhealthy = health.stream().filter(ElbQueries::isUnhealthy).count();
                var ratio = (double) unhealthy / health.size();
                if (ratio >= UNHEALTHY_RATIO_THRESHOLD) {
                    issues.add(new Issue(
                        Severity.HIGH,
                        Category.PERFORMANCE,
                        "unhealthy_targets",
                        String.format("%d of %d targets in %s are unhealthy", unhealthy, health.size(), targetGroup.name()),
                        targetGroup.arn(),
                        Map.of("unhealthy_count", unhealthy, "total_count", health.size(),
                            "unhealthy_percentage", Math.round(ratio * 1000.0) / 10.0)
                    ));
                }
            } catch (SdkException e) {
                logger.warn("Could not read target health of {}: {}", targetGroup.arn(), e.getMessage());
            }
        }
        return CheckResult.of(issues);
    }
}
