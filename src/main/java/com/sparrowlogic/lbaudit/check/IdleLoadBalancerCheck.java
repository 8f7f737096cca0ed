package com.sparrowlogic.lbaudit.check;

import com.sparrowlogic.lbaudit.model.AuditTarget;
import com.sparrowlogic.lbaudit.model.Category;
import com.sparrowlogic.lbaudit.model.Issue;
import com.sparrowlogic.lbaudit.model.Severity;
import com.sparrowlogic.lbaudit.service.MetricStatistic;
import com.sparrowlogic.lbaudit.service.MetricsAggregator;

import java.util.List;
import java.util.Map;

/**
 * A load balancer with no traffic over the window is a deletion candidate. Unavailable
 * metrics count as no traffic.
 */
public class IdleLoadBalancerCheck implements LoadBalancerCheck {

    private final MetricsAggregator metrics;
    private final int windowDays;

    public IdleLoadBalancerCheck(MetricsAggregator metrics, int windowDays) {
        this.metrics = metrics;
        this.windowDays = windowDays;
    }

    @Override
    public String name() {
        return "idle_assets";
    }

    @Override
    public CheckResult run(AuditTarget target) {
        var lb = target.loadBalancer();
        var metricName = lb.kind().trafficMetric();
        var traffic = metrics.getMetric(lb, metricName, MetricStatistic.SUM, windowDays);
        if (traffic > 0) {
            return CheckResult.empty();
        }
        return CheckResult.of(List.of(new Issue(
            Severity.LOW,
            Category.COST,
            "idle_assets",
            "Load balancer " + lb.name() + " received no traffic in the last " + windowDays + " days",
            lb.arn(),
            Map.of("metric", metricName, "window_days", windowDays)
        )));
    }
}
