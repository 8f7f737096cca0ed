package com.sparrowlogic.lbaudit.check;

import com.sparrowlogic.lbaudit.model.AuditTarget;
import com.sparrowlogic.lbaudit.model.Category;
import com.sparrowlogic.lbaudit.model.Issue;
import com.sparrowlogic.lbaudit.model.Severity;
import com.sparrowlogic.lbaudit.service.MetricStatistic;
import com.sparrowlogic.lbaudit.service.MetricsAggregator;

import java.util.List;
import java.util.Map;

public class ErrorRateCheck implements LoadBalancerCheck {

    static final double MAX_ERROR_RATE = 0.01;

    private final MetricsAggregator metrics;
    private final int windowDays;

    public ErrorRateCheck(MetricsAggregator metrics, int windowDays) {
        this.metrics = metrics;
        this.windowDays = windowDays;
    }

    @Override
    public String name() {
        return "error_rate";
    }

    @Override
    public CheckResult run(AuditTarget target) {
        var lb = target.loadBalancer();
        if (!lb.isApplication()) {
            return CheckResult.empty();
        }
        var errors = metrics.getMetric(lb, "HTTPCode_Target_5XX_Count", MetricStatistic.SUM, windowDays);
        var requests = metrics.getMetric(lb, "RequestCount", MetricStatistic.SUM, windowDays);
        if (requests <= 0) {
            return CheckResult.empty();
        }
        var rate = errors / requests;
        if (rate <= MAX_ERROR_RATE) {
            return CheckResult.empty();
        }
        var percentage = Math.round(rate * 10000.0) / 100.0;
        return CheckResult.of(List.of(new Issue(
            Severity.HIGH,
            Category.PERFORMANCE,
            "high_5xx_rate",
            "5XX error rate of " + percentage + "% over the last " + windowDays + " days",
            lb.arn(),
            Map.of("error_count", errors, "request_count", requests, "error_rate_percentage", percentage)
        )));
    }
}
