package com.sparrowlogic.lbaudit.check;

import com.sparrowlogic.lbaudit.model.AuditTarget;
import com.sparrowlogic.lbaudit.model.Category;
import com.sparrowlogic.lbaudit.model.Issue;
import com.sparrowlogic.lbaudit.model.Severity;

import java.util.ArrayList;
import java.util.Map;

/**
 * Slow health checks delay detection of failed targets. Interval and timeout are judged
 * separately and each raises its own issue.
 */
public class HealthCheckConfigCheck implements LoadBalancerCheck {

    static final int MAX_INTERVAL_SECONDS = 30;
    static final int MAX_TIMEOUT_SECONDS = 10;

    @Override
    public String name() {
        return "health_check_config";
    }

    @Override
    public CheckResult run(AuditTarget target) {
        var issues = new ArrayList<Issue>();
        for (var targetGroup : target.targetGroups()) {
            var interval = targetGroup.healthCheckIntervalSeconds();
            if (interval != null && interval > MAX_INTERVAL_SECONDS) {
                issues.add(new Issue(
                    Severity.MEDIUM,
                    Category.PERFORMANCE,
                    "inefficient_health_checks",
                    "Health check interval of " + interval + "s exceeds " + MAX_INTERVAL_SECONDS + "s",
                    targetGroup.arn(),
                    Map.of("parameter", "interval", "value", interval, "recommended_max", MAX_INTERVAL_SECONDS)
                ));
            }
            var timeout = targetGroup.healthCheckTimeoutSeconds();
            if (timeout != null && timeout > MAX_TIMEOUT_SECONDS) {
                issues.add(new Issue(
                    Severity.MEDIUM,
                    Category.PERFORMANCE,
                    "inefficient_health_checks",
                    "Health check timeout of " + timeout + "s exceeds " + MAX_TIMEOUT_SECONDS + "s",
                    targetGroup.arn(),
                    Map.of("parameter", "timeout", "value", timeout, "recommended_max", MAX_TIMEOUT_SECONDS)
                ));
            }
        }
        return CheckResult.of(issues);
    }
}
