package com.sparrowlogic.lbaudit.check;

import com.sparrowlogic.lbaudit.model.AuditTarget;
import com.sparrowlogic.lbaudit.model.Category;
import com.sparrowlogic.lbaudit.model.Issue;
import com.sparrowlogic.lbaudit.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.cloudwatch.CloudWatchClient;
import software.amazon.awssdk.services.cloudwatch.model.DescribeAlarmsRequest;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Every load balancer should carry alarms on its error and health metrics. An alarm counts
 * when it watches the required metric with this load balancer as its {@code LoadBalancer}
 * dimension.
 *
 * <p>The account's alarms are listed once per check instance and indexed by load balancer.
 * A failed listing is not remembered; the next load balancer tries again.
 */
public class MonitoringAlarmsCheck implements LoadBalancerCheck {

    private static final Logger logger = LoggerFactory.getLogger(MonitoringAlarmsCheck.class);

    static final List<String> APPLICATION_ALARMS = List.of("HTTPCode_Target_5XX_Count", "UnHealthyHostCount", "TargetResponseTime");
    static final List<String> NETWORK_ALARMS = List.of("UnHealthyHostCount", "TCP_Target_Reset_Count");

    private final CloudWatchClient cloudWatch;
    private volatile Map<String, Set<String>> alarmedMetricsByLoadBalancer;

    public MonitoringAlarmsCheck(CloudWatchClient cloudWatch) {
        this.cloudWatch = cloudWatch;
    }

    @Override
    public String name() {
        return "monitoring_alarms";
    }

    @Override
    public CheckResult run(AuditTarget target) {
        var lb = target.loadBalancer();
        try {
            var covered = alarmIndex().getOrDefault(lb.metricDimension(), Set.of());
            var required = lb.isApplication() ? APPLICATION_ALARMS : NETWORK_ALARMS;
            var missing = required.stream().filter(metric -> !covered.contains(metric)).toList();
            if (missing.isEmpty()) {
                return CheckResult.empty();
            }
            return CheckResult.of(List.of(new Issue(
                Severity.MEDIUM,
                Category.OBSERVABILITY,
                "no_monitoring_alarms",
                "Load balancer " + lb.name() + " is missing alarms for " + String.join(", ", missing),
                lb.arn(),
                Map.of("missing_alarms", missing)
            )));
        } catch (SdkException e) {
            logger.warn("Could not describe alarms for {}: {}", lb.name(), e.getMessage());
            return CheckResult.empty();
        }
    }

    private Map<String, Set<String>> alarmIndex() {
        var index = alarmedMetricsByLoadBalancer;
        if (index == null) {
            synchronized (this) {
                index = alarmedMetricsByLoadBalancer;
                if (index == null) {
                    index = listAlarms();
                    alarmedMetricsByLoadBalancer = index;
                }
            }
        }
        return index;
    }

    private Map<String, Set<String>> listAlarms() {
        var index = new HashMap<String, Set<String>>();
        String nextToken = null;
        do {
            var response = cloudWatch.describeAlarms(DescribeAlarmsRequest.builder().nextToken(nextToken).build());
            for (var alarm : response.metricAlarms()) {
                if (alarm.metricName() == null) {
                    continue;
                }
                alarm.dimensions().stream()
                    .filter(dimension -> "LoadBalancer".equals(dimension.name()) && dimension.value() != null)
                    .forEach(dimension -> index.computeIfAbsent(dimension.value(), key -> new HashSet<>()).add(alarm.metricName()));
            }
            nextToken = response.nextToken();
        } while (nextToken != null && !nextToken.isEmpty());
        return index;
    }
}
