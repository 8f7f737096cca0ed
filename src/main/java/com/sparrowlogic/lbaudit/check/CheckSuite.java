package com.sparrowlogic.lbaudit.check;

import com.sparrowlogic.lbaudit.aws.AwsClients;
import com.sparrowlogic.lbaudit.service.MetricsAggregator;

import java.time.Clock;
import java.util.List;

/**
 * The fixed set of checks every load balancer goes through, in report order. Built once per
 * sweep, so lookups the checks remember last for that sweep only.
 */
public final class CheckSuite {

    private CheckSuite() {
    }

    public static List<LoadBalancerCheck> standard(AwsClients clients, MetricsAggregator metrics, Clock clock, int windowDays) {
        var targetHealth = new TargetHealthLookup(clients.elb());
        return List.of(
            // security
            new TlsPolicyCheck(),
            new HttpsRedirectCheck(clients.elb()),
            new WafAttachmentCheck(clients.waf()),
            new CertificateExpiryCheck(clients.acm(), clock),
            new DeletionProtectionCheck(clients.elb()),
            new SecurityGroupIngressCheck(clients.ec2()),
            // performance
            new UnhealthyTargetsCheck(targetHealth, metrics, windowDays),
            new ErrorRateCheck(metrics, windowDays),
            new HealthCheckConfigCheck(),
            new AvailabilityZoneCheck(),
            new CrossZoneCheck(clients.elb()),
            new SessionStickinessCheck(clients.elb()),
            // cost
            new IdleLoadBalancerCheck(metrics, windowDays),
            new UnusedTargetGroupCheck(targetHealth),
            // observability
            new AccessLoggingCheck(clients.elb()),
            new MonitoringAlarmsCheck(clients.cloudWatch()),
            // cost
            new MaintenanceRuleCheck(clients.elb()),
            new InefficientTargetTypeCheck(targetHealth, clients.ec2())
        );
    }
}
