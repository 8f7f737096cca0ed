package com.sparrowlogic.lbaudit.check;

import com.sparrowlogic.lbaudit.model.AuditTarget;
import com.sparrowlogic.lbaudit.model.Category;
import com.sparrowlogic.lbaudit.model.Issue;
import com.sparrowlogic.lbaudit.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.elasticloadbalancingv2.ElasticLoadBalancingV2Client;

import java.util.List;
import java.util.Map;

/**
 * Network load balancers without cross-zone balancing skew traffic toward zones with fewer targets.
 */
public class CrossZoneCheck implements LoadBalancerCheck {

    private static final Logger logger = LoggerFactory.getLogger(CrossZoneCheck.class);

    private final ElasticLoadBalancingV2Client elb;

    public CrossZoneCheck(ElasticLoadBalancingV2Client elb) {
        this.elb = elb;
    }

    @Override
    public String name() {
        return "nlb_cross_zone";
    }

    @Override
    public CheckResult run(AuditTarget target) {
        var lb = target.loadBalancer();
        if (!lb.isNetwork()) {
            return CheckResult.empty();
        }
        try {
            var attributes = ElbQueries.loadBalancerAttributes(elb, lb.arn());
            if (ElbQueries.isEnabled(attributes, ElbQueries.CROSS_ZONE)) {
                return CheckResult.empty();
            }
            return CheckResult.of(List.of(new Issue(
                Severity.MEDIUM,
                Category.PERFORMANCE,
                "nlb_skew",
                "Cross-zone load balancing is disabled on " + lb.name(),
                lb.arn(),
                Map.of("availability_zones", lb.availabilityZones())
            )));
        } catch (SdkException e) {
            logger.warn("Could not read attributes of {}: {}", lb.name(), e.getMessage());
            return CheckResult.empty();
        }
    }
}
