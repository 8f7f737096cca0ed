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

public class DeletionProtectionCheck implements LoadBalancerCheck {

    private static final Logger logger = LoggerFactory.getLogger(DeletionProtectionCheck.class);

    private final ElasticLoadBalancingV2Client elb;

    public DeletionProtectionCheck(ElasticLoadBalancingV2Client elb) {
        this.elb = elb;
    }

    @Override
    public String name() {
        return "deletion_protection";
    }

    @Override
    public CheckResult run(AuditTarget target) {
        var lb = target.loadBalancer();
        if (!"production".equalsIgnoreCase(lb.tag("Environment"))) {
            return CheckResult.empty();
        }
        try {
            var attributes = ElbQueries.loadBalancerAttributes(elb, lb.arn());
            if (ElbQueries.isEnabled(attributes, ElbQueries.DELETION_PROTECTION)) {
                return CheckResult.empty();
            }
            return CheckResult.of(List.of(new Issue(
                Severity.HIGH,
                Category.SECURITY,
                "no_deletion_protection",
                "Production load balancer " + lb.name() + " has deletion protection disabled",
                lb.arn(),
                Map.of("environment", "production")
            )));
        } catch (SdkException e) {
            logger.warn("Could not read attributes of {}: {}", lb.name(), e.getMessage());
            return CheckResult.empty();
        }
    }
}
