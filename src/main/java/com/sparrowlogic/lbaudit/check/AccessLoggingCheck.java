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

public class AccessLoggingCheck implements LoadBalancerCheck {

    private static final Logger logger = LoggerFactory.getLogger(AccessLoggingCheck.class);

    private final ElasticLoadBalancingV2Client elb;

    public AccessLoggingCheck(ElasticLoadBalancingV2Client elb) {
        this.elb = elb;
    }

    @Override
    public String name() {
        return "access_logging";
    }

    @Override
    public CheckResult run(AuditTarget target) {
        var lb = target.loadBalancer();
        try {
            var attributes = ElbQueries.loadBalancerAttributes(elb, lb.arn());
            if (ElbQueries.isEnabled(attributes, ElbQueries.ACCESS_LOGS)) {
                return CheckResult.empty();
            }
            return CheckResult.of(List.of(new Issue(
                Severity.MEDIUM,
                Category.OBSERVABILITY,
                "missing_observability",
                "Access logging is disabled on " + lb.name(),
                lb.arn(),
                Map.of("attribute", ElbQueries.ACCESS_LOGS)
            )));
        } catch (SdkException e) {
            logger.warn("Could not read attributes of {}: {}", lb.name(), e.getMessage());
            return CheckResult.empty();
        }
    }
}
