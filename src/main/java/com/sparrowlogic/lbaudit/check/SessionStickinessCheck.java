package com.sparrowlogic.lbaudit.check;

import com.sparrowlogic.lbaudit.model.AuditTarget;
import com.sparrowlogic.lbaudit.model.Category;
import com.sparrowlogic.lbaudit.model.Issue;
import com.sparrowlogic.lbaudit.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.elasticloadbalancingv2.ElasticLoadBalancingV2Client;

import java.util.ArrayList;
import java.util.Map;
import java.util.function.Predicate;

public class SessionStickinessCheck implements LoadBalancerCheck {

    private static final Logger logger = LoggerFactory.getLogger(SessionStickinessCheck.class);

    private final ElasticLoadBalancingV2Client elb;
    private final Predicate<String> statefulWorkload;

    public SessionStickinessCheck(ElasticLoadBalancingV2Client elb) {
        this(elb, NameHeuristics.statefulWorkload());
    }

    public SessionStickinessCheck(ElasticLoadBalancingV2Client elb, Predicate<String> statefulWorkload) {
        this.elb = elb;
        this.statefulWorkload = statefulWorkload;
    }

    @Override
    public String name() {
        return "session_stickiness";
    }

    @Override
    public CheckResult run(AuditTarget target) {
        if (!target.loadBalancer().isApplication()) {
            return CheckResult.empty();
        }
        var issues = new ArrayList<Issue>();
        for (var targetGroup : target.targetGroups()) {
            if ("lambda".equals(targetGroup.targetType()) || !statefulWorkload.test(targetGroup.name())) {
                continue;
            }
            try {
                var attributes = ElbQueries.targetGroupAttributes(elb, targetGroup.arn());
                if (!ElbQueries.isEnabled(attributes, ElbQueries.STICKINESS)) {
                    issues.add(new Issue(
                        Severity.MEDIUM,
                        Category.PERFORMANCE,
                        "stateful_session_issues",
                        "Target group " + targetGroup.name() + " looks stateful but has stickiness disabled",
                        targetGroup.arn(),
                        Map.of("target_group", targetGroup.name())
                    ));
                }
            } catch (SdkException e) {
                logger.warn("Could not read attributes of target group {}: {}", targetGroup.arn(), e.getMessage());
            }
        }
        return CheckResult.of(issues);
    }
}
