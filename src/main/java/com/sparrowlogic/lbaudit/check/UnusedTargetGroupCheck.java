package com.sparrowlogic.lbaudit.check;

import com.sparrowlogic.lbaudit.model.AuditTarget;
import com.sparrowlogic.lbaudit.model.Category;
import com.sparrowlogic.lbaudit.model.Issue;
import com.sparrowlogic.lbaudit.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;

import java.util.ArrayList;
import java.util.Map;

public class UnusedTargetGroupCheck implements LoadBalancerCheck {

    private static final Logger logger = LoggerFactory.getLogger(UnusedTargetGroupCheck.class);

    private final TargetHealthLookup targetHealth;

    public UnusedTargetGroupCheck(TargetHealthLookup targetHealth) {
        this.targetHealth = targetHealth;
    }

    @Override
    public String name() {
        return "unused_target_groups";
    }

    @Override
    public CheckResult run(AuditTarget target) {
        var issues = new ArrayList<Issue>();
        for (var targetGroup : target.targetGroups()) {
            try {
                var health = targetHealth.targetHealth(targetGroup.arn());
                String reason = null;
                if (health.isEmpty()) {
                    reason = "has no registered targets";
                } else if (health.stream().allMatch(ElbQueries::isUnhealthy)) {
                    reason = "has only unhealthy targets";
                }
                if (reason != null) {
                    issues.add(new Issue(
                        Severity.LOW,
                        Category.COST,
                        "unused_target_groups",
                        "Target group " + targetGroup.name() + " " + reason,
                        targetGroup.arn(),
                        Map.of("registered_targets", health.size())
                    ));
                }
            } catch (SdkException e) {
                logger.warn("Could not read target health of {}: {}", targetGroup.arn(), e.getMessage());
            }
        }
        return CheckResult.of(issues);
    }
}
