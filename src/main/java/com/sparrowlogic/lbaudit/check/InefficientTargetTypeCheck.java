package com.sparrowlogic.lbaudit.check;

import com.sparrowlogic.lbaudit.model.AuditTarget;
import com.sparrowlogic.lbaudit.model.Category;
import com.sparrowlogic.lbaudit.model.Issue;
import com.sparrowlogic.lbaudit.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.ec2.Ec2Client;
import software.amazon.awssdk.services.ec2.model.DescribeInstancesRequest;
import software.amazon.awssdk.services.ec2.model.Instance;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Instance-backed target groups that look like request handlers and run on burstable
 * micro or small instances are candidates for Lambda targets.
 */
public class InefficientTargetTypeCheck implements LoadBalancerCheck {

    private static final Logger logger = LoggerFactory.getLogger(InefficientTargetTypeCheck.class);

    static final Pattern SMALL_INSTANCE = Pattern.compile("^t\\d[a-z]*\\.(nano|micro|small)$");

    private final TargetHealthLookup targetHealth;
    private final Ec2Client ec2;
    private final Predicate<String> serverlessCandidate;

    public InefficientTargetTypeCheck(TargetHealthLookup targetHealth, Ec2Client ec2) {
        this(targetHealth, ec2, NameHeuristics.serverlessCandidate());
    }

    public InefficientTargetTypeCheck(TargetHealthLookup targetHealth, Ec2Client ec2, Predicate<String> serverlessCandidate) {
        this.targetHealth = targetHealth;
        this.ec2 = ec2;
        this.serverlessCandidate = serverlessCandidate;
    }

    @Override
    public String name() {
        return "inefficient_target_type";
    }

    @Override
    public CheckResult run(AuditTarget target) {
        var issues = new ArrayList<Issue>();
        for (var targetGroup : target.targetGroups()) {
            if (!targetGroup.isInstanceTarget() || !serverlessCandidate.test(targetGroup.name())) {
                continue;
            }
            try {
                var instanceIds = targetHealth.targetHealth(targetGroup.arn()).stream()
                    .filter(description -> description.target() != null && description.target().id() != null)
                    .map(description -> description.target().id())
                    .distinct()
                    .toList();
                if (instanceIds.isEmpty()) {
                    continue;
                }
                var instanceTypes = instanceTypes(instanceIds);
                if (!instanceTypes.isEmpty() && instanceTypes.stream().allMatch(type -> SMALL_INSTANCE.matcher(type).matches())) {
                    issues.add(new Issue(
                        Severity.LOW,
                        Category.COST,
                        "inefficient_target_type",
                        "Target group " + targetGroup.name() + " runs on small instances and may suit Lambda targets",
                        targetGroup.arn(),
                        Map.of("instance_types", instanceTypes.stream().distinct().toList(), "instance_count", instanceIds.size())
                    ));
                }
            } catch (SdkException e) {
                logger.warn("Could not inspect targets of {}: {}", targetGroup.arn(), e.getMessage());
            }
        }
        return CheckResult.of(issues);
    }

    private List<String> instanceTypes(List<String> instanceIds) {
        return ec2.describeInstances(DescribeInstancesRequest.builder().instanceIds(instanceIds).build())
            .reservations().stream()
            .flatMap(reservation -> reservation.instances().stream())
            .map(Instance::instanceTypeAsString)
            .filter(Objects::nonNull)
            .toList();
    }
}
