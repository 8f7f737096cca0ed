package com.sparrowlogic.lbaudit.check;

import com.sparrowlogic.lbaudit.model.AuditTarget;
import com.sparrowlogic.lbaudit.model.Category;
import com.sparrowlogic.lbaudit.model.Issue;
import com.sparrowlogic.lbaudit.model.SecurityGroupRule;
import com.sparrowlogic.lbaudit.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.ec2.Ec2Client;
import software.amazon.awssdk.services.ec2.model.DescribeSecurityGroupsRequest;
import software.amazon.awssdk.services.ec2.model.SecurityGroup;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Application load balancers should only be reachable from anywhere on 80 and 443.
 */
public class SecurityGroupIngressCheck implements LoadBalancerCheck {

    private static final Logger logger = LoggerFactory.getLogger(SecurityGroupIngressCheck.class);

    private final Ec2Client ec2;

    public SecurityGroupIngressCheck(Ec2Client ec2) {
        this.ec2 = ec2;
    }

    @Override
    public String name() {
        return "security_group_ingress";
    }

    @Override
    public CheckResult run(AuditTarget target) {
        var lb = target.loadBalancer();
        if (!lb.isApplication() || lb.securityGroups().isEmpty()) {
            return CheckResult.empty();
        }
        try {
            var groups = ec2.describeSecurityGroups(DescribeSecurityGroupsRequest.builder()
                    .groupIds(lb.securityGroups())
                    .build())
                .securityGroups();

            var issues = new ArrayList<Issue>();
            for (var group : groups) {
                var broadRules = ingressRules(group).stream()
                    .filter(SecurityGroupRule::isOpenToWorld)
                    .filter(rule -> !rule.coversOnlyWebPorts())
                    .toList();
                if (broadRules.isEmpty()) {
                    continue;
                }
                var ports = broadRules.stream()
                    .map(SecurityGroupRule::portRange)
                    .distinct()
                    .toList();
                issues.add(new Issue(
                    Severity.MEDIUM,
                    Category.SECURITY,
                    "overly_broad_ingress",
                    "Security group " + group.groupId() + " allows ingress from anywhere on ports " + String.join(", ", ports),
                    group.groupId(),
                    Map.of("security_group_id", group.groupId(), "open_ports", ports)
                ));
            }
            return CheckResult.of(issues);
        } catch (SdkException e) {
            logger.warn("Could not describe security groups of {}: {}", lb.name(), e.getMessage());
            return CheckResult.empty();
        }
    }

    private static List<SecurityGroupRule> ingressRules(SecurityGroup group) {
        var rules = new ArrayList<SecurityGroupRule>();
        group.ipPermissions().forEach(permission -> {
            var fromPort = permission.fromPort() != null ? permission.fromPort() : -1;
            var toPort = permission.toPort() != null ? permission.toPort() : -1;
            permission.ipRanges().forEach(range ->
                rules.add(new SecurityGroupRule(group.groupId(), permission.ipProtocol(), fromPort, toPort, range.cidrIp())));
            permission.ipv6Ranges().forEach(range ->
                rules.add(new SecurityGroupRule(group.groupId(), permission.ipProtocol(), fromPort, toPort, range.cidrIpv6())));
        });
        return rules;
    }
}
