package com.sparrowlogic.lbaudit.check;

import com.sparrowlogic.lbaudit.model.AuditTarget;
import com.sparrowlogic.lbaudit.model.Category;
import com.sparrowlogic.lbaudit.model.Issue;
import com.sparrowlogic.lbaudit.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.elasticloadbalancingv2.ElasticLoadBalancingV2Client;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.Action;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.ActionTypeEnum;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Fixed-response rules serving a maintenance page keep the load balancer billed while
 * serving no real traffic.
 */
public class MaintenanceRuleCheck implements LoadBalancerCheck {

    private static final Logger logger = LoggerFactory.getLogger(MaintenanceRuleCheck.class);

    static final List<String> MAINTENANCE_KEYWORDS = List.of("maintenance", "temporarily unavailable", "under construction", "coming soon");

    private final ElasticLoadBalancingV2Client elb;

    public MaintenanceRuleCheck(ElasticLoadBalancingV2Client elb) {
        this.elb = elb;
    }

    @Override
    public String name() {
        return "maintenance_rules";
    }

    @Override
    public CheckResult run(AuditTarget target) {
        if (!target.loadBalancer().isApplication()) {
            return CheckResult.empty();
        }
        var issues = new ArrayList<Issue>();
        for (var listener : target.listeners()) {
            try {
                for (var rule : ElbQueries.rules(elb, listener.arn())) {
                    if (rule.actions().stream().anyMatch(MaintenanceRuleCheck::servesMaintenancePage)) {
                        var ruleId = rule.ruleArn() != null ? rule.ruleArn() : listener.arn();
                        issues.add(new Issue(
                            Severity.LOW,
                            Category.COST,
                            "maintenance_rules",
                            "Listener rule " + (rule.priority() != null ? rule.priority() : "?") + " serves a maintenance page",
                            ruleId,
                            Map.of("listener_arn", listener.arn(), "priority", rule.priority() != null ? rule.priority() : "")
                        ));
                    }
                }
            } catch (SdkException e) {
                logger.warn("Could not read rules of listener {}: {}", listener.arn(), e.getMessage());
            }
        }
        return CheckResult.of(issues);
    }

    private static boolean servesMaintenancePage(Action action) {
        if (action.type() != ActionTypeEnum.FIXED_RESPONSE || action.fixedResponseConfig() == null) {
            return false;
        }
        var body = action.fixedResponseConfig().messageBody();
        if (body == null) {
            return false;
        }
        var lower = body.toLowerCase(Locale.ROOT);
        return MAINTENANCE_KEYWORDS.stream().anyMatch(lower::contains);
    }
}
