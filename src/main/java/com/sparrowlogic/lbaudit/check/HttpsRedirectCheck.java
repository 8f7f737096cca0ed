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
import software.amazon.awssdk.services.elasticloadbalancingv2.model.Rule;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public class HttpsRedirectCheck implements LoadBalancerCheck {

    private static final Logger logger = LoggerFactory.getLogger(HttpsRedirectCheck.class);

    private final ElasticLoadBalancingV2Client elb;

    public HttpsRedirectCheck(ElasticLoadBalancingV2Client elb) {
        this.elb = elb;
    }

    @Override
    public String name() {
        return "https_redirect";
    }

    @Override
    public CheckResult run(AuditTarget target) {
        var issues = new ArrayList<Issue>();
        for (var listener : target.listeners()) {
            if (!listener.isHttp()) {
                continue;
            }
            try {
                if (!redirectsToHttps(ElbQueries.rules(elb, listener.arn()))) {
                    issues.add(new Issue(
                        Severity.HIGH,
                        Category.SECURITY,
                        "no_https_redirect",
                        "HTTP listener on port " + listener.port() + " does not redirect to HTTPS",
                        listener.arn(),
                        Map.of("port", listener.port())
                    ));
                }
            } catch (SdkException e) {
                logger.warn("Could not read rules of listener {}: {}", listener.arn(), e.getMessage());
            }
        }
        return CheckResult.of(issues);
    }

    private static boolean redirectsToHttps(List<Rule> rules) {
        return rules.stream()
            .flatMap(rule -> rule.actions().stream())
            .anyMatch(HttpsRedirectCheck::isHttpsRedirect);
    }

    private static boolean isHttpsRedirect(Action action) {
        if (action.type() != ActionTypeEnum.REDIRECT) {
            return false;
        }
        // an unset protocol defaults to #{protocol}, which keeps HTTP
        var config = action.redirectConfig();
        return config != null && "HTTPS".equalsIgnoreCase(config.protocol());
    }
}
