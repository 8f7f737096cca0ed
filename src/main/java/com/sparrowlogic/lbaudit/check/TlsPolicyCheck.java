package com.sparrowlogic.lbaudit.check;

import com.sparrowlogic.lbaudit.model.AuditTarget;
import com.sparrowlogic.lbaudit.model.Category;
import com.sparrowlogic.lbaudit.model.Issue;
import com.sparrowlogic.lbaudit.model.Severity;

import java.util.ArrayList;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Flags HTTPS listeners negotiating with a policy from 2016 or earlier, or one that still
 * allows TLS 1.0/1.1.
 */
public class TlsPolicyCheck implements LoadBalancerCheck {

    static final Pattern DEPRECATED_POLICY = Pattern.compile("(20(0\\d|1[0-6])-\\d{2})|(TLS-1-[01]-)");

    @Override
    public String name() {
        return "tls_policy";
    }

    @Override
    public CheckResult run(AuditTarget target) {
        var issues = new ArrayList<Issue>();
        for (var listener : target.listeners()) {
            if (!listener.isHttps() || listener.sslPolicy() == null) {
                continue;
            }
            if (isDeprecated(listener.sslPolicy())) {
                issues.add(new Issue(
                    Severity.CRITICAL,
                    Category.SECURITY,
                    "weak_tls_policy",
                    "Listener on port " + listener.port() + " uses deprecated TLS policy " + listener.sslPolicy(),
                    listener.arn(),
                    Map.of("port", listener.port(), "ssl_policy", listener.sslPolicy())
                ));
            }
        }
        return CheckResult.of(issues);
    }

    static boolean isDeprecated(String policy) {
        return DEPRECATED_POLICY.matcher(policy).find();
    }
}
