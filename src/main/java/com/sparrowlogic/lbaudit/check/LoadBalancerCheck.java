package com.sparrowlogic.lbaudit.check;

import com.sparrowlogic.lbaudit.model.AuditTarget;

/**
 * One independent audit rule. Implementations read provider data and never modify it.
 *
 * <p>A check returns an empty result when it does not apply to the load balancer's kind,
 * scheme or listeners. Provider errors are logged and degrade to whatever the check found
 * before the failure.
 */
public interface LoadBalancerCheck {

    String name();

    CheckResult run(AuditTarget target);
}
