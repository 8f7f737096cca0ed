package com.sparrowlogic.lbaudit.model;

import java.util.List;

/**
 * A load balancer together with the listeners and target groups fetched for it.
 */
public record AuditTarget(LoadBalancer loadBalancer, List<Listener> listeners, List<TargetGroup> targetGroups) {
    public AuditTarget {
        listeners = List.copyOf(listeners);
        targetGroups = List.copyOf(targetGroups);
    }
}
