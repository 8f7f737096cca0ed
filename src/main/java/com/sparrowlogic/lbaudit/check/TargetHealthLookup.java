package com.sparrowlogic.lbaudit.check;

import software.amazon.awssdk.services.elasticloadbalancingv2.ElasticLoadBalancingV2Client;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.TargetHealthDescription;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Target health per target group, read once per sweep and shared by the checks that need it.
 * Provider exceptions propagate and nothing is remembered for the failed target group.
 */
public class TargetHealthLookup {

    private final ElasticLoadBalancingV2Client elb;
    private final Map<String, List<TargetHealthDescription>> byTargetGroup = new ConcurrentHashMap<>();

    public TargetHealthLookup(ElasticLoadBalancingV2Client elb) {
        this.elb = elb;
    }

    public List<TargetHealthDescription> targetHealth(String targetGroupArn) {
        var cached = byTargetGroup.get(targetGroupArn);
        if (cached != null) {
            return cached;
        }
        var health = ElbQueries.targetHealth(elb, targetGroupArn);
        byTargetGroup.put(targetGroupArn, health);
        return health;
    }
}
