package com.sparrowlogic.lbaudit.service;

import com.sparrowlogic.lbaudit.model.AuditTarget;
import com.sparrowlogic.lbaudit.model.LoadBalancer;
import com.sparrowlogic.lbaudit.model.Listener;
import com.sparrowlogic.lbaudit.model.TargetGroup;
import software.amazon.awssdk.services.elasticloadbalancingv2.ElasticLoadBalancingV2Client;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.Certificate;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.DescribeListenersRequest;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.DescribeTargetGroupsRequest;

import java.util.ArrayList;
import java.util.List;

/**
 * Fetches the listeners and target groups of one load balancer. Errors propagate to the
 * caller, which skips the load balancer.
 */
public class TopologyFetcher {

    private final ElasticLoadBalancingV2Client elb;

    public TopologyFetcher(ElasticLoadBalancingV2Client elb) {
        this.elb = elb;
    }

    public AuditTarget fetch(LoadBalancer loadBalancer) {
        return new AuditTarget(loadBalancer, listeners(loadBalancer), targetGroups(loadBalancer));
    }

    private List<Listener> listeners(LoadBalancer loadBalancer) {
        var listeners = new ArrayList<Listener>();
        String marker = null;
        do {
            var response = elb.describeListeners(DescribeListenersRequest.builder()
                .loadBalancerArn(loadBalancer.arn())
                .marker(marker)
                .build());
            response.listeners().forEach(listener -> listeners.add(new Listener(
                listener.listenerArn(),
                listener.protocolAsString(),
                listener.port() != null ? listener.port() : 0,
                listener.sslPolicy(),
                listener.certificates().stream().map(Certificate::certificateArn).toList(),
                loadBalancer.arn()
            )));
            marker = response.nextMarker();
        } while (marker != null && !marker.isEmpty());
        return listeners;
    }

    private List<TargetGroup> targetGroups(LoadBalancer loadBalancer) {
        var targetGroups = new ArrayList<TargetGroup>();
        String marker = null;
        do {
            var response = elb.describeTargetGroups(DescribeTargetGroupsRequest.builder()
                .loadBalancerArn(loadBalancer.arn())
                .marker(marker)
                .build());
            response.targetGroups().forEach(tg -> targetGroups.add(new TargetGroup(
                tg.targetGroupArn(),
                tg.targetGroupName(),
                tg.targetTypeAsString(),
                tg.healthCheckIntervalSeconds(),
                tg.healthCheckTimeoutSeconds(),
                loadBalancer.arn()
            )));
            marker = response.nextMarker();
        } while (marker != null && !marker.isEmpty());
        return targetGroups;
    }
}
