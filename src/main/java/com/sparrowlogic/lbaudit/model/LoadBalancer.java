package com.sparrowlogic.lbaudit.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Snapshot of one load balancer as returned by discovery. Security groups are only
 * populated for application load balancers.
 */
public record LoadBalancer(
    String arn,
    String name,
    LoadBalancerKind kind,
    Scheme scheme,
    List<String> availabilityZones,
    List<String> securityGroups,
    Map<String, String> tags,
    Instant createdTime
) {
    public LoadBalancer {
        availabilityZones = List.copyOf(availabilityZones);
        securityGroups = List.copyOf(securityGroups);
        tags = Map.copyOf(tags);
    }

    public boolean isApplication() {
        return kind == LoadBalancerKind.APPLICATION;
    }

    public boolean isNetwork() {
        return kind == LoadBalancerKind.NETWORK;
    }

    public String tag(String key) {
        return tags.get(key);
    }

    public LoadBalancer withTags(Map<String, String> newTags) {
        return new LoadBalancer(arn, name, kind, scheme, availabilityZones, securityGroups, newTags, createdTime);
    }

    /**
     * The {@code app/name/id} or {@code net/name/id} suffix CloudWatch uses as the
     * {@code LoadBalancer} dimension value.
     */
    public String metricDimension() {
        var marker = ":loadbalancer/";
        var index = arn.indexOf(marker);
        return index >= 0 ? arn.substring(index + marker.length()) : arn;
    }
}
