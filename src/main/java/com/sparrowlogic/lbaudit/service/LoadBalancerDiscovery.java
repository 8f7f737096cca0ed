package com.sparrowlogic.lbaudit.service;

import com.sparrowlogic.lbaudit.config.AuditProperties;
import com.sparrowlogic.lbaudit.model.LoadBalancer;
import com.sparrowlogic.lbaudit.model.LoadBalancerKind;
import com.sparrowlogic.lbaudit.model.Scheme;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.elasticloadbalancingv2.ElasticLoadBalancingV2Client;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.AvailabilityZone;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.DescribeLoadBalancersRequest;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.DescribeTagsRequest;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.Tag;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Lists the load balancers of a region and keeps the ones that qualify for an audit.
 */
public class LoadBalancerDiscovery {

    private static final Logger logger = LoggerFactory.getLogger(LoadBalancerDiscovery.class);

    static final String EXCLUDE_TAG = "ExcludeFromAnalysis";
    static final List<String> EXCLUDED_NAME_PREFIXES = List.of("test-", "dev-");

    private final ElasticLoadBalancingV2Client elb;
    private final AuditProperties properties;
    private final Clock clock;

    public LoadBalancerDiscovery(ElasticLoadBalancingV2Client elb, AuditProperties properties, Clock clock) {
        this.elb = elb;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Listing failures are not caught; without the list there is nothing to audit.
     */
    public List<LoadBalancer> discover() {
        var qualifying = new ArrayList<LoadBalancer>();
        String marker = null;
        do {
            var response = elb.describeLoadBalancers(DescribeLoadBalancersRequest.builder().marker(marker).build());
            for (var lb : response.loadBalancers()) {
                if (!isSupportedType(lb.typeAsString())) {
                    logger.debug("Skipping load balancer {} of type {}", lb.loadBalancerName(), lb.typeAsString());
                    continue;
                }
                var loadBalancer = toLoadBalancer(lb).withTags(fetchTags(lb.loadBalancerArn()));
                if (!shouldAnalyze(loadBalancer.name(), loadBalancer.tags())) {
                    continue;
                }
                if (!isOldEnough(loadBalancer)) {
                    logger.debug("Skipping load balancer {}: younger than {} days", loadBalancer.name(), properties.minAgeDays());
                    continue;
                }
                qualifying.add(loadBalancer);
            }
            marker = response.nextMarker();
        } while (marker != null && !marker.isEmpty());

        logger.info("Discovered {} load balancers to audit", qualifying.size());
        return qualifying;
    }

    public boolean shouldAnalyze(String name, Map<String, String> tags) {
        if ("true".equalsIgnoreCase(tags.get(EXCLUDE_TAG))) {
            return false;
        }
        if (!properties.skipNameFilter()) {
            return EXCLUDED_NAME_PREFIXES.stream().noneMatch(name::startsWith);
        }
        return true;
    }

    private boolean isOldEnough(LoadBalancer loadBalancer) {
        if (properties.skipAgeFilter() || loadBalancer.createdTime() == null) {
            return true;
        }
        var age = Duration.between(loadBalancer.createdTime(), clock.instant());
        return age.compareTo(Duration.ofDays(properties.minAgeDays())) >= 0;
    }

    private Map<String, String> fetchTags(String arn) {
        try {
            return elb.describeTags(DescribeTagsRequest.builder().resourceArns(arn).build())
                .tagDescriptions().stream()
                .flatMap(description -> description.tags().stream())
                .collect(Collectors.toMap(Tag::key, tag -> tag.value() != null ? tag.value() : "", (first, second) -> second));
        } catch (SdkException e) {
            logger.warn("Could not fetch tags for {}: {}", arn, e.getMessage());
            return Map.of();
        }
    }

    private static boolean isSupportedType(String type) {
        return LoadBalancerKind.APPLICATION.value().equals(type) || LoadBalancerKind.NETWORK.value().equals(type);
    }

    private static LoadBalancer toLoadBalancer(software.amazon.awssdk.services.elasticloadbalancingv2.model.LoadBalancer lb) {
        return new LoadBalancer(
            lb.loadBalancerArn(),
            lb.loadBalancerName(),
            LoadBalancerKind.fromValue(lb.typeAsString()),
            Scheme.fromValue(lb.schemeAsString()),
            lb.availabilityZones().stream().map(AvailabilityZone::zoneName).toList(),
            lb.securityGroups(),
            Map.of(),
            lb.createdTime()
        );
    }
}
