package com.sparrowlogic.lbaudit.check;

import software.amazon.awssdk.services.elasticloadbalancingv2.ElasticLoadBalancingV2Client;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.DescribeLoadBalancerAttributesRequest;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.DescribeRulesRequest;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.DescribeTargetGroupAttributesRequest;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.DescribeTargetHealthRequest;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.LoadBalancerAttribute;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.Rule;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.TargetGroupAttribute;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.TargetHealthDescription;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.TargetHealthStateEnum;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * ELBv2 lookups shared by several checks. Provider exceptions propagate.
 */
final class ElbQueries {

    static final String DELETION_PROTECTION = "deletion_protection.enabled";
    static final String CROSS_ZONE = "load_balancing.cross_zone.enabled";
    static final String ACCESS_LOGS = "access_logs.s3.enabled";
    static final String STICKINESS = "stickiness.enabled";

    private ElbQueries() {
    }

    static Map<String, String> loadBalancerAttributes(ElasticLoadBalancingV2Client elb, String loadBalancerArn) {
        return elb.describeLoadBalancerAttributes(DescribeLoadBalancerAttributesRequest.builder()
                .loadBalancerArn(loadBalancerArn)
                .build())
            .attributes().stream()
            .filter(attribute -> attribute.value() != null)
            .collect(Collectors.toMap(LoadBalancerAttribute::key, LoadBalancerAttribute::value, (first, second) -> second));
    }

    static Map<String, String> targetGroupAttributes(ElasticLoadBalancingV2Client elb, String targetGroupArn) {
        return elb.describeTargetGroupAttributes(DescribeTargetGroupAttributesRequest.builder()
                .targetGroupArn(targetGroupArn)
                .build())
            .attributes().stream()
            .filter(attribute -> attribute.value() != null)
            .collect(Collectors.toMap(TargetGroupAttribute::key, TargetGroupAttribute::value, (first, second) -> second));
    }

    static boolean isEnabled(Map<String, String> attributes, String key) {
        return "true".equalsIgnoreCase(attributes.get(key));
    }

    static List<TargetHealthDescription> targetHealth(ElasticLoadBalancingV2Client elb, String targetGroupArn) {
        return elb.describeTargetHealth(DescribeTargetHealthRequest.builder()
                .targetGroupArn(targetGroupArn)
                .build())
            .targetHealthDescriptions();
    }

    static boolean isUnhealthy(TargetHealthDescription description) {
        return description.targetHealth() != null
            && description.targetHealth().state() == TargetHealthStateEnum.UNHEALTHY;
    }

    static List<Rule> rules(ElasticLoadBalancingV2Client elb, String listenerArn) {
        var rules = new ArrayList<Rule>();
        String marker = null;
        do {
            var response = elb.describeRules(DescribeRulesRequest.builder()
                .listenerArn(listenerArn)
                .marker(marker)
                .build());
            rules.addAll(response.rules());
            marker = response.nextMarker();
        } while (marker != null && !marker.isEmpty());
        return rules;
    }
}
