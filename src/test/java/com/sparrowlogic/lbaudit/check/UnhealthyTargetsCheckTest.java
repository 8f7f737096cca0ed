package com.sparrowlogic.lbaudit.check;

import com.sparrowlogic.lbaudit.model.Severity;
import com.sparrowlogic.lbaudit.service.MetricsAggregator;
import org.junit.jupiter.api.Test;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.services.elasticloadbalancingv2.ElasticLoadBalancingV2Client;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.DescribeTargetHealthRequest;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.DescribeTargetHealthResponse;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.TargetHealth;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.TargetHealthDescription;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.TargetHealthStateEnum;

import static com.sparrowlogic.lbaudit.TestFixtures.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class UnhealthyTargetsCheckTest {

    private final ElasticLoadBalancingV2Client elb = mock(ElasticLoadBalancingV2Client.class);
    private final MetricsAggregator metrics = mock(MetricsAggregator.class);
    private final UnhealthyTargetsCheck check = new UnhealthyTargetsCheck(new TargetHealthLookup(elb), metrics, 7);

    private static TargetHealthDescription target(TargetHealthStateEnum state) {
        return TargetHealthDescription.builder().targetHealth(TargetHealth.builder().state(state).build()).build();
    }

    private void health(TargetHealthDescription... descriptions) {
        when(elb.describeTargetHealth(any(DescribeTargetHealthRequest.class)))
            .thenReturn(DescribeTargetHealthResponse.builder().targetHealthDescriptions(descriptions).build());
    }

    private void traffic(double requests) {
        when(metrics.getMetric(any(), anyString(), any(), anyInt())).thenReturn(requests);
    }

    @Test
    void shouldFlagTargetGroupWithManyUnhealthyTargets() {
        traffic(1000.0);
        health(target(TargetHealthStateEnum.HEALTHY), target(TargetHealthStateEnum.HEALTHY), target(TargetHealthStateEnum.UNHEALTHY));

        var issues = check.run(withTargetGroups(alb(), targetGroup("web-tg"))).issues();

        assertEquals(1, issues.size());
        assertEquals(Severity.HIGH, issues.get(0).severity());
        assertEquals("unhealthy_targets", issues.get(0).issueType());
    }

    @Test
    void shouldPassWhenAllTargetsHealthy() {
        traffic(1000.0);
        health(target(TargetHealthStateEnum.HEALTHY), target(TargetHealthStateEnum.HEALTHY));

        assertTrue(check.run(withTargetGroups(alb(), targetGroup("web-tg"))).issues().isEmpty());
    }

    @Test
    void shouldIgnoreUnhealthyTargetsWithoutTraffic() {
        traffic(0.0);

        assertTrue(check.run(withTargetGroups(alb(), targetGroup("web-tg"))).issues().isEmpty());
        verifyNoInteractions(elb);
    }

    @Test
    void shouldDegradeOnProviderError() {
        traffic(1000.0);
        when(elb.describeTargetHealth(any(DescribeTargetHealthRequest.class)))
            .thenThrow(AwsServiceException.builder().message("Access Denied").build());

        assertTrue(check.run(withTargetGroups(alb(), targetGroup("web-tg"))).issues().isEmpty());
    }
}
