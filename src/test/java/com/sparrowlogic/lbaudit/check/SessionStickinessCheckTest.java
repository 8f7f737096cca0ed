package com.sparrowlogic.lbaudit.check;

import com.sparrowlogic.lbaudit.model.Severity;
import org.junit.jupiter.api.Test;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.services.elasticloadbalancingv2.ElasticLoadBalancingV2Client;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.DescribeTargetGroupAttributesRequest;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.DescribeTargetGroupAttributesResponse;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.TargetGroupAttribute;

import static com.sparrowlogic.lbaudit.TestFixtures.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class SessionStickinessCheckTest {

    private final ElasticLoadBalancingV2Client elb = mock(ElasticLoadBalancingV2Client.class);

    private void stickiness(String value) {
        when(elb.describeTargetGroupAttributes(any(DescribeTargetGroupAttributesRequest.class)))
            .thenReturn(DescribeTargetGroupAttributesResponse.builder()
                .attributes(TargetGroupAttribute.builder().key("stickiness.enabled").value(value).build())
                .build());
    }

    @Test
    void shouldFlagStatefulTargetGroupWithoutStickiness() {
        stickiness("false");

        var issues = new SessionStickinessCheck(elb).run(withTargetGroups(alb(), targetGroup("user-session-tg"))).issues();

        assertEquals(1, issues.size());
        assertEquals(Severity.MEDIUM, issues.get(0).severity());
        assertEquals("stateful_session_issues", issues.get(0).issueType());
    }

    @Test
    void shouldPassStatefulTargetGroupWithStickiness() {
        stickiness("true");

        assertTrue(new SessionStickinessCheck(elb).run(withTargetGroups(alb(), targetGroup("user-session-tg"))).issues().isEmpty());
    }

    @Test
    void shouldIgnoreStatelessLookingTargetGroup() {
        assertTrue(new SessionStickinessCheck(elb).run(withTargetGroups(alb(), targetGroup("static-assets-tg"))).issues().isEmpty());
        verifyNoInteractions(elb);
    }

    @Test
    void shouldUseSuppliedHeuristic() {
        stickiness("false");
        var check = new SessionStickinessCheck(elb, name -> name.endsWith("-stateful"));

        assertEquals(1, check.run(withTargetGroups(alb(), targetGroup("orders-stateful"))).issues().size());
        assertTrue(check.run(withTargetGroups(alb(), targetGroup("user-session-tg"))).issues().isEmpty());
    }

    @Test
    void shouldSkipNetworkLoadBalancer() {
        assertTrue(new SessionStickinessCheck(elb).run(withTargetGroups(nlb(), targetGroup("user-session-tg"))).issues().isEmpty());
        verifyNoInteractions(elb);
    }

    @Test
    void shouldDegradeOnProviderError() {
        when(elb.describeTargetGroupAttributes(any(DescribeTargetGroupAttributesRequest.class)))
            .thenThrow(AwsServiceException.builder().message("Access Denied").build());

        assertTrue(new SessionStickinessCheck(elb).run(withTargetGroups(alb(), targetGroup("user-session-tg"))).issues().isEmpty());
    }
}
