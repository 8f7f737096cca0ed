package com.sparrowlogic.lbaudit.check;

import com.sparrowlogic.lbaudit.model.Category;
import org.junit.jupiter.api.Test;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.services.elasticloadbalancingv2.ElasticLoadBalancingV2Client;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.Action;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.ActionTypeEnum;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.DescribeRulesRequest;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.DescribeRulesResponse;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.FixedResponseActionConfig;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.Rule;

import static com.sparrowlogic.lbaudit.TestFixtures.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class MaintenanceRuleCheckTest {

    private final ElasticLoadBalancingV2Client elb = mock(ElasticLoadBalancingV2Client.class);
    private final MaintenanceRuleCheck check = new MaintenanceRuleCheck(elb);

    private static Rule fixedResponse(String priority, String body) {
        return Rule.builder()
            .ruleArn("arn:aws:rule/" + priority)
            .priority(priority)
            .actions(Action.builder()
                .type(ActionTypeEnum.FIXED_RESPONSE)
                .fixedResponseConfig(FixedResponseActionConfig.builder().statusCode("503").messageBody(body).build())
                .build())
            .build();
    }

    private static Rule forward(String priority) {
        return Rule.builder()
            .ruleArn("arn:aws:rule/" + priority)
            .priority(priority)
            .actions(Action.builder().type(ActionTypeEnum.FORWARD).targetGroupArn("arn:aws:targetgroup/web-tg").build())
            .build();
    }

    @Test
    void shouldFlagMaintenancePageRule() {
        when(elb.describeRules(any(DescribeRulesRequest.class)))
            .thenReturn(DescribeRulesResponse.builder()
                .rules(forward("1"), fixedResponse("5", "Site is down for Maintenance"))
                .build());

        var issues = check.run(withListeners(alb(), http())).issues();

        assertEquals(1, issues.size());
        assertEquals(Category.COST, issues.get(0).category());
        assertEquals("maintenance_rules", issues.get(0).issueType());
        assertEquals("arn:aws:rule/5", issues.get(0).resourceId());
    }

    @Test
    void shouldIgnoreOtherFixedResponses() {
        when(elb.describeRules(any(DescribeRulesRequest.class)))
            .thenReturn(DescribeRulesResponse.builder()
                .rules(fixedResponse("2", "Not found"))
                .build());

        assertTrue(check.run(withListeners(alb(), http())).issues().isEmpty());
    }

    @Test
    void shouldSkipNetworkLoadBalancer() {
        assertTrue(check.run(withListeners(nlb(), http())).issues().isEmpty());
        verifyNoInteractions(elb);
    }

    @Test
    void shouldDegradeOnProviderError() {
        when(elb.describeRules(any(DescribeRulesRequest.class)))
            .thenThrow(AwsServiceException.builder().message("Access Denied").build());

        assertTrue(check.run(withListeners(alb(), http())).issues().isEmpty());
    }
}
