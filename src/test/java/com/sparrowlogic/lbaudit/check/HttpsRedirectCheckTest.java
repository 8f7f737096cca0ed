package com.sparrowlogic.lbaudit.check;

import com.sparrowlogic.lbaudit.model.Severity;
import org.junit.jupiter.api.Test;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.services.elasticloadbalancingv2.ElasticLoadBalancingV2Client;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.Action;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.ActionTypeEnum;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.DescribeRulesRequest;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.DescribeRulesResponse;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.RedirectActionConfig;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.Rule;

import static com.sparrowlogic.lbaudit.TestFixtures.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class HttpsRedirectCheckTest {

    private final ElasticLoadBalancingV2Client elb = mock(ElasticLoadBalancingV2Client.class);
    private final HttpsRedirectCheck check = new HttpsRedirectCheck(elb);

    private void rules(Action action) {
        when(elb.describeRules(any(DescribeRulesRequest.class)))
            .thenReturn(DescribeRulesResponse.builder().rules(Rule.builder().actions(action).build()).build());
    }

    @Test
    void shouldFlagHttpListenerWithoutRedirect() {
        rules(Action.builder().type(ActionTypeEnum.FORWARD).targetGroupArn("arn:aws:tg1").build());

        var issues = check.run(withListeners(alb(), http())).issues();

        assertEquals(1, issues.size());
        assertEquals(Severity.HIGH, issues.get(0).severity());
        assertEquals("no_https_redirect", issues.get(0).issueType());
    }

    @Test
    void shouldPassHttpListenerRedirectingToHttps() {
        rules(Action.builder()
            .type(ActionTypeEnum.REDIRECT)
            .redirectConfig(RedirectActionConfig.builder().protocol("HTTPS").port("443").statusCode("HTTP_301").build())
            .build());

        assertTrue(check.run(withListeners(alb(), http())).issues().isEmpty());
    }

    @Test
    void shouldFlagRedirectThatKeepsProtocol() {
        rules(Action.builder()
            .type(ActionTypeEnum.REDIRECT)
            .redirectConfig(RedirectActionConfig.builder().host("www.example.com").statusCode("HTTP_301").build())
            .build());

        assertEquals(1, check.run(withListeners(alb(), http())).issues().size());
    }

    @Test
    void shouldFlagRedirectToSameProtocolPlaceholder() {
        rules(Action.builder()
            .type(ActionTypeEnum.REDIRECT)
            .redirectConfig(RedirectActionConfig.builder().protocol("#{protocol}").statusCode("HTTP_302").build())
            .build());

        assertEquals(1, check.run(withListeners(alb(), http())).issues().size());
    }

    @Test
    void shouldReportNothingWhenRulesCannotBeRead() {
        when(elb.describeRules(any(DescribeRulesRequest.class)))
            .thenThrow(AwsServiceException.builder().message("Access Denied").build());

        assertTrue(check.run(withListeners(alb(), http())).issues().isEmpty());
    }

    @Test
    void shouldSkipHttpsListeners() {
        assertTrue(check.run(withListeners(alb(), https("ELBSecurityPolicy-TLS13-1-2-2021-06"))).issues().isEmpty());
        verifyNoInteractions(elb);
    }
}
