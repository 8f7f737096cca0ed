package com.sparrowlogic.lbaudit.check;

import com.sparrowlogic.lbaudit.aws.AwsClients;
import com.sparrowlogic.lbaudit.service.MetricsAggregator;
import org.junit.jupiter.api.Test;
import software.amazon.awssdk.services.acm.AcmClient;
import software.amazon.awssdk.services.cloudwatch.CloudWatchClient;
import software.amazon.awssdk.services.ec2.Ec2Client;
import software.amazon.awssdk.services.elasticloadbalancingv2.ElasticLoadBalancingV2Client;
import software.amazon.awssdk.services.wafv2.Wafv2Client;

import java.time.Clock;
import java.util.HashSet;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class CheckSuiteTest {

    @Test
    void shouldRegisterEighteenDistinctChecks() {
        var clients = new AwsClients(mock(ElasticLoadBalancingV2Client.class), mock(Ec2Client.class),
            mock(CloudWatchClient.class), mock(Wafv2Client.class), mock(AcmClient.class));

        var checks = CheckSuite.standard(clients, mock(MetricsAggregator.class), Clock.systemUTC(), 7);

        assertEquals(18, checks.size());
        var names = new HashSet<String>();
        checks.forEach(check -> assertTrue(names.add(check.name()), "duplicate check " + check.name()));
        assertInstanceOf(TlsPolicyCheck.class, checks.get(0));
        assertInstanceOf(InefficientTargetTypeCheck.class, checks.get(17));
    }
}
