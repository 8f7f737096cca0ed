package com.sparrowlogic.lbaudit.aws;

import software.amazon.awssdk.services.acm.AcmClient;
import software.amazon.awssdk.services.cloudwatch.CloudWatchClient;
import software.amazon.awssdk.services.ec2.Ec2Client;
import software.amazon.awssdk.services.elasticloadbalancingv2.ElasticLoadBalancingV2Client;
import software.amazon.awssdk.services.wafv2.Wafv2Client;

/**
 * The provider clients one audit run talks to, all bound to the same credentials and region.
 */
public record AwsClients(
    ElasticLoadBalancingV2Client elb,
    Ec2Client ec2,
    CloudWatchClient cloudWatch,
    Wafv2Client waf,
    AcmClient acm
) implements AutoCloseable {

    @Override
    public void close() {
        elb.close();
        ec2.close();
        cloudWatch.close();
        waf.close();
        acm.close();
    }
}
