package com.sparrowlogic.lbaudit.aws;

import org.springframework.stereotype.Component;
import software.amazon.awssdk.auth.credentials.ProfileCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.acm.AcmClient;
import software.amazon.awssdk.services.cloudwatch.CloudWatchClient;
import software.amazon.awssdk.services.ec2.Ec2Client;
import software.amazon.awssdk.services.elasticloadbalancingv2.ElasticLoadBalancingV2Client;
import software.amazon.awssdk.services.wafv2.Wafv2Client;

@Component
public class AwsClientFactory {

    public AwsClients create(String profile, String region) {
        var credentialsProvider = profile != null && !profile.isBlank() ?
            ProfileCredentialsProvider.create(profile) :
            ProfileCredentialsProvider.create();
        var awsRegion = Region.of(region);

        return new AwsClients(
            ElasticLoadBalancingV2Client.builder()
                .credentialsProvider(credentialsProvider)
                .region(awsRegion)
                .build(),
            Ec2Client.builder()
                .credentialsProvider(credentialsProvider)
                .region(awsRegion)
                .build(),
            CloudWatchClient.builder()
                .credentialsProvider(credentialsProvider)
                .region(awsRegion)
                .build(),
            Wafv2Client.builder()
                .credentialsProvider(credentialsProvider)
                .region(awsRegion)
                .build(),
            AcmClient.builder()
                .credentialsProvider(credentialsProvider)
                .region(awsRegion)
                .build()
        );
    }
}
