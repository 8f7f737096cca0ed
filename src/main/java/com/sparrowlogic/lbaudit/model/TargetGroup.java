package com.sparrowlogic.lbaudit.model;

public record TargetGroup(
    String arn,
    String name,
    String targetType,
    Integer healthCheckIntervalSeconds,
    Integer healthCheckTimeoutSeconds,
    String loadBalancerArn
) {
    public boolean isInstanceTarget() {
        return "instance".equals(targetType);
    }
}
