package com.sparrowlogic.lbaudit.model;

import java.util.List;

public record Listener(
    String arn,
    String protocol,
    int port,
    String sslPolicy,
    List<String> certificateArns,
    String loadBalancerArn
) {
    public Listener {
        certificateArns = List.copyOf(certificateArns);
    }

    public boolean isHttps() {
        return "HTTPS".equals(protocol);
    }

    public boolean isHttp() {
        return "HTTP".equals(protocol);
    }
}
