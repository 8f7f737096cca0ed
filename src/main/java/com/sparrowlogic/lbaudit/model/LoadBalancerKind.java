package com.sparrowlogic.lbaudit.model;

public enum LoadBalancerKind {
    APPLICATION("application", "AWS/ApplicationELB", "RequestCount"),
    NETWORK("network", "AWS/NetworkELB", "NewFlowCount");

    private final String value;
    private final String metricNamespace;
    private final String trafficMetric;

    LoadBalancerKind(String value, String metricNamespace, String trafficMetric) {
        this.value = value;
        this.metricNamespace = metricNamespace;
        this.trafficMetric = trafficMetric;
    }

    public String value() {
        return value;
    }

    public String metricNamespace() {
        return metricNamespace;
    }

    /**
     * Metric whose sum over a window tells whether the load balancer served any traffic.
     */
    public String trafficMetric() {
        return trafficMetric;
    }

    public static LoadBalancerKind fromValue(String value) {
        for (var kind : values()) {
            if (kind.value.equalsIgnoreCase(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unsupported load balancer type: " + value);
    }
}
