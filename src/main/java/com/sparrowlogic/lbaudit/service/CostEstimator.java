package com.sparrowlogic.lbaudit.service;

import com.sparrowlogic.lbaudit.model.LoadBalancer;

/**
 * Monthly cost estimate: a flat base price, plus an LCU charge driven by request volume
 * for application load balancers.
 */
public class CostEstimator {

    public static final double BASE_MONTHLY_COST = 22.50;
    static final double LCU_HOURLY_PRICE = 0.008;
    static final double NEW_CONNECTIONS_PER_LCU = 25.0;
    static final double HOURS_PER_MONTH = 730.0;

    private final MetricsAggregator metrics;
    private final int windowDays;

    public CostEstimator(MetricsAggregator metrics, int windowDays) {
        this.metrics = metrics;
        this.windowDays = windowDays;
    }

    public double estimate(LoadBalancer loadBalancer) {
        if (!loadBalancer.isApplication()) {
            return BASE_MONTHLY_COST;
        }
        var requests = metrics.getMetric(loadBalancer, "RequestCount", MetricStatistic.SUM, windowDays);
        var requestsPerSecond = requests / (windowDays * 86400.0);
        var lcus = requestsPerSecond / NEW_CONNECTIONS_PER_LCU;
        return round(BASE_MONTHLY_COST + lcus * LCU_HOURLY_PRICE * HOURS_PER_MONTH);
    }

    private static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
