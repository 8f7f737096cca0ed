package com.sparrowlogic.lbaudit.service;

import com.sparrowlogic.lbaudit.model.LoadBalancer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.cloudwatch.CloudWatchClient;
import software.amazon.awssdk.services.cloudwatch.model.Dimension;
import software.amazon.awssdk.services.cloudwatch.model.GetMetricStatisticsRequest;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Reduces CloudWatch datapoints for a load balancer to a single number.
 *
 * <p>A failed query is reported as {@code 0.0}, the same value a load balancer without
 * traffic produces. Callers cannot tell the two apart.
 *
 * <p>Successful results are remembered for the lifetime of the aggregator, one sweep, so the
 * checks, the cost estimate and the metrics snapshot share a single query per series. Failed
 * queries are not remembered.
 */
public class MetricsAggregator {

    private static final Logger logger = LoggerFactory.getLogger(MetricsAggregator.class);

    static final int PERIOD_SECONDS = 3600;

    private final CloudWatchClient cloudWatch;
    private final Clock clock;
    private final Map<SeriesKey, Double> results = new ConcurrentHashMap<>();

    public MetricsAggregator(CloudWatchClient cloudWatch, Clock clock) {
        this.cloudWatch = cloudWatch;
        this.clock = clock;
    }

    public double getMetric(LoadBalancer loadBalancer, String metricName, MetricStatistic statistic, int windowDays) {
        var key = new SeriesKey(loadBalancer.arn(), metricName, statistic, windowDays);
        var cached = results.get(key);
        if (cached != null) {
            return cached;
        }
        var endTime = clock.instant();
        var request = GetMetricStatisticsRequest.builder()
            .namespace(loadBalancer.kind().metricNamespace())
            .metricName(metricName)
            .dimensions(Dimension.builder().name("LoadBalancer").value(loadBalancer.metricDimension()).build())
            .startTime(endTime.minus(Duration.ofDays(windowDays)))
            .endTime(endTime)
            .period(PERIOD_SECONDS)
            .statistics(statistic.toSdk())
            .build();

        try {
            var datapoints = cloudWatch.getMetricStatistics(request).datapoints();
            var values = datapoints.stream().mapToDouble(statistic::valueOf);
            var value = statistic == MetricStatistic.SUM ? values.sum() : values.average().orElse(0.0);
            results.put(key, value);
            return value;
        } catch (SdkException e) {
            logger.warn("Could not fetch metric {} for load balancer {}: {}", metricName, loadBalancer.name(), e.getMessage());
            return 0.0;
        }
    }

    private record SeriesKey(String loadBalancerArn, String metricName, MetricStatistic statistic, int windowDays) {}
}
