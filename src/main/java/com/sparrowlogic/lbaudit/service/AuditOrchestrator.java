package com.sparrowlogic.lbaudit.service;

import com.sparrowlogic.lbaudit.aws.AwsClients;
import com.sparrowlogic.lbaudit.check.CheckSuite;
import com.sparrowlogic.lbaudit.check.LoadBalancerCheck;
import com.sparrowlogic.lbaudit.config.AuditProperties;
import com.sparrowlogic.lbaudit.model.AuditResult;
import com.sparrowlogic.lbaudit.model.AuditTarget;
import com.sparrowlogic.lbaudit.model.CertificateInfo;
import com.sparrowlogic.lbaudit.model.Issue;
import com.sparrowlogic.lbaudit.model.LoadBalancer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;

/**
 * Runs one audit sweep: discovery once, then every qualifying load balancer through
 * topology fetch, all checks, scoring and cost estimation.
 *
 * <p>Load balancers are audited on a bounded pool. A load balancer that fails is logged and
 * left out of the results; a check that fails contributes no issues. Only discovery
 * failures abort the sweep.
 */
public class AuditOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(AuditOrchestrator.class);

    private final LoadBalancerDiscovery discovery;
    private final TopologyFetcher topology;
    private final List<LoadBalancerCheck> checks;
    private final MetricsAggregator metrics;
    private final CostEstimator costEstimator;
    private final int windowDays;
    private final int parallelism;

    public AuditOrchestrator(
        LoadBalancerDiscovery discovery,
        TopologyFetcher topology,
        List<LoadBalancerCheck> checks,
        MetricsAggregator metrics,
        CostEstimator costEstimator,
        int windowDays,
        int parallelism
    ) {
        this.discovery = discovery;
        this.topology = topology;
        this.checks = List.copyOf(checks);
        this.metrics = metrics;
        this.costEstimator = costEstimator;
        this.windowDays = windowDays;
        this.parallelism = Math.max(1, parallelism);
    }

    public static AuditOrchestrator forClients(AwsClients clients, AuditProperties properties, Clock clock) {
        var metrics = new MetricsAggregator(clients.cloudWatch(), clock);
        var windowDays = properties.metricsWindowDays();
        return new AuditOrchestrator(
            new LoadBalancerDiscovery(clients.elb(), properties, clock),
            new TopologyFetcher(clients.elb()),
            CheckSuite.standard(clients, metrics, clock, windowDays),
            metrics,
            new CostEstimator(metrics, windowDays),
            windowDays,
            properties.parallelism()
        );
    }

    public List<AuditResult> run() {
        var loadBalancers = discovery.discover();
        if (loadBalancers.isEmpty()) {
            return List.of();
        }

        var executor = Executors.newFixedThreadPool(Math.min(parallelism, loadBalancers.size()));
        try {
            var futures = loadBalancers.stream()
                .map(lb -> CompletableFuture.supplyAsync(() -> auditSafely(lb), executor))
                .toList();
            var results = futures.stream()
                .map(CompletableFuture::join)
                .flatMap(Optional::stream)
                .toList();
            logger.info("Audited {} of {} load balancers", results.size(), loadBalancers.size());
            return results;
        } finally {
            executor.shutdown();
        }
    }

    private Optional<AuditResult> auditSafely(LoadBalancer loadBalancer) {
        try {
            return Optional.of(audit(loadBalancer));
        } catch (RuntimeException e) {
            logger.error("Failed to audit load balancer {}", loadBalancer.name(), e);
            return Optional.empty();
        }
    }

    public AuditResult audit(LoadBalancer loadBalancer) {
        var target = topology.fetch(loadBalancer);

        var issues = new ArrayList<Issue>();
        var certificates = new LinkedHashMap<String, CertificateInfo>();
        for (var check : checks) {
            try {
                var result = check.run(target);
                issues.addAll(result.issues());
                certificates.putAll(result.certificates());
            } catch (RuntimeException e) {
                logger.warn("Check {} failed for {}: {}", check.name(), loadBalancer.name(), e.getMessage());
            }
        }

        var score = ScoreCalculator.score(issues);
        var result = new AuditResult(
            loadBalancer.name(),
            loadBalancer.arn(),
            loadBalancer.kind().value(),
            score,
            issues,
            metricsSnapshot(target),
            certificates,
            costEstimator.estimate(loadBalancer)
        );
        logger.info("Audited {}: health score {} with {} issues", loadBalancer.name(), score, issues.size());
        return result;
    }

    private Map<String, Double> metricsSnapshot(AuditTarget target) {
        var lb = target.loadBalancer();
        var suffix = "_" + windowDays + "d";
        var snapshot = new LinkedHashMap<String, Double>();
        if (lb.isApplication()) {
            snapshot.put("request_count" + suffix, metrics.getMetric(lb, "RequestCount", MetricStatistic.SUM, windowDays));
            snapshot.put("http_5xx_count" + suffix, metrics.getMetric(lb, "HTTPCode_Target_5XX_Count", MetricStatistic.SUM, windowDays));
            snapshot.put("target_response_time_avg", metrics.getMetric(lb, "TargetResponseTime", MetricStatistic.AVERAGE, windowDays));
        } else {
            snapshot.put("new_flow_count" + suffix, metrics.getMetric(lb, "NewFlowCount", MetricStatistic.SUM, windowDays));
            snapshot.put("active_flow_count_avg", metrics.getMetric(lb, "ActiveFlowCount", MetricStatistic.AVERAGE, windowDays));
        }
        return snapshot;
    }
}
