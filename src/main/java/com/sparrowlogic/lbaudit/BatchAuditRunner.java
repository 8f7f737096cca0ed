package com.sparrowlogic.lbaudit;

import com.sparrowlogic.lbaudit.config.AuditProperties;
import com.sparrowlogic.lbaudit.report.ReportPublisher;
import com.sparrowlogic.lbaudit.service.LoadBalancerAuditService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * One sweep on startup for scheduled runs (cron, CI). Enabled with {@code audit.batch.enabled=true}.
 */
@Component
@ConditionalOnProperty(prefix = "audit.batch", name = "enabled", havingValue = "true")
public class BatchAuditRunner implements CommandLineRunner {

    private static final Logger logger = LoggerFactory.getLogger(BatchAuditRunner.class);

    private final LoadBalancerAuditService auditService;
    private final ReportPublisher reportPublisher;
    private final AuditProperties properties;

    public BatchAuditRunner(LoadBalancerAuditService auditService, ReportPublisher reportPublisher, AuditProperties properties) {
        this.auditService = auditService;
        this.reportPublisher = reportPublisher;
        this.properties = properties;
    }

    @Override
    public void run(String... args) {
        logger.info("Starting load balancer audit in {}", properties.region());
        var results = auditService.audit(properties.profile(), properties.region());
        reportPublisher.publish(results);
    }
}
