package com.sparrowlogic.lbaudit.service;

import com.sparrowlogic.lbaudit.aws.AwsClientFactory;
import com.sparrowlogic.lbaudit.config.AuditProperties;
import com.sparrowlogic.lbaudit.model.AuditResult;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

@Service
public class LoadBalancerAuditService {

    private final AwsClientFactory clientFactory;
    private final AuditProperties properties;
    private final Clock clock;

    public LoadBalancerAuditService(AwsClientFactory clientFactory, AuditProperties properties, Clock clock) {
        this.clientFactory = clientFactory;
        this.properties = properties;
        this.clock = clock;
    }

    public List<AuditResult> audit(String profile, String region) {
        var effectiveRegion = region != null && !region.isBlank() ? region : properties.region();
        try (var clients = clientFactory.create(profile, effectiveRegion)) {
            return AuditOrchestrator.forClients(clients, properties, clock).run();
        }
    }
}
