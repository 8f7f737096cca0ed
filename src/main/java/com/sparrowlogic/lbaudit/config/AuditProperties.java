package com.sparrowlogic.lbaudit.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties("audit")
public record AuditProperties(
    @DefaultValue("us-east-1") String region,
    String profile,
    @DefaultValue("false") boolean skipNameFilter,
    @DefaultValue("false") boolean skipAgeFilter,
    @DefaultValue("14") int minAgeDays,
    @DefaultValue("7") int metricsWindowDays,
    @DefaultValue("4") int parallelism,
    @DefaultValue("reports") String reportDir
) {}
