package com.sparrowlogic.lbaudit.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record CertificateInfo(
    String domain,
    @JsonProperty("days_until_expiry") long daysUntilExpiry
) {}
