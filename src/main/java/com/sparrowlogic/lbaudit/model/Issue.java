package com.sparrowlogic.lbaudit.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

public record Issue(
    Severity severity,
    Category category,
    @JsonProperty("issue_type") String issueType,
    String description,
    @JsonProperty("resource_id") String resourceId,
    Map<String, Object> details
) {
    public Issue {
        details = Map.copyOf(details);
    }
}
