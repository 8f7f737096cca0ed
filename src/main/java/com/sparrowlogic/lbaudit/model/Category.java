package com.sparrowlogic.lbaudit.model;

public enum Category {
    SECURITY,
    PERFORMANCE,
    COST,
    OBSERVABILITY
}
