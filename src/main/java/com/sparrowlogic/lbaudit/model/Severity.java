package com.sparrowlogic.lbaudit.model;

public enum Severity {
    CRITICAL,
    HIGH,
    MEDIUM,
    LOW
}
