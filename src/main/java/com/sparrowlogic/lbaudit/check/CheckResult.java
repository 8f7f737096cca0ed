package com.sparrowlogic.lbaudit.check;

import com.sparrowlogic.lbaudit.model.CertificateInfo;
import com.sparrowlogic.lbaudit.model.Issue;

import java.util.List;
import java.util.Map;

public record CheckResult(List<Issue> issues, Map<String, CertificateInfo> certificates) {

    private static final CheckResult EMPTY = new CheckResult(List.of(), Map.of());

    public CheckResult {
        issues = List.copyOf(issues);
        certificates = Map.copyOf(certificates);
    }

    public static CheckResult empty() {
        return EMPTY;
    }

    public static CheckResult of(List<Issue> issues) {
        return issues.isEmpty() ? EMPTY : new CheckResult(issues, Map.of());
    }
}
