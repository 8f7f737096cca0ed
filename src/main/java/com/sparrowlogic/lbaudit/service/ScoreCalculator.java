package com.sparrowlogic.lbaudit.service;

import com.sparrowlogic.lbaudit.model.Issue;
import com.sparrowlogic.lbaudit.model.Severity;

import java.util.Collection;
import java.util.Map;

/**
 * Turns a set of issues into a 0-100 health score by deducting a fixed weight per severity.
 */
public final class ScoreCalculator {

    public static final double MAX_SCORE = 100.0;

    public static final double CRITICAL_WEIGHT = 20.0;
    public static final double HIGH_WEIGHT = 10.0;
    public static final double MEDIUM_WEIGHT = 5.0;
    public static final double LOW_WEIGHT = 2.0;

    private static final Map<Severity, Double> WEIGHTS = Map.of(
        Severity.CRITICAL, CRITICAL_WEIGHT,
        Severity.HIGH, HIGH_WEIGHT,
        Severity.MEDIUM, MEDIUM_WEIGHT,
        Severity.LOW, LOW_WEIGHT
    );

    private ScoreCalculator() {
    }

    public static double score(Collection<Issue> issues) {
        var deductions = issues.stream()
            .mapToDouble(issue -> WEIGHTS.get(issue.severity()))
            .sum();
        return Math.max(0.0, Math.min(MAX_SCORE, MAX_SCORE - deductions));
    }
}
