package com.sparrowlogic.lbaudit.check;

import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;

/**
 * Substring guesses about a workload from its target group name. Approximate by nature;
 * the checks take these as plain predicates so a tag-based rule can replace them.
 */
public final class NameHeuristics {

    static final List<String> STATEFUL_MARKERS = List.of("session", "stateful", "cart", "login");
    static final List<String> SERVERLESS_MARKERS = List.of("api", "handler", "function", "webhook", "worker");

    private NameHeuristics() {
    }

    public static Predicate<String> statefulWorkload() {
        return name -> containsAny(name, STATEFUL_MARKERS);
    }

    public static Predicate<String> serverlessCandidate() {
        return name -> containsAny(name, SERVERLESS_MARKERS);
    }

    private static boolean containsAny(String name, List<String> markers) {
        if (name == null) {
            return false;
        }
        var lower = name.toLowerCase(Locale.ROOT);
        return markers.stream().anyMatch(lower::contains);
    }
}
