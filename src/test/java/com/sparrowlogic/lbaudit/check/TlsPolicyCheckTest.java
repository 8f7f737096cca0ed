package com.sparrowlogic.lbaudit.check;

import com.sparrowlogic.lbaudit.model.Category;
import com.sparrowlogic.lbaudit.model.Severity;
import org.junit.jupiter.api.Test;

import static com.sparrowlogic.lbaudit.TestFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class TlsPolicyCheckTest {

    private final TlsPolicyCheck check = new TlsPolicyCheck();

    @Test
    void shouldFlagDeprecatedPolicy() {
        var issues = check.run(withListeners(alb(), https("ELBSecurityPolicy-2015-05"))).issues();

        assertEquals(1, issues.size());
        assertEquals(Severity.CRITICAL, issues.get(0).severity());
        assertEquals(Category.SECURITY, issues.get(0).category());
        assertEquals("weak_tls_policy", issues.get(0).issueType());
    }

    @Test
    void shouldPassModernPolicy() {
        var issues = check.run(withListeners(alb(), https("ELBSecurityPolicy-TLS13-1-2-2021-06"))).issues();

        assertTrue(issues.isEmpty());
    }

    @Test
    void shouldFlagPoliciesAllowingOldTlsVersions() {
        assertTrue(TlsPolicyCheck.isDeprecated("ELBSecurityPolicy-TLS-1-1-2017-01"));
        assertTrue(TlsPolicyCheck.isDeprecated("ELBSecurityPolicy-2016-08"));
        assertFalse(TlsPolicyCheck.isDeprecated("ELBSecurityPolicy-TLS-1-2-2017-01"));
    }

    @Test
    void shouldIgnoreHttpListeners() {
        assertTrue(check.run(withListeners(alb(), http())).issues().isEmpty());
    }
}
