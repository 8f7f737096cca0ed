package com.sparrowlogic.lbaudit.check;

import com.sparrowlogic.lbaudit.model.Category;
import com.sparrowlogic.lbaudit.model.Severity;
import com.sparrowlogic.lbaudit.service.MetricsAggregator;
import org.junit.jupiter.api.Test;

import static com.sparrowlogic.lbaudit.TestFixtures.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class ErrorRateCheckTest {

    private final MetricsAggregator metrics = mock(MetricsAggregator.class);
    private final ErrorRateCheck check = new ErrorRateCheck(metrics, 7);

    private void metrics(double errors, double requests) {
        when(metrics.getMetric(any(), eq("HTTPCode_Target_5XX_Count"), any(), anyInt())).thenReturn(errors);
        when(metrics.getMetric(any(), eq("RequestCount"), any(), anyInt())).thenReturn(requests);
    }

    @Test
    void shouldFlagErrorRateAboveOnePercent() {
        metrics(1000, 50000);

        var issues = check.run(target(alb())).issues();

        assertEquals(1, issues.size());
        assertEquals(Severity.HIGH, issues.get(0).severity());
        assertEquals(Category.PERFORMANCE, issues.get(0).category());
        assertEquals("high_5xx_rate", issues.get(0).issueType());
        assertEquals(2.0, issues.get(0).details().get("error_rate_percentage"));
    }

    @Test
    void shouldPassLowErrorRate() {
        metrics(500, 100000);

        assertTrue(check.run(target(alb())).issues().isEmpty());
    }

    @Test
    void shouldPassWithoutRequests() {
        metrics(0, 0);

        assertTrue(check.run(target(alb())).issues().isEmpty());
    }

    @Test
    void shouldSkipNetworkLoadBalancer() {
        assertTrue(check.run(target(nlb())).issues().isEmpty());
        verifyNoInteractions(metrics);
    }
}
