package com.sparrowlogic.lbaudit.check;

import com.sparrowlogic.lbaudit.model.AuditTarget;
import com.sparrowlogic.lbaudit.model.Category;
import com.sparrowlogic.lbaudit.model.Issue;
import com.sparrowlogic.lbaudit.model.Severity;

import java.util.List;
import java.util.Map;

public class AvailabilityZoneCheck implements LoadBalancerCheck {

    @Override
    public String name() {
        return "availability_zones";
    }

    @Override
    public CheckResult run(AuditTarget target) {
        var lb = target.loadBalancer();
        if (lb.availabilityZones().size() != 1) {
            return CheckResult.empty();
        }
        return CheckResult.of(List.of(new Issue(
            Severity.HIGH,
            Category.PERFORMANCE,
            "single_az_risk",
            "Load balancer " + lb.name() + " is deployed in a single availability zone",
            lb.arn(),
            Map.of("availability_zones", lb.availabilityZones())
        )));
    }
}
