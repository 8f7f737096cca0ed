package com.sparrowlogic.lbaudit.check;

import com.sparrowlogic.lbaudit.model.AuditTarget;
import com.sparrowlogic.lbaudit.model.Category;
import com.sparrowlogic.lbaudit.model.Issue;
import com.sparrowlogic.lbaudit.model.Scheme;
import com.sparrowlogic.lbaudit.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.wafv2.Wafv2Client;
import software.amazon.awssdk.services.wafv2.model.GetWebAclForResourceRequest;
import software.amazon.awssdk.services.wafv2.model.WafNonexistentItemException;

import java.util.List;
import java.util.Map;

public class WafAttachmentCheck implements LoadBalancerCheck {

    private static final Logger logger = LoggerFactory.getLogger(WafAttachmentCheck.class);

    private final Wafv2Client waf;

    public WafAttachmentCheck(Wafv2Client waf) {
        this.waf = waf;
    }

    @Override
    public String name() {
        return "waf_attachment";
    }

    @Override
    public CheckResult run(AuditTarget target) {
        var lb = target.loadBalancer();
        if (!lb.isApplication() || lb.scheme() != Scheme.INTERNET_FACING) {
            return CheckResult.empty();
        }
        try {
            var response = waf.getWebACLForResource(GetWebAclForResourceRequest.builder()
                .resourceArn(lb.arn())
                .build());
            return response.webACL() == null ? missingWaf(lb.arn(), lb.name()) : CheckResult.empty();
        } catch (WafNonexistentItemException e) {
            return missingWaf(lb.arn(), lb.name());
        } catch (SdkException e) {
            logger.warn("Could not read Web ACL for {}: {}", lb.name(), e.getMessage());
            return CheckResult.empty();
        }
    }

    private static CheckResult missingWaf(String arn, String name) {
        return CheckResult.of(List.of(new Issue(
            Severity.HIGH,
            Category.SECURITY,
            "missing_waf",
            "Internet-facing load balancer " + name + " has no WAF Web ACL attached",
            arn,
            Map.of()
        )));
    }
}
