package com.sparrowlogic.lbaudit.check;

import com.sparrowlogic.lbaudit.model.AuditTarget;
import com.sparrowlogic.lbaudit.model.Category;
import com.sparrowlogic.lbaudit.model.CertificateInfo;
import com.sparrowlogic.lbaudit.model.Issue;
import com.sparrowlogic.lbaudit.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.acm.AcmClient;
import software.amazon.awssdk.services.acm.model.DescribeCertificateRequest;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Looks up every ACM certificate on the HTTPS listeners. All examined certificates are
 * reported in the result's certificate map; the ones expiring soon also raise an issue.
 * Certificates uploaded to IAM are not examined.
 */
public class CertificateExpiryCheck implements LoadBalancerCheck {

    private static final Logger logger = LoggerFactory.getLogger(CertificateExpiryCheck.class);

    static final long EXPIRY_THRESHOLD_DAYS = 30;

    private final AcmClient acm;
    private final Clock clock;

    public CertificateExpiryCheck(AcmClient acm, Clock clock) {
        this.acm = acm;
        this.clock = clock;
    }

    @Override
    public String name() {
        return "certificate_expiry";
    }

    @Override
    public CheckResult run(AuditTarget target) {
        var issues = new ArrayList<Issue>();
        var certificates = new LinkedHashMap<String, CertificateInfo>();
        for (var listener : target.listeners()) {
            if (!listener.isHttps()) {
                continue;
            }
            for (var certificateArn : listener.certificateArns()) {
                if (!isManaged(certificateArn) || certificates.containsKey(certificateArn)) {
                    continue;
                }
                try {
                    var detail = acm.describeCertificate(DescribeCertificateRequest.builder()
                            .certificateArn(certificateArn)
                            .build())
                        .certificate();
                    if (detail.notAfter() == null) {
                        continue;
                    }
                    var days = Duration.between(clock.instant(), detail.notAfter()).toDays();
                    var domain = detail.domainName() != null ? detail.domainName() : "";
                    certificates.put(certificateArn, new CertificateInfo(domain, days));
                    if (days <= EXPIRY_THRESHOLD_DAYS) {
                        issues.add(new Issue(
                            Severity.CRITICAL,
                            Category.SECURITY,
                            "ssl_expiration_risk",
                            "Certificate for " + domain + " expires in " + days + " days",
                            certificateArn,
                            Map.of("domain", domain, "days_until_expiry", days)
                        ));
                    }
                } catch (SdkException e) {
                    logger.warn("Could not describe certificate {}: {}", certificateArn, e.getMessage());
                }
            }
        }
        return new CheckResult(issues, certificates);
    }

    static boolean isManaged(String certificateArn) {
        return certificateArn != null && certificateArn.contains(":acm:");
    }
}
