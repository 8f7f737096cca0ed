package com.sparrowlogic.lbaudit.controller;

import com.sparrowlogic.lbaudit.model.AuditResult;
import com.sparrowlogic.lbaudit.report.AuditSummary;
import com.sparrowlogic.lbaudit.report.MarkdownReportService;
import com.sparrowlogic.lbaudit.service.LoadBalancerAuditService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseBody;

import java.util.List;

@Controller
public class AuditController {

    private static final Logger logger = LoggerFactory.getLogger(AuditController.class);

    private final LoadBalancerAuditService auditService;
    private final MarkdownReportService markdownService;

    public AuditController(LoadBalancerAuditService auditService, MarkdownReportService markdownService) {
        this.auditService = auditService;
        this.markdownService = markdownService;
    }

    @GetMapping("/")
    public String showForm() {
        return "form";
    }

    @PostMapping("/audit")
    public String audit(@RequestParam(required = false) String profile, @RequestParam String region, Model model) {
        try {
            var results = auditService.audit(profile, region);
            var markdown = markdownService.generateMarkdown(results);

            model.addAttribute("results", results);
            model.addAttribute("summary", AuditSummary.of(results));
            model.addAttribute("markdown", markdown);
            model.addAttribute("reportHtml", markdownService.toHtml(markdown));
            return "report";
        } catch (Exception e) {
            logger.error("Audit of region {} failed", region, e);
            model.addAttribute("error", "Error auditing load balancers: " + e.getMessage());
            return "error";
        }
    }

    @GetMapping("/api/audit")
    @ResponseBody
    public List<AuditResult> auditJson(@RequestParam(required = false) String profile, @RequestParam(required = false) String region) {
        return auditService.audit(profile, region);
    }
}
