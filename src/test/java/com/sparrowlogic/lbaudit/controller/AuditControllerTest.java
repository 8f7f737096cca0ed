package com.sparrowlogic.lbaudit.controller;

import com.sparrowlogic.lbaudit.model.AuditResult;
import com.sparrowlogic.lbaudit.report.MarkdownReportService;
import com.sparrowlogic.lbaudit.service.LoadBalancerAuditService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(AuditController.class)
class AuditControllerTest {

    private static final String ARN = "arn:aws:elasticloadbalancing:us-east-1:123456789012:loadbalancer/app/prod-alb/abc123";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private LoadBalancerAuditService auditService;

    @MockBean
    private MarkdownReportService markdownService;

    private static AuditResult result() {
        return new AuditResult("prod-alb", ARN, "application", 100.0, List.of(), Map.of(), Map.of(), 22.50);
    }

    @Test
    void shouldShowForm() throws Exception {
        mockMvc.perform(get("/"))
                .andExpect(status().isOk())
                .andExpect(view().name("form"));
    }

    @Test
    void shouldRenderReport() throws Exception {
        var results = List.of(result());
        when(auditService.audit("prod", "us-east-1")).thenReturn(results);
        when(markdownService.generateMarkdown(results)).thenReturn("# Load Balancer Audit\n");
        when(markdownService.toHtml("# Load Balancer Audit\n")).thenReturn("<h1>Load Balancer Audit</h1>");

        mockMvc.perform(post("/audit")
                .param("profile", "prod")
                .param("region", "us-east-1"))
                .andExpect(status().isOk())
                .andExpect(view().name("report"))
                .andExpect(model().attributeExists("results", "summary", "markdown"))
                .andExpect(model().attribute("reportHtml", "<h1>Load Balancer Audit</h1>"));
    }

    @Test
    void shouldHandleError() throws Exception {
        when(auditService.audit(null, "us-east-1"))
                .thenThrow(new RuntimeException("AWS error"));

        mockMvc.perform(post("/audit")
                .param("region", "us-east-1"))
                .andExpect(status().isOk())
                .andExpect(view().name("error"))
                .andExpect(model().attribute("error", "Error auditing load balancers: AWS error"));
    }

    @Test
    void shouldReturnResultsAsJson() throws Exception {
        when(auditService.audit(null, "eu-west-1")).thenReturn(List.of(result()));

        mockMvc.perform(get("/api/audit").param("region", "eu-west-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].lb_name").value("prod-alb"))
                .andExpect(jsonPath("$[0].health_score").value(100.0))
                .andExpect(jsonPath("$[0].estimated_monthly_cost").value(22.5));
    }
}
