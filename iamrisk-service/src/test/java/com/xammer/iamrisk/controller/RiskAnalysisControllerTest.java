package com.xammer.iamrisk.controller;

import com.xammer.iamrisk.dto.AnalyzerCapabilities;
import com.xammer.iamrisk.dto.RiskAnalysisRequest;
import com.xammer.iamrisk.dto.RiskAnalysisResponse;
import com.xammer.iamrisk.dto.ScanSummary;
import com.xammer.iamrisk.dto.risk.RiskCategory;
import com.xammer.iamrisk.dto.risk.RiskLevel;
import com.xammer.iamrisk.dto.risk.UserRiskProfile;
import com.xammer.iamrisk.exception.InvalidScanRequestException;
import com.xammer.iamrisk.security.RequestCredentialsResolver;
import com.xammer.iamrisk.service.RiskAnalysisService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(RiskAnalysisController.class)
@Import(RequestCredentialsResolver.class)
class RiskAnalysisControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private RiskAnalysisService riskAnalysisService;

    @Test
    void analysesPermissionSetsWithCallerCredentials() throws Exception {
        UserRiskProfile profile = UserRiskProfile.builder()
                .userId("arn:aws:sso:::permissionSet/ssoins-1/ps-read")
                .userName("ReadOnly")
                .overallRiskScore(1)
                .riskLevel(RiskLevel.LOW)
                .build();
        when(riskAnalysisService.analyze(any(), any())).thenReturn(RiskAnalysisResponse.builder()
                .permissionSetRiskProfiles(List.of(profile))
                .summary(ScanSummary.of(List.of(profile)))
                .analyzedAt(Instant.parse("2024-05-01T10:00:00Z"))
                .build());

        mockMvc.perform(post("/api/risk-analysis")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header(RequestCredentialsResolver.ACCESS_KEY_ID_HEADER, "AKIA")
                        .header(RequestCredentialsResolver.SECRET_ACCESS_KEY_HEADER, "secret")
                        .content("{\"analysisType\":\"permission-sets\",\"permissionSets\":"
                                + "[\"arn:aws:sso:::permissionSet/ssoins-1/ps-read\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.permissionSetRiskProfiles[0].userName").value("ReadOnly"))
                .andExpect(jsonPath("$.permissionSetRiskProfiles[0].riskLevel").value("LOW"))
                .andExpect(jsonPath("$.userRiskProfiles").doesNotExist())
                .andExpect(jsonPath("$.summary.totalAnalyzed").value(1))
                .andExpect(jsonPath("$.analyzedAt").value("2024-05-01T10:00:00Z"));

        verify(riskAnalysisService).analyze(
                argThat((RiskAnalysisRequest r) -> r != null && r.isPermissionSetAnalysis()
                        && "ps-read".equals(r.getPermissionSets().get(0).getName())),
                argThat(c -> c != null && "AKIA".equals(c.getAccessKeyId()) && c.getSessionToken() == null));
    }

    @Test
    void credentialsAreOptionalForBatchAnalysis() throws Exception {
        when(riskAnalysisService.analyze(any(), any())).thenReturn(RiskAnalysisResponse.builder().build());

        mockMvc.perform(post("/api/risk-analysis")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"users\":[]}"))
                .andExpect(status().isOk());

        verify(riskAnalysisService).analyze(any(), isNull());
    }

    @Test
    void validationFailuresBecomeBadRequest() throws Exception {
        when(riskAnalysisService.analyze(any(), any()))
                .thenThrow(new InvalidScanRequestException("Users array is required for user-based analysis"));

        mockMvc.perform(post("/api/risk-analysis")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"analysisType\":\"users\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Users array is required for user-based analysis"))
                .andExpect(jsonPath("$.timestamp").exists());
    }

    @Test
    void missingBodyIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/risk-analysis").contentType(MediaType.APPLICATION_JSON))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Invalid request body"));
    }

    @Test
    void describesCapabilities() throws Exception {
        when(riskAnalysisService.getCapabilities()).thenReturn(new AnalyzerCapabilities(
                "IAM Risk Analyzer", "1.0.0", "Analyzes IAM permissions for security risks and compliance violations",
                List.of("Permission set risk analysis"),
                Arrays.asList(RiskCategory.values()),
                Arrays.asList(RiskLevel.values())));

        mockMvc.perform(get("/api/risk-analysis"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("IAM Risk Analyzer"))
                .andExpect(jsonPath("$.riskCategories[0]").value("OVERLY_PERMISSIVE"))
                .andExpect(jsonPath("$.riskLevels.length()").value(5));
    }
}
