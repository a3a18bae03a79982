package com.xammer.iamrisk.service.risk;

import com.xammer.iamrisk.IamRiskApplication;
import com.xammer.iamrisk.dto.risk.PolicyAnalysisResult;
import com.xammer.iamrisk.dto.risk.RiskCategory;
import com.xammer.iamrisk.dto.risk.RiskFinding;
import com.xammer.iamrisk.dto.risk.RiskLevel;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PolicyAnalyzerTest {

    private final PolicyAnalyzer analyzer = new PolicyAnalyzer(new IamRiskApplication().objectMapper());

    @Test
    void wildcardAllowIsAdministrative() {
        PolicyAnalysisResult result = analyzer.analyzeInlinePolicy(
                "{\"Version\":\"2012-10-17\",\"Statement\":[{\"Effect\":\"Allow\",\"Action\":\"*\",\"Resource\":\"*\"}]}", "p");

        assertTrue(result.isAdminPermissions());
        assertTrue(result.getWildcardActionsCount() >= 1);
        assertEquals(1, result.getPermissionsCount());
        assertTrue(has(result.getFindings(), RiskLevel.CRITICAL, RiskCategory.OVERLY_PERMISSIVE));
        assertTrue(result.getFindings().stream().anyMatch(f -> "Wildcard Resource Access".equals(f.getTitle())));
        assertEquals("p", result.getPolicyName());
        assertNotNull(result.getParsedDocument());
    }

    @Test
    void administratorAccessManagedPolicy() {
        PolicyAnalysisResult result = analyzer.analyzeManagedPolicy("arn:aws:iam::aws:policy/AdministratorAccess");

        assertTrue(result.isAdminPermissions());
        assertEquals(1, result.getWildcardActionsCount());
        assertEquals("AdministratorAccess", result.getPolicyName());
        assertTrue(has(result.getFindings(), RiskLevel.CRITICAL, RiskCategory.ADMINISTRATIVE_ACCESS));
        assertEquals(10, result.getFindings().get(0).getSeverity());
    }

    @Test
    void powerUserManagedPolicyIsOverlyPermissive() {
        PolicyAnalysisResult result = analyzer.analyzeManagedPolicy("arn:aws:iam::aws:policy/PowerUserAccess");

        assertFalse(result.isAdminPermissions());
        assertEquals(1, result.getFindings().size());
        assertTrue(has(result.getFindings(), RiskLevel.HIGH, RiskCategory.OVERLY_PERMISSIVE));
    }

    @Test
    void managedPolicyServicesAreGuessedFromName() {
        PolicyAnalysisResult result = analyzer.analyzeManagedPolicy("arn:aws:iam::aws:policy/AmazonS3ReadOnlyAccess");

        assertEquals(List.of("s3:*"), result.getServicePermissions().get("s3"));
        assertTrue(result.getFindings().isEmpty());
    }

    @Test
    void nullManagedPolicyArnYieldsEmptyResult() {
        PolicyAnalysisResult result = analyzer.analyzeManagedPolicy(null);

        assertEquals("Unknown", result.getPolicyName());
        assertTrue(result.getFindings().isEmpty());
        assertFalse(result.isAdminPermissions());
    }

    @Test
    void malformedDocumentIsReportedNotThrown() {
        PolicyAnalysisResult result = analyzer.analyzeInlinePolicy("{not json", "p");

        assertEquals(0, result.getPermissionsCount());
        assertEquals(1, result.getFindings().size());
        RiskFinding finding = result.getFindings().get(0);
        assertEquals(RiskLevel.HIGH, finding.getRiskLevel());
        assertEquals(RiskCategory.SECURITY_MISCONFIGURATION, finding.getCategory());
        assertEquals(8, finding.getSeverity());
        assertNotNull(finding.getDetails().get("error"));
    }

    @Test
    void nonObjectDocumentIsMalformed() {
        PolicyAnalysisResult result = analyzer.analyzeInlinePolicy("[1,2]", "p");

        assertEquals(1, result.getFindings().size());
        assertEquals(RiskCategory.SECURITY_MISCONFIGURATION, result.getFindings().get(0).getCategory());
    }

    @Test
    void missingStatementYieldsEmptyResult() {
        PolicyAnalysisResult result = analyzer.analyzeInlinePolicy("{\"Version\":\"2012-10-17\"}", "p");

        assertTrue(result.getFindings().isEmpty());
        assertEquals(0, result.getPermissionsCount());
        assertNotNull(result.getParsedDocument());
    }

    @Test
    void singleStatementObjectAndActionListsAreNormalized() {
        PolicyAnalysisResult result = analyzer.analyzeInlinePolicy(
                "{\"Statement\":{\"Effect\":\"Allow\",\"Action\":[\"iam:PassRole\",\"s3:DeleteObject\",\"s3:GetObject\",\"ec2:*\"],"
                        + "\"Resource\":\"arn:aws:s3:::bucket/*\"}}", "inline");

        assertEquals(4, result.getPermissionsCount());
        assertEquals(1, result.getWildcardActionsCount());
        assertFalse(result.isAdminPermissions());
        assertEquals(List.of("s3:GetObject"), result.getDataAccessPermissions());
        assertEquals(List.of("s3:DeleteObject", "s3:GetObject"), result.getServicePermissions().get("s3"));
        assertEquals(List.of("iam:PassRole"), result.getServicePermissions().get("iam"));
        assertEquals(List.of("ec2:*"), result.getServicePermissions().get("ec2"));
        assertTrue(has(result.getFindings(), RiskLevel.HIGH, RiskCategory.PRIVILEGE_ESCALATION));
        assertEquals(2, result.getFindings().stream()
                .filter(f -> f.getCategory() == RiskCategory.DATA_EXPOSURE)
                .count());
        assertFalse(result.getFindings().stream().anyMatch(f -> "Wildcard Resource Access".equals(f.getTitle())));
    }

    @Test
    void denyStatementsDoNotCountActions() {
        PolicyAnalysisResult result = analyzer.analyzeInlinePolicy(
                "{\"Statement\":[{\"Effect\":\"Deny\",\"Action\":\"*\",\"Resource\":\"*\"}]}", "deny");

        assertEquals(0, result.getPermissionsCount());
        assertFalse(result.isAdminPermissions());
        assertTrue(result.getFindings().isEmpty());
    }

    @Test
    void principalIsFlaggedWhateverTheEffect() {
        PolicyAnalysisResult result = analyzer.analyzeInlinePolicy(
                "{\"Statement\":[{\"Effect\":\"Deny\",\"Principal\":{\"AWS\":\"arn:aws:iam::123456789012:root\"},"
                        + "\"Action\":\"s3:GetObject\",\"Resource\":\"*\"}]}", "trust");

        assertTrue(result.isCrossAccountAccess());
        assertEquals(0, result.getPermissionsCount());
        RiskFinding finding = result.getFindings().get(0);
        assertEquals(RiskCategory.CROSS_ACCOUNT_ACCESS, finding.getCategory());
        assertEquals(7, finding.getSeverity());
        assertEquals("Deny", finding.getDetails().get("effect"));
    }

    private static boolean has(List<RiskFinding> findings, RiskLevel level, RiskCategory category) {
        return findings.stream().anyMatch(f -> f.getRiskLevel() == level && f.getCategory() == category);
    }
}
