package com.xammer.iamrisk.service.risk;

import com.xammer.iamrisk.dto.AccountAccess;
import com.xammer.iamrisk.dto.OrganizationUser;
import com.xammer.iamrisk.dto.PermissionSetDetails;
import com.xammer.iamrisk.dto.risk.AccountRiskSummary;
import com.xammer.iamrisk.dto.risk.PermissionSetRisk;
import com.xammer.iamrisk.dto.risk.PolicyAnalysisResult;
import com.xammer.iamrisk.dto.risk.ResourceType;
import com.xammer.iamrisk.dto.risk.RiskCategory;
import com.xammer.iamrisk.dto.risk.RiskFinding;
import com.xammer.iamrisk.dto.risk.RiskLevel;
import com.xammer.iamrisk.dto.risk.UserRiskProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import static com.xammer.iamrisk.service.risk.RiskFindings.details;
import static com.xammer.iamrisk.service.risk.RiskFindings.newFinding;

/**
 * Builds risk profiles for permission sets, accounts and users from individual policy
 * analyses.
 */
@Service
public class RiskAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(RiskAnalyzer.class);

    public static final String ORGANIZATION_ACCOUNT = "organization";
    public static final String ANALYSIS_FAILED_TITLE = RiskFindings.ANALYSIS_FAILED_TITLE;

    private final PolicyAnalyzer policyAnalyzer;
    private final RiskCalculator riskCalculator;

    public RiskAnalyzer(PolicyAnalyzer policyAnalyzer, RiskCalculator riskCalculator) {
        this.policyAnalyzer = policyAnalyzer;
        this.riskCalculator = riskCalculator;
    }

    public PermissionSetRisk analyzePermissionSetRisk(PermissionSetDetails permissionSet, String accountId) {
        List<RiskFinding> findings = new ArrayList<>();
        List<PolicyAnalysisResult> analyses = new ArrayList<>();
        boolean adminPermissions = false;
        int wildcardActions = 0;

        List<String> managedPolicies = permissionSet.getManagedPolicies() != null
                ? permissionSet.getManagedPolicies() : List.of();
        for (String policyArn : managedPolicies) {
            PolicyAnalysisResult analysis = policyAnalyzer.analyzeManagedPolicy(policyArn);
            analyses.add(analysis);
            adminPermissions |= analysis.isAdminPermissions();
            wildcardActions += analysis.getWildcardActionsCount();

            if (policyArn != null && SensitiveActions.HIGH_PRIVILEGE_POLICIES.contains(policyArn)) {
                boolean administrator = policyArn.contains("AdministratorAccess");
                findings.add(newFinding()
                        .title("High-Privilege AWS Managed Policy")
                        .description("Permission set uses high-privilege policy: " + policyArn)
                        .riskLevel(administrator ? RiskLevel.CRITICAL : RiskLevel.HIGH)
                        .category(RiskCategory.OVERLY_PERMISSIVE)
                        .severity(administrator ? 9 : 7)
                        .impact("Grants broad permissions that may exceed necessary access")
                        .recommendation("Review policy necessity and consider custom policies with minimal required permissions")
                        .resourceType(ResourceType.PERMISSION_SET)
                        .resourceArn(permissionSet.getArn())
                        .resourceName(permissionSet.getName())
                        .details(details("policyArn", policyArn, "accountId", accountId))
                        .build());
            }
            findings.addAll(analysis.getFindings());
        }

        if (permissionSet.hasInlinePolicy()) {
            PolicyAnalysisResult analysis = policyAnalyzer.analyzeInlinePolicy(
                    permissionSet.getInlinePolicyDocument(), permissionSet.getName());
            analyses.add(analysis);
            adminPermissions |= analysis.isAdminPermissions();
            wildcardActions += analysis.getWildcardActionsCount();
            findings.addAll(analysis.getFindings());
        }

        Set<String> sensitiveServices = new LinkedHashSet<>();
        for (PolicyAnalysisResult analysis : analyses) {
            analysis.getServicePermissions().keySet().stream()
                    .filter(SensitiveActions.SENSITIVE_SERVICES::contains)
                    .forEach(sensitiveServices::add);
        }

        int highSeverity = (int) findings.stream().filter(f -> f.getSeverity() >= 7).count();
        int riskScore = riskCalculator.scorePermissionSet(
                adminPermissions, wildcardActions, sensitiveServices.size(), findings.size(), highSeverity);

        return PermissionSetRisk.builder()
                .arn(permissionSet.getArn())
                .name(permissionSet.getName())
                .riskScore(riskScore)
                .riskLevel(riskCalculator.levelOf(riskScore))
                .findings(findings)
                .policyAnalyses(analyses)
                .adminPermissions(adminPermissions)
                .wildcardActions(wildcardActions)
                .sensitiveServices(sensitiveServices)
                .build();
    }

    /**
     * Like {@link #analyzePermissionSetRisk} but never throws: a failure yields a degraded
     * outcome whose value holds a single "Risk Analysis Failed" finding.
     */
    public AnalysisOutcome<PermissionSetRisk> analyzePermissionSetRiskSafely(PermissionSetDetails permissionSet,
                                                                             String accountId) {
        try {
            return AnalysisOutcome.success(analyzePermissionSetRisk(permissionSet, accountId));
        } catch (RuntimeException e) {
            logger.error("Error analyzing permission set {}", permissionSet.displayName(), e);
            String error = errorMessage(e);
            return AnalysisOutcome.degraded(PermissionSetRisk.builder()
                    .arn(permissionSet.getArn())
                    .name(permissionSet.getName())
                    .riskScore(RiskCalculator.MIN_SCORE)
                    .riskLevel(RiskLevel.INFO)
                    .finding(RiskFindings.analysisFailed(ResourceType.PERMISSION_SET, permissionSet.getArn(),
                            permissionSet.getName(), error, "Manually review permission set policies"))
                    .build(), error);
        }
    }

    /**
     * Reports a permission set analysed on its own in the user profile shape.
     */
    public UserRiskProfile analyzePermissionSetDirectly(PermissionSetDetails permissionSet) {
        return toProfile(permissionSet, analyzePermissionSetRiskSafely(permissionSet, ORGANIZATION_ACCOUNT).getValue());
    }

    public UserRiskProfile toProfile(PermissionSetDetails permissionSet, PermissionSetRisk risk) {
        return UserRiskProfile.builder()
                .userId(permissionSet.getArn() != null ? permissionSet.getArn() : permissionSet.getName())
                .userName(permissionSet.getName())
                .displayName(permissionSet.getDescription() != null ? permissionSet.getDescription() : permissionSet.getName())
                .overallRiskScore(risk.getRiskScore())
                .riskLevel(risk.getRiskLevel())
                .findings(risk.getFindings())
                .totalPermissionSets(1)
                .adminAccess(risk.isAdminPermissions())
                .crossAccountAccess(risk.getFindings().stream()
                        .anyMatch(f -> f.getCategory() == RiskCategory.CROSS_ACCOUNT_ACCESS))
                .lastAnalyzed(Instant.now())
                .build();
    }

    public UserRiskProfile analyzeUserRisk(OrganizationUser user) {
        String userName = user.getUser() != null ? user.getUser().getUserName() : null;
        List<AccountAccess> accountAccess = user.getAccountAccess() != null ? user.getAccountAccess() : List.of();

        List<RiskFinding> findings = new ArrayList<>();
        List<AccountRiskSummary> summaries = new ArrayList<>();
        boolean adminAccess = false;
        boolean crossAccountAccess = false;

        for (AccountAccess access : accountAccess) {
            if (!access.isHasAccess()) {
                continue;
            }
            boolean external = !Objects.equals(access.getAccountId(), user.getHomeAccountId());
            crossAccountAccess |= external;

            AnalysisOutcome<AccountRiskSummary> outcome = analyzeAccountAccessSafely(user, access, external);
            AccountRiskSummary summary = outcome.getValue();
            summaries.add(summary);
            adminAccess |= summary.isAdminAccess();
            findings.addAll(summary.getFindings());
            summary.getPermissionSets().forEach(ps -> findings.addAll(ps.getFindings()));
        }

        if (adminAccess) {
            findings.add(newFinding()
                    .title("Administrative Access Detected")
                    .description("User has administrative privileges in one or more accounts")
                    .riskLevel(RiskLevel.HIGH)
                    .category(RiskCategory.ADMINISTRATIVE_ACCESS)
                    .severity(8)
                    .impact("User has broad administrative control over AWS resources")
                    .recommendation("Regularly review administrative access and consider using temporary elevated access patterns")
                    .resourceType(ResourceType.USER)
                    .resourceName(userName)
                    .details(details("adminAccess", true))
                    .build());
        }
        if (crossAccountAccess) {
            findings.add(newFinding()
                    .title("Multi-Account Access")
                    .description("User has access to multiple AWS accounts")
                    .riskLevel(RiskLevel.MEDIUM)
                    .category(RiskCategory.CROSS_ACCOUNT_ACCESS)
                    .severity(5)
                    .impact("Potential for lateral movement across account boundaries")
                    .recommendation("Implement cross-account access reviews and monitoring")
                    .resourceType(ResourceType.USER)
                    .resourceName(userName)
                    .details(details(
                            "totalAccounts", accountAccess.size(),
                            "accessibleAccounts", accountAccess.stream().filter(AccountAccess::isHasAccess).count()))
                    .build());
        }

        int overallRiskScore = summaries.stream()
                .mapToInt(AccountRiskSummary::getRiskScore)
                .max()
                .orElse(RiskCalculator.MIN_SCORE);

        return UserRiskProfile.builder()
                .userId(user.getUser() != null ? user.getUser().getUserId() : null)
                .userName(userName)
                .displayName(user.getUser() != null ? user.getUser().getDisplayName() : null)
                .overallRiskScore(overallRiskScore)
                .riskLevel(riskCalculator.levelOf(overallRiskScore))
                .findings(findings)
                .accountAccess(summaries)
                .totalPermissionSets(accountAccess.stream()
                        .mapToInt(a -> a.getPermissionSets() != null ? a.getPermissionSets().size() : 0)
                        .sum())
                .adminAccess(adminAccess)
                .crossAccountAccess(crossAccountAccess)
                .lastAnalyzed(Instant.now())
                .build();
    }

    public AnalysisOutcome<UserRiskProfile> analyzeUserRiskSafely(OrganizationUser user) {
        try {
            return AnalysisOutcome.success(analyzeUserRisk(user));
        } catch (RuntimeException e) {
            OrganizationUser.IdentityUser identity = user.getUser();
            String userName = identity != null ? identity.getUserName() : null;
            logger.error("Error analyzing risk for user {}", userName, e);
            String error = errorMessage(e);
            return AnalysisOutcome.degraded(UserRiskProfile.builder()
                    .userId(identity != null ? identity.getUserId() : null)
                    .userName(userName)
                    .displayName(identity != null ? identity.getDisplayName() : null)
                    .overallRiskScore(RiskCalculator.MIN_SCORE)
                    .riskLevel(RiskLevel.INFO)
                    .finding(RiskFindings.analysisFailed(ResourceType.USER, null, userName, error,
                            "Manually review user permissions"))
                    .lastAnalyzed(Instant.now())
                    .build(), error);
        }
    }

    private AnalysisOutcome<AccountRiskSummary> analyzeAccountAccessSafely(OrganizationUser user,
                                                                           AccountAccess access,
                                                                           boolean external) {
        String accountName = access.getAccountName() != null ? access.getAccountName() : access.getAccountId();
        try {
            return AnalysisOutcome.success(analyzeAccountAccess(user, access, accountName, external));
        } catch (RuntimeException e) {
            logger.error("Error analyzing access to account {}", access.getAccountId(), e);
            String error = errorMessage(e);
            return AnalysisOutcome.degraded(AccountRiskSummary.builder()
                    .accountId(access.getAccountId())
                    .accountName(accountName)
                    .riskScore(RiskCalculator.MIN_SCORE)
                    .riskLevel(RiskLevel.INFO)
                    .finding(RiskFindings.analysisFailed(ResourceType.ACCOUNT, null, accountName, error,
                            "Manually review account assignments"))
                    .build(), error);
        }
    }

    private AccountRiskSummary analyzeAccountAccess(OrganizationUser user, AccountAccess access,
                                                    String accountName, boolean external) {
        List<RiskFinding> accountFindings = new ArrayList<>();
        if (external) {
            accountFindings.add(newFinding()
                    .title("Cross-Account Access Detected")
                    .description("User has access to account " + access.getAccountId()
                            + " which is different from their home account " + user.getHomeAccountId())
                    .riskLevel(RiskLevel.MEDIUM)
                    .category(RiskCategory.CROSS_ACCOUNT_ACCESS)
                    .severity(6)
                    .impact("User can access resources across multiple AWS accounts")
                    .recommendation("Review cross-account access necessity and ensure principle of least privilege")
                    .resourceType(ResourceType.ACCOUNT)
                    .resourceArn(null)
                    .resourceName(accountName)
                    .details(details(
                            "homeAccountId", user.getHomeAccountId(),
                            "accessAccountId", access.getAccountId(),
                            "accessType", access.getAccessType()))
                    .build());
        }

        List<PermissionSetRisk> permissionSetRisks = new ArrayList<>();
        if (access.getPermissionSets() != null) {
            for (PermissionSetDetails permissionSet : access.getPermissionSets()) {
                permissionSetRisks.add(analyzePermissionSetRiskSafely(permissionSet, access.getAccountId()).getValue());
            }
        }

        int riskScore = riskCalculator.scoreAccount(permissionSetRisks, accountFindings);
        return AccountRiskSummary.builder()
                .accountId(access.getAccountId())
                .accountName(accountName)
                .riskScore(riskScore)
                .riskLevel(riskCalculator.levelOf(riskScore))
                .findings(accountFindings)
                .permissionSets(permissionSetRisks)
                .adminAccess(permissionSetRisks.stream().anyMatch(PermissionSetRisk::isAdminPermissions))
                .build();
    }

    private static String errorMessage(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
