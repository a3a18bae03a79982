package com.xammer.iamrisk.service;

import com.xammer.iamrisk.dto.AccountAccess;
import com.xammer.iamrisk.dto.AnalyzerCapabilities;
import com.xammer.iamrisk.dto.AwsRequestCredentials;
import com.xammer.iamrisk.dto.OrganizationUser;
import com.xammer.iamrisk.dto.PermissionSetDetails;
import com.xammer.iamrisk.dto.RiskAnalysisRequest;
import com.xammer.iamrisk.dto.RiskAnalysisResponse;
import com.xammer.iamrisk.dto.ScanSummary;
import com.xammer.iamrisk.dto.risk.RiskCategory;
import com.xammer.iamrisk.dto.risk.RiskLevel;
import com.xammer.iamrisk.dto.risk.UserRiskProfile;
import com.xammer.iamrisk.exception.InvalidScanRequestException;
import com.xammer.iamrisk.service.risk.AnalysisOutcome;
import com.xammer.iamrisk.service.risk.RiskAnalyzer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Non-streaming analysis of a whole request, either of permission sets or of users with
 * their account assignments.
 */
@Service
public class RiskAnalysisService {

    private static final Logger logger = LoggerFactory.getLogger(RiskAnalysisService.class);

    static final List<String> CAPABILITIES = List.of(
            "Permission set risk analysis",
            "Cross-account access detection",
            "Administrative privilege identification",
            "Policy overpermission detection",
            "Privilege escalation risk assessment",
            "Data exposure risk evaluation");

    private final RiskAnalyzer riskAnalyzer;
    private final PermissionSetDetailsService permissionSetDetailsService;

    public RiskAnalysisService(RiskAnalyzer riskAnalyzer, PermissionSetDetailsService permissionSetDetailsService) {
        this.riskAnalyzer = riskAnalyzer;
        this.permissionSetDetailsService = permissionSetDetailsService;
    }

    public RiskAnalysisResponse analyze(RiskAnalysisRequest request, AwsRequestCredentials credentials) {
        if (request.isPermissionSetAnalysis()) {
            return analyzePermissionSets(request, credentials);
        }
        return analyzeUsers(request, credentials);
    }

    public RiskAnalysisResponse analyzePermissionSets(RiskAnalysisRequest request, AwsRequestCredentials credentials) {
        if (request.getPermissionSets() == null) {
            throw new InvalidScanRequestException("Permission sets array is required for permission set analysis");
        }
        logger.info("Analyzing risk for {} permission sets (region={}, ssoRegion={})",
                request.getPermissionSets().size(), request.getRegion(), request.getSsoRegion());

        Map<String, PermissionSetDetails> enriched = enrichAll(request.getPermissionSets(), credentials, request);
        List<UserRiskProfile> profiles = new ArrayList<>();
        for (PermissionSetDetails permissionSet : request.getPermissionSets()) {
            PermissionSetDetails target = Optional.ofNullable(permissionSet.getArn())
                    .map(enriched::get)
                    .orElse(permissionSet);
            profiles.add(riskAnalyzer.analyzePermissionSetDirectly(target));
        }

        return RiskAnalysisResponse.builder()
                .permissionSetRiskProfiles(profiles)
                .summary(ScanSummary.of(profiles))
                .analyzedAt(Instant.now())
                .build();
    }

    public RiskAnalysisResponse analyzeUsers(RiskAnalysisRequest request, AwsRequestCredentials credentials) {
        if (request.getUsers() == null) {
            throw new InvalidScanRequestException("Users array is required for user-based analysis");
        }
        List<OrganizationUser> usersWithAccess = request.getUsers().stream()
                .filter(OrganizationUser::hasAccountAccessData)
                .collect(Collectors.toList());
        if (usersWithAccess.isEmpty()) {
            throw new InvalidScanRequestException("No user access data available for risk analysis. "
                    + "Ensure users have been loaded with their account access information.");
        }
        logger.info("Found {} users with account access data to analyze", usersWithAccess.size());

        Map<String, PermissionSetDetails> unique = new LinkedHashMap<>();
        for (OrganizationUser user : usersWithAccess) {
            for (AccountAccess access : user.getAccountAccess()) {
                if (access.isHasAccess() && access.getPermissionSets() != null) {
                    access.getPermissionSets().stream()
                            .filter(ps -> ps.getArn() != null)
                            .forEach(ps -> unique.putIfAbsent(ps.getArn(), ps));
                }
            }
        }
        logger.info("Found {} unique permission sets to analyze", unique.size());
        Map<String, PermissionSetDetails> enriched = enrichAll(new ArrayList<>(unique.values()), credentials, request);

        List<UserRiskProfile> profiles = new ArrayList<>();
        for (OrganizationUser user : usersWithAccess) {
            AnalysisOutcome<UserRiskProfile> outcome =
                    riskAnalyzer.analyzeUserRiskSafely(withEnrichedPermissionSets(user, enriched));
            if (outcome.isDegraded()) {
                logger.warn("Analysis of user {} degraded: {}",
                        user.getUser() != null ? user.getUser().getUserName() : null, outcome.getDegradedReason());
            }
            profiles.add(outcome.getValue());
        }

        return RiskAnalysisResponse.builder()
                .userRiskProfiles(profiles)
                .summary(ScanSummary.of(profiles))
                .analyzedAt(Instant.now())
                .build();
    }

    public AnalyzerCapabilities getCapabilities() {
        return new AnalyzerCapabilities(
                "IAM Risk Analyzer",
                "1.0.0",
                "Analyzes IAM permissions for security risks and compliance violations",
                CAPABILITIES,
                Arrays.asList(RiskCategory.values()),
                Arrays.asList(RiskLevel.values()));
    }

    /**
     * Fetches live details once per ARN. Items that cannot be enriched are left out of the
     * returned map so callers keep the request data for them.
     */
    private Map<String, PermissionSetDetails> enrichAll(List<PermissionSetDetails> permissionSets,
                                                        AwsRequestCredentials credentials,
                                                        RiskAnalysisRequest request) {
        Map<String, PermissionSetDetails> enriched = new LinkedHashMap<>();
        List<PermissionSetDetails> withArn = permissionSets.stream()
                .filter(ps -> ps.getArn() != null)
                .collect(Collectors.toList());
        if (withArn.isEmpty()) {
            return enriched;
        }
        String region = request.getSsoRegion() != null ? request.getSsoRegion() : request.getRegion();
        try (PermissionSetSource source = permissionSetDetailsService.open(credentials, region)) {
            Optional<String> instanceArn = source.resolveInstanceArn(withArn.get(0).getArn());
            if (instanceArn.isEmpty()) {
                logger.warn("No SSO instance found - risk analysis will use basic permission set data only");
                return enriched;
            }
            for (PermissionSetDetails permissionSet : withArn) {
                try {
                    enriched.put(permissionSet.getArn(), source.enrich(instanceArn.get(), permissionSet));
                } catch (RuntimeException e) {
                    logger.warn("Failed to get details for permission set {}: {}", permissionSet.getArn(), e.getMessage());
                }
            }
        } catch (RuntimeException e) {
            logger.warn("Permission set enrichment unavailable, using request data: {}", e.getMessage());
        }
        logger.info("Enriched {} of {} permission sets", enriched.size(), withArn.size());
        return enriched;
    }

    private static OrganizationUser withEnrichedPermissionSets(OrganizationUser user,
                                                               Map<String, PermissionSetDetails> enriched) {
        List<AccountAccess> accounts = new ArrayList<>();
        for (AccountAccess access : user.getAccountAccess()) {
            if (!access.isHasAccess() || access.getPermissionSets() == null) {
                accounts.add(access);
                continue;
            }
            List<PermissionSetDetails> permissionSets = access.getPermissionSets().stream()
                    .map(ps -> ps.getArn() != null ? enriched.getOrDefault(ps.getArn(), ps) : ps)
                    .collect(Collectors.toList());
            accounts.add(access.toBuilder().permissionSets(permissionSets).build());
        }
        return new OrganizationUser(user.getUser(), user.getHomeAccountId(), accounts);
    }
}
