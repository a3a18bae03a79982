package com.xammer.iamrisk.dto.risk;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * Aggregate risk profile of a user. Permission sets analysed on their own are reported in
 * the same shape so that stream and batch consumers handle a single record type.
 */
@Value
@Builder
@Jacksonized
public class UserRiskProfile {
    String userId;
    String userName;
    String displayName;
    int overallRiskScore;
    RiskLevel riskLevel;
    @Singular
    List<RiskFinding> findings;
    @Singular("account")
    List<AccountRiskSummary> accountAccess;
    int totalPermissionSets;
    boolean adminAccess;
    boolean crossAccountAccess;
    /**
     * Always {@code null}: usage-based detection is not performed.
     */
    Integer unusedPermissions;
    Instant lastAnalyzed;
}
