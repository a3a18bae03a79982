package com.xammer.iamrisk.dto.risk;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AccountRiskSummary {
    String accountId;
    String accountName;
    int riskScore;
    RiskLevel riskLevel;
    @Singular
    List<RiskFinding> findings;
    @Singular
    List<PermissionSetRisk> permissionSets;
    boolean adminAccess;
}
