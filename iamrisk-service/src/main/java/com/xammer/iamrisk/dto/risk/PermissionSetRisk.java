package com.xammer.iamrisk.dto.risk;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Set;

@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PermissionSetRisk {
    String arn;
    String name;
    int riskScore;
    RiskLevel riskLevel;
    @Singular
    List<RiskFinding> findings;
    @Singular
    List<PolicyAnalysisResult> policyAnalyses;
    boolean adminPermissions;
    int wildcardActions;
    @Singular
    Set<String> sensitiveServices;
}
