package com.xammer.iamrisk.dto.risk;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;

@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PolicyAnalysisResult {
    String policyArn;
    String policyName;
    JsonNode parsedDocument;
    @Singular
    List<RiskFinding> findings;
    int permissionsCount;
    int wildcardActionsCount;
    boolean adminPermissions;
    boolean crossAccountAccess;
    @Singular
    List<String> dataAccessPermissions;
    @Singular
    Map<String, List<String>> servicePermissions;
}
