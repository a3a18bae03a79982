package com.xammer.iamrisk.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.xammer.iamrisk.dto.risk.UserRiskProfile;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Batch analysis response. Exactly one of the profile lists is populated, depending on
 * the requested analysis type.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RiskAnalysisResponse {
    private List<UserRiskProfile> permissionSetRiskProfiles;
    private List<UserRiskProfile> userRiskProfiles;
    private ScanSummary summary;
    private Instant analyzedAt;
}
