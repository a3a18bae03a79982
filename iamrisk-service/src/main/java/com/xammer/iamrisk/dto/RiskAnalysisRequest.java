package com.xammer.iamrisk.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RiskAnalysisRequest {
    public static final String PERMISSION_SETS = "permission-sets";

    private String analysisType;
    private List<OrganizationUser> users;
    private List<PermissionSetDetails> permissionSets;
    private String region;
    private String ssoRegion;

    public boolean isPermissionSetAnalysis() {
        return PERMISSION_SETS.equals(analysisType);
    }
}
