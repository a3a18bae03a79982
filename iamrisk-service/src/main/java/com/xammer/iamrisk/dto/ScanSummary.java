package com.xammer.iamrisk.dto;

import com.xammer.iamrisk.dto.risk.RiskLevel;
import com.xammer.iamrisk.dto.risk.UserRiskProfile;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScanSummary {
    private int totalAnalyzed;
    private int criticalCount;
    private int highRiskCount;
    private int adminCount;
    private int crossAccountCount;
    private double averageRiskScore;
    private int totalFindings;

    /**
     * Summarises a list of profiles. {@code highRiskCount} includes critical profiles and the
     * average is rounded to one decimal place.
     */
    public static ScanSummary of(List<UserRiskProfile> profiles) {
        double average = profiles.isEmpty() ? 0
                : profiles.stream().mapToInt(UserRiskProfile::getOverallRiskScore).average().orElse(0);
        return ScanSummary.builder()
                .totalAnalyzed(profiles.size())
                .criticalCount((int) profiles.stream().filter(p -> p.getRiskLevel() == RiskLevel.CRITICAL).count())
                .highRiskCount((int) profiles.stream().filter(p -> p.getRiskLevel().isAtLeast(RiskLevel.HIGH)).count())
                .adminCount((int) profiles.stream().filter(UserRiskProfile::isAdminAccess).count())
                .crossAccountCount((int) profiles.stream().filter(UserRiskProfile::isCrossAccountAccess).count())
                .averageRiskScore(Math.round(average * 10) / 10.0)
                .totalFindings(profiles.stream().mapToInt(p -> p.getFindings().size()).sum())
                .build();
    }
}
