package com.xammer.iamrisk.service.risk;

import com.xammer.iamrisk.dto.risk.PermissionSetRisk;
import com.xammer.iamrisk.dto.risk.RiskFinding;
import com.xammer.iamrisk.dto.risk.RiskLevel;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Pure scoring functions. Every score returned lies in [{@link #MIN_SCORE}, {@link #MAX_SCORE}].
 */
@Component
public class RiskCalculator {

    public static final int MIN_SCORE = 1;
    public static final int MAX_SCORE = 10;

    public int scorePermissionSet(boolean adminPermissions,
                                  int wildcardActions,
                                  int sensitiveServicesCount,
                                  int findingsCount,
                                  int highSeverityFindingsCount) {
        double score = 1;
        if (adminPermissions) {
            score += 6;
        }
        score += Math.min(wildcardActions * 1.5, 3);
        score += Math.min(sensitiveServicesCount * 0.5, 2);
        score += Math.min(findingsCount * 0.3, 2);
        score += Math.min(highSeverityFindingsCount * 0.8, 3);
        return clamp(Math.round(score));
    }

    public int scoreAccount(List<PermissionSetRisk> permissionSetRisks, List<RiskFinding> accountFindings) {
        if (permissionSetRisks.isEmpty()) {
            return MIN_SCORE;
        }
        int max = permissionSetRisks.stream().mapToInt(PermissionSetRisk::getRiskScore).max().orElse(MIN_SCORE);
        double avg = permissionSetRisks.stream().mapToInt(PermissionSetRisk::getRiskScore).average().orElse(MIN_SCORE);
        double findingsImpact = Math.min(accountFindings.size() * 0.5, 2);
        return clamp(Math.round(max * 0.7 + avg * 0.2 + findingsImpact));
    }

    public RiskLevel levelOf(int score) {
        if (score >= 9) {
            return RiskLevel.CRITICAL;
        }
        if (score >= 7) {
            return RiskLevel.HIGH;
        }
        if (score >= 5) {
            return RiskLevel.MEDIUM;
        }
        if (score >= 3) {
            return RiskLevel.LOW;
        }
        return RiskLevel.INFO;
    }

    public int clamp(long score) {
        return (int) Math.max(MIN_SCORE, Math.min(MAX_SCORE, score));
    }
}
