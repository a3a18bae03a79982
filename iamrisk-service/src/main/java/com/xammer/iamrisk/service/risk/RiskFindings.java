package com.xammer.iamrisk.service.risk;

import com.xammer.iamrisk.dto.risk.ResourceType;
import com.xammer.iamrisk.dto.risk.RiskCategory;
import com.xammer.iamrisk.dto.risk.RiskFinding;
import com.xammer.iamrisk.dto.risk.RiskLevel;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

final class RiskFindings {

    static final String ANALYSIS_FAILED_TITLE = "Risk Analysis Failed";

    private RiskFindings() {
    }

    static RiskFinding.RiskFindingBuilder newFinding() {
        return RiskFinding.builder()
                .id("finding-" + UUID.randomUUID())
                .createdAt(Instant.now());
    }

    /**
     * Builds an unmodifiable details map from alternating keys and values, skipping null values.
     */
    static Map<String, Object> details(Object... keysAndValues) {
        Map<String, Object> details = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keysAndValues.length; i += 2) {
            if (keysAndValues[i + 1] != null) {
                details.put(String.valueOf(keysAndValues[i]), keysAndValues[i + 1]);
            }
        }
        return Collections.unmodifiableMap(details);
    }

    static RiskFinding analysisFailed(ResourceType resourceType, String resourceArn, String resourceName,
                                      String error, String recommendation) {
        return newFinding()
                .title(ANALYSIS_FAILED_TITLE)
                .description("Unable to complete risk analysis for this " + describe(resourceType))
                .riskLevel(RiskLevel.INFO)
                .category(RiskCategory.SECURITY_MISCONFIGURATION)
                .severity(1)
                .impact("Risk assessment incomplete")
                .recommendation(recommendation)
                .resourceType(resourceType)
                .resourceArn(resourceArn)
                .resourceName(resourceName)
                .details(details("error", error))
                .build();
    }

    private static String describe(ResourceType resourceType) {
        switch (resourceType) {
            case USER:
                return "user";
            case ACCOUNT:
                return "account";
            case POLICY:
                return "policy";
            default:
                return "permission set";
        }
    }
}
