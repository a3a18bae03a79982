package com.xammer.iamrisk.dto.risk;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Map;

/**
 * A single classified observation about a policy, permission set, account or user.
 * Instances are immutable; {@code id} is unique per instance.
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RiskFinding {
    String id;
    String title;
    String description;
    RiskLevel riskLevel;
    RiskCategory category;
    int severity;
    String impact;
    String recommendation;
    ResourceType resourceType;
    String resourceArn;
    String resourceName;
    Map<String, Object> details;
    Instant createdAt;
}
