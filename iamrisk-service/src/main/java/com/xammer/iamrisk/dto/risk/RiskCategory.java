package com.xammer.iamrisk.dto.risk;

public enum RiskCategory {
    OVERLY_PERMISSIVE,
    PRIVILEGE_ESCALATION,
    DATA_EXPOSURE,
    SECURITY_MISCONFIGURATION,
    COMPLIANCE_VIOLATION,
    UNUSED_PERMISSIONS,
    ADMINISTRATIVE_ACCESS,
    CROSS_ACCOUNT_ACCESS,
    SERVICE_SPECIFIC
}
