package com.xammer.iamrisk.dto.risk;

public enum ResourceType {
    USER,
    PERMISSION_SET,
    POLICY,
    ACCOUNT
}
