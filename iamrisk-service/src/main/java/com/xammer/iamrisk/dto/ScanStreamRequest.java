package com.xammer.iamrisk.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Body of a streaming scan request. {@code sessionId} optionally names a session in the
 * scan session store that should record the stream.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ScanStreamRequest {
    private List<PermissionSetDetails> permissionSets;
    private String region;
    private String ssoRegion;
    private String sessionId;
}
