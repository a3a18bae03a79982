package com.xammer.iamrisk.dto.stream;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.xammer.iamrisk.dto.risk.UserRiskProfile;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

@Data
@Builder
@EqualsAndHashCode(callSuper = false)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ScanResultEvent extends ScanEvent {
    private UserRiskProfile permissionSet;
    private int index;
    private int completedCount;
    private int totalCount;
    private int progress;
    private String message;
    private String currentStep;

    @Override
    public ScanEventType getType() {
        return ScanEventType.RESULT;
    }
}
