package com.xammer.iamrisk.dto.stream;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.xammer.iamrisk.dto.ScanSummary;
import com.xammer.iamrisk.dto.risk.UserRiskProfile;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@EqualsAndHashCode(callSuper = false)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ScanCompleteEvent extends ScanEvent {
    private ScanSummary summary;
    private List<UserRiskProfile> allResults;
    private String message;

    @Override
    public ScanEventType getType() {
        return ScanEventType.COMPLETE;
    }
}
