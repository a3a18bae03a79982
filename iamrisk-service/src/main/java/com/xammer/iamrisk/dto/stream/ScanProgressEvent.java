package com.xammer.iamrisk.dto.stream;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
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
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ScanProgressEvent extends ScanEvent {
    public static final String STEP_INITIALIZATION = "initialization";
    public static final String STEP_ANALYZING = "analyzing";

    private Integer currentIndex;
    private Integer totalCount;
    private String permissionSetName;
    private String message;
    private String currentStep;
    private Integer progress;

    @Override
    public ScanEventType getType() {
        return ScanEventType.PROGRESS;
    }
}
