package com.xammer.iamrisk.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScanProgress {
    private int currentIndex;
    private int totalCount;
    private String permissionSetName;
    private String message;
    private String currentStep;
    private int progress;
}
