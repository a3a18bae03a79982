package com.xammer.iamrisk.dto;

import com.xammer.iamrisk.dto.risk.RiskCategory;
import com.xammer.iamrisk.dto.risk.RiskLevel;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AnalyzerCapabilities {
    private String name;
    private String version;
    private String description;
    private List<String> capabilities;
    private List<RiskCategory> riskCategories;
    private List<RiskLevel> riskLevels;
}
