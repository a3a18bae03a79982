package com.xammer.iamrisk.controller;

import com.xammer.iamrisk.dto.AnalyzerCapabilities;
import com.xammer.iamrisk.dto.RiskAnalysisRequest;
import com.xammer.iamrisk.dto.RiskAnalysisResponse;
import com.xammer.iamrisk.exception.InvalidScanRequestException;
import com.xammer.iamrisk.security.RequestCredentialsResolver;
import com.xammer.iamrisk.service.RiskAnalysisService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/risk-analysis")
public class RiskAnalysisController {

    private static final Logger logger = LoggerFactory.getLogger(RiskAnalysisController.class);

    private final RiskAnalysisService riskAnalysisService;
    private final RequestCredentialsResolver credentialsResolver;

    public RiskAnalysisController(RiskAnalysisService riskAnalysisService,
                                  RequestCredentialsResolver credentialsResolver) {
        this.riskAnalysisService = riskAnalysisService;
        this.credentialsResolver = credentialsResolver;
    }

    @PostMapping
    public ResponseEntity<RiskAnalysisResponse> analyze(@RequestBody(required = false) RiskAnalysisRequest request,
                                                        @RequestHeader HttpHeaders headers) {
        if (request == null) {
            throw new InvalidScanRequestException("Invalid request body");
        }
        logger.info("Batch risk analysis requested, type={}", request.getAnalysisType());
        return ResponseEntity.ok(riskAnalysisService.analyze(request, credentialsResolver.resolve(headers).orElse(null)));
    }

    @GetMapping
    public ResponseEntity<AnalyzerCapabilities> getCapabilities() {
        return ResponseEntity.ok(riskAnalysisService.getCapabilities());
    }
}
