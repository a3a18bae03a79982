package com.xammer.iamrisk.controller;

import com.xammer.iamrisk.domain.ScanSession;
import com.xammer.iamrisk.dto.AwsRequestCredentials;
import com.xammer.iamrisk.dto.ScanStreamRequest;
import com.xammer.iamrisk.dto.StartScanRequest;
import com.xammer.iamrisk.exception.InvalidScanRequestException;
import com.xammer.iamrisk.security.RequestCredentialsResolver;
import com.xammer.iamrisk.service.RiskScanStreamClient;
import com.xammer.iamrisk.service.session.ScanSessionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.concurrent.Executor;

/**
 * Runs a scan on the configured remote scanner and mirrors its stream into a local session,
 * which clients then follow through the session endpoints.
 */
@RestController
@RequestMapping("/api/risk-analysis/sessions")
public class RemoteScanController {

    private static final Logger logger = LoggerFactory.getLogger(RemoteScanController.class);

    private final RiskScanStreamClient streamClient;
    private final ScanSessionStore sessionStore;
    private final RequestCredentialsResolver credentialsResolver;
    private final Executor riskScanExecutor;

    @Value("${risk.stream-client.base-url:}")
    private String remoteBaseUrl;

    public RemoteScanController(RiskScanStreamClient streamClient,
                                ScanSessionStore sessionStore,
                                RequestCredentialsResolver credentialsResolver,
                                @Qualifier("riskScanTaskExecutor") Executor riskScanExecutor) {
        this.streamClient = streamClient;
        this.sessionStore = sessionStore;
        this.credentialsResolver = credentialsResolver;
        this.riskScanExecutor = riskScanExecutor;
    }

    @PostMapping("/remote")
    public ResponseEntity<ScanSession> startRemoteScan(@RequestBody StartScanRequest request,
                                                       @RequestParam(defaultValue = ScanSessionStore.DEFAULT_SCOPE) String scope,
                                                       @RequestHeader HttpHeaders headers) {
        if (remoteBaseUrl == null || remoteBaseUrl.isBlank()) {
            throw new InvalidScanRequestException("No remote scanner is configured");
        }
        if (request.getPermissionSets() == null || request.getPermissionSets().isEmpty()) {
            throw new InvalidScanRequestException("Permission sets array is required");
        }
        AwsRequestCredentials credentials = credentialsResolver.require(headers);
        ScanStreamRequest streamRequest = ScanStreamRequest.builder()
                .permissionSets(request.getPermissionSets())
                .region(request.getRegion())
                .ssoRegion(request.getSsoRegion())
                .build();

        String sessionId = streamClient.startSession(scope, streamRequest);
        logger.info("Following remote scan at {} into session {}", remoteBaseUrl, sessionId);
        riskScanExecutor.execute(() -> streamClient.follow(remoteBaseUrl, sessionId, streamRequest, credentials));

        return sessionStore.getSession(sessionId)
                .map(session -> ResponseEntity.status(HttpStatus.ACCEPTED).body(session))
                .orElseGet(() -> ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).build());
    }
}
