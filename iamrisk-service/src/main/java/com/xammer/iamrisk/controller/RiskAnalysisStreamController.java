package com.xammer.iamrisk.controller;

import com.xammer.iamrisk.domain.ScanSession;
import com.xammer.iamrisk.dto.AwsRequestCredentials;
import com.xammer.iamrisk.dto.ScanStreamRequest;
import com.xammer.iamrisk.exception.InvalidScanRequestException;
import com.xammer.iamrisk.exception.ScanAlreadyRunningException;
import com.xammer.iamrisk.security.RequestCredentialsResolver;
import com.xammer.iamrisk.service.RiskScanService;
import com.xammer.iamrisk.service.session.ScanSessionEventApplier;
import com.xammer.iamrisk.service.session.ScanSessionRecorder;
import com.xammer.iamrisk.service.session.ScanSessionStore;
import com.xammer.iamrisk.stream.EmitterScanEventSink;
import com.xammer.iamrisk.stream.ScanCancellation;
import com.xammer.iamrisk.stream.ScanEventCodec;
import com.xammer.iamrisk.stream.ScanEventSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.ResponseBodyEmitter;

import java.util.concurrent.Executor;

@RestController
@RequestMapping("/api/risk-analysis")
public class RiskAnalysisStreamController {

    private static final Logger logger = LoggerFactory.getLogger(RiskAnalysisStreamController.class);

    private final RiskScanService riskScanService;
    private final ScanEventCodec codec;
    private final ScanSessionStore sessionStore;
    private final ScanSessionEventApplier eventApplier;
    private final RequestCredentialsResolver credentialsResolver;
    private final Executor riskScanExecutor;

    @Value("${risk.scan.emitter-timeout-ms:1800000}")
    private long emitterTimeoutMs;

    public RiskAnalysisStreamController(RiskScanService riskScanService,
                                        ScanEventCodec codec,
                                        ScanSessionStore sessionStore,
                                        ScanSessionEventApplier eventApplier,
                                        RequestCredentialsResolver credentialsResolver,
                                        @Qualifier("riskScanTaskExecutor") Executor riskScanExecutor) {
        this.riskScanService = riskScanService;
        this.codec = codec;
        this.sessionStore = sessionStore;
        this.eventApplier = eventApplier;
        this.credentialsResolver = credentialsResolver;
        this.riskScanExecutor = riskScanExecutor;
    }

    /**
     * Streams a permission set scan as Server-Sent Events. When the request names a session,
     * the scan is recorded there and keeps running if the client disconnects.
     */
    @PostMapping("/stream")
    public ResponseEntity<ResponseBodyEmitter> streamRiskAnalysis(
            @RequestBody(required = false) ScanStreamRequest request,
            @RequestHeader HttpHeaders headers) {
        if (request == null) {
            throw new InvalidScanRequestException("Invalid request body");
        }
        if (request.getPermissionSets() == null || request.getPermissionSets().isEmpty()) {
            throw new InvalidScanRequestException("Permission sets array is required");
        }
        AwsRequestCredentials credentials = credentialsResolver.require(headers);

        ResponseBodyEmitter emitter = new ResponseBodyEmitter(emitterTimeoutMs);
        ScanCancellation cancellation = new ScanCancellation();
        EmitterScanEventSink emitterSink = new EmitterScanEventSink(emitter, codec);
        ScanEventSink sink;
        if (request.getSessionId() != null) {
            ScanSession session = sessionStore.getSession(request.getSessionId())
                    .filter(ScanSession::isActive)
                    .orElseThrow(() -> new InvalidScanRequestException(
                            "Unknown or finished scan session: " + request.getSessionId()));
            if (!ScanSessionStore.isSameScan(session, request.getPermissionSets(),
                    request.getRegion(), request.getSsoRegion())) {
                throw new InvalidScanRequestException(
                        "Stream request does not match the targets of scan session " + session.getId());
            }
            if (!sessionStore.attachRecorder(session.getId())) {
                throw new ScanAlreadyRunningException(session.getId(),
                        "Scan session " + session.getId() + " is already being recorded");
            }
            sink = new ScanSessionRecorder(sessionStore, eventApplier, session.getId(), emitterSink);
        } else {
            sink = emitterSink.cancelOnDisconnect(cancellation);
        }

        logger.info("Streaming risk analysis of {} permission sets (region={}, ssoRegion={}, session={})",
                request.getPermissionSets().size(), request.getRegion(), request.getSsoRegion(), request.getSessionId());
        riskScanExecutor.execute(() -> riskScanService.runScan(request, credentials, sink, cancellation));

        return ResponseEntity.ok()
                .contentType(MediaType.TEXT_EVENT_STREAM)
                .header(HttpHeaders.CACHE_CONTROL, "no-cache")
                .header("X-Accel-Buffering", "no")
                .body(emitter);
    }
}
