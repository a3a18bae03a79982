package com.xammer.iamrisk.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.xammer.iamrisk.domain.ScanSession;
import com.xammer.iamrisk.dto.AwsRequestCredentials;
import com.xammer.iamrisk.dto.ScanStreamRequest;
import com.xammer.iamrisk.dto.stream.ScanEvent;
import com.xammer.iamrisk.exception.ScanAlreadyRunningException;
import com.xammer.iamrisk.security.RequestCredentialsResolver;
import com.xammer.iamrisk.service.session.ScanSessionEventApplier;
import com.xammer.iamrisk.service.session.ScanSessionStore;
import com.xammer.iamrisk.stream.ScanEventCodec;
import com.xammer.iamrisk.stream.ScanEventParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Consumes the scan stream of a remote service and mirrors it into a local session, so the
 * scan can be followed through the session store.
 */
@Service
public class RiskScanStreamClient {

    private static final Logger logger = LoggerFactory.getLogger(RiskScanStreamClient.class);

    static final String STREAM_PATH = "/api/risk-analysis/stream";

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final ScanEventCodec codec;
    private final ScanSessionStore sessionStore;
    private final ScanSessionEventApplier eventApplier;

    public RiskScanStreamClient(@Qualifier("riskStreamRestTemplate") RestTemplate restTemplate,
                                ObjectMapper objectMapper,
                                ScanEventCodec codec,
                                ScanSessionStore sessionStore,
                                ScanSessionEventApplier eventApplier) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.codec = codec;
        this.sessionStore = sessionStore;
        this.eventApplier = eventApplier;
    }

    /**
     * Starts a session in {@code scope} and follows the remote scan until it ends. Blocks
     * for the duration of the scan.
     *
     * @return the id of the session holding the results
     * @throws ScanAlreadyRunningException when the scope already runs the same scan
     */
    public String scan(String baseUrl, String scope, ScanStreamRequest request, AwsRequestCredentials credentials) {
        String sessionId = startSession(scope, request);
        follow(baseUrl, sessionId, request, credentials);
        return sessionId;
    }

    /**
     * Opens the local session a remote scan will be mirrored into.
     *
     * @throws ScanAlreadyRunningException when the scope already runs the same scan
     */
    public String startSession(String scope, ScanStreamRequest request) {
        if (!sessionStore.canStartNewScan(scope, request.getPermissionSets(), request.getRegion(), request.getSsoRegion())) {
            throw new ScanAlreadyRunningException(
                    sessionStore.getCurrentSession(scope).map(ScanSession::getId).orElse(null));
        }
        return sessionStore.startNewScan(scope, request.getPermissionSets(),
                request.getRegion(), request.getSsoRegion());
    }

    /**
     * Reads the remote stream into an existing session. End of stream completes the session
     * and a transport failure marks it as failed.
     */
    public void follow(String baseUrl, String sessionId, ScanStreamRequest request, AwsRequestCredentials credentials) {
        ScanStreamRequest remoteRequest = ScanStreamRequest.builder()
                .permissionSets(request.getPermissionSets())
                .region(request.getRegion())
                .ssoRegion(request.getSsoRegion())
                .build();
        try {
            int received = restTemplate.execute(baseUrl + STREAM_PATH, HttpMethod.POST,
                    clientRequest -> {
                        HttpHeaders headers = clientRequest.getHeaders();
                        headers.setContentType(MediaType.APPLICATION_JSON);
                        headers.setAccept(List.of(MediaType.TEXT_EVENT_STREAM, MediaType.APPLICATION_JSON));
                        if (credentials != null) {
                            headers.set(RequestCredentialsResolver.ACCESS_KEY_ID_HEADER, credentials.getAccessKeyId());
                            headers.set(RequestCredentialsResolver.SECRET_ACCESS_KEY_HEADER, credentials.getSecretAccessKey());
                            if (credentials.getSessionToken() != null) {
                                headers.set(RequestCredentialsResolver.SESSION_TOKEN_HEADER, credentials.getSessionToken());
                            }
                        }
                        objectMapper.writeValue(clientRequest.getBody(), remoteRequest);
                    },
                    response -> {
                        ScanEventParser parser = codec.newParser();
                        int count = 0;
                        try (Reader reader = new InputStreamReader(response.getBody(), StandardCharsets.UTF_8)) {
                            char[] buffer = new char[4096];
                            int read;
                            while ((read = reader.read(buffer)) != -1) {
                                count += apply(sessionId, parser.feed(new String(buffer, 0, read)));
                            }
                        }
                        return count + apply(sessionId, parser.finish());
                    });
            logger.info("Remote scan stream for session {} ended after {} events", sessionId, received);
            sessionStore.completeScan(sessionId);
        } catch (RestClientException e) {
            logger.error("Reading remote scan stream for session {} failed: {}", sessionId, e.getMessage());
            sessionStore.setError(sessionId, e.getMessage());
        }
    }

    private int apply(String sessionId, List<ScanEvent> events) {
        for (ScanEvent event : events) {
            logger.debug("Applying {} event to session {}", event.getType().getWireName(), sessionId);
            eventApplier.apply(sessionId, event);
        }
        return events.size();
    }
}
