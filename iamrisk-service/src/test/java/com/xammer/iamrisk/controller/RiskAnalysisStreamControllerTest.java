package com.xammer.iamrisk.controller;

import com.xammer.iamrisk.domain.ScanSession;
import com.xammer.iamrisk.dto.PermissionSetDetails;
import com.xammer.iamrisk.dto.ScanStreamRequest;
import com.xammer.iamrisk.dto.ScanSummary;
import com.xammer.iamrisk.dto.risk.RiskLevel;
import com.xammer.iamrisk.dto.risk.UserRiskProfile;
import com.xammer.iamrisk.dto.stream.ScanCompleteEvent;
import com.xammer.iamrisk.dto.stream.ScanResultEvent;
import com.xammer.iamrisk.dto.stream.ScanStartEvent;
import com.xammer.iamrisk.repository.InMemoryScanSessionRepository;
import com.xammer.iamrisk.security.RequestCredentialsResolver;
import com.xammer.iamrisk.service.RiskScanService;
import com.xammer.iamrisk.service.session.ScanSessionEventApplier;
import com.xammer.iamrisk.service.session.ScanSessionStore;
import com.xammer.iamrisk.stream.ScanEventCodec;
import com.xammer.iamrisk.stream.ScanEventSink;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.core.task.SyncTaskExecutor;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executor;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(RiskAnalysisStreamController.class)
@Import({ScanEventCodec.class, RequestCredentialsResolver.class, ScanSessionEventApplier.class})
class RiskAnalysisStreamControllerTest {

    private static final String ARN = "arn:aws:sso:::permissionSet/ssoins-1/ps-admin";
    private static final String BODY = "{\"permissionSets\":[{\"name\":\"Admin\",\"arn\":\"" + ARN + "\"}],"
            + "\"region\":\"us-east-1\",\"ssoRegion\":\"us-east-1\"}";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ScanSessionStore sessionStore;

    @MockBean
    private RiskScanService riskScanService;

    @TestConfiguration
    static class SyncScanConfig {
        @Bean(name = "riskScanTaskExecutor")
        Executor riskScanTaskExecutor() {
            return new SyncTaskExecutor();
        }

        @Bean
        ScanSessionStore scanSessionStore() {
            return new ScanSessionStore(new InMemoryScanSessionRepository(), Clock.systemUTC(), Duration.ofHours(1));
        }
    }

    @AfterEach
    void resetSessions() {
        sessionStore.resetScan(ScanSessionStore.DEFAULT_SCOPE);
    }

    @Test
    void streamsEncodedEvents() throws Exception {
        emitOneResult();

        MvcResult result = mockMvc.perform(post("/api/risk-analysis/stream")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header(RequestCredentialsResolver.ACCESS_KEY_ID_HEADER, "AKIA")
                        .header(RequestCredentialsResolver.SECRET_ACCESS_KEY_HEADER, "secret")
                        .content(BODY))
                .andExpect(request().asyncStarted())
                .andExpect(header().string("Cache-Control", "no-cache"))
                .andExpect(header().string("X-Accel-Buffering", "no"))
                .andReturn();

        assertTrue(result.getResponse().getContentType().startsWith(MediaType.TEXT_EVENT_STREAM_VALUE));
        String content = result.getResponse().getContentAsString();
        assertTrue(content.startsWith("event: start\ndata: {"));
        assertTrue(content.contains("event: result\ndata: {"));
        assertTrue(content.endsWith("\n\n"));
        int start = content.indexOf("event: start");
        int resultAt = content.indexOf("event: result");
        int complete = content.indexOf("event: complete");
        assertTrue(start < resultAt && resultAt < complete);
    }

    @Test
    void recordsStreamIntoNamedSession() throws Exception {
        emitOneResult();
        String sessionId = sessionStore.startNewScan(ScanSessionStore.DEFAULT_SCOPE,
                List.of(PermissionSetDetails.fromArn(ARN)), "us-east-1", "us-east-1");
        String body = BODY.replace("\"region\"", "\"sessionId\":\"" + sessionId + "\",\"region\"");

        mockMvc.perform(post("/api/risk-analysis/stream")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header(RequestCredentialsResolver.ACCESS_KEY_ID_HEADER, "AKIA")
                        .header(RequestCredentialsResolver.SECRET_ACCESS_KEY_HEADER, "secret")
                        .content(body))
                .andExpect(request().asyncStarted());

        ScanSession session = sessionStore.getSession(sessionId).orElseThrow();
        assertFalse(session.isActive());
        assertEquals(1, session.getResults().size());
        assertEquals(1, session.getSummary().getTotalAnalyzed());
    }

    @Test
    void sessionWithDifferentTargetsIsRejected() throws Exception {
        String sessionId = sessionStore.startNewScan(ScanSessionStore.DEFAULT_SCOPE,
                List.of(PermissionSetDetails.fromArn("arn:aws:sso:::permissionSet/ssoins-1/ps-billing")),
                "us-east-1", "us-east-1");
        String body = BODY.replace("\"region\"", "\"sessionId\":\"" + sessionId + "\",\"region\"");

        mockMvc.perform(post("/api/risk-analysis/stream")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header(RequestCredentialsResolver.ACCESS_KEY_ID_HEADER, "AKIA")
                        .header(RequestCredentialsResolver.SECRET_ACCESS_KEY_HEADER, "secret")
                        .content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Stream request does not match the targets of scan session " + sessionId));

        ScanSession session = sessionStore.getSession(sessionId).orElseThrow();
        assertTrue(session.isActive());
        assertFalse(session.isRecorded());
        assertTrue(session.getResults().isEmpty());
        verify(riskScanService, never()).runScan(any(), any(), any(), any());
    }

    @Test
    void secondStreamIntoSameSessionConflicts() throws Exception {
        String sessionId = sessionStore.startNewScan(ScanSessionStore.DEFAULT_SCOPE,
                List.of(PermissionSetDetails.fromArn(ARN)), "us-east-1", "us-east-1");
        String body = BODY.replace("\"region\"", "\"sessionId\":\"" + sessionId + "\",\"region\"");

        mockMvc.perform(post("/api/risk-analysis/stream")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header(RequestCredentialsResolver.ACCESS_KEY_ID_HEADER, "AKIA")
                        .header(RequestCredentialsResolver.SECRET_ACCESS_KEY_HEADER, "secret")
                        .content(body))
                .andExpect(request().asyncStarted());

        mockMvc.perform(post("/api/risk-analysis/stream")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header(RequestCredentialsResolver.ACCESS_KEY_ID_HEADER, "AKIA")
                        .header(RequestCredentialsResolver.SECRET_ACCESS_KEY_HEADER, "secret")
                        .content(body))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.sessionId").value(sessionId));

        verify(riskScanService, times(1)).runScan(any(), any(), any(), any());
    }

    @Test
    void unknownSessionIsRejected() throws Exception {
        String body = BODY.replace("\"region\"", "\"sessionId\":\"scan-missing\",\"region\"");

        mockMvc.perform(post("/api/risk-analysis/stream")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header(RequestCredentialsResolver.ACCESS_KEY_ID_HEADER, "AKIA")
                        .header(RequestCredentialsResolver.SECRET_ACCESS_KEY_HEADER, "secret")
                        .content(body))
                .andExpect(status().isBadRequest());
    }

    @Test
    void missingCredentialsAreRejected() throws Exception {
        mockMvc.perform(post("/api/risk-analysis/stream")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BODY))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.message").value("AWS credentials are required. Please configure your credentials."));

        verify(riskScanService, never()).runScan(any(), any(), any(), any());
    }

    @Test
    void emptyPermissionSetsAreRejected() throws Exception {
        mockMvc.perform(post("/api/risk-analysis/stream")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header(RequestCredentialsResolver.ACCESS_KEY_ID_HEADER, "AKIA")
                        .header(RequestCredentialsResolver.SECRET_ACCESS_KEY_HEADER, "secret")
                        .content("{\"permissionSets\":[]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Permission sets array is required"));
    }

    @Test
    void malformedBodyIsRejected() throws Exception {
        mockMvc.perform(post("/api/risk-analysis/stream")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Invalid request body"));
    }

    private void emitOneResult() {
        UserRiskProfile profile = UserRiskProfile.builder()
                .userId(ARN)
                .userName("Admin")
                .overallRiskScore(9)
                .riskLevel(RiskLevel.CRITICAL)
                .adminAccess(true)
                .build();
        doAnswer(invocation -> {
            ScanStreamRequest request = invocation.getArgument(0);
            ScanEventSink sink = invocation.getArgument(2);
            sink.send(new ScanStartEvent(request.getPermissionSets().size(), "Initializing risk analysis..."));
            sink.send(ScanResultEvent.builder()
                    .permissionSet(profile).index(0).completedCount(1).totalCount(1).progress(100)
                    .message("Completed 1/1: Admin").build());
            sink.send(new ScanCompleteEvent(ScanSummary.of(List.of(profile)), List.of(profile), "Risk analysis complete!"));
            sink.complete();
            return List.of(profile);
        }).when(riskScanService).runScan(any(), any(), any(), any());
    }
}
