package com.xammer.iamrisk.service.session;

import com.xammer.iamrisk.domain.ScanSession;
import com.xammer.iamrisk.dto.PermissionSetDetails;
import com.xammer.iamrisk.dto.stream.ScanEvent;
import com.xammer.iamrisk.dto.stream.ScanStartEvent;
import com.xammer.iamrisk.repository.InMemoryScanSessionRepository;
import com.xammer.iamrisk.stream.ScanEventSink;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.RedisConnectionFailureException;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class ScanSessionRecorderTest {

    private ScanSessionStore store;
    private ScanEventSink client;
    private ScanSessionRecorder recorder;
    private String sessionId;

    @BeforeEach
    void setUp() {
        store = new ScanSessionStore(new InMemoryScanSessionRepository(), Clock.systemUTC(), Duration.ofHours(1));
        client = mock(ScanEventSink.class);
        sessionId = store.startNewScan("default",
                List.of(PermissionSetDetails.fromArn("arn:aws:sso:::permissionSet/ssoins-1/ps-a")), "us-east-1", null);
        recorder = new ScanSessionRecorder(store, new ScanSessionEventApplier(store), sessionId, client);
    }

    @Test
    void forwardsAndRecords() throws IOException {
        ScanStartEvent start = new ScanStartEvent(1, "Initializing risk analysis...");

        recorder.send(start);
        recorder.complete();

        verify(client).send(start);
        verify(client).complete();
        ScanSession session = store.getSession(sessionId).orElseThrow();
        assertEquals(1, session.getProgress().getTotalCount());
        assertFalse(session.isActive());
    }

    @Test
    void keepsRecordingAfterClientDisconnects() throws IOException {
        doThrow(new IOException("Broken pipe")).when(client).send(any(ScanEvent.class));

        recorder.send(new ScanStartEvent(2, "first"));
        recorder.send(new ScanStartEvent(2, "second"));
        recorder.complete();

        assertTrue(recorder.isDetached());
        verify(client, times(1)).send(any(ScanEvent.class));
        verify(client, never()).complete();
        assertEquals("second", store.getSession(sessionId).orElseThrow().getProgress().getMessage());
    }

    @Test
    void failureMarksSessionAsErrored() {
        recorder.completeWithError(new IllegalStateException("scan crashed"));

        ScanSession session = store.getSession(sessionId).orElseThrow();
        assertFalse(session.isActive());
        assertEquals("scan crashed", session.getError());
        verify(client).completeWithError(any(IllegalStateException.class));
    }

    @Test
    void storeOutageDoesNotStarveTheClient() throws IOException {
        ScanSessionEventApplier applier = mock(ScanSessionEventApplier.class);
        doThrow(new RedisConnectionFailureException("Unable to connect to Redis"))
                .when(applier).apply(anyString(), any(ScanEvent.class));
        ScanSessionStore failingStore = mock(ScanSessionStore.class);
        doThrow(new RedisConnectionFailureException("Unable to connect to Redis"))
                .when(failingStore).completeScan(anyString());
        ScanSessionRecorder outage = new ScanSessionRecorder(failingStore, applier, sessionId, client);
        ScanStartEvent start = new ScanStartEvent(1, "Initializing risk analysis...");

        outage.send(start);
        outage.complete();

        verify(client).send(start);
        verify(client).complete();
        assertFalse(outage.isDetached());
    }
}
