package com.xammer.iamrisk.service.session;

import com.xammer.iamrisk.dto.stream.ScanEvent;
import com.xammer.iamrisk.stream.ScanEventSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Records every event of a scan into a session before forwarding it to the client. When
 * the client goes away the scan continues and only the session is updated. A failing store
 * never keeps events from the client.
 */
public class ScanSessionRecorder implements ScanEventSink {

    private static final Logger logger = LoggerFactory.getLogger(ScanSessionRecorder.class);

    private final ScanSessionStore store;
    private final ScanSessionEventApplier applier;
    private final String sessionId;
    private final ScanEventSink delegate;
    private volatile boolean detached;

    public ScanSessionRecorder(ScanSessionStore store, ScanSessionEventApplier applier,
                               String sessionId, ScanEventSink delegate) {
        this.store = store;
        this.applier = applier;
        this.sessionId = sessionId;
        this.delegate = delegate;
    }

    @Override
    public void send(ScanEvent event) {
        record(() -> applier.apply(sessionId, event), event.getType().getWireName());
        if (detached) {
            return;
        }
        try {
            delegate.send(event);
        } catch (IOException | IllegalStateException e) {
            detached = true;
            logger.info("Client of scan session {} disconnected, continuing in background: {}",
                    sessionId, e.getMessage());
        }
    }

    @Override
    public void complete() {
        record(() -> store.completeScan(sessionId), "completion");
        if (!detached) {
            delegate.complete();
        }
    }

    @Override
    public void completeWithError(Throwable error) {
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        record(() -> store.setError(sessionId, message), "error");
        if (!detached) {
            delegate.completeWithError(error);
        }
    }

    private void record(Runnable update, String what) {
        try {
            update.run();
        } catch (RuntimeException e) {
            logger.warn("Could not record {} in scan session {}: {}", what, sessionId, e.getMessage());
        }
    }

    public boolean isDetached() {
        return detached;
    }
}
