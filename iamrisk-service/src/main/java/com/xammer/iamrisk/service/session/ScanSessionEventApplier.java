package com.xammer.iamrisk.service.session;

import com.xammer.iamrisk.domain.ScanSession;
import com.xammer.iamrisk.dto.ScanProgress;
import com.xammer.iamrisk.dto.stream.ScanCompleteEvent;
import com.xammer.iamrisk.dto.stream.ScanEvent;
import com.xammer.iamrisk.dto.stream.ScanProgressEvent;
import com.xammer.iamrisk.dto.stream.ScanResultEvent;
import com.xammer.iamrisk.dto.stream.ScanStartEvent;
import org.springframework.stereotype.Component;

/**
 * Folds scan stream events into a session of the {@link ScanSessionStore}.
 */
@Component
public class ScanSessionEventApplier {

    private final ScanSessionStore store;

    public ScanSessionEventApplier(ScanSessionStore store) {
        this.store = store;
    }

    public void apply(String sessionId, ScanEvent event) {
        switch (event.getType()) {
            case START:
                ScanStartEvent start = (ScanStartEvent) event;
                store.updateProgress(sessionId, ScanProgress.builder()
                        .totalCount(start.getTotalCount())
                        .message(start.getMessage())
                        .currentStep(ScanProgressEvent.STEP_INITIALIZATION)
                        .build());
                break;
            case PROGRESS:
                store.updateProgress(sessionId, mergeProgress(sessionId, (ScanProgressEvent) event));
                break;
            case RESULT:
                ScanResultEvent result = (ScanResultEvent) event;
                store.addResult(sessionId, result.getPermissionSet());
                store.updateProgress(sessionId, ScanProgress.builder()
                        .currentIndex(result.getCompletedCount())
                        .totalCount(result.getTotalCount())
                        .permissionSetName(result.getPermissionSet() != null ? result.getPermissionSet().getUserName() : null)
                        .message(result.getMessage())
                        .currentStep(ScanProgressEvent.STEP_ANALYZING)
                        .progress(result.getProgress())
                        .build());
                break;
            case COMPLETE:
                ScanCompleteEvent complete = (ScanCompleteEvent) event;
                store.setSummary(sessionId, complete.getSummary());
                store.completeScan(sessionId);
                break;
            default:
                throw new IllegalArgumentException("Unsupported scan event type: " + event.getType());
        }
    }

    // Progress frames may omit fields; keep the last known values for those.
    private ScanProgress mergeProgress(String sessionId, ScanProgressEvent event) {
        ScanProgress previous = store.getSession(sessionId)
                .map(ScanSession::getProgress)
                .orElseGet(ScanProgress::new);
        return ScanProgress.builder()
                .currentIndex(event.getCurrentIndex() != null ? event.getCurrentIndex() : previous.getCurrentIndex())
                .totalCount(event.getTotalCount() != null ? event.getTotalCount() : previous.getTotalCount())
                .permissionSetName(event.getPermissionSetName() != null
                        ? event.getPermissionSetName() : previous.getPermissionSetName())
                .message(event.getMessage())
                .currentStep(event.getCurrentStep() != null ? event.getCurrentStep() : previous.getCurrentStep())
                .progress(event.getProgress() != null ? event.getProgress() : previous.getProgress())
                .build();
    }
}
