package com.xammer.iamrisk.controller;

import com.xammer.iamrisk.domain.ScanSession;
import com.xammer.iamrisk.dto.StartScanRequest;
import com.xammer.iamrisk.exception.InvalidScanRequestException;
import com.xammer.iamrisk.exception.ScanAlreadyRunningException;
import com.xammer.iamrisk.service.session.ScanSessionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Lets clients start, resume and discard scan sessions. Sessions are grouped by a scope
 * chosen by the client.
 */
@RestController
@RequestMapping("/api/risk-analysis/sessions")
public class ScanSessionController {

    private static final Logger logger = LoggerFactory.getLogger(ScanSessionController.class);

    private final ScanSessionStore sessionStore;

    @Value("${risk.scan.emitter-timeout-ms:1800000}")
    private long emitterTimeoutMs;

    public ScanSessionController(ScanSessionStore sessionStore) {
        this.sessionStore = sessionStore;
    }

    @PostMapping
    public ResponseEntity<ScanSession> startScan(@RequestBody StartScanRequest request,
                                                 @RequestParam(defaultValue = ScanSessionStore.DEFAULT_SCOPE) String scope) {
        if (request.getPermissionSets() == null || request.getPermissionSets().isEmpty()) {
            throw new InvalidScanRequestException("Permission sets array is required");
        }
        if (!sessionStore.canStartNewScan(scope, request.getPermissionSets(), request.getRegion(), request.getSsoRegion())) {
            String runningId = sessionStore.getCurrentSession(scope).map(ScanSession::getId).orElse(null);
            throw new ScanAlreadyRunningException(runningId);
        }
        String id = sessionStore.startNewScan(scope, request.getPermissionSets(), request.getRegion(), request.getSsoRegion());
        return sessionStore.getSession(id)
                .map(session -> ResponseEntity.status(HttpStatus.CREATED).body(session))
                .orElseGet(() -> ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).build());
    }

    @GetMapping("/current")
    public ResponseEntity<ScanSession> getCurrentSession(
            @RequestParam(defaultValue = ScanSessionStore.DEFAULT_SCOPE) String scope) {
        return ResponseEntity.of(sessionStore.getCurrentSession(scope));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ScanSession> getSession(@PathVariable String id) {
        return ResponseEntity.of(sessionStore.getSession(id));
    }

    @DeleteMapping("/current")
    public ResponseEntity<Void> resetScan(@RequestParam(defaultValue = ScanSessionStore.DEFAULT_SCOPE) String scope) {
        sessionStore.resetScan(scope);
        return ResponseEntity.noContent().build();
    }

    /**
     * Streams a snapshot of the scope's current session on every change, starting with the
     * present state. A reset is sent as a {@code reset} event.
     */
    @GetMapping("/current/events")
    public SseEmitter subscribe(@RequestParam(defaultValue = ScanSessionStore.DEFAULT_SCOPE) String scope) {
        SseEmitter emitter = new SseEmitter(emitterTimeoutMs);
        AtomicReference<Runnable> unsubscribe = new AtomicReference<>(() -> { });

        unsubscribe.set(sessionStore.subscribe(scope, session -> {
            try {
                if (session == null) {
                    emitter.send(SseEmitter.event().name("reset").data(""));
                } else {
                    emitter.send(SseEmitter.event().name("session").id(session.getId()).data(session));
                }
            } catch (IOException | IllegalStateException e) {
                logger.debug("Session subscriber for scope {} went away: {}", scope, e.getMessage());
                unsubscribe.get().run();
            }
        }));

        emitter.onCompletion(() -> unsubscribe.get().run());
        emitter.onTimeout(() -> unsubscribe.get().run());
        emitter.onError(e -> unsubscribe.get().run());
        return emitter;
    }
}
