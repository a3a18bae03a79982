package com.xammer.iamrisk.service;

import com.xammer.iamrisk.dto.AwsRequestCredentials;
import com.xammer.iamrisk.dto.PermissionSetDetails;
import com.xammer.iamrisk.dto.ScanStreamRequest;
import com.xammer.iamrisk.dto.ScanSummary;
import com.xammer.iamrisk.dto.risk.PermissionSetRisk;
import com.xammer.iamrisk.dto.risk.UserRiskProfile;
import com.xammer.iamrisk.dto.stream.ScanCompleteEvent;
import com.xammer.iamrisk.dto.stream.ScanEvent;
import com.xammer.iamrisk.dto.stream.ScanProgressEvent;
import com.xammer.iamrisk.dto.stream.ScanResultEvent;
import com.xammer.iamrisk.dto.stream.ScanStartEvent;
import com.xammer.iamrisk.service.risk.AnalysisOutcome;
import com.xammer.iamrisk.service.risk.RiskAnalyzer;
import com.xammer.iamrisk.stream.ScanCancellation;
import com.xammer.iamrisk.stream.ScanEventSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs a streaming scan: analyses permission sets one at a time, in request order, and
 * reports each step to a {@link ScanEventSink}.
 */
@Service
public class RiskScanService {

    private static final Logger logger = LoggerFactory.getLogger(RiskScanService.class);

    private final RiskAnalyzer riskAnalyzer;
    private final PermissionSetDetailsService permissionSetDetailsService;
    private final Executor enrichmentExecutor;

    @Value("${risk.scan.enrichment-timeout-ms:15000}")
    private long enrichmentTimeoutMs;

    public RiskScanService(RiskAnalyzer riskAnalyzer,
                           PermissionSetDetailsService permissionSetDetailsService,
                           @Qualifier("enrichmentTaskExecutor") Executor enrichmentExecutor) {
        this.riskAnalyzer = riskAnalyzer;
        this.permissionSetDetailsService = permissionSetDetailsService;
        this.enrichmentExecutor = enrichmentExecutor;
    }

    void setEnrichmentTimeoutMs(long enrichmentTimeoutMs) {
        this.enrichmentTimeoutMs = enrichmentTimeoutMs;
    }

    /**
     * Emits {@code start}, then {@code progress} and {@code result} per permission set and
     * finally {@code complete}. Stops early, without {@code complete}, once the cancellation
     * is set or an event cannot be delivered. The sink is always completed.
     *
     * @return the profiles produced before the scan ended
     */
    public List<UserRiskProfile> runScan(ScanStreamRequest request, AwsRequestCredentials credentials,
                                         ScanEventSink sink, ScanCancellation cancellation) {
        List<PermissionSetDetails> permissionSets = request.getPermissionSets();
        int total = permissionSets.size();
        List<UserRiskProfile> results = new ArrayList<>();
        boolean failed = false;
        logger.info("Starting risk scan of {} permission sets", total);

        try (PermissionSetSource source = openSource(credentials, request)) {
            if (!send(sink, new ScanStartEvent(total, "Initializing risk analysis..."), cancellation)) {
                return results;
            }

            String instanceArn = resolveInstanceArn(source, permissionSets);
            if (instanceArn != null && !send(sink, ScanProgressEvent.builder()
                    .message("Using SSO instance: " + instanceArn)
                    .currentStep(ScanProgressEvent.STEP_INITIALIZATION)
                    .build(), cancellation)) {
                return results;
            }

            for (int i = 0; i < total; i++) {
                if (cancellation.isCancelled()) {
                    logger.info("Risk scan cancelled after {}/{} permission sets: {}",
                            results.size(), total, cancellation.getReason());
                    return results;
                }
                PermissionSetDetails permissionSet = permissionSets.get(i);
                String name = permissionSet.displayName();

                if (!send(sink, ScanProgressEvent.builder()
                        .currentIndex(i)
                        .totalCount(total)
                        .permissionSetName(permissionSet.getName())
                        .message("Analyzing " + name + "...")
                        .currentStep(ScanProgressEvent.STEP_ANALYZING)
                        .progress(percent(i, total))
                        .build(), cancellation)) {
                    return results;
                }

                PermissionSetDetails target = enrich(source, instanceArn, permissionSet, cancellation);
                AnalysisOutcome<PermissionSetRisk> outcome =
                        riskAnalyzer.analyzePermissionSetRiskSafely(target, RiskAnalyzer.ORGANIZATION_ACCOUNT);
                if (outcome.isDegraded()) {
                    logger.warn("Analysis of {} degraded: {}", name, outcome.getDegradedReason());
                }
                UserRiskProfile profile = riskAnalyzer.toProfile(target, outcome.getValue());
                results.add(profile);

                int completed = results.size();
                if (!send(sink, ScanResultEvent.builder()
                        .permissionSet(profile)
                        .index(i)
                        .completedCount(completed)
                        .totalCount(total)
                        .progress(percent(completed, total))
                        .message("Completed " + completed + "/" + total + ": " + name)
                        .currentStep(ScanProgressEvent.STEP_ANALYZING)
                        .build(), cancellation)) {
                    return results;
                }
                logger.debug("Completed {}/{}: {} - {}", completed, total, name, profile.getRiskLevel());
            }

            send(sink, new ScanCompleteEvent(ScanSummary.of(results), results, "Risk analysis complete!"), cancellation);
            logger.info("Risk scan finished with {} results", results.size());
            return results;
        } catch (RuntimeException e) {
            logger.error("Risk scan failed after {}/{} permission sets", results.size(), total, e);
            try {
                sink.completeWithError(e);
                failed = true;
            } catch (RuntimeException reportFailure) {
                logger.warn("Could not report scan failure, closing stream: {}", reportFailure.getMessage());
            }
            return results;
        } finally {
            if (!failed) {
                completeQuietly(sink);
            }
        }
    }

    private void completeQuietly(ScanEventSink sink) {
        try {
            sink.complete();
        } catch (RuntimeException e) {
            logger.warn("Could not close scan stream: {}", e.getMessage());
        }
    }

    private boolean send(ScanEventSink sink, ScanEvent event, ScanCancellation cancellation) {
        try {
            sink.send(event);
            return true;
        } catch (IOException | IllegalStateException e) {
            logger.info("Could not deliver {} event, stopping scan: {}", event.getType().getWireName(), e.getMessage());
            cancellation.cancel("event delivery failed");
            return false;
        }
    }

    private PermissionSetSource openSource(AwsRequestCredentials credentials, ScanStreamRequest request) {
        String region = request.getSsoRegion() != null ? request.getSsoRegion() : request.getRegion();
        try {
            return permissionSetDetailsService.open(credentials, region);
        } catch (RuntimeException e) {
            logger.warn("Could not create SSO Admin client, analysing request data only: {}", e.getMessage());
            return null;
        }
    }

    private String resolveInstanceArn(PermissionSetSource source, List<PermissionSetDetails> permissionSets) {
        if (source == null) {
            return null;
        }
        String sampleArn = permissionSets.stream()
                .map(PermissionSetDetails::getArn)
                .filter(Objects::nonNull)
                .findFirst()
                .orElse(null);
        try {
            Optional<String> instanceArn = source.resolveInstanceArn(sampleArn);
            if (instanceArn.isEmpty()) {
                logger.warn("No SSO instance found, analysing request data only");
            }
            return instanceArn.orElse(null);
        } catch (RuntimeException e) {
            logger.warn("Could not get SSO instance: {}", e.getMessage());
            return null;
        }
    }

    private PermissionSetDetails enrich(PermissionSetSource source, String instanceArn,
                                        PermissionSetDetails permissionSet, ScanCancellation cancellation) {
        if (source == null || instanceArn == null || permissionSet.getArn() == null) {
            return permissionSet;
        }
        CompletableFuture<PermissionSetDetails> future =
                CompletableFuture.supplyAsync(() -> source.enrich(instanceArn, permissionSet), enrichmentExecutor);
        try {
            return future.get(enrichmentTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            logger.warn("Timed out after {} ms getting details for {}, using request data",
                    enrichmentTimeoutMs, permissionSet.displayName());
        } catch (ExecutionException e) {
            logger.warn("Failed to get details for {}, using request data: {}",
                    permissionSet.displayName(), e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancellation.cancel("interrupted");
            logger.warn("Interrupted getting details for {}, using request data", permissionSet.displayName());
        }
        return permissionSet;
    }

    private static int percent(int done, int total) {
        return total == 0 ? 100 : (int) Math.round(done * 100.0 / total);
    }
}
