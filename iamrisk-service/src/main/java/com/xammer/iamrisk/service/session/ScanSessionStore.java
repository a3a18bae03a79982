package com.xammer.iamrisk.service.session;

import com.xammer.iamrisk.domain.ScanSession;
import com.xammer.iamrisk.dto.PermissionSetDetails;
import com.xammer.iamrisk.dto.ScanProgress;
import com.xammer.iamrisk.dto.ScanSummary;
import com.xammer.iamrisk.dto.risk.UserRiskProfile;
import com.xammer.iamrisk.repository.ScanSessionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Keeps resumable scan sessions. Each scope (one logical client) has at most one current
 * session; sessions are addressed by id so that a running scan keeps writing to its own
 * session even after the scope has moved on.
 *
 * <p>Mutations are serialized. Listeners of the affected scope receive a snapshot after the
 * store's lock is released, so a slow listener only delays the thread that made the change.
 * Once a session is inactive, further mutations are ignored. A persisted session is visible
 * only while it is younger than the TTL.
 */
public class ScanSessionStore {

    private static final Logger logger = LoggerFactory.getLogger(ScanSessionStore.class);

    public static final String DEFAULT_SCOPE = "default";

    private final ScanSessionRepository repository;
    private final Clock clock;
    private final Duration ttl;
    private final Map<String, List<ScanSessionListener>> listeners = new ConcurrentHashMap<>();

    public ScanSessionStore(ScanSessionRepository repository, Clock clock, Duration ttl) {
        this.repository = repository;
        this.clock = clock;
        this.ttl = ttl;
    }

    public synchronized Optional<ScanSession> getCurrentSession(String scope) {
        Optional<String> currentId = repository.findCurrentId(scope);
        if (currentId.isEmpty()) {
            return Optional.empty();
        }
        Optional<ScanSession> session = getSession(currentId.get());
        if (session.isEmpty()) {
            repository.deleteCurrentId(scope);
        }
        return session;
    }

    public synchronized Optional<ScanSession> getSession(String id) {
        Optional<ScanSession> session = repository.findById(id);
        if (session.isPresent() && isExpired(session.get())) {
            logger.info("Scan session {} expired, discarding", id);
            repository.deleteById(id);
            return Optional.empty();
        }
        return session;
    }

    /**
     * A new scan may start unless the scope already runs one over the same targets and regions.
     */
    public synchronized boolean canStartNewScan(String scope, List<PermissionSetDetails> targets,
                                                String region, String ssoRegion) {
        return getCurrentSession(scope)
                .map(current -> !(current.isActive() && isSameScan(current, targets, region, ssoRegion)))
                .orElse(true);
    }

    public String startNewScan(String scope, List<PermissionSetDetails> targets,
                               String region, String ssoRegion) {
        ScanSession session = new ScanSession();
        synchronized (this) {
            repository.findCurrentId(scope).ifPresent(repository::deleteById);

            session.setId("scan-" + UUID.randomUUID());
            session.setScope(scope);
            session.setPermissionSets(targets != null ? new ArrayList<>(targets) : new ArrayList<>());
            session.setRegion(region);
            session.setSsoRegion(ssoRegion);
            session.setStartTime(clock.instant());
            session.setActive(true);
            repository.save(session);
            repository.saveCurrentId(scope, session.getId());
        }

        logger.info("Started scan session {} for scope {} with {} permission sets",
                session.getId(), scope, session.getPermissionSets().size());
        notifyListeners(scope, session);
        return session.getId();
    }

    /**
     * Claims an active session for a recording stream. A session is recorded by one stream at
     * most.
     *
     * @return false when the session is unknown, finished or already recorded
     */
    public synchronized boolean attachRecorder(String id) {
        Optional<ScanSession> found = getSession(id);
        if (found.isEmpty() || !found.get().isActive() || found.get().isRecorded()) {
            return false;
        }
        ScanSession session = found.get();
        session.setRecorded(true);
        repository.save(session);
        logger.debug("Stream attached to scan session {}", id);
        return true;
    }

    public void updateProgress(String id, ScanProgress progress) {
        mutate(id, session -> session.setProgress(progress));
    }

    public void addResult(String id, UserRiskProfile result) {
        mutate(id, session -> session.getResults().add(result));
    }

    public void setSummary(String id, ScanSummary summary) {
        mutate(id, session -> session.setSummary(summary));
    }

    public void setError(String id, String error) {
        mutate(id, session -> {
            session.setError(error);
            session.setActive(false);
        });
    }

    public void completeScan(String id) {
        mutate(id, session -> session.setActive(false));
    }

    public void resetScan(String scope) {
        synchronized (this) {
            repository.findCurrentId(scope).ifPresent(repository::deleteById);
            repository.deleteCurrentId(scope);
        }
        logger.info("Reset scan session for scope {}", scope);
        notifyListeners(scope, null);
    }

    /**
     * Registers a listener and immediately replays the scope's current session to it.
     *
     * @return an action that removes the listener
     */
    public Runnable subscribe(String scope, ScanSessionListener listener) {
        listeners.compute(scope, (key, scoped) -> {
            List<ScanSessionListener> list = scoped != null ? scoped : new CopyOnWriteArrayList<>();
            list.add(listener);
            return list;
        });
        deliver(listener, getCurrentSession(scope).orElse(null));
        return () -> listeners.computeIfPresent(scope, (key, scoped) -> {
            scoped.remove(listener);
            return scoped.isEmpty() ? null : scoped;
        });
    }

    /**
     * Drops sessions older than the TTL and scopes nobody listens to any more.
     *
     * @return the number of sessions removed
     */
    public int purgeExpired() {
        int removed;
        synchronized (this) {
            removed = repository.deleteStartedBefore(clock.instant().minus(ttl));
        }
        for (String scope : listeners.keySet()) {
            listeners.computeIfPresent(scope, (key, scoped) -> scoped.isEmpty() ? null : scoped);
        }
        return removed;
    }

    boolean hasListeners(String scope) {
        return listeners.containsKey(scope);
    }

    /**
     * Whether a session was started for exactly these regions and targets, in this order.
     */
    public static boolean isSameScan(ScanSession session, List<PermissionSetDetails> targets,
                                     String region, String ssoRegion) {
        return Objects.equals(session.getRegion(), region)
                && Objects.equals(session.getSsoRegion(), ssoRegion)
                && targetKeys(session.getPermissionSets()).equals(targetKeys(targets));
    }

    private void mutate(String id, Consumer<ScanSession> mutation) {
        ScanSession changed = null;
        synchronized (this) {
            Optional<ScanSession> found = getSession(id);
            if (found.isEmpty()) {
                logger.debug("Ignoring update for unknown scan session {}", id);
                return;
            }
            ScanSession session = found.get();
            if (!session.isActive()) {
                logger.debug("Ignoring update for inactive scan session {}", id);
                return;
            }
            mutation.accept(session);
            repository.save(session);

            boolean current = repository.findCurrentId(session.getScope())
                    .map(id::equals)
                    .orElse(false);
            if (current) {
                changed = session;
            }
        }
        if (changed != null) {
            notifyListeners(changed.getScope(), changed);
        }
    }

    private boolean isExpired(ScanSession session) {
        Instant startTime = session.getStartTime();
        return startTime == null || Duration.between(startTime, clock.instant()).compareTo(ttl) >= 0;
    }

    private void notifyListeners(String scope, ScanSession session) {
        List<ScanSessionListener> scoped = listeners.get(scope);
        if (scoped == null) {
            return;
        }
        for (ScanSessionListener listener : scoped) {
            deliver(listener, session);
        }
    }

    private void deliver(ScanSessionListener listener, ScanSession session) {
        try {
            listener.onSessionChanged(session != null ? session.snapshot() : null);
        } catch (RuntimeException e) {
            logger.warn("Scan session listener failed: {}", e.getMessage(), e);
        }
    }

    private static List<String> targetKeys(List<PermissionSetDetails> targets) {
        if (targets == null) {
            return List.of();
        }
        return targets.stream()
                .map(ps -> ps.getArn() != null ? ps.getArn() : ps.getName())
                .collect(Collectors.toList());
    }
}
