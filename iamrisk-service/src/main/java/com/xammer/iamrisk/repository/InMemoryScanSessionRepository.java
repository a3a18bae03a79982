package com.xammer.iamrisk.repository;

import com.xammer.iamrisk.domain.ScanSession;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

public class InMemoryScanSessionRepository implements ScanSessionRepository {

    private final Map<String, ScanSession> sessions = new ConcurrentHashMap<>();
    private final Map<String, String> currentIds = new ConcurrentHashMap<>();

    @Override
    public Optional<ScanSession> findById(String id) {
        ScanSession session = sessions.get(id);
        return session != null ? Optional.of(session.snapshot()) : Optional.empty();
    }

    @Override
    public void save(ScanSession session) {
        sessions.put(session.getId(), session.snapshot());
    }

    @Override
    public void deleteById(String id) {
        sessions.remove(id);
    }

    @Override
    public Optional<String> findCurrentId(String scope) {
        return Optional.ofNullable(currentIds.get(scope));
    }

    @Override
    public void saveCurrentId(String scope, String id) {
        currentIds.put(scope, id);
    }

    @Override
    public void deleteCurrentId(String scope) {
        currentIds.remove(scope);
    }

    @Override
    public int deleteStartedBefore(Instant cutoff) {
        Set<String> expired = sessions.values().stream()
                .filter(s -> s.getStartTime() == null || !s.getStartTime().isAfter(cutoff))
                .map(ScanSession::getId)
                .collect(Collectors.toSet());
        expired.forEach(sessions::remove);
        currentIds.values().removeIf(expired::contains);
        return expired.size();
    }

    int size() {
        return sessions.size();
    }
}
