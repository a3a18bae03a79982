package com.xammer.iamrisk.repository;

import com.xammer.iamrisk.domain.ScanSession;

import java.time.Instant;
import java.util.Optional;

/**
 * Persistence of scan sessions and of the current-session pointer of each scope. Expiry is
 * decided by the caller; implementations may additionally evict old entries.
 */
public interface ScanSessionRepository {

    Optional<ScanSession> findById(String id);

    void save(ScanSession session);

    void deleteById(String id);

    Optional<String> findCurrentId(String scope);

    void saveCurrentId(String scope, String id);

    void deleteCurrentId(String scope);

    /**
     * Removes sessions started at or before {@code cutoff}, along with current pointers to them.
     *
     * @return the number of sessions removed
     */
    int deleteStartedBefore(Instant cutoff);
}
