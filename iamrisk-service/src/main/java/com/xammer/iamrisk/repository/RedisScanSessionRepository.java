package com.xammer.iamrisk.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.xammer.iamrisk.domain.ScanSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Stores sessions as JSON strings. Keys expire after the session TTL so abandoned sessions
 * do not accumulate.
 */
public class RedisScanSessionRepository implements ScanSessionRepository {

    private static final Logger logger = LoggerFactory.getLogger(RedisScanSessionRepository.class);

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final String keyPrefix;
    private final Duration ttl;

    public RedisScanSessionRepository(StringRedisTemplate redisTemplate, ObjectMapper objectMapper,
                                      String keyPrefix, Duration ttl) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.keyPrefix = keyPrefix;
        this.ttl = ttl;
    }

    @Override
    public Optional<ScanSession> findById(String id) {
        String key = sessionKey(id);
        String json = redisTemplate.opsForValue().get(key);
        if (json == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json, ScanSession.class));
        } catch (JsonProcessingException e) {
            logger.error("Error deserializing scan session {}: {}", key, e.getOriginalMessage());
            redisTemplate.delete(key);
            return Optional.empty();
        }
    }

    @Override
    public void save(ScanSession session) {
        try {
            redisTemplate.opsForValue().set(sessionKey(session.getId()), objectMapper.writeValueAsString(session), ttl);
        } catch (JsonProcessingException e) {
            logger.error("Error serializing scan session {}: {}", session.getId(), e.getOriginalMessage());
        }
    }

    @Override
    public void deleteById(String id) {
        redisTemplate.delete(sessionKey(id));
    }

    @Override
    public Optional<String> findCurrentId(String scope) {
        return Optional.ofNullable(redisTemplate.opsForValue().get(currentKey(scope)));
    }

    @Override
    public void saveCurrentId(String scope, String id) {
        redisTemplate.opsForValue().set(currentKey(scope), id, ttl);
    }

    @Override
    public void deleteCurrentId(String scope) {
        redisTemplate.delete(currentKey(scope));
    }

    private String sessionKey(String id) {
        return keyPrefix + "session:" + id;
    }

    private String currentKey(String scope) {
        return keyPrefix + "current:" + scope;
    }

    /**
     * Keys are written with the session TTL, so Redis evicts them on its own.
     */
    @Override
    public int deleteStartedBefore(Instant cutoff) {
        return 0;
    }
}
