package com.xammer.iamrisk.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.xammer.iamrisk.repository.InMemoryScanSessionRepository;
import com.xammer.iamrisk.repository.RedisScanSessionRepository;
import com.xammer.iamrisk.repository.ScanSessionRepository;
import com.xammer.iamrisk.service.session.ScanSessionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;
import java.time.Duration;

@Configuration
public class ScanSessionConfig {

    private static final Logger logger = LoggerFactory.getLogger(ScanSessionConfig.class);

    @Value("${risk.scan-session.ttl-minutes:60}")
    private long ttlMinutes;

    @Value("${risk.scan-session.redis-key-prefix:iamrisk:scan:}")
    private String redisKeyPrefix;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnProperty(name = "risk.scan-session.store", havingValue = "redis")
    public ScanSessionRepository redisScanSessionRepository(StringRedisTemplate redisTemplate, ObjectMapper objectMapper) {
        logger.info("Scan sessions are persisted in Redis under prefix {}", redisKeyPrefix);
        return new RedisScanSessionRepository(redisTemplate, objectMapper, redisKeyPrefix, Duration.ofMinutes(ttlMinutes));
    }

    @Bean
    @ConditionalOnProperty(name = "risk.scan-session.store", havingValue = "memory", matchIfMissing = true)
    public ScanSessionRepository inMemoryScanSessionRepository() {
        logger.info("Scan sessions are kept in memory");
        return new InMemoryScanSessionRepository();
    }

    @Bean
    public ScanSessionStore scanSessionStore(ScanSessionRepository repository, Clock clock) {
        return new ScanSessionStore(repository, clock, Duration.ofMinutes(ttlMinutes));
    }
}
