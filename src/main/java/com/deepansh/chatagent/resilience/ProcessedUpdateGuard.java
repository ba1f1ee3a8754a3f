package com.deepansh.chatagent.resilience;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Redis-based de-duplication of inbound chat updates.
 *
 * The chat platform redelivers an update when the webhook answer is slow or
 * lost. Each update id is claimed once with SET NX; later deliveries of the
 * same id are dropped.
 *
 * Key pattern: agent:update:{updateId}
 * TTL: 24 hours
 */
@Service
@Slf4j
public class ProcessedUpdateGuard {

    private static final String KEY_PREFIX = "agent:update:";
    private static final Duration TTL = Duration.ofHours(24);

    private final StringRedisTemplate redisTemplate;

    public ProcessedUpdateGuard(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    /**
     * Claim an update id.
     *
     * @return true the first time an id is seen, false for a redelivery.
     *         When Redis is unreachable the update is let through.
     */
    public boolean claim(String updateId) {
        if (updateId == null || updateId.isBlank()) {
            return true;
        }
        try {
            Boolean claimed = redisTemplate.opsForValue().setIfAbsent(KEY_PREFIX + updateId, "1", TTL);
            if (!Boolean.TRUE.equals(claimed)) {
                log.info("Dropping redelivered update id={}", updateId);
                return false;
            }
            return true;
        } catch (Exception e) {
            log.warn("Update de-duplication unavailable, processing update id={}: {}", updateId, e.getMessage());
            return true;
        }
    }
}
