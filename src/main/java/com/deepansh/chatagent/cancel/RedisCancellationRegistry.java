package com.deepansh.chatagent.cancel;

import com.deepansh.chatagent.config.AgentProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Registry shared by every orchestrator instance.
 *
 * Key pattern: agent:cancel:{chatId}
 * TTL bounds a flag whose chat never runs another iteration.
 * consume relies on DEL returning whether the key existed, which is atomic.
 */
@Component
@ConditionalOnProperty(name = "agent.cancellation.store", havingValue = "redis")
@Slf4j
public class RedisCancellationRegistry implements CancellationRegistry {

    private static final String KEY_PREFIX = "agent:cancel:";

    private final StringRedisTemplate redisTemplate;
    private final Duration ttl;

    public RedisCancellationRegistry(StringRedisTemplate redisTemplate, AgentProperties properties) {
        this.redisTemplate = redisTemplate;
        this.ttl = properties.getCancellation().getRedisTtl();
    }

    @Override
    public void request(String chatId) {
        redisTemplate.opsForValue().set(buildKey(chatId), "1", ttl);
        log.info("Cancellation requested [chat={}, store=redis]", chatId);
    }

    @Override
    public boolean consume(String chatId) {
        return Boolean.TRUE.equals(redisTemplate.delete(buildKey(chatId)));
    }

    private String buildKey(String chatId) {
        return KEY_PREFIX + chatId;
    }
}
