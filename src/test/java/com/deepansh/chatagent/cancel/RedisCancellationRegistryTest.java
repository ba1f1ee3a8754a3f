package com.deepansh.chatagent.cancel;

import com.deepansh.chatagent.config.AgentProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RedisCancellationRegistryTest {

    @Mock StringRedisTemplate redisTemplate;
    @Mock ValueOperations<String, String> valueOps;

    private RedisCancellationRegistry registry;

    @BeforeEach
    void setUp() {
        AgentProperties properties = new AgentProperties();
        properties.getCancellation().setRedisTtl(Duration.ofMinutes(5));
        registry = new RedisCancellationRegistry(redisTemplate, properties);
    }

    @Test
    void request_setsKeyWithTtl() {
        when(redisTemplate.opsForValue()).thenReturn(valueOps);

        registry.request("123");

        verify(valueOps).set("agent:cancel:123", "1", Duration.ofMinutes(5));
    }

    @Test
    void consume_existingKey_returnsTrue() {
        when(redisTemplate.delete("agent:cancel:123")).thenReturn(true);

        assertThat(registry.consume("123")).isTrue();
    }

    @Test
    void consume_missingKey_returnsFalse() {
        when(redisTemplate.delete("agent:cancel:123")).thenReturn(false);

        assertThat(registry.consume("123")).isFalse();
    }
}
