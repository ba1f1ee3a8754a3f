package com.deepansh.chatagent.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Orchestrator budgets, timeouts and delivery limits.
 * Bound from application.yml under the "agent" prefix.
 */
@ConfigurationProperties(prefix = "agent")
@Data
public class AgentProperties {

    /** Upper bound on reasoning iterations per session */
    private int maxLoops = 10;

    private Duration reasoningTimeout = Duration.ofSeconds(60);
    private Duration toolTimeout = Duration.ofSeconds(60);

    /**
     * When a tool quota is hit, spend one more reasoning call (without tools)
     * to synthesize an answer from the accumulated context instead of giving up.
     */
    private boolean quotaExhaustedSynthesis = false;

    /** Sender name stamped on bot-authored conversation records */
    private String botName = "Everything Bot";

    /** Per-session quota by tool name. Overrides a tool's own default. */
    private Map<String, Integer> toolQuotas = new HashMap<>();

    private History history = new History();
    private Delivery delivery = new Delivery();
    private Cancellation cancellation = new Cancellation();

    @Data
    public static class History {
        private Duration lookback = Duration.ofHours(24);
        private int maxRecords = 50;
    }

    @Data
    public static class Delivery {
        private int maxChunkLength = 4000;
        private int maxChunks = 4;
        private Duration baseDelay = Duration.ofMillis(500);
        private Duration delayStep = Duration.ofMillis(200);
        private Duration maxDelay = Duration.ofSeconds(2);
    }

    @Data
    public static class Cancellation {
        /** "memory" (single instance) or "redis" (shared across instances) */
        private String store = "memory";
        private Duration redisTtl = Duration.ofMinutes(10);
    }
}
