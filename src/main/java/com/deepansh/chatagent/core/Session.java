package com.deepansh.chatagent.core;

import com.deepansh.chatagent.model.TerminationOutcome;
import com.deepansh.chatagent.observability.RunContext;
import com.deepansh.chatagent.persistence.ConversationRecord;
import com.deepansh.chatagent.status.StatusHandle;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * All mutable state for one user request, owned by the single thread that
 * runs it. Never shared across sessions and never persisted.
 *
 * The accumulated context only grows, the loop count only goes up, and the
 * outcome can be set once.
 */
@Getter
public class Session {

    private final String sessionId;
    private final String chatId;
    private final String query;
    private final String personaId;
    private final String sender;
    private final String requestMessageId;
    private final List<ConversationRecord> recentHistory;
    private final StatusHandle statusHandle;
    private final RunContext runContext = new RunContext();

    @Getter(AccessLevel.NONE)
    private final StringBuilder context = new StringBuilder();
    private final Map<String, Integer> toolUsage;

    private int loopCount;
    private TerminationOutcome outcome = TerminationOutcome.PENDING;
    private String quotaExhaustedTool;
    private int chunksDelivered;

    @Builder
    private Session(String sessionId, String chatId, String query, String personaId, String sender,
                    String requestMessageId, List<ConversationRecord> recentHistory,
                    StatusHandle statusHandle, Map<String, Integer> initialUsage) {
        this.sessionId = sessionId;
        this.chatId = chatId;
        this.query = query;
        this.personaId = personaId;
        this.sender = sender;
        this.requestMessageId = requestMessageId;
        this.recentHistory = recentHistory != null ? List.copyOf(recentHistory) : List.of();
        this.statusHandle = statusHandle != null ? statusHandle : StatusHandle.detached(chatId);
        this.toolUsage = initialUsage != null ? new LinkedHashMap<>(initialUsage) : new LinkedHashMap<>();
    }

    public String getAccumulatedContext() {
        return context.toString();
    }

    void appendContext(String text) {
        context.append(text);
    }

    /** Starts the next iteration and returns its 1-based number */
    int nextIteration() {
        return ++loopCount;
    }

    public int usageOf(String toolName) {
        return toolUsage.getOrDefault(toolName, 0);
    }

    void recordToolUse(String toolName) {
        toolUsage.merge(toolName, 1, Integer::sum);
    }

    public Map<String, Integer> toolUsageSnapshot() {
        return Collections.unmodifiableMap(toolUsage);
    }

    public boolean isTerminated() {
        return outcome.isTerminal();
    }

    void terminate(TerminationOutcome terminal) {
        if (outcome.isTerminal()) {
            throw new IllegalStateException("Session " + sessionId + " already ended as " + outcome.kind());
        }
        if (!terminal.isTerminal()) {
            throw new IllegalArgumentException("PENDING is not a terminal outcome");
        }
        this.outcome = terminal;
    }

    void markQuotaExhausted(String toolName) {
        this.quotaExhaustedTool = toolName;
    }

    void setChunksDelivered(int chunksDelivered) {
        this.chunksDelivered = chunksDelivered;
    }

    public String logTag() {
        return "[session=" + sessionId + ", chat=" + chatId + "]";
    }
}
