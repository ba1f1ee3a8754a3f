package com.deepansh.chatagent.core;

import com.deepansh.chatagent.config.AgentProperties;
import com.deepansh.chatagent.model.AgentRequest;
import com.deepansh.chatagent.model.AgentResponse;
import com.deepansh.chatagent.model.TerminationOutcome;
import com.deepansh.chatagent.persistence.ConversationRecord;
import com.deepansh.chatagent.persistence.ConversationStore;
import com.deepansh.chatagent.status.StatusHandle;
import com.deepansh.chatagent.status.StatusReporter;
import com.deepansh.chatagent.tool.ToolRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;

/**
 * Entry point for running sessions: builds the Session (history snapshot,
 * status message, usage counters) and hands it to the orchestrator, either
 * on the caller's thread or on the session pool.
 */
@Service
@Slf4j
public class AgentService {

    private final AgentOrchestrator orchestrator;
    private final ConversationStore conversationStore;
    private final StatusReporter statusReporter;
    private final ToolRegistry toolRegistry;
    private final AgentProperties properties;
    private final TaskExecutor sessionExecutor;

    public AgentService(AgentOrchestrator orchestrator,
                        ConversationStore conversationStore,
                        StatusReporter statusReporter,
                        ToolRegistry toolRegistry,
                        AgentProperties properties,
                        @Qualifier("sessionTaskExecutor") TaskExecutor sessionExecutor) {
        this.orchestrator = orchestrator;
        this.conversationStore = conversationStore;
        this.statusReporter = statusReporter;
        this.toolRegistry = toolRegistry;
        this.properties = properties;
        this.sessionExecutor = sessionExecutor;
    }

    /** Runs one session to completion on the calling thread */
    public AgentResponse handle(AgentRequest request) {
        Session session = open(request);
        TerminationOutcome outcome = orchestrator.run(session);

        return AgentResponse.builder()
                .sessionId(session.getSessionId())
                .chatId(session.getChatId())
                .outcome(outcome.kind())
                .finalAnswer(outcome.text())
                .error(outcome.error())
                .loopsUsed(session.getLoopCount())
                .toolUsage(session.toolUsageSnapshot())
                .chunksDelivered(session.getChunksDelivered())
                .build();
    }

    /**
     * Queues a session on the session pool and returns immediately.
     *
     * @return false when the pool rejected the task
     */
    public boolean submit(AgentRequest request) {
        try {
            sessionExecutor.execute(() -> {
                try {
                    handle(request);
                } catch (Exception e) {
                    log.error("Session for chat={} crashed outside the orchestrator", request.getChatId(), e);
                }
            });
            return true;
        } catch (TaskRejectedException e) {
            log.warn("Session pool saturated, rejecting request for chat={}", request.getChatId());
            return false;
        }
    }

    Session open(AgentRequest request) {
        List<ConversationRecord> history = loadHistory(request.getChatId());
        StatusHandle status = statusReporter.start(request.getChatId(), request.getRequestMessageId());

        return Session.builder()
                .sessionId(UUID.randomUUID().toString())
                .chatId(request.getChatId())
                .query(request.getQuery())
                .personaId(request.getPersonaId())
                .sender(request.getSender())
                .requestMessageId(request.getRequestMessageId())
                .recentHistory(history)
                .statusHandle(status)
                .initialUsage(toolRegistry.initialUsage())
                .build();
    }

    private List<ConversationRecord> loadHistory(String chatId) {
        AgentProperties.History history = properties.getHistory();
        try {
            return conversationStore.recent(chatId, history.getLookback(), history.getMaxRecords());
        } catch (Exception e) {
            log.warn("Could not load history for chat={}, running without it: {}", chatId, e.getMessage());
            return List.of();
        }
    }
}
