package com.deepansh.chatagent.observability;

import com.deepansh.chatagent.core.Session;
import com.deepansh.chatagent.model.TerminationOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Persists session traces and exposes per-chat analytics.
 *
 * Trace persistence is @Async and never delays the session's return.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TraceService {

    private final AgentRunTraceRepository traceRepository;

    @Async("traceTaskExecutor")
    public void persistTrace(Session session) {
        try {
            TerminationOutcome outcome = session.getOutcome();
            RunContext runCtx = session.getRunContext();

            AgentRunTrace trace = AgentRunTrace.builder()
                    .sessionId(session.getSessionId())
                    .chatId(session.getChatId())
                    .personaId(session.getPersonaId())
                    .query(truncate(session.getQuery(), 4000))
                    .outcome(outcome.kind())
                    .finalAnswer(truncate(outcome.text(), 8000))
                    .errorMessage(truncate(outcome.error(), 2000))
                    .loopsUsed(session.getLoopCount())
                    .quotaExhaustedTool(session.getQuotaExhaustedTool())
                    .toolUsage(new LinkedHashMap<>(session.toolUsageSnapshot()))
                    .toolCalls(List.copyOf(runCtx.toolCalls()))
                    .totalLatencyMs(runCtx.elapsedMs())
                    .reasoningCalls(runCtx.getReasoningCalls())
                    .promptTokens(runCtx.getPromptTokens())
                    .completionTokens(runCtx.getCompletionTokens())
                    .build();

            traceRepository.save(trace);

            log.info("Trace persisted [session={}, outcome={}, latency={}ms, tokens={}]",
                    session.getSessionId(), outcome.kind(), runCtx.elapsedMs(), runCtx.totalTokens());

        } catch (Exception e) {
            // Trace persistence must never crash the app
            log.error("Failed to persist run trace for session={}", session.getSessionId(), e);
        }
    }

    public List<AgentRunTrace> getTracesForChat(String chatId) {
        return traceRepository.findByChatIdOrderByCreatedAtDesc(chatId);
    }

    public List<AgentRunTrace> getTracesForSession(String sessionId) {
        return traceRepository.findBySessionId(sessionId);
    }

    public Map<String, Object> getAnalytics(String chatId) {
        Double avgLatency = traceRepository.avgLatencyForChat(chatId);
        Map<String, Long> breakdown = traceRepository.outcomeBreakdownForChat(chatId).stream()
                .collect(Collectors.toMap(
                        AgentRunTraceRepository.OutcomeCount::id,
                        AgentRunTraceRepository.OutcomeCount::count));

        return Map.of(
                "chatId", chatId,
                "avgLatencyMs", avgLatency != null ? Math.round(avgLatency) : 0,
                "outcomeBreakdown", breakdown
        );
    }

    private String truncate(String s, int max) {
        if (s == null) return null;
        return s.length() <= max ? s : s.substring(0, max) + "...[truncated]";
    }
}
