package com.deepansh.chatagent.api;

import com.deepansh.chatagent.observability.AgentRunTrace;
import com.deepansh.chatagent.observability.TraceService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST endpoints for session traces and analytics.
 *
 * GET /api/v1/traces/chat/{chatId}              all session traces for a chat
 * GET /api/v1/traces/chat/{chatId}/analytics    latency, tokens, outcome breakdown
 * GET /api/v1/traces/session/{sessionId}        trace of one session
 */
@RestController
@RequestMapping("/api/v1/traces")
@RequiredArgsConstructor
public class ObservabilityController {

    private final TraceService traceService;

    @GetMapping("/chat/{chatId}")
    public ResponseEntity<List<AgentRunTrace>> getChatTraces(@PathVariable String chatId) {
        return ResponseEntity.ok(traceService.getTracesForChat(chatId));
    }

    @GetMapping("/chat/{chatId}/analytics")
    public ResponseEntity<Map<String, Object>> getAnalytics(@PathVariable String chatId) {
        return ResponseEntity.ok(traceService.getAnalytics(chatId));
    }

    @GetMapping("/session/{sessionId}")
    public ResponseEntity<List<AgentRunTrace>> getSessionTraces(@PathVariable String sessionId) {
        return ResponseEntity.ok(traceService.getTracesForSession(sessionId));
    }
}
