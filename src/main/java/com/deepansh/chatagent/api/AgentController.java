package com.deepansh.chatagent.api;

import com.deepansh.chatagent.cancel.CancellationRegistry;
import com.deepansh.chatagent.core.AgentService;
import com.deepansh.chatagent.model.AgentRequest;
import com.deepansh.chatagent.model.AgentResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * Direct agent endpoints.
 *
 * POST /api/v1/agent/run                      run one session synchronously
 * POST /api/v1/agent/chats/{chatId}/cancel    stop the chat's running session at its next iteration
 * GET  /api/v1/agent/health
 */
@RestController
@RequestMapping("/api/v1/agent")
@RequiredArgsConstructor
@Slf4j
public class AgentController {

    private final AgentService agentService;
    private final CancellationRegistry cancellationRegistry;

    @PostMapping("/run")
    public ResponseEntity<AgentResponse> run(@Valid @RequestBody AgentRequest request) {
        log.info("Agent run request [chat={}, persona={}]", request.getChatId(), request.getPersonaId());
        return ResponseEntity.ok(agentService.handle(request));
    }

    @PostMapping("/chats/{chatId}/cancel")
    public ResponseEntity<Map<String, String>> cancel(@PathVariable String chatId) {
        cancellationRegistry.request(chatId);
        log.info("Cancellation requested via API [chat={}]", chatId);
        return ResponseEntity.accepted().body(Map.of("chatId", chatId, "status", "CANCELLATION_REQUESTED"));
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        return ResponseEntity.ok(Map.of("status", "UP"));
    }
}
