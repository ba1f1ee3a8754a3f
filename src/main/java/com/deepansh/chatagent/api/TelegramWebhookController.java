package com.deepansh.chatagent.api;

import com.deepansh.chatagent.resilience.ProcessedUpdateGuard;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.Optional;

/**
 * Receives Telegram updates.
 *
 * POST /api/v1/telegram/webhook
 *
 * Always answers 200 quickly: sessions run on the session pool, and a non-2xx
 * answer would only make Telegram redeliver the same update.
 */
@RestController
@RequestMapping("/api/v1/telegram")
@RequiredArgsConstructor
@Slf4j
public class TelegramWebhookController {

    private static final Map<String, Boolean> OK = Map.of("ok", true);

    private final ProcessedUpdateGuard updateGuard;
    private final MessageRouter messageRouter;

    @PostMapping("/webhook")
    public ResponseEntity<Map<String, Boolean>> onUpdate(@RequestBody JsonNode update) {
        Optional<InboundMessage> parsed = toInboundMessage(update);
        if (parsed.isEmpty()) {
            log.debug("Ignoring update without a text message: {}", update.path("update_id").asText());
            return ResponseEntity.ok(OK);
        }

        InboundMessage message = parsed.get();
        if (!updateGuard.claim(message.updateId())) {
            return ResponseEntity.ok(OK);
        }

        try {
            messageRouter.route(message);
        } catch (Exception e) {
            log.error("Failed to route update {} [chat={}]", message.updateId(), message.chatId(), e);
        }
        return ResponseEntity.ok(OK);
    }

    static Optional<InboundMessage> toInboundMessage(JsonNode update) {
        JsonNode message = update.path("message");
        if (message.isMissingNode() || !message.hasNonNull("text")) {
            return Optional.empty();
        }

        JsonNode from = message.path("from");
        String sender = from.hasNonNull("username")
                ? from.get("username").asText()
                : from.path("first_name").asText("user");

        return Optional.of(new InboundMessage(
                update.path("update_id").asText(null),
                message.path("chat").path("id").asText(),
                message.path("message_id").asText(),
                sender,
                from.path("is_bot").asBoolean(false),
                message.get("text").asText()));
    }
}
