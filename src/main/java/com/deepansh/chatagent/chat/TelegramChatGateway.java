package com.deepansh.chatagent.chat;

import com.deepansh.chatagent.config.TelegramProperties;
import com.deepansh.chatagent.exception.ChatGatewayException;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * {@link ChatGateway} over the Telegram Bot API.
 *
 * | Operation | Endpoint          | Success body                    |
 * |-----------|-------------------|---------------------------------|
 * | send      | sendMessage       | {"ok":true,"result":{message}}  |
 * | edit      | editMessageText   | {"ok":true,"result":{message}}  |
 * | delete    | deleteMessage     | {"ok":true,"result":true}       |
 *
 * Telegram answers most failures with HTTP 400 and {"ok":false,"description":...};
 * both that and transport errors surface as ChatGatewayException.
 */
@Component
@Slf4j
public class TelegramChatGateway implements ChatGateway {

    private final RestClient restClient;

    public TelegramChatGateway(TelegramProperties properties,
                               @Qualifier("pooledRestClientBuilder") RestClient.Builder builder) {
        if (properties.getBotToken() == null || properties.getBotToken().isBlank()) {
            log.error("Telegram bot token not set! Set env var: TELEGRAM_BOT_TOKEN={your-token}");
        }
        this.restClient = builder
                .baseUrl(properties.getBaseUrl() + "/bot" + properties.getBotToken())
                .defaultHeader("Content-Type", "application/json")
                .build();
    }

    @Override
    public MessageRef send(String chatId, String text, SendOptions options) {
        Map<String, Object> body = new HashMap<>();
        body.put("chat_id", chatId);
        body.put("text", text);
        body.put("disable_web_page_preview", false);
        if (options.markdown()) {
            body.put("parse_mode", "Markdown");
        }
        if (options.replyToMessageId() != null) {
            body.put("reply_to_message_id", options.replyToMessageId());
            body.put("allow_sending_without_reply", true);
        }

        JsonNode result = call("sendMessage", body);
        return toRef(chatId, text, result);
    }

    @Override
    public MessageRef edit(MessageRef ref, String text) {
        JsonNode result = call("editMessageText", Map.of(
                "chat_id", ref.chatId(),
                "message_id", ref.messageId(),
                "text", text));

        if (result == null || !result.isObject()) {
            return null;
        }
        return toRef(ref.chatId(), text, result);
    }

    @Override
    public void delete(MessageRef ref) {
        call("deleteMessage", Map.of(
                "chat_id", ref.chatId(),
                "message_id", ref.messageId()));
    }

    private JsonNode call(String method, Map<String, Object> body) {
        JsonNode response;
        try {
            response = restClient.post()
                    .uri("/" + method)
                    .body(body)
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientResponseException e) {
            throw new ChatGatewayException(
                    "Telegram " + method + " failed [" + e.getStatusCode().value() + "]: "
                            + e.getResponseBodyAsString(), e);
        } catch (RestClientException e) {
            throw new ChatGatewayException("Telegram " + method + " failed: " + e.getMessage(), e);
        }

        if (response == null || !response.path("ok").asBoolean(false)) {
            String description = response != null
                    ? response.path("description").asText("no description")
                    : "empty response";
            throw new ChatGatewayException("Telegram " + method + " rejected: " + description);
        }

        log.debug("Telegram {} ok", method);
        return response.get("result");
    }

    private MessageRef toRef(String chatId, String text, JsonNode message) {
        if (message == null || !message.hasNonNull("message_id")) {
            throw new ChatGatewayException("Telegram response carried no message_id");
        }
        long epochSeconds = message.path("edit_date").asLong(message.path("date").asLong(0));
        Instant sentAt = epochSeconds > 0 ? Instant.ofEpochSecond(epochSeconds) : Instant.now();
        return new MessageRef(chatId, message.get("message_id").asText(), text, sentAt);
    }
}
