package com.deepansh.chatagent.tool.impl;

import com.deepansh.chatagent.chat.ChatGateway;
import com.deepansh.chatagent.chat.MessageRef;
import com.deepansh.chatagent.chat.SendOptions;
import com.deepansh.chatagent.config.AgentProperties;
import com.deepansh.chatagent.config.ToolProperties;
import com.deepansh.chatagent.delivery.Pacer;
import com.deepansh.chatagent.persistence.ConversationRecord;
import com.deepansh.chatagent.persistence.ConversationSink;
import com.deepansh.chatagent.tool.AgentTool;
import com.deepansh.chatagent.tool.ToolResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Terminal tool: sends the final answer as one or more chat messages and
 * ends the session.
 *
 * Messages go out in order with a pause before each follow-up that grows
 * with the follow-up's length (base + perChar * length, bonus capped).
 * Each sent message is persisted; a persistence failure is logged only.
 * A send failure aborts the tool and surfaces as a tool error.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SendMessagesTool implements AgentTool {

    private final ChatGateway chatGateway;
    private final ConversationSink conversationSink;
    private final Pacer pacer;
    private final ToolProperties toolProperties;
    private final AgentProperties agentProperties;

    @Override
    public String getName() {
        return "send_messages";
    }

    @Override
    public String getDescription() {
        return """
                Send your final response to the user as one or more chat messages.
                This ENDS the conversation loop: call it only when ready to answer.
                Keep messages concise and conversational.
                """;
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "messages", Map.of(
                                "type", "array",
                                "items", Map.of("type", "string"),
                                "description", "Messages to send, in order"
                        )
                ),
                "required", List.of("messages")
        );
    }

    @Override
    public boolean isTerminal() {
        return true;
    }

    @Override
    public ToolResult execute(Map<String, Object> arguments, String chatId) throws InterruptedException {
        List<String> messages = resolveMessages(arguments.get("messages"));
        log.info("Sending {} messages [chat={}]", messages.size(), chatId);

        for (int i = 0; i < messages.size(); i++) {
            MessageRef sent = chatGateway.send(chatId, messages.get(i), SendOptions.markdown(null));

            try {
                conversationSink.append(chatId, ConversationRecord.fromBot(sent, agentProperties.getBotName()));
            } catch (Exception e) {
                log.warn("Failed to persist sent message {} [chat={}]: {}", sent.messageId(), chatId, e.getMessage());
            }

            if (i < messages.size() - 1) {
                pacer.pause(delayBefore(messages.get(i + 1)));
            }
        }

        return ToolResult.delivered(messages.size());
    }

    Duration delayBefore(String next) {
        ToolProperties.SendMessages pacing = toolProperties.getSendMessages();
        Duration bonus = pacing.getPerCharDelay().multipliedBy(next.length());
        if (bonus.compareTo(pacing.getMaxLengthBonus()) > 0) {
            bonus = pacing.getMaxLengthBonus();
        }
        return pacing.getBaseDelay().plus(bonus);
    }

    private static List<String> resolveMessages(Object raw) {
        if (raw instanceof Collection<?> items) {
            List<String> messages = items.stream()
                    .filter(Objects::nonNull)
                    .map(Object::toString)
                    .filter(s -> !s.isBlank())
                    .toList();
            if (!messages.isEmpty()) {
                return messages;
            }
        } else if (raw instanceof String single && !single.isBlank()) {
            return List.of(single);
        }
        throw new IllegalArgumentException("'messages' must be a non-empty array of strings");
    }
}
