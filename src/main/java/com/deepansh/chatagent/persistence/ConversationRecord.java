package com.deepansh.chatagent.persistence;

import com.deepansh.chatagent.chat.MessageRef;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * One message in a chat's history, from a user or from the bot.
 * Append-only: records are written once and never updated.
 */
@Document(collection = "conversation_records")
@CompoundIndex(name = "idx_chat_timestamp", def = "{'chatId': 1, 'timestamp': -1}")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConversationRecord {

    @Id
    private String id;

    private String chatId;

    private boolean fromBot;

    private String sender;

    private String text;

    /** Platform message id, when the message exists on the platform */
    private String externalMessageId;

    private Instant timestamp;

    public static ConversationRecord fromBot(MessageRef sent, String botName) {
        return ConversationRecord.builder()
                .chatId(sent.chatId())
                .fromBot(true)
                .sender(botName)
                .text(sent.text())
                .externalMessageId(sent.messageId())
                .timestamp(sent.sentAt() != null ? sent.sentAt() : Instant.now())
                .build();
    }

    public static ConversationRecord fromUser(String chatId, String sender, String text, String messageId) {
        return ConversationRecord.builder()
                .chatId(chatId)
                .fromBot(false)
                .sender(sender != null ? sender : "user")
                .text(text)
                .externalMessageId(messageId)
                .timestamp(Instant.now())
                .build();
    }
}
