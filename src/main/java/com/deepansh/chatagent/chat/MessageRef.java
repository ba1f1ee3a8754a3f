package com.deepansh.chatagent.chat;

import java.time.Instant;

/**
 * Handle to a message that exists on the chat platform.
 *
 * @param chatId    conversation the message lives in
 * @param messageId platform-assigned id
 * @param text      text as last sent or edited
 * @param sentAt    platform timestamp of the send / edit
 */
public record MessageRef(String chatId, String messageId, String text, Instant sentAt) {

    public MessageRef withText(String newText, Instant editedAt) {
        return new MessageRef(chatId, messageId, newText, editedAt);
    }
}
