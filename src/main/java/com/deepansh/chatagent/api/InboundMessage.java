package com.deepansh.chatagent.api;

/**
 * A text message received from the chat platform.
 *
 * @param updateId  platform delivery id, used for de-duplication
 * @param chatId    conversation it arrived in
 * @param messageId platform message id
 * @param sender    display name of the author
 * @param fromBot   authored by a bot account (including this one)
 * @param text      message text, never null
 */
public record InboundMessage(String updateId, String chatId, String messageId,
                             String sender, boolean fromBot, String text) {
}
