package com.deepansh.chatagent.chat;

/**
 * Outbound messaging contract used by the status reporter, the delivery
 * splitter and terminal tools.
 *
 * Every method may fail independently with a
 * {@link com.deepansh.chatagent.exception.ChatGatewayException}. No ordering
 * holds between a send and a later delete of an unrelated message.
 */
public interface ChatGateway {

    MessageRef send(String chatId, String text, SendOptions options);

    /**
     * Replace the text of an existing message.
     *
     * @return the updated reference, or null when the platform did not return one
     */
    MessageRef edit(MessageRef ref, String text);

    void delete(MessageRef ref);
}
