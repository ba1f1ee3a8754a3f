package com.deepansh.chatagent.persistence;

/**
 * Append-only persistence for conversation records.
 * Callers own any ordering between appends.
 */
public interface ConversationSink {

    void append(String chatId, ConversationRecord record);
}
