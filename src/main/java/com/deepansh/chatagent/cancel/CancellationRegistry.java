package com.deepansh.chatagent.cancel;

/**
 * Process-wide set of chats whose running session has been asked to stop.
 * Checked cooperatively by the orchestrator at iteration boundaries.
 */
public interface CancellationRegistry {

    void request(String chatId);

    /**
     * Atomically test and clear the flag.
     *
     * @return true if a cancellation was pending for this chat
     */
    boolean consume(String chatId);
}
